/**
 * Plugin contract and lifecycle.
 * <ul>
 *   <li>{@link com.heimdall.plugin.Plugin}, {@link com.heimdall.plugin.PluginContext}: what a plugin implements and
 *   what it is given</li>
 *   <li>{@link com.heimdall.plugin.PluginSource}: classpath ({@code ServiceLoader}), plugin directories and
 *   in-process plugins</li>
 *   <li>{@link com.heimdall.plugin.PluginResolver}: dependency graph, version ranges, cycles, initialization
 *   order</li>
 *   <li>{@link com.heimdall.plugin.PluginManager}: initialization with rollback, reverse-order shutdown</li>
 *   <li>{@link com.heimdall.plugin.ServiceRegistry}: named services offered by active plugins</li>
 * </ul>
 */
package com.heimdall.plugin;
