/**
 * Heimdall annotations: static plugin metadata for discovery.
 * <ul>
 *   <li>{@link com.heimdall.annotations.HeimdallPlugin} – plugin id, version, dependencies and capability flags</li>
 *   <li>{@link com.heimdall.annotations.PluginDependency} – one dependency (plugin id + version range)</li>
 * </ul>
 * Classpath and directory plugin sources read these through reflection on the provider type, so a plugin
 * is only constructed once the dependency graph it belongs to has resolved.
 */
package com.heimdall.annotations;
