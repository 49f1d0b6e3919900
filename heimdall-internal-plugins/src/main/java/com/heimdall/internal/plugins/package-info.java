/**
 * Plugins bundled with the runtime: {@link com.heimdall.internal.plugins.EventJournalPlugin}, exposed to
 * the application through {@link com.heimdall.internal.plugins.InternalPlugins#createSource()}.
 */
package com.heimdall.internal.plugins;
