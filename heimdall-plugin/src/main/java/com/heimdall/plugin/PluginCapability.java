package com.heimdall.plugin;

/**
 * Capability flags a plugin advertises in its descriptor. Reported at startup; services themselves are
 * typed by their capability interface.
 */
public final class PluginCapability {

    /** Offers {@link ExportSource}s. */
    public static final String EXPORT_SOURCE = "EXPORT_SOURCE";

    /** Contributes {@link UiComponent}s. */
    public static final String UI_COMPONENTS = "UI_COMPONENTS";

    /** Handles {@code command.*} events. */
    public static final String COMMAND_HANDLER = "COMMAND_HANDLER";

    /** Provides a data repository service. */
    public static final String DATA_REPOSITORY = "DATA_REPOSITORY";

    /** Provides an analysis engine service. */
    public static final String ANALYSIS_ENGINE = "ANALYSIS_ENGINE";

    /** Observes runtime events (journal, audit). */
    public static final String OBSERVER = "OBSERVER";

    private PluginCapability() {
    }
}
