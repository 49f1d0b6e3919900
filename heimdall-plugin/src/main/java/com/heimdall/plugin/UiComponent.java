package com.heimdall.plugin;

/**
 * Toolkit-neutral description of a UI contribution. The UI layer looks these up in the service registry
 * and builds its widgets.
 */
public interface UiComponent {

    String id();

    String title();

    /** Where the UI should place the component, e.g. {@code tab} or {@code dock}. */
    default String placement() {
        return "tab";
    }
}
