package com.heimdall.plugin;

import java.util.List;

/**
 * Where plugins come from. Discovery returns descriptors and factories only; no plugin is instantiated.
 */
public interface PluginSource {

    String name();

    /**
     * @return candidates in a stable order; a source that cannot be read returns what it could read and logs the rest
     */
    List<PluginCandidate> discover();
}
