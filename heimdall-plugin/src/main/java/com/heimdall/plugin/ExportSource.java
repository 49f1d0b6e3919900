package com.heimdall.plugin;

import java.util.List;
import java.util.Map;

/**
 * A tabular data set an export collaborator can write to CSV, Excel or JSON. The runtime only registers
 * sources; it does not encode them.
 */
public interface ExportSource {

    /** Rows as field → value maps; keys are a subset of {@link #fieldNames()}. */
    Iterable<Map<String, Object>> rows();

    /** Column order. */
    List<String> fieldNames();

    /** File name without directory, e.g. {@code portfolio.csv}. */
    String suggestedFileName();
}
