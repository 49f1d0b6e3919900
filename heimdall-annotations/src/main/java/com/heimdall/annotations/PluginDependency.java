package com.heimdall.annotations;

import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * One declared dependency inside {@link HeimdallPlugin#dependsOn()}.
 */
@Target({})
@Retention(RetentionPolicy.RUNTIME)
public @interface PluginDependency {

    /** Id of the plugin depended upon. */
    String id();

    /** Accepted version range (e.g. "^1.2.0", "&gt;=1.0.0 &lt;2.0.0", "*"). */
    String version() default "*";
}
