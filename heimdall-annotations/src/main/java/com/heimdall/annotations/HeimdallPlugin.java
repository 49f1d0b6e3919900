package com.heimdall.annotations;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a class as a Heimdall plugin and carries its static descriptor. Discovery reads this annotation
 * from the class without instantiating it, so no plugin code runs before dependency resolution succeeds.
 * The values must agree with what the plugin returns from its {@code descriptor()} method.
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
public @interface HeimdallPlugin {

    /** Unique plugin id (e.g. "finance", "heimdall.event-journal"). */
    String id();

    /** Semantic version of the plugin (MAJOR.MINOR.PATCH). */
    String version();

    /** Display name for UI and reports. Defaults to the id. */
    String displayName() default "";

    /** Declared dependencies on other plugins (id + version range). */
    PluginDependency[] dependsOn() default {};

    /** Capability flags advertised by the plugin (e.g. EXPORT_SOURCE, UI_COMPONENTS). */
    String[] capabilities() default {};
}
