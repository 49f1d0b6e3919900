package com.heimdall.plugin;

/**
 * Restricted parent classloader for plugin JARs loaded from plugin directories. Exposes only the runtime's
 * public API packages; every other class request throws {@link ClassNotFoundException}, so a directory
 * plugin cannot reach the orchestrator, the plugin manager internals of other plugins, or libraries the
 * runtime happens to bundle. Reflection goes through this loader as well.
 * <p>
 * <b>Allowed:</b> {@code java.*}, {@code javax.*}, {@code com.heimdall.plugin.*},
 * {@code com.heimdall.config.*}, {@code com.heimdall.events.*}, {@code com.heimdall.executor.*},
 * {@code com.heimdall.annotations.*}, {@code org.slf4j.*}
 */
public final class RestrictedPluginClassLoader extends ClassLoader {

    private static final String[] ALLOWED_PREFIXES = {
            "java.",
            "javax.",
            "com.heimdall.plugin.",
            "com.heimdall.config.",
            "com.heimdall.events.",
            "com.heimdall.executor.",
            "com.heimdall.annotations.",
            "org.slf4j."
    };

    private final ClassLoader runtimeLoader;

    /**
     * Creates a restricted classloader with no parent. Delegates to the loader that loaded {@link Plugin}
     * only for allowed package prefixes.
     */
    public RestrictedPluginClassLoader() {
        super(null);
        this.runtimeLoader = Plugin.class.getClassLoader();
    }

    @Override
    protected Class<?> loadClass(String name, boolean resolve) throws ClassNotFoundException {
        synchronized (getClassLoadingLock(name)) {
            Class<?> c = findLoadedClass(name);
            if (c != null) {
                if (resolve) resolveClass(c);
                return c;
            }
            if (isAllowed(name)) {
                c = runtimeLoader.loadClass(name);
                if (resolve) resolveClass(c);
                return c;
            }
            throw new ClassNotFoundException("Access denied: " + name
                    + " (directory plugins may only use java.*, javax.*, com.heimdall.{plugin,config,events,executor,annotations}.*, org.slf4j.*)");
        }
    }

    static boolean isAllowed(String name) {
        for (String prefix : ALLOWED_PREFIXES) {
            if (name.startsWith(prefix)) return true;
        }
        return false;
    }
}
