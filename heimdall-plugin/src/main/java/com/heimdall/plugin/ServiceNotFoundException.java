package com.heimdall.plugin;

/**
 * No service is registered under the requested name, or it does not implement the requested type.
 */
public class ServiceNotFoundException extends RuntimeException {

    private final String serviceName;

    public ServiceNotFoundException(String serviceName, String message) {
        super(message);
        this.serviceName = serviceName;
    }

    public String getServiceName() {
        return serviceName;
    }
}
