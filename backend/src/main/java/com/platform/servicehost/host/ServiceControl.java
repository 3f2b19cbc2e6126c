package com.platform.servicehost.host;

import com.platform.servicehost.state.OsServiceState;

/**
 * The OS service manager, addressed by service name.
 */
public interface ServiceControl {
    
    /**
     * @return {@link OsServiceState#NOT_FOUND} when no service has this name
     */
    OsServiceState queryState(String serviceName) throws ServiceControlException;
    
    /**
     * Requests a start and returns without waiting for RUNNING.
     * Starting a service that is already running is not an error.
     */
    void start(String serviceName) throws ServiceControlException;
    
    /**
     * Requests a stop and returns without waiting for STOPPED.
     * Stopping a service that is not running is not an error.
     */
    void stop(String serviceName) throws ServiceControlException;
}
