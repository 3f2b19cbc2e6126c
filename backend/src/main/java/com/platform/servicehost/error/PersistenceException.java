package com.platform.servicehost.error;

/**
 * Service metadata could not be read from or written to disk.
 */
public class PersistenceException extends ServiceHostException {
    
    public PersistenceException(String message, Throwable cause) {
        super(ErrorCode.PERSISTENCE_ERROR, message, cause);
    }
}
