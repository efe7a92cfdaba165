package com.companya.crm.service.flags;

/**
 * Raised when a flagging run's output cannot be written. Nothing from the run is kept.
 */
public class FlagPersistenceException extends RuntimeException {

    public FlagPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
