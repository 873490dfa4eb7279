package com.example.dbconsole.exception;

/**
 * Base class for failures raised while running the engine executable.
 */
public class EngineException extends RuntimeException {

    public EngineException(String message) {
        super(message);
    }

    public EngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
