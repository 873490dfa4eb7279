package com.example.dbconsole.exception;

public class QueryTimeoutException extends EngineException {

    private final long timeoutSeconds;

    public QueryTimeoutException(long timeoutSeconds) {
        super("Execution Timeout: Process killed after " + timeoutSeconds + " seconds.");
        this.timeoutSeconds = timeoutSeconds;
    }

    public long getTimeoutSeconds() {
        return timeoutSeconds;
    }
}
