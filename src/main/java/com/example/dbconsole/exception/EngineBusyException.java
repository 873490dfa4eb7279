package com.example.dbconsole.exception;

public class EngineBusyException extends EngineException {

    public EngineBusyException() {
        super("Server busy: another query is still running. Please try again.");
    }
}
