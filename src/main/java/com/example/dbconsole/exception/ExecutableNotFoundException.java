package com.example.dbconsole.exception;

public class ExecutableNotFoundException extends EngineException {

    private final String executable;

    public ExecutableNotFoundException(String executable, Throwable cause) {
        super("DBMS executable not found at " + executable, cause);
        this.executable = executable;
    }

    public String getExecutable() {
        return executable;
    }
}
