package com.example.dbconsole.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Raw outcome of one run of the engine executable.
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
public class ExecutionResult {
    private String stdout;
    private String stderr;
    private int exitCode;
    private long elapsedMs;

    public boolean failedWithError() {
        return exitCode != 0 && stderr != null && !stderr.isEmpty();
    }
}
