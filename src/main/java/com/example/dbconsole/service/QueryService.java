package com.example.dbconsole.service;

import com.example.dbconsole.exception.ExecutableNotFoundException;
import com.example.dbconsole.exception.QueryTimeoutException;
import com.example.dbconsole.model.ExecutionResult;
import com.example.dbconsole.model.QueryResponse;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

@Service
public class QueryService {

    private static final org.slf4j.Logger log = org.slf4j.LoggerFactory.getLogger(QueryService.class);

    public static final String EMPTY_QUERY_MESSAGE = "Query cannot be empty";
    public static final String SUCCESS_PLACEHOLDER = "Query executed successfully";
    public static final String TIMEOUT_MESSAGE = "Query execution timeout";

    @Autowired
    private EngineExecutor engineExecutor;

    @Autowired
    private ExecutionGate executionGate;

    /**
     * Runs one query through the engine and wraps the outcome.
     * Engine failures come back as an error envelope, only an empty query throws.
     *
     * @throws IllegalArgumentException if the query is null or blank
     */
    public QueryResponse executeQuery(String query) {
        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException(EMPTY_QUERY_MESSAGE);
        }
        String text = query.strip();

        try {
            ExecutionResult result = executionGate.run(() -> engineExecutor.execute(text));
            log.info("Query finished, exitCode: {}, elapsed: {} ms", result.getExitCode(), result.getElapsedMs());

            if (result.failedWithError()) {
                return QueryResponse.error(result.getStderr());
            }
            String stdout = result.getStdout();
            return QueryResponse.success(stdout == null || stdout.isEmpty() ? SUCCESS_PLACEHOLDER : stdout);
        } catch (QueryTimeoutException e) {
            log.warn("Query timed out after {}s", e.getTimeoutSeconds());
            return QueryResponse.error(TIMEOUT_MESSAGE);
        } catch (ExecutableNotFoundException e) {
            log.warn(e.getMessage());
            return QueryResponse.error(e.getMessage());
        } catch (Exception e) {
            log.error("Query execution failed", e);
            return QueryResponse.error(e.getMessage() != null ? e.getMessage() : e.toString());
        }
    }
}
