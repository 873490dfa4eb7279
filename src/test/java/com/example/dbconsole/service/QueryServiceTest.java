package com.example.dbconsole.service;

import com.example.dbconsole.exception.ExecutableNotFoundException;
import com.example.dbconsole.exception.QueryTimeoutException;
import com.example.dbconsole.model.ExecutionResult;
import com.example.dbconsole.model.QueryResponse;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.Spy;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class QueryServiceTest {

    @Mock
    EngineExecutor engineExecutor;

    @Spy
    ExecutionGate executionGate = new ExecutionGate();

    @InjectMocks
    QueryService queryService;

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"   ", "\t\n", " \r\n "})
    void blankQueryIsRejectedWithoutRunningTheEngine(String query) {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> queryService.executeQuery(query));

        assertEquals(QueryService.EMPTY_QUERY_MESSAGE, e.getMessage());
        verifyNoInteractions(engineExecutor);
    }

    @Test
    void queryIsStrippedBeforeItReachesTheEngine() {
        when(engineExecutor.execute("SHOW TABLES;")).thenReturn(new ExecutionResult("users\n", "", 0, 5));

        queryService.executeQuery("  SHOW TABLES;\n");

        verify(engineExecutor).execute("SHOW TABLES;");
    }

    @Test
    void stdoutBecomesTheDataPayloadUnchanged() {
        String table = "id | name\n---+------\n 1 | Alice\n";
        when(engineExecutor.execute(anyString())).thenReturn(new ExecutionResult(table, "", 0, 12));

        QueryResponse response = queryService.executeQuery("SELECT * FROM users;");

        assertTrue(response.isSuccess());
        assertEquals(table, response.getData());
        assertNull(response.getError());
    }

    @Test
    void emptyStdoutYieldsPlaceholder() {
        when(engineExecutor.execute(anyString())).thenReturn(new ExecutionResult("", "", 0, 3));

        QueryResponse response = queryService.executeQuery("CREATE TABLE t (id INT);");

        assertTrue(response.isSuccess());
        assertEquals(QueryService.SUCCESS_PLACEHOLDER, response.getData());
    }

    @Test
    void nonZeroExitWithStderrIsAFailureCarryingStderr() {
        when(engineExecutor.execute(anyString()))
                .thenReturn(new ExecutionResult("partial", "Syntax error near 'SELEC'\n", 1, 4));

        QueryResponse response = queryService.executeQuery("SELEC * FROM t;");

        assertFalse(response.isSuccess());
        assertEquals("Syntax error near 'SELEC'\n", response.getError());
        assertNull(response.getData());
    }

    @Test
    void nonZeroExitWithoutStderrStillSucceeds() {
        when(engineExecutor.execute(anyString())).thenReturn(new ExecutionResult("Unknown command\n", "", 2, 4));

        QueryResponse response = queryService.executeQuery("FOO;");

        assertTrue(response.isSuccess());
        assertEquals("Unknown command\n", response.getData());
    }

    @Test
    void stderrOnZeroExitIsIgnored() {
        when(engineExecutor.execute(anyString())).thenReturn(new ExecutionResult("ok\n", "warning: slow\n", 0, 4));

        QueryResponse response = queryService.executeQuery("SHOW TABLES;");

        assertTrue(response.isSuccess());
        assertEquals("ok\n", response.getData());
    }

    @Test
    void timeoutMapsToTimeoutMessage() {
        when(engineExecutor.execute(anyString())).thenThrow(new QueryTimeoutException(10));

        QueryResponse response = queryService.executeQuery("SELECT * FROM huge;");

        assertFalse(response.isSuccess());
        assertEquals(QueryService.TIMEOUT_MESSAGE, response.getError());
    }

    @Test
    void missingExecutableNamesThePath() {
        when(engineExecutor.execute(anyString()))
                .thenThrow(new ExecutableNotFoundException("./dbms", new IOException("error=2")));

        QueryResponse response = queryService.executeQuery("SHOW TABLES;");

        assertFalse(response.isSuccess());
        assertEquals("DBMS executable not found at ./dbms", response.getError());
    }

    @Test
    void unexpectedFaultUsesItsMessage() {
        when(engineExecutor.execute(anyString())).thenThrow(new IllegalStateException("pipe closed"));

        QueryResponse response = queryService.executeQuery("SHOW TABLES;");

        assertFalse(response.isSuccess());
        assertEquals("pipe closed", response.getError());
    }

    @Test
    void faultWithoutMessageFallsBackToItsName() {
        when(engineExecutor.execute(anyString())).thenThrow(new IllegalStateException());

        QueryResponse response = queryService.executeQuery("SHOW TABLES;");

        assertFalse(response.isSuccess());
        assertEquals("java.lang.IllegalStateException", response.getError());
    }
}
