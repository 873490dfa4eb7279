package com.example.dbconsole.service;

import com.example.dbconsole.exception.EngineBusyException;
import com.example.dbconsole.exception.EngineException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Optional process-wide serialisation of engine runs.
 * Disabled by default: concurrent runs against the shared data directory are
 * left to the engine itself.
 */
@Service
public class ExecutionGate {
    private static final org.slf4j.Logger log = org.slf4j.LoggerFactory.getLogger(ExecutionGate.class);

    @Value("${app.dbms.serialize-executions:false}")
    private boolean serialize;

    @Value("${app.dbms.lock-timeout-seconds:30}")
    private long lockTimeoutSeconds;

    private final ReentrantLock lock = new ReentrantLock(true);

    public <T> T run(Supplier<T> action) {
        if (!serialize) {
            return action.get();
        }
        try {
            if (lock.tryLock(lockTimeoutSeconds, TimeUnit.SECONDS)) {
                try {
                    return action.get();
                } finally {
                    lock.unlock();
                }
            } else {
                log.warn("Execution lock timeout after {}s", lockTimeoutSeconds);
                throw new EngineBusyException();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EngineException("Operation interrupted.", e);
        }
    }

    public boolean isSerialize() {
        return serialize;
    }
}
