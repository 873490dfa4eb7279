package com.example.dbconsole.service;

import com.example.dbconsole.exception.EngineException;
import com.example.dbconsole.exception.ExecutableNotFoundException;
import com.example.dbconsole.exception.QueryTimeoutException;
import com.example.dbconsole.model.ExecutionResult;
import jakarta.annotation.PostConstruct;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Runs the external engine executable once per query: the query goes to stdin,
 * stdout and stderr are captured in full.
 */
@Service
public class EngineExecutor {

    private static final org.slf4j.Logger log = org.slf4j.LoggerFactory.getLogger(EngineExecutor.class);

    private static final long STREAM_JOIN_MILLIS = 1000;

    static final String RUN_ID_ENV = "DBCONSOLE_RUN_ID";

    private static final Path PROC = Paths.get("/proc");

    @Value("${app.dbms.executable:./dbms}")
    private String executable;

    @Value("${app.dbms.working-dir:.}")
    private String workingDir;

    @Value("${app.dbms.data-dir:dbms_data}")
    private String dataDir;

    @Value("${app.dbms.timeout-seconds:10}")
    private long timeoutSeconds;

    private Path workingPath;

    @PostConstruct
    public void init() throws IOException {
        this.workingPath = Paths.get(workingDir).toAbsolutePath().normalize();
        Files.createDirectories(workingPath.resolve(dataDir));

        Path exe = resolveExecutable();
        if (exe.isAbsolute() && !Files.isExecutable(exe)) {
            log.warn("DBMS executable not found or not executable at {}, queries will fail until it is installed", exe);
        }
        log.info("Engine executor initialized, executable: {}, working dir: {}, data dir: {}, timeout: {}s",
                executable, workingPath, dataDir, timeoutSeconds);
    }

    public ExecutionResult execute(String query) {
        ProcessBuilder pb = new ProcessBuilder(resolveExecutable().toString());
        pb.directory(workingPath.toFile());
        pb.redirectErrorStream(false);
        String runId = UUID.randomUUID().toString();
        pb.environment().put(RUN_ID_ENV, runId);

        long started = System.nanoTime();
        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            log.warn("Failed to start DBMS executable {}: {}", executable, e.getMessage());
            throw new ExecutableNotFoundException(executable, e);
        }
        log.debug("Started DBMS process pid: {}, run: {}", process.pid(), runId);

        ByteArrayOutputStream stdout = new ByteArrayOutputStream();
        ByteArrayOutputStream stderr = new ByteArrayOutputStream();
        Thread inThread = daemon(() -> writeQuery(process, query), "dbms-stdin-" + process.pid());
        Thread outThread = daemon(() -> captureStream(process.getInputStream(), stdout), "dbms-stdout-" + process.pid());
        Thread errThread = daemon(() -> captureStream(process.getErrorStream(), stderr), "dbms-stderr-" + process.pid());
        inThread.start();
        outThread.start();
        errThread.start();

        boolean finished;
        try {
            finished = process.waitFor(timeoutSeconds, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EngineException("Query execution interrupted", e);
        } finally {
            // background children of the engine keep its pipes open until they die
            destroyProcessTree(process, runId);
            awaitThreads(inThread, outThread, errThread);
        }

        if (!finished) {
            log.warn("DBMS process {} exceeded {}s and was killed", process.pid(), timeoutSeconds);
            throw new QueryTimeoutException(timeoutSeconds);
        }

        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
        log.debug("DBMS process {} exited with {} after {} ms", process.pid(), process.exitValue(), elapsedMs);
        return new ExecutionResult(
                stdout.toString(StandardCharsets.UTF_8),
                stderr.toString(StandardCharsets.UTF_8),
                process.exitValue(),
                elapsedMs
        );
    }

    /**
     * Kills the engine and everything it started. Children still attached to the engine
     * are found through {@link Process#descendants()}; once the engine has exited its
     * orphans are re-parented, so on Linux they are found by the run id in their environment.
     */
    private void destroyProcessTree(Process process, String runId) {
        Set<ProcessHandle> tree = new LinkedHashSet<>();
        process.descendants().forEach(tree::add);
        tree.addAll(findByRunId(runId));
        tree.remove(process.toHandle());

        for (ProcessHandle handle : tree) {
            if (handle.isAlive()) {
                log.debug("Killing leftover process {} of DBMS run {}", handle.pid(), runId);
                handle.destroyForcibly();
            }
        }
        if (process.isAlive()) {
            process.destroyForcibly();
        }
    }

    private Set<ProcessHandle> findByRunId(String runId) {
        if (!Files.isDirectory(PROC)) {
            return Collections.emptySet();
        }
        String entry = "\0" + RUN_ID_ENV + "=" + runId + "\0";
        long self = ProcessHandle.current().pid();
        return ProcessHandle.allProcesses()
                .filter(h -> h.pid() != self)
                .filter(h -> environContains(h.pid(), entry))
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    private boolean environContains(long pid, String entry) {
        try {
            byte[] environ = Files.readAllBytes(PROC.resolve(Long.toString(pid)).resolve("environ"));
            return ("\0" + new String(environ, StandardCharsets.ISO_8859_1)).contains(entry);
        } catch (IOException e) {
            // exited in the meantime, or owned by another user
            return false;
        }
    }

    private void awaitThreads(Thread... threads) {
        long deadline = System.currentTimeMillis() + STREAM_JOIN_MILLIS;
        for (Thread t : threads) {
            long remaining = deadline - System.currentTimeMillis();
            try {
                if (remaining > 0) {
                    t.join(remaining);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            if (t.isAlive()) {
                log.warn("Thread {} still running after the DBMS process ended", t.getName());
            }
        }
    }

    /**
     * Relative paths containing a separator resolve against the working directory,
     * bare names are left for the OS to look up on PATH.
     */
    Path resolveExecutable() {
        Path exe = Paths.get(executable);
        if (exe.isAbsolute() || exe.getNameCount() == 1) {
            return exe;
        }
        return workingPath.resolve(exe).normalize();
    }

    public String getExecutable() {
        return executable;
    }

    public long getTimeoutSeconds() {
        return timeoutSeconds;
    }

    private void writeQuery(Process process, String query) {
        try (OutputStream stdin = process.getOutputStream()) {
            stdin.write(query.getBytes(StandardCharsets.UTF_8));
            stdin.flush();
        } catch (IOException e) {
            // the engine exited without reading all of its input
            log.debug("DBMS process {} closed stdin early: {}", process.pid(), e.getMessage());
        }
    }

    private void captureStream(InputStream is, ByteArrayOutputStream sink) {
        try (InputStream in = is) {
            in.transferTo(sink);
        } catch (IOException e) {
            log.debug("Output stream closed while capturing: {}", e.getMessage());
        }
    }

    private static Thread daemon(Runnable task, String name) {
        Thread t = new Thread(task, name);
        t.setDaemon(true);
        return t;
    }
}
