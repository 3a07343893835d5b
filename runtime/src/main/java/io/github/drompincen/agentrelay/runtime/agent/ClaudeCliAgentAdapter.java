package io.github.drompincen.agentrelay.runtime.agent;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.agentrelay.protocol.event.AgentEvent;
import io.github.drompincen.agentrelay.runtime.config.RelayProperties;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs the Claude CLI in print mode and streams its {@code stream-json} output. Each run gets one
 * reader thread for stdout, which is also the thread every event of that run is delivered on.
 */
@Component
public class ClaudeCliAgentAdapter implements AgentAdapter {

    private static final Logger log = LoggerFactory.getLogger(ClaudeCliAgentAdapter.class);

    private static final int STDERR_TAIL_LINES = 20;
    private static final long TERMINATE_GRACE_SECONDS = 5;

    private final String command;
    private final ObjectMapper mapper;
    private final AtomicInteger runCounter = new AtomicInteger();
    private final ExecutorService readers = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "agent-reader");
        t.setDaemon(true);
        return t;
    });

    public ClaudeCliAgentAdapter(RelayProperties properties, ObjectMapper mapper) {
        this.command = properties.agentCommand();
        this.mapper = mapper;
    }

    List<String> commandLine(AgentRequest request) {
        List<String> cmd = new ArrayList<>(List.of(command, "--print", "--output-format", "stream-json", "--verbose"));
        if (request.sessionId() != null && !request.sessionId().isBlank()) {
            cmd.add("--resume");
            cmd.add(request.sessionId());
        }
        cmd.add("-p");
        cmd.add(request.prompt());
        return cmd;
    }

    @Override
    public AgentHandle spawn(AgentRequest request, AgentListener listener) {
        int run = runCounter.incrementAndGet();
        ProcessBuilder pb = new ProcessBuilder(commandLine(request)).redirectErrorStream(false);
        if (request.cwd() != null) {
            pb.directory(request.cwd().toFile());
        }

        Process process;
        try {
            process = pb.start();
            process.getOutputStream().close();
        } catch (IOException e) {
            log.error("Failed to start agent run {} in {}", run, request.cwd(), e);
            readers.execute(() -> {
                deliver(run, listener, AgentEvent.error("Failed to start agent: " + e.getMessage()));
                deliver(run, listener, AgentEvent.done());
            });
            return () -> { };
        }
        log.info("Agent run {} started (pid {}, resume={})", run, process.pid(), request.sessionId() != null);

        AtomicBoolean cancelled = new AtomicBoolean();
        Deque<String> stderrTail = new ArrayDeque<>();
        readers.execute(() -> drainStderr(process, stderrTail));
        readers.execute(() -> readStdout(run, process, listener, cancelled, stderrTail));

        return () -> {
            if (cancelled.compareAndSet(false, true) && process.isAlive()) {
                log.info("Cancelling agent run {}", run);
                process.destroy();
                readers.execute(() -> forceKillIfAlive(run, process));
            }
        };
    }

    @PreDestroy
    public void shutdown() {
        readers.shutdownNow();
    }

    private void readStdout(int run, Process process, AgentListener listener, AtomicBoolean cancelled,
                            Deque<String> stderrTail) {
        StreamJsonParser parser = new StreamJsonParser(mapper);
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                for (AgentEvent event : parser.parseLine(line)) {
                    deliver(run, listener, event);
                }
            }
        } catch (IOException e) {
            if (!cancelled.get()) {
                log.warn("Agent run {} output stream failed", run, e);
            }
        }

        try {
            int exit = process.waitFor();
            log.info("Agent run {} exited with code {}{}", run, exit, cancelled.get() ? " (cancelled)" : "");
            if (exit != 0 && !cancelled.get()) {
                String stderr;
                synchronized (stderrTail) {
                    stderr = String.join("\n", stderrTail);
                }
                deliver(run, listener, AgentEvent.error("Process exited with code " + exit
                        + (stderr.isBlank() ? "" : ": " + stderr)));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            deliver(run, listener, AgentEvent.error("Interrupted while waiting for the agent to exit"));
        } finally {
            deliver(run, listener, AgentEvent.done());
        }
    }

    private static void deliver(int run, AgentListener listener, AgentEvent event) {
        try {
            listener.onEvent(event);
        } catch (RuntimeException e) {
            log.error("Listener failed on {} event of agent run {}", event.type(), run, e);
        }
    }

    private void drainStderr(Process process, Deque<String> tail) {
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getErrorStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                log.debug("agent stderr: {}", line);
                synchronized (tail) {
                    tail.addLast(line);
                    if (tail.size() > STDERR_TAIL_LINES) tail.removeFirst();
                }
            }
        } catch (IOException e) {
            log.debug("Agent stderr closed: {}", e.getMessage());
        }
    }

    private void forceKillIfAlive(int run, Process process) {
        try {
            if (!process.waitFor(TERMINATE_GRACE_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Agent run {} ignored SIGTERM, killing it", run);
                process.destroyForcibly();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
        }
    }
}
