package com.localllm.agent.transport;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.localllm.agent.exception.TransportException;
import com.localllm.agent.provider.EnvironmentResolver;
import com.localllm.agent.provider.ProviderConfig;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * MCP over a child process: newline-delimited JSON on stdin/stdout.
 *
 * Design decisions:
 * - One reader thread per process dispatches responses by id.
 * - stderr is drained continuously into the log so a chatty server can never
 *   block on a full pipe.
 * - Calls are serialized with a single permit; most stdio servers handle one
 *   request at a time.
 */
@Slf4j
public class StdioTransport extends AbstractMcpTransport {

    private static final Duration GRACEFUL_EXIT = Duration.ofSeconds(3);

    private final EnvironmentResolver resolver;
    private final PendingRequests pending;
    private final Semaphore callPermit = new Semaphore(1);
    private final Object writeLock = new Object();

    private Process process;
    private BufferedWriter stdin;

    public StdioTransport(ProviderConfig config, ObjectMapper objectMapper, EnvironmentResolver resolver) {
        super(config, objectMapper);
        this.resolver = resolver;
        this.pending = new PendingRequests(config.getId());
    }

    @Override
    public boolean supportsConcurrentCalls() {
        return false;
    }

    @Override
    protected void open() {
        List<String> command = new ArrayList<>();
        command.add(resolver.resolve(config.getCommand()));
        command.addAll(resolver.resolveAll(config.getArgs()));

        ProcessBuilder builder = new ProcessBuilder(command);
        builder.environment().putAll(resolver.resolveAll(config.getEnv()));

        try {
            process = builder.start();
        } catch (IOException e) {
            throw new TransportException("Failed to start '" + command.get(0) + "' [provider=" + providerId() + "]", e);
        }
        stdin = new BufferedWriter(new OutputStreamWriter(process.getOutputStream(), StandardCharsets.UTF_8));

        startDaemon("mcp-stdout-" + providerId(), this::readStdout);
        startDaemon("mcp-stderr-" + providerId(), this::drainStderr);
        log.info("Started stdio provider [provider={}, pid={}, command={}]", providerId(), process.pid(), command.get(0));
    }

    @Override
    protected JsonNode sendRequest(long id, ObjectNode request, Duration timeout) {
        String method = request.path("method").asText();
        acquirePermit(method, timeout);
        try {
            CompletableFuture<JsonNode> future = pending.register(id);
            try {
                writeLine(serialize(request));
            } catch (TransportException e) {
                pending.cancel(id);
                throw e;
            }
            return pending.await(id, future, timeout, method);
        } finally {
            callPermit.release();
        }
    }

    @Override
    protected void sendNotification(ObjectNode notification) {
        writeLine(serialize(notification));
    }

    @Override
    protected void doClose() {
        pending.failAll(new TransportException("Transport closed [provider=" + providerId() + "]"));
        if (process == null) {
            return;
        }
        try {
            stdin.close();
        } catch (IOException e) {
            log.debug("stdin already closed [provider={}]", providerId());
        }
        process.destroy();
        try {
            if (!process.waitFor(GRACEFUL_EXIT.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Provider did not exit gracefully, killing [provider={}, pid={}]", providerId(), process.pid());
                process.destroyForcibly();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
        }
    }

    private void acquirePermit(String method, Duration timeout) {
        try {
            if (!callPermit.tryAcquire(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                throw new TransportException(method + " timed out waiting for the channel [provider=" + providerId() + "]");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException(method + " interrupted [provider=" + providerId() + "]", e);
        }
    }

    private void writeLine(String line) {
        ensureOpen();
        synchronized (writeLock) {
            try {
                stdin.write(line);
                stdin.write('\n');
                stdin.flush();
            } catch (IOException e) {
                throw new TransportException("Write to provider process failed [provider=" + providerId() + "]", e);
            }
        }
    }

    private void readStdout() {
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isBlank()) {
                    continue;
                }
                JsonNode message;
                try {
                    message = parse(line);
                } catch (TransportException e) {
                    log.debug("Ignoring non-JSON stdout line [provider={}]: {}", providerId(), line);
                    continue;
                }
                if (!pending.complete(message)) {
                    log.debug("Provider message ignored [provider={}, method={}]",
                            providerId(), message.path("method").asText("-"));
                }
            }
        } catch (IOException e) {
            if (!closed) {
                log.warn("stdout read failed [provider={}]: {}", providerId(), e.getMessage());
            }
        }
        if (!closed) {
            log.warn("Provider process ended unexpectedly [provider={}]", providerId());
        }
        pending.failAll(new TransportException("Provider process exited [provider=" + providerId() + "]"));
    }

    private void drainStderr() {
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getErrorStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                log.debug("[provider={}] stderr: {}", providerId(), line);
            }
        } catch (IOException e) {
            log.trace("stderr closed [provider={}]", providerId());
        }
    }

    private static void startDaemon(String name, Runnable task) {
        Thread thread = new Thread(task, name);
        thread.setDaemon(true);
        thread.start();
    }
}
