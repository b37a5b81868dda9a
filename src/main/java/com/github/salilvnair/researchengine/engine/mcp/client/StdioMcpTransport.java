package com.github.salilvnair.researchengine.engine.mcp.client;

import com.github.salilvnair.researchengine.config.ResearchEngineMcpConfig;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Data service subprocess speaking newline delimited JSON on stdin/stdout.
 */
@Slf4j
public class StdioMcpTransport implements McpTransport {

    private static final Logger SERVER_LOG = LoggerFactory.getLogger("researchengine.mcp.server");

    private final ResearchEngineMcpConfig config;
    private final AtomicBoolean closed = new AtomicBoolean();
    private final Object writeLock = new Object();

    private Process process;
    private BufferedWriter stdin;

    public StdioMcpTransport(ResearchEngineMcpConfig config) {
        this.config = config;
    }

    @Override
    public void start(McpTransportListener listener) throws IOException {
        List<String> command = new ArrayList<>();
        command.add(config.getCommand());
        command.addAll(config.getArgs());

        ProcessBuilder builder = new ProcessBuilder(command);
        if (config.getWorkingDirectory() != null && !config.getWorkingDirectory().isBlank()) {
            builder.directory(new File(config.getWorkingDirectory()));
        }
        builder.environment().putAll(config.getEnvironment());
        builder.environment().putIfAbsent("PYTHONUNBUFFERED", "1");

        ResearchEngineMcpConfig.DebugLog debugLog = config.getDebugLog();
        boolean stderrToFile = debugLog.isEnabled() && debugLog.getPath() != null && !debugLog.getPath().isBlank();
        if (stderrToFile) {
            builder.redirectError(ProcessBuilder.Redirect.appendTo(new File(debugLog.getPath())));
        }

        log.info("Starting MCP server command={} dir={}", command, config.getWorkingDirectory());
        process = builder.start();
        stdin = new BufferedWriter(new OutputStreamWriter(process.getOutputStream(), StandardCharsets.UTF_8));

        daemon("mcp-stdout-" + process.pid(), () -> readStdout(process.getInputStream(), listener)).start();
        if (!stderrToFile) {
            daemon("mcp-stderr-" + process.pid(), () -> drainStderr(process.getErrorStream())).start();
        }
    }

    @Override
    public void send(String frame) throws IOException {
        if (closed.get() || process == null || !process.isAlive()) {
            throw new IOException("MCP server process is not running");
        }
        synchronized (writeLock) {
            stdin.write(frame);
            stdin.newLine();
            stdin.flush();
        }
    }

    @Override
    public boolean isAlive() {
        return !closed.get() && process != null && process.isAlive();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true) || process == null) {
            return;
        }
        try {
            synchronized (writeLock) {
                stdin.close();
            }
        } catch (IOException e) {
            log.debug("Closing MCP server stdin failed: {}", e.getMessage());
        }
        try {
            if (!process.waitFor(config.getShutdownGraceMs(), TimeUnit.MILLISECONDS)) {
                process.destroy();
                if (!process.waitFor(config.getShutdownGraceMs(), TimeUnit.MILLISECONDS)) {
                    process.destroyForcibly();
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
        }
        log.info("MCP server process pid={} terminated", process.pid());
    }

    private void readStdout(InputStream stream, McpTransportListener listener) {
        Throwable failure = null;
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                listener.onMessage(line);
            }
        } catch (IOException e) {
            failure = e;
        }
        if (failure == null) {
            failure = new IOException("MCP server stdout closed" + exitSuffix());
        }
        listener.onClosed(failure);
    }

    private void drainStderr(InputStream stream) {
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                SERVER_LOG.debug(line);
            }
        } catch (IOException e) {
            log.debug("MCP server stderr closed: {}", e.getMessage());
        }
    }

    private String exitSuffix() {
        try {
            return process.isAlive() ? "" : " (exit code " + process.exitValue() + ")";
        } catch (IllegalThreadStateException e) {
            return "";
        }
    }

    private static Thread daemon(String name, Runnable body) {
        Thread thread = new Thread(body, name);
        thread.setDaemon(true);
        return thread;
    }
}
