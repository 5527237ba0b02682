package io.pairledger.worker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

public final class ScriptWorker implements TaskWorker {
    private static final Logger log = LoggerFactory.getLogger(ScriptWorker.class);
    private static final int MAX_ERROR_CHARS = 512;
    private static final int MAX_CAPTURE_BYTES = 64 * 1024;

    private final List<String> command;
    private final long timeoutMs;

    public ScriptWorker(List<String> command, long timeoutMs) {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("script worker command cannot be empty");
        }
        this.command = List.copyOf(command);
        this.timeoutMs = Math.max(1_000L, timeoutMs);
    }

    @Override
    public String id() {
        return "script";
    }

    @Override
    public WorkResult perform(WorkContext context) {
        ProcessBuilder pb = new ProcessBuilder(new ArrayList<>(command));
        pb.redirectErrorStream(true);
        Map<String, String> env = pb.environment();
        env.put("PAIRLEDGER_AGENT_ID", nullToEmpty(context.agentId()));
        env.put("PAIRLEDGER_TASK_ID", nullToEmpty(context.taskId()));
        env.put("PAIRLEDGER_PAIR_ID", nullToEmpty(context.pairId()));
        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            return WorkResult.failed("script spawn failed: " + e.getMessage());
        }

        // stdout must drain while the process runs or a chatty script blocks on a full pipe.
        OutputCapture capture = new OutputCapture(process.getInputStream(), MAX_CAPTURE_BYTES);
        Thread drainer = new Thread(capture, "script-output-" + nullToEmpty(context.taskId()));
        drainer.setDaemon(true);
        drainer.start();

        try {
            writeInput(process, context.description());

            boolean finished = process.waitFor(timeoutMs, TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                process.waitFor(1, TimeUnit.SECONDS);
                return WorkResult.failed("script timeout after " + Duration.ofMillis(timeoutMs));
            }

            drainer.join(TimeUnit.SECONDS.toMillis(5));
            String combined = capture.text();
            if (process.exitValue() == 0) {
                return WorkResult.completed(combined.strip());
            }
            return WorkResult.failed("script exit=" + process.exitValue() + " output=" + truncate(combined));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            return WorkResult.failed("script interrupted");
        }
    }

    private void writeInput(Process process, String description) {
        byte[] input = description == null ? new byte[0] : description.getBytes(StandardCharsets.UTF_8);
        try (OutputStream stdin = process.getOutputStream()) {
            stdin.write(input);
            stdin.flush();
        } catch (IOException e) {
            // The script may exit without reading stdin; its exit code still decides the outcome.
            log.debug("Could not write task description to script stdin: {}", e.getMessage());
        }
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    private String truncate(String raw) {
        if (raw == null) {
            return "";
        }
        String normalized = raw.replace("\r", " ").replace("\n", " ").trim();
        if (normalized.length() <= MAX_ERROR_CHARS) {
            return normalized;
        }
        return normalized.substring(0, MAX_ERROR_CHARS) + "...";
    }

    private static final class OutputCapture implements Runnable {
        private final InputStream in;
        private final int limit;
        private final ByteArrayOutputStream kept = new ByteArrayOutputStream();

        OutputCapture(InputStream in, int limit) {
            this.in = in;
            this.limit = limit;
        }

        @Override
        public void run() {
            byte[] buffer = new byte[8192];
            try (InputStream stream = in) {
                int read;
                while ((read = stream.read(buffer)) != -1) {
                    synchronized (kept) {
                        int room = limit - kept.size();
                        if (room > 0) {
                            kept.write(buffer, 0, Math.min(room, read));
                        }
                    }
                }
            } catch (IOException e) {
                log.debug("Script output stream closed: {}", e.getMessage());
            }
        }

        String text() {
            synchronized (kept) {
                return kept.toString(StandardCharsets.UTF_8);
            }
        }
    }
}
