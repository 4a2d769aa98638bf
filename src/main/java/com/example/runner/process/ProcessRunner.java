package com.example.runner.process;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 外部进程执行器：
 * - stdout / stderr 由 streamExec 线程池并发读取，按块（8 KiB）回调 sink，避免管道缓冲区写满导致死锁
 * - 超时后先 destroy 再 destroyForcibly（连同子进程），返回 TIMED_OUT
 * - 读流线程不足（被拒绝）时结束进程并返回 INTERNAL_ERROR，读流从不在调用线程上执行
 * - 后台子进程继承管道导致读流迟迟不结束时，放弃读取并关闭本端管道
 * - exit code >= 127 视为异常退出（信号 / command not found）
 * - 任何异常映射为 INTERNAL_ERROR，不向外抛出
 */
@Slf4j
@Component
public class ProcessRunner {

    public static final String RUN_ID_ENV = "DISPATCHER_RUN_ID";
    public static final int ABNORMAL_EXIT_CODE = 127;

    private static final int CHUNK_SIZE = 8192;
    private static final int MAX_CAPTURE_CHARS = 1024 * 1024;
    private static final long TERMINATE_GRACE_MS = 2000L;
    private static final long DRAIN_GRACE_MS = 5000L;

    private final Executor streamExec;

    public ProcessRunner(@Qualifier("streamExec") Executor streamExec) {
        this.streamExec = streamExec;
    }

    public ExecutionResult run(ProcessInvocation invocation, Duration timeout, OutputSink sink) {
        OutputSink target = sink == null ? DiscardingSink.INSTANCE : sink;
        Process process = null;
        try {
            ProcessBuilder pb = new ProcessBuilder(invocation.getCommand());
            pb.environment().putAll(invocation.getEnvironment());
            if (invocation.getCorrelationId() != null) {
                pb.environment().put(RUN_ID_ENV, invocation.getCorrelationId());
            }

            process = pb.start();
            process.getOutputStream().close();
            log.debug("Process started pid={} cmd={}", process.pid(), invocation.commandLine());

            StringBuilder out = new StringBuilder();
            StringBuilder err = new StringBuilder();
            CompletableFuture<Void> outDrain = drain(process.getInputStream(), OutputSink.Stream.STDOUT, target, out);
            CompletableFuture<Void> errDrain = drain(process.getErrorStream(), OutputSink.Stream.STDERR, target, err);

            boolean finished = waitFor(process, timeout);
            if (!finished) {
                log.warn("Process timed out after {}s, terminating pid={}", timeout.getSeconds(), process.pid());
                terminate(process);
                awaitDrain(process, outDrain, errDrain, true);
                return ExecutionResult.timedOut(timeout, snapshot(out), snapshot(err));
            }

            awaitDrain(process, outDrain, errDrain, false);
            int exitCode = process.exitValue();
            log.debug("Process finished pid={} exit={}", process.pid(), exitCode);

            if (exitCode >= ABNORMAL_EXIT_CODE) {
                return ExecutionResult.executionError(exitCode, snapshot(out), snapshot(err));
            }
            return ExecutionResult.completed(exitCode, snapshot(out), snapshot(err));

        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            terminateQuietly(process);
            return ExecutionResult.internalError("Interrupted while waiting for process");
        } catch (RejectedExecutionException re) {
            terminateQuietly(process);
            log.warn("No stream reader available, process not run: {}", invocation.commandLine());
            return ExecutionResult.internalError("No stream reader thread available: " + re.getMessage());
        } catch (Exception e) {
            terminateQuietly(process);
            Throwable cause = (e instanceof ExecutionException && e.getCause() != null) ? e.getCause() : e;
            if (cause instanceof UncheckedIOException && cause.getCause() != null) {
                cause = cause.getCause();
            }
            log.debug("Process execution failed: {}", cause.toString());
            return ExecutionResult.internalError(cause.getClass().getSimpleName() + ": " + cause.getMessage());
        }
    }

    private CompletableFuture<Void> drain(InputStream in, OutputSink.Stream stream, OutputSink sink, StringBuilder capture) {
        return CompletableFuture.runAsync(() -> {
            char[] buf = new char[CHUNK_SIZE];
            try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
                int n;
                while ((n = reader.read(buf)) != -1) {
                    String chunk = new String(buf, 0, n);
                    synchronized (capture) {
                        if (capture.length() < MAX_CAPTURE_CHARS) {
                            capture.append(chunk, 0, Math.min(chunk.length(), MAX_CAPTURE_CHARS - capture.length()));
                        }
                    }
                    sink.write(stream, chunk);
                }
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }, streamExec);
    }

    private static boolean waitFor(Process process, Duration timeout) throws InterruptedException {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            process.waitFor();
            return true;
        }
        return process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * 等待读流线程结束。超时场景下进程已被杀掉，读流最多再等一个宽限期，
     * 期间的 IO 异常（管道被关闭）不再视为失败。
     * 宽限期过后仍未结束（管道被后台子进程持有），关闭本端管道并放弃读取。
     */
    private static void awaitDrain(Process process, CompletableFuture<Void> outDrain, CompletableFuture<Void> errDrain,
                                   boolean afterKill) throws InterruptedException, ExecutionException {
        try {
            CompletableFuture.allOf(outDrain, errDrain).get(DRAIN_GRACE_MS, TimeUnit.MILLISECONDS);
        } catch (TimeoutException te) {
            log.warn("Output streams still open {}ms after process exit (pid={}), abandoning drain", DRAIN_GRACE_MS, process.pid());
            closeStreams(process);
        } catch (ExecutionException ee) {
            if (!afterKill) throw ee;
            log.debug("Stream drain ended with error after termination: {}", ee.getCause().toString());
        }
    }

    private static void terminate(Process process) throws InterruptedException {
        process.descendants().forEach(ProcessHandle::destroy);
        process.destroy();
        if (!process.waitFor(TERMINATE_GRACE_MS, TimeUnit.MILLISECONDS)) {
            process.descendants().forEach(ProcessHandle::destroyForcibly);
            process.destroyForcibly();
            process.waitFor(TERMINATE_GRACE_MS, TimeUnit.MILLISECONDS);
        }
    }

    private static void terminateQuietly(Process process) {
        if (process == null || !process.isAlive()) return;
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
    }

    private static void closeStreams(Process process) {
        try {
            process.getInputStream().close();
            process.getErrorStream().close();
        } catch (IOException e) {
            log.debug("Closing output pipes of pid={} failed: {}", process.pid(), e.toString());
        }
    }

    private static String snapshot(StringBuilder capture) {
        synchronized (capture) {
            return capture.toString();
        }
    }
}
