package com.example.runner.process;

import lombok.Getter;
import lombok.ToString;

import java.time.Duration;

@Getter
@ToString
public final class ExecutionResult {

    public enum Outcome {
        /** 进程正常退出（exit code < 127） */
        COMPLETED,
        /** 超时，进程已被终止 */
        TIMED_OUT,
        /** exit code >= 127：被信号杀死或 command not found */
        EXECUTION_ERROR,
        /** 启动 / 读流 / 等待过程中的异常，或没有空闲的读流线程 */
        INTERNAL_ERROR
    }

    private final Outcome outcome;
    private final Integer exitCode;
    private final String stdout;
    private final String stderr;
    private final String message;

    private ExecutionResult(Outcome outcome, Integer exitCode, String stdout, String stderr, String message) {
        this.outcome = outcome;
        this.exitCode = exitCode;
        this.stdout = stdout == null ? "" : stdout;
        this.stderr = stderr == null ? "" : stderr;
        this.message = message;
    }

    public static ExecutionResult completed(int exitCode, String stdout, String stderr) {
        return new ExecutionResult(Outcome.COMPLETED, exitCode, stdout, stderr, null);
    }

    public static ExecutionResult timedOut(Duration timeout, String stdout, String stderr) {
        return new ExecutionResult(Outcome.TIMED_OUT, null, stdout, stderr,
                "Process exceeded the timeout of " + timeout.getSeconds() + "s");
    }

    public static ExecutionResult executionError(int exitCode, String stdout, String stderr) {
        String detail = stderr == null ? "" : stderr.trim();
        return new ExecutionResult(Outcome.EXECUTION_ERROR, exitCode, stdout, stderr,
                "Abnormal exit code " + exitCode + (detail.isEmpty() ? "" : ": " + detail));
    }

    public static ExecutionResult internalError(String message) {
        return new ExecutionResult(Outcome.INTERNAL_ERROR, null, null, null, message);
    }
}
