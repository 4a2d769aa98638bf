package com.example.dispatcher.service;

import com.example.dispatcher.config.CommandRegistrar;
import com.example.dispatcher.config.DispatcherProperties;
import com.example.dispatcher.cron.CronEvaluator;
import com.example.dispatcher.cron.InvalidScheduleException;
import com.example.dispatcher.domain.DispatchOptions;
import com.example.dispatcher.domain.DispatchReport;
import com.example.dispatcher.domain.JobOutcome;
import com.example.dispatcher.domain.ScheduledJob;
import com.example.runner.process.ExecutionResult;
import com.example.runner.process.ProcessInvocation;
import com.example.runner.process.ProcessRunner;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.security.SecureRandom;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 一次调度 pass：读取启用作业 → 到期判断 → 领取 → 执行外部进程 → 回写结果。
 * 作业严格串行；任何一个作业的失败都不影响同一 pass 内的其它作业。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CommandDispatcher {

    public static final int INTERNAL_FAILURE_CODE = -1;
    public static final String JOB_ID_ENV = "DISPATCHER_JOB_ID";

    static final String MDC_JOB_ID = "jobId";
    static final String MDC_RUN_ID = "runId";

    private static final DateTimeFormatter LAST_EXECUTION_FORMAT =
            DateTimeFormatter.ofPattern("dd/MM/yyyy HH:mm:ss").withZone(ZoneId.systemDefault());
    private static final SecureRandom RANDOM = new SecureRandom();

    private final JobStore store;
    private final CronEvaluator cron;
    private final CommandRegistrar commands;
    private final ProcessRunner runner;
    private final JobLogService jobLogs;
    private final StaleLockReaper reaper;
    private final DispatcherProperties properties;

    /**
     * @throws LogPathNotWritableException 作业日志目录不可写，pass 在处理任何作业之前中止
     */
    public DispatchReport dispatch(DispatchOptions options) {
        ConsoleOutput out = new ConsoleOutput(options.isNoOutput());
        DispatchReport report = new DispatchReport(options.isDump());

        if (options.getUnlockSeconds() != null) {
            out.info("Unlocking after " + options.getUnlockSeconds());
            report.setUnlocked(reaper.reap(options.getUnlockSeconds()));
        }

        out.info("Start : " + (options.isDump() ? "Dump" : "Execute") + " all scheduled command");

        try {
            jobLogs.checkWritable();
        } catch (LogPathNotWritableException e) {
            out.error(e.getMessage());
            throw e;
        }

        Duration timeout = Duration.ofSeconds(options.getTimeoutSeconds() != null
                ? options.getTimeoutSeconds()
                : properties.getDefaultTimeoutSeconds());

        List<ScheduledJob> jobs = store.listEnabled();
        log.debug("Dispatch pass over {} enabled job(s), dump={}, timeout={}s", jobs.size(), options.isDump(), timeout.getSeconds());

        for (ScheduledJob job : jobs) {
            JobOutcome outcome = handle(job, options, timeout, out);
            if (outcome != null) report.add(outcome);
        }

        if (report.isNothingToDo()) {
            out.info("Nothing to do.");
        }
        return report;
    }

    private JobOutcome handle(ScheduledJob job, DispatchOptions options, Duration timeout, ConsoleOutput out) {
        Instant now = Instant.now();
        boolean due;
        try {
            due = cron.isDue(job, now);
        } catch (InvalidScheduleException e) {
            log.warn("Invalid cron id={}, cron={}: {}", job.getId(), job.getCronExpression(), e.getMessage());
            return null;
        }
        if (!due) return null;

        if (job.isExecuteImmediately()) {
            out.info("Immediately execution asked for : " + job.getCommandName());
        } else {
            out.info("Command " + job.getCommandName() + " should be executed - last execution : "
                    + (job.getLastExecution() == null ? "never" : LAST_EXECUTION_FORMAT.format(job.getLastExecution().toInstant())) + ".");
        }

        if (options.isDump()) {
            return JobOutcome.builder()
                    .jobId(job.getId())
                    .name(job.getName())
                    .status(JobOutcome.Status.DUE)
                    .nextRun(nextRunQuietly(job, now))
                    .build();
        }
        return execute(job, timeout, out);
    }

    private JobOutcome execute(ScheduledJob job, Duration timeout, ConsoleOutput out) {
        Optional<ScheduledJob> claimed;
        try {
            claimed = store.claim(job.getId());
        } catch (RuntimeException e) {
            log.error("Claim failed for job id={}", job.getId(), e);
            out.error("Command " + job.getCommandName() + " could not be locked (" + e.getMessage() + ")");
            return outcome(job, JobOutcome.Status.ERROR, null, null, false);
        }
        if (!claimed.isPresent()) {
            log.info("Job id={} is locked, skipped", job.getId());
            out.error("Command " + job.getCommandName() + " is locked");
            return outcome(job, JobOutcome.Status.LOCKED, null, null, false);
        }

        ScheduledJob locked = claimed.get();
        String runId = locked.getId() + "-" + Long.toHexString(RANDOM.nextLong());
        MDC.put(MDC_JOB_ID, String.valueOf(locked.getId()));
        MDC.put(MDC_RUN_ID, runId);

        JobLog jobLog = JobLog.NONE;
        int returnCode = INTERNAL_FAILURE_CODE;
        JobOutcome.Status status = JobOutcome.Status.ERROR;
        boolean recorded = false;
        try {
            Optional<List<String>> resolved = commands.resolve(locked.getCommandName());
            if (!resolved.isPresent()) {
                status = JobOutcome.Status.COMMAND_NOT_FOUND;
                log.error("Cannot find command '{}' for job id={}", locked.getCommandName(), locked.getId());
                out.error("Cannot find " + locked.getCommandName());
            } else {
                ProcessInvocation invocation = buildInvocation(locked, resolved.get(), runId);
                jobLog = jobLogs.open(locked, runId);
                jobLog.event("DEBUG", "Start command #" + locked.getId());
                out.info("Execute : " + locked.getCommandName() + " " + nullToEmpty(locked.getArguments()));
                log.info("Execute job id={}: {}", locked.getId(), invocation.commandLine());

                ExecutionResult result = runner.run(invocation, timeout, jobLog);
                jobLog.event("DEBUG", "End command #" + locked.getId());

                switch (result.getOutcome()) {
                    case COMPLETED:
                        returnCode = result.getExitCode();
                        status = returnCode == 0 ? JobOutcome.Status.SUCCEEDED : JobOutcome.Status.FAILED;
                        log.info("Job id={} finished with exit code {}", locked.getId(), returnCode);
                        break;
                    case TIMED_OUT:
                        returnCode = INTERNAL_FAILURE_CODE;
                        status = JobOutcome.Status.TIMED_OUT;
                        reportError(locked, result.getMessage(), jobLog, false);
                        break;
                    case EXECUTION_ERROR:
                        returnCode = result.getExitCode();
                        status = JobOutcome.Status.ERROR;
                        reportError(locked, "ERROR " + invocation.commandLine() + " " + result.getMessage(), jobLog, true);
                        break;
                    case INTERNAL_ERROR:
                    default:
                        returnCode = INTERNAL_FAILURE_CODE;
                        status = JobOutcome.Status.ERROR;
                        reportError(locked, result.getMessage(), jobLog, true);
                        break;
                }
            }
        } catch (RuntimeException e) {
            returnCode = INTERNAL_FAILURE_CODE;
            status = JobOutcome.Status.ERROR;
            log.error("Error command #{} {}", locked.getId(), e.getMessage(), e);
            log.error(LogMarkers.CRITICAL, "{} (job id={})", e.getMessage(), locked.getId());
            jobLog.event("ERROR", "Error command #" + locked.getId() + " " + e.getMessage());
        } finally {
            jobLog.close();
            recorded = store.recordResult(locked, returnCode);
            if (!recorded) {
                out.error("Cannot unlock command " + locked.getCommandName());
            }
            MDC.remove(MDC_JOB_ID);
            MDC.remove(MDC_RUN_ID);
        }
        return outcome(locked, status, returnCode, runId, recorded);
    }

    /**
     * 有效调用行：command-prefix + 解析出的可执行命令 + 作业参数 [+ --env=...]；
     * 环境 = 继承环境 + dispatcher.env + 作业 id / 关联 id
     */
    ProcessInvocation buildInvocation(ScheduledJob job, List<String> resolved, String runId) {
        List<String> argv = new ArrayList<>(properties.getCommandPrefix());
        argv.addAll(resolved);
        argv.addAll(ArgumentTokenizer.tokenize(job.getArguments()));
        if (StringUtils.hasText(properties.getEnvironment())) {
            argv.add("--env=" + properties.getEnvironment().trim());
        }
        return ProcessInvocation.builder()
                .command(argv)
                .environment(properties.getEnv())
                .env(JOB_ID_ENV, String.valueOf(job.getId()))
                .correlationId(runId)
                .build();
    }

    private void reportError(ScheduledJob job, String message, JobLog jobLog, boolean critical) {
        log.error("Error command #{} {}", job.getId(), message);
        jobLog.event("ERROR", "Error command #" + job.getId() + " " + message);
        if (critical) {
            log.error(LogMarkers.CRITICAL, "{} (job id={})", message, job.getId());
            jobLog.event("CRITICAL", message);
        }
    }

    private Instant nextRunQuietly(ScheduledJob job, Instant now) {
        try {
            Instant base = job.getLastExecution() == null ? now : job.getLastExecution().toInstant();
            return cron.nextRun(job.getCronExpression(), base);
        } catch (InvalidScheduleException e) {
            return null;
        }
    }

    private static JobOutcome outcome(ScheduledJob job, JobOutcome.Status status, Integer returnCode, String runId, boolean recorded) {
        return JobOutcome.builder()
                .jobId(job.getId())
                .name(job.getName())
                .status(status)
                .returnCode(returnCode)
                .correlationId(runId)
                .recorded(recorded)
                .build();
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
