package com.example.dispatcher.cron;

import com.example.dispatcher.domain.ScheduledJob;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * 计算下一次执行时间与到期判断。
 * 支持标准 5 段（分 时 日 月 周）、Spring 6 段（秒在前）以及 @hourly 等宏；
 * 5 段表达式按第 0 秒触发处理。
 */
@Component
public class CronEvaluator {

    private final ZoneId zone;

    public CronEvaluator() {
        this(ZoneId.systemDefault());
    }

    public CronEvaluator(ZoneId zone) {
        this.zone = zone;
    }

    public Instant nextRun(String expression, Instant after) {
        CronExpression cron = parse(expression);
        ZonedDateTime next = cron.next(after.atZone(zone));
        if (next == null) {
            throw new InvalidScheduleException(expression, new IllegalArgumentException("expression never fires"));
        }
        return next.toInstant();
    }

    /**
     * executeImmediately 优先于排期；从未执行过（lastExecution 为空）时从 now 起算，
     * 下一次执行总在 now 之后，因此要等到显式请求立即执行才会运行。
     */
    public boolean isDue(ScheduledJob job, Instant now) {
        if (job.isExecuteImmediately()) return true;
        Instant base = job.getLastExecution() == null ? now : job.getLastExecution().toInstant();
        return nextRun(job.getCronExpression(), base).isBefore(now);
    }

    public CronExpression parse(String expression) {
        if (!StringUtils.hasText(expression)) {
            throw new InvalidScheduleException(expression, new IllegalArgumentException("empty expression"));
        }
        String normalized = expression.trim();
        if (!normalized.startsWith("@") && normalized.split("\\s+").length == 5) {
            normalized = "0 " + normalized;
        }
        try {
            return CronExpression.parse(normalized);
        } catch (IllegalArgumentException e) {
            throw new InvalidScheduleException(expression, e);
        }
    }
}
