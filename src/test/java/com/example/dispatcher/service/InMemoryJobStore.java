package com.example.dispatcher.service;

import com.example.dispatcher.domain.ScheduledJob;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * 测试用 JobStore：内存保存、返回副本，语义与 JpaJobStore 一致。
 */
class InMemoryJobStore implements JobStore {

    private final Map<Long, ScheduledJob> jobs = new LinkedHashMap<>();
    private final AtomicLong ids = new AtomicLong();
    final AtomicInteger claims = new AtomicInteger();
    final Set<Long> failRecordFor = new HashSet<>();

    synchronized ScheduledJob save(ScheduledJob job) {
        if (job.getId() == null) job.setId(ids.incrementAndGet());
        if (job.getName() == null) job.setName("job-" + job.getId());
        jobs.put(job.getId(), copy(job));
        return job;
    }

    synchronized ScheduledJob get(Long id) {
        return copy(jobs.get(id));
    }

    @Override
    public synchronized List<ScheduledJob> listEnabled() {
        return jobs.values().stream()
                .filter(ScheduledJob::isEnabled)
                .sorted(Comparator.comparing(ScheduledJob::getPriority).reversed().thenComparing(ScheduledJob::getId))
                .map(InMemoryJobStore::copy)
                .collect(Collectors.toList());
    }

    @Override
    public synchronized Optional<ScheduledJob> claim(Long jobId) {
        claims.incrementAndGet();
        ScheduledJob job = jobs.get(jobId);
        if (job == null || job.isLocked()) return Optional.empty();
        job.setLocked(true);
        job.setLastExecution(Timestamp.from(Instant.now()));
        return Optional.of(copy(job));
    }

    @Override
    public synchronized boolean recordResult(ScheduledJob job, int returnCode) {
        if (failRecordFor.contains(job.getId())) return false;
        ScheduledJob stored = jobs.get(job.getId());
        if (stored == null) return false;
        stored.setLastReturnCode(returnCode);
        stored.setLocked(false);
        stored.setExecuteImmediately(false);
        return true;
    }

    @Override
    public synchronized int unlockStale(long thresholdSeconds) {
        Instant cutoff = Instant.now().minusSeconds(thresholdSeconds);
        int n = 0;
        for (ScheduledJob job : jobs.values()) {
            if (job.isLocked() && job.getLastExecution() != null && job.getLastExecution().toInstant().isBefore(cutoff)) {
                job.setLocked(false);
                n++;
            }
        }
        return n;
    }

    private static ScheduledJob copy(ScheduledJob job) {
        ScheduledJob c = new ScheduledJob();
        c.setId(job.getId());
        c.setName(job.getName());
        c.setCommandName(job.getCommandName());
        c.setArguments(job.getArguments());
        c.setCronExpression(job.getCronExpression());
        c.setLastExecution(job.getLastExecution());
        c.setLastReturnCode(job.getLastReturnCode());
        c.setLogFile(job.getLogFile());
        c.setPriority(job.getPriority());
        c.setExecuteImmediately(job.isExecuteImmediately());
        c.setEnabled(job.isEnabled());
        c.setLocked(job.isLocked());
        return c;
    }
}
