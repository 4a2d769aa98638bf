package com.example.dispatcher.service;

import com.example.dispatcher.config.DispatcherProperties;
import com.example.dispatcher.domain.ScheduledJob;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Slf4j
@Component
@RequiredArgsConstructor
public class JpaJobStore implements JobStore {

    private final JobTxService tx;
    private final DispatcherProperties properties;

    @Override
    public List<ScheduledJob> listEnabled() {
        return tx.listEnabledTx();
    }

    @Override
    public Optional<ScheduledJob> claim(Long jobId) {
        return tx.claimTx(jobId, tsNow());
    }

    /**
     * 每次尝试都是一个新事务、从连接池拿新连接；外部进程运行期间断开的连接
     * 会被连接池剔除，重试即可恢复。
     */
    @Override
    public boolean recordResult(ScheduledJob job, int returnCode) {
        int attempts = Math.max(1, properties.getResultWriteAttempts());
        RuntimeException last = null;
        for (int i = 1; i <= attempts; i++) {
            try {
                if (tx.releaseTx(job.getId(), returnCode)) {
                    return true;
                }
                // 行已不存在，重试无意义
                log.error(LogMarkers.CRITICAL, "Cannot unlock job id={} name={} returnCode={}: no such row",
                        job.getId(), job.getName(), returnCode);
                return false;
            } catch (RuntimeException e) {
                last = e;
                log.warn("Recording result failed for job id={} (attempt {}/{}): {}", job.getId(), i, attempts, e.toString());
                if (i < attempts && !backoff(i)) break;
            }
        }
        log.error(LogMarkers.CRITICAL, "Cannot unlock job id={} name={} returnCode={}", job.getId(), job.getName(), returnCode, last);
        return false;
    }

    @Override
    public int unlockStale(long thresholdSeconds) {
        Timestamp cutoff = Timestamp.from(Instant.now().minusSeconds(thresholdSeconds));
        return tx.unlockLockedBeforeTx(cutoff);
    }

    private boolean backoff(int attempt) {
        try {
            Thread.sleep(properties.getResultWriteBackoffMs() * attempt);
            return true;
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static Timestamp tsNow() {
        return Timestamp.from(Instant.now());
    }
}
