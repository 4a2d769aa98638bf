package com.example.dispatcher.service;

import com.example.dispatcher.domain.ScheduledJob;
import com.example.dispatcher.repo.ScheduledJobRepo;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.util.List;
import java.util.Optional;

/**
 * 短事务集合：每个方法都在独立的新事务里执行，外部进程运行期间不持有任何事务或连接。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobTxService {

    private final ScheduledJobRepo jobRepo;

    @Transactional(propagation = Propagation.REQUIRES_NEW, readOnly = true)
    public List<ScheduledJob> listEnabledTx() {
        return jobRepo.findByEnabledTrueOrderByPriorityDescIdAsc();
    }

    /**
     * A. 原子领取（短事务 / 新事务）- 条件 UPDATE ... WHERE locked=false 保证只有一个实例成功
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public Optional<ScheduledJob> claimTx(Long jobId, Timestamp now) {
        int ok = jobRepo.markLocked(jobId, now);
        if (ok == 0) {
            // 已被其它实例锁定（或作业不存在）
            return Optional.empty();
        }
        return jobRepo.findById(jobId);
    }

    /**
     * 结果回写（短事务 / 新事务）
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean releaseTx(Long jobId, int returnCode) {
        int updated = jobRepo.release(jobId, returnCode);
        if (updated == 0) {
            log.warn("Job not found when recording result, id={}", jobId);
        }
        return updated > 0;
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public int unlockLockedBeforeTx(Timestamp cutoff) {
        return jobRepo.unlockLockedBefore(cutoff);
    }
}
