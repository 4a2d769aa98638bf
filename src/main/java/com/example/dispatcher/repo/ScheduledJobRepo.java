package com.example.dispatcher.repo;

import com.example.dispatcher.domain.ScheduledJob;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.util.List;

@Repository
public interface ScheduledJobRepo extends JpaRepository<ScheduledJob, Long> {

    List<ScheduledJob> findByEnabledTrueOrderByPriorityDescIdAsc();

    /**
     * 将作业从未锁定原子转为锁定，同时记录 last_execution。
     * 只有在当前仍为 locked=false 时更新成功（返回 1）。
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE ScheduledJob j SET j.locked = true, j.lastExecution = :now " +
            "WHERE j.id = :id AND j.locked = false")
    int markLocked(@Param("id") Long id, @Param("now") Timestamp now);

    /**
     * 回写结果并释放锁，同时清除 executeImmediately。
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE ScheduledJob j SET j.lastReturnCode = :code, j.locked = false, j.executeImmediately = false " +
            "WHERE j.id = :id")
    int release(@Param("id") Long id, @Param("code") Integer code);

    /**
     * 批量解锁：locked=true 且 last_execution 早于 cutoff；last_execution 为空的不处理。
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE ScheduledJob j SET j.locked = false " +
            "WHERE j.locked = true AND j.lastExecution < :cutoff")
    int unlockLockedBefore(@Param("cutoff") Timestamp cutoff);
}
