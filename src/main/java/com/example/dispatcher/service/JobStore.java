package com.example.dispatcher.service;

import com.example.dispatcher.domain.ScheduledJob;

import java.util.List;
import java.util.Optional;

/**
 * 作业存储。claim 是多实例之间唯一的互斥手段，必须是原子的条件更新。
 */
public interface JobStore {

    /**
     * 启用的作业快照，priority 降序、id 升序
     */
    List<ScheduledJob> listEnabled();

    /**
     * 领取作业：locked=false 时置为 true 并记录 lastExecution=now；
     * 已被其它实例锁定时返回 empty（正常竞争结果，不是错误）
     */
    Optional<ScheduledJob> claim(Long jobId);

    /**
     * 回写 lastReturnCode 并释放锁、清除 executeImmediately。
     * 失败不抛出，返回 false（作业保持锁定，等待 unlockStale 或人工处理）
     */
    boolean recordResult(ScheduledJob job, int returnCode);

    /**
     * 解锁 locked=true 且 lastExecution 距今超过 thresholdSeconds 的作业，返回更新行数
     */
    int unlockStale(long thresholdSeconds);
}
