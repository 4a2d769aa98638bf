package com.example.dispatcher.service;

import com.example.dispatcher.domain.DispatchOptions;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 进程内定时触发，替代外部 cron / systemd timer。fixedDelay 保证同一 JVM 内 pass 不重叠；
 * 多个实例之间仍依赖 claim 互斥。
 */
@Slf4j
@Component
@EnableScheduling
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "dispatcher.poll", name = "enabled", havingValue = "true")
public class PollScheduler {
    private final CommandDispatcher dispatcher;

    @Scheduled(fixedDelayString = "${dispatcher.poll.delay-ms:60000}", initialDelayString = "${dispatcher.poll.initial-delay-ms:5000}")
    public void tick() {
        try {
            dispatcher.dispatch(DispatchOptions.builder().noOutput(true).build());
        } catch (LogPathNotWritableException e) {
            log.error("Dispatch pass aborted: {}", e.getMessage());
        }
    }
}
