package com.example.dispatcher.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * 进程输出读取线程池
 * - 每个运行中的进程占用两个线程（stdout / stderr），单次 pass 内作业串行执行
 * - 无队列、不回落到调用线程：线程耗尽时拒绝，该作业以 INTERNAL_ERROR 结束，
 *   调度线程永远不会阻塞在读流上（否则超时无法生效）
 * - 核心线程可超时回收，一次性运行时不常驻
 */
@Configuration
public class ExecPoolConfig {

    @Bean("streamExec")
    public ThreadPoolTaskExecutor streamExec() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();

        e.setCorePoolSize(2);                     // stdout + stderr
        e.setMaxPoolSize(8);                      // 进程内轮询与一次性 pass 偶尔重叠时留余量
        e.setQueueCapacity(0);
        e.setKeepAliveSeconds(30);
        e.setAllowCoreThreadTimeOut(true);
        e.setThreadNamePrefix("proc-io-");        // 便于日志排查
        e.setDaemon(true);
        e.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());

        // 优雅关闭
        e.setWaitForTasksToCompleteOnShutdown(true);
        e.setAwaitTerminationSeconds(10);

        e.initialize();
        return e;
    }
}
