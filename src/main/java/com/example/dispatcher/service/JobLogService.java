package com.example.dispatcher.service;

import com.example.dispatcher.config.DispatcherProperties;
import com.example.dispatcher.domain.ScheduledJob;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * 作业日志目录的前置检查与单次运行日志的打开。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobLogService {

    private final DispatcherProperties properties;
    private final ObjectMapper mapper;

    /**
     * 开启作业日志时，目录必须存在且可写，否则整个 pass 中止
     */
    public void checkWritable() {
        if (!properties.isJobLoggingEnabled()) return;
        Path dir = logDirectory();
        if (!Files.isDirectory(dir) || !Files.isWritable(dir)) {
            throw new LogPathNotWritableException(dir);
        }
    }

    /**
     * 未配置 logFile 或全局关闭作业日志时输出直接丢弃
     */
    public JobLog open(ScheduledJob job, String correlationId) {
        if (!properties.isJobLoggingEnabled() || !StringUtils.hasText(job.getLogFile())) {
            return JobLog.NONE;
        }
        Path dir = logDirectory();
        Path file = dir.resolve(job.getLogFile().trim()).normalize();
        if (!file.startsWith(dir)) {
            log.warn("Log file of job id={} escapes the log directory, output discarded: {}", job.getId(), job.getLogFile());
            return JobLog.NONE;
        }
        try {
            return new JobLogWriter(mapper, file, job.getId(), correlationId);
        } catch (IOException e) {
            log.warn("Cannot open job log {} for job id={}, output discarded: {}", file, job.getId(), e.toString());
            return JobLog.NONE;
        }
    }

    private Path logDirectory() {
        return Paths.get(properties.getLogPath().trim()).toAbsolutePath().normalize();
    }
}
