package com.example.dispatcher.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 追加写作业日志，每行一个 JSON 对象：
 * {"timestamp","level","message","job_id","run_correlation_id"[,"stream"]}
 * 进程输出按行切分，未结束的半行保留到下一个 chunk 或 close 时输出。
 */
@Slf4j
public class JobLogWriter implements JobLog {

    private final ObjectMapper mapper;
    private final Path file;
    private final Long jobId;
    private final String correlationId;
    private final BufferedWriter writer;
    private final Map<Stream, StringBuilder> partial = new EnumMap<>(Stream.class);
    private boolean broken;

    public JobLogWriter(ObjectMapper mapper, Path file, Long jobId, String correlationId) throws IOException {
        this.mapper = mapper;
        this.file = file;
        this.jobId = jobId;
        this.correlationId = correlationId;
        this.writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        for (Stream s : Stream.values()) partial.put(s, new StringBuilder());
    }

    @Override
    public synchronized void write(Stream stream, String chunk) {
        StringBuilder buf = partial.get(stream);
        buf.append(chunk);
        int nl;
        while ((nl = buf.indexOf("\n")) >= 0) {
            String line = buf.substring(0, nl);
            buf.delete(0, nl + 1);
            if (line.endsWith("\r")) line = line.substring(0, line.length() - 1);
            append(levelOf(stream), line, stream);
        }
    }

    @Override
    public synchronized void event(String level, String message) {
        append(level, message, null);
    }

    @Override
    public synchronized void close() {
        for (Map.Entry<Stream, StringBuilder> e : partial.entrySet()) {
            if (e.getValue().length() > 0) {
                append(levelOf(e.getKey()), e.getValue().toString(), e.getKey());
                e.getValue().setLength(0);
            }
        }
        try {
            writer.close();
        } catch (IOException e) {
            log.warn("Failed to close job log {}: {}", file, e.toString());
        }
    }

    private void append(String level, String message, Stream stream) {
        if (broken) return;
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("timestamp", Instant.now().toString());
        record.put("level", level);
        record.put("message", message);
        record.put("job_id", jobId);
        record.put("run_correlation_id", correlationId);
        if (stream != null) record.put("stream", stream.name().toLowerCase());
        try {
            writer.write(mapper.writeValueAsString(record));
            writer.newLine();
            writer.flush();
        } catch (JsonProcessingException e) {
            log.warn("Cannot serialize job log record for job id={}: {}", jobId, e.toString());
        } catch (IOException e) {
            // 日志文件写失败不影响作业本身，后续记录丢弃
            broken = true;
            log.warn("Job log {} became unwritable, further output discarded: {}", file, e.toString());
        }
    }

    private static String levelOf(Stream stream) {
        return stream == Stream.STDERR ? "WARN" : "INFO";
    }
}
