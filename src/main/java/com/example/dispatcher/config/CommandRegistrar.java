package com.example.dispatcher.config;

import com.example.dispatcher.service.ArgumentTokenizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

import javax.annotation.PostConstruct;
import java.io.File;
import java.io.InputStream;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * CommandRegistrar: 管理 commandName -> 可执行命令（argv 前缀）的解析与缓存。
 * 优先策略：
 *  1) cache（已解析过的命令）
 *  2) commands.properties 映射（value 为可执行文件 + 固定参数）
 *  3) commandName 本身是可执行文件的绝对路径
 *  4) 在 PATH 中按文件名查找（dispatcher.search-path=true 时）
 *
 * 支持的 commands.properties 格式：
 *   report.daily=/opt/app/bin/console app:report:daily
 *   cleanup=/usr/local/bin/cleanup.sh
 */
@Slf4j
@Component
public class CommandRegistrar {

    private final DispatcherProperties properties;

    // cache: commandName -> argv prefix
    private final Map<String, List<String>> cache = new ConcurrentHashMap<>();

    // properties loaded from classpath:/commands.properties
    private final Properties mappings = new Properties();

    public CommandRegistrar(DispatcherProperties properties) {
        this.properties = properties;
    }

    @PostConstruct
    public void init() {
        String file = properties.getCommandsFile();
        if (file == null || file.trim().isEmpty()) {
            log.debug("No commands file configured");
            return;
        }
        try {
            Resource r = new ClassPathResource(file.trim());
            if (r.exists()) {
                try (InputStream in = r.getInputStream()) {
                    mappings.load(in);
                    log.info("Loaded {} ({} entries)", file, mappings.size());
                }
            } else {
                log.debug("No {} found on classpath", file);
            }
        } catch (Exception ex) {
            log.warn("Failed to load " + file, ex);
        }
    }

    /**
     * 解析命令，返回 argv 前缀（不含 dispatcher.command-prefix 与作业参数）
     */
    public Optional<List<String>> resolve(String commandName) {
        if (commandName == null || commandName.trim().isEmpty()) return Optional.empty();
        String name = commandName.trim();

        // 1.cache
        List<String> cached = cache.get(name);
        if (cached != null) return Optional.of(cached);

        // 2.properties mapping
        String mapped = mappings.getProperty(name);
        if (mapped != null && !mapped.trim().isEmpty()) {
            List<String> argv;
            try {
                argv = ArgumentTokenizer.tokenize(mapped);
            } catch (IllegalArgumentException e) {
                log.warn("Bad mapping for command '{}': {}", name, e.getMessage());
                return Optional.empty();
            }
            Optional<String> exe = locateExecutable(argv.get(0));
            if (!exe.isPresent()) {
                log.warn("Mapped executable for command '{}' not found: {}", name, argv.get(0));
                return Optional.empty();
            }
            List<String> resolved = new ArrayList<>(argv);
            resolved.set(0, exe.get());
            return Optional.of(remember(name, resolved));
        }

        // 3./4. executable path or PATH lookup
        if (name.indexOf(' ') >= 0) return Optional.empty();
        Optional<String> exe = locateExecutable(name);
        return exe.map(e -> remember(name, Collections.singletonList(e)));
    }

    private List<String> remember(String name, List<String> argv) {
        List<String> value = Collections.unmodifiableList(argv);
        cache.putIfAbsent(name, value);
        return value;
    }

    private Optional<String> locateExecutable(String exe) {
        File file = new File(exe);
        if (file.isAbsolute() || exe.contains(File.separator)) {
            return (file.isFile() && file.canExecute()) ? Optional.of(file.getAbsolutePath()) : Optional.empty();
        }
        if (!properties.isSearchPath()) return Optional.empty();

        String path = System.getenv("PATH");
        if (path != null) {
            for (String dir : path.split(File.pathSeparator)) {
                if (dir.isEmpty()) continue;
                File candidate = new File(dir, exe);
                if (candidate.isFile() && candidate.canExecute()) {
                    return Optional.of(candidate.getAbsolutePath());
                }
            }
        }
        return Optional.empty();
    }
}
