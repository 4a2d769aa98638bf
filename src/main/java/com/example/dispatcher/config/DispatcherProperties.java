package com.example.dispatcher.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for the command dispatcher.
 */
@Configuration
@ConfigurationProperties(prefix = "dispatcher")
@Data
public class DispatcherProperties {

    /**
     * Directory receiving per-job log files. Empty or "false" disables job logging.
     */
    private String logPath = "";

    /**
     * Timeout applied when the pass does not specify one.
     */
    private long defaultTimeoutSeconds = 300;

    /**
     * Launcher prepended to every resolved command, e.g. an interpreter and its console script.
     */
    private List<String> commandPrefix = new ArrayList<>();

    /**
     * When set, forwarded to every command as {@code --env=<value>}.
     */
    private String environment;

    /**
     * Extra environment variables handed to every spawned process.
     */
    private Map<String, String> env = new LinkedHashMap<>();

    /**
     * Classpath resource mapping command names to executables.
     */
    private String commandsFile = "commands.properties";

    /**
     * Fall back to a PATH lookup when a command name has no explicit mapping.
     */
    private boolean searchPath = true;

    /**
     * Attempts made to persist a job result before giving up.
     */
    private int resultWriteAttempts = 3;

    private long resultWriteBackoffMs = 500;

    /**
     * Run one dispatch pass with the command line options when the application starts.
     */
    private boolean runOnStartup = true;

    private Poll poll = new Poll();

    @Data
    public static class Poll {
        /**
         * In-process fixed-delay dispatching, for deployments without an external timer.
         */
        private boolean enabled = false;

        private long delayMs = 60000;

        private long initialDelayMs = 5000;
    }

    public boolean isJobLoggingEnabled() {
        return StringUtils.hasText(logPath) && !"false".equalsIgnoreCase(logPath.trim());
    }
}
