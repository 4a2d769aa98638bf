package com.example.dispatcher.cli;

import com.example.dispatcher.domain.DispatchOptions;
import com.example.dispatcher.domain.DispatchReport;
import com.example.dispatcher.service.CommandDispatcher;
import com.example.dispatcher.service.LogPathNotWritableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 启动时执行一次 pass，选项：
 *   --dump              只显示到期作业
 *   --no-output         关闭信息输出
 *   --timeout=SECONDS   单个作业超时（默认 dispatcher.default-timeout-seconds）
 *   --unlock=SECONDS    先解锁超过该时长的作业
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "dispatcher", name = "run-on-startup", havingValue = "true", matchIfMissing = true)
public class DispatchCommand implements ApplicationRunner, ExitCodeGenerator {

    private final CommandDispatcher dispatcher;

    private int exitCode;

    @Override
    public void run(ApplicationArguments args) {
        DispatchOptions options;
        try {
            options = parse(args);
        } catch (IllegalArgumentException e) {
            log.error("Invalid option: {}", e.getMessage());
            exitCode = 2;
            return;
        }

        try {
            DispatchReport report = dispatcher.dispatch(options);
            log.debug("Dispatch finished: {}", report);
            exitCode = 0;
        } catch (LogPathNotWritableException e) {
            exitCode = 1;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    static DispatchOptions parse(ApplicationArguments args) {
        return DispatchOptions.builder()
                .dump(args.containsOption("dump"))
                .noOutput(args.containsOption("no-output"))
                .timeoutSeconds(seconds(args, "timeout"))
                .unlockSeconds(seconds(args, "unlock"))
                .build();
    }

    private static Long seconds(ApplicationArguments args, String name) {
        if (!args.containsOption(name)) return null;
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty() || values.get(0).trim().isEmpty()) {
            throw new IllegalArgumentException("--" + name + " requires a number of seconds");
        }
        try {
            long v = Long.parseLong(values.get(0).trim());
            if (v <= 0) throw new IllegalArgumentException("--" + name + " must be positive: " + v);
            return v;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("--" + name + " is not a number: " + values.get(0));
        }
    }
}
