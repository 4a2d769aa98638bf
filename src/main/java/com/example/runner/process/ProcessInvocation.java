package com.example.runner.process;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

import java.util.List;
import java.util.Map;

/**
 * 一次外部进程调用：argv + 额外环境变量 + 关联 id（注入为 {@link ProcessRunner#RUN_ID_ENV}）。
 * 继承的环境由 ProcessBuilder 提供，这里只放增量。
 */
@Getter
@Builder
@ToString
public class ProcessInvocation {

    @Singular("arg")
    private final List<String> command;

    @Singular("env")
    private final Map<String, String> environment;

    private final String correlationId;

    public String commandLine() {
        return String.join(" ", command);
    }
}
