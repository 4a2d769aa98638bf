package com.example.dispatcher.service;

import lombok.extern.slf4j.Slf4j;

/**
 * 一次 pass 的控制台报告。quiet 时只保留错误。
 */
@Slf4j(topic = "console")
public class ConsoleOutput {

    private final boolean quiet;

    public ConsoleOutput(boolean quiet) {
        this.quiet = quiet;
    }

    public void info(String message) {
        if (!quiet) log.info(message);
    }

    public void error(String message) {
        log.error(message);
    }
}
