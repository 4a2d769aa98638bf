package com.example.dispatcher.service;

import java.nio.file.Path;

public class LogPathNotWritableException extends RuntimeException {

    public LogPathNotWritableException(Path path) {
        super(path + " not found or not writable. You should override `dispatcher.log-path` in your configuration");
    }
}
