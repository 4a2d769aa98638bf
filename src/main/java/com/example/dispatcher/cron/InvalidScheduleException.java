package com.example.dispatcher.cron;

public class InvalidScheduleException extends RuntimeException {

    public InvalidScheduleException(String expression, Throwable cause) {
        super("Invalid cron expression '" + expression + "': " + (cause == null ? "" : cause.getMessage()), cause);
    }
}
