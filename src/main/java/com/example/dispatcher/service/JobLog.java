package com.example.dispatcher.service;

import com.example.runner.process.OutputSink;

/**
 * 单个作业一次运行的输出目的地：进程输出 + 调度器自身的事件记录。
 */
public interface JobLog extends OutputSink {

    JobLog NONE = new JobLog() {
        @Override
        public void write(Stream stream, String chunk) {
            // discard
        }

        @Override
        public void event(String level, String message) {
            // discard
        }
    };

    void event(String level, String message);
}
