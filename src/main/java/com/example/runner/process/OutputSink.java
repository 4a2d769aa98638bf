package com.example.runner.process;

/**
 * 进程输出的接收端。两条流由不同线程回调，实现需自行保证线程安全；
 * 同一条流内的 chunk 按到达顺序回调。
 */
public interface OutputSink extends AutoCloseable {

    enum Stream {
        STDOUT,
        STDERR
    }

    void write(Stream stream, String chunk);

    @Override
    default void close() {
    }
}
