package com.example.runner.process;

public final class DiscardingSink implements OutputSink {

    public static final DiscardingSink INSTANCE = new DiscardingSink();

    private DiscardingSink() {
    }

    @Override
    public void write(Stream stream, String chunk) {
        // discard
    }
}
