package com.example.dispatcher.service;

import org.slf4j.Marker;
import org.slf4j.MarkerFactory;

public final class LogMarkers {

    /** 需要人工介入的事件：作业异常退出、结果无法写回 */
    public static final Marker CRITICAL = MarkerFactory.getMarker("CRITICAL");

    private LogMarkers() {
    }
}
