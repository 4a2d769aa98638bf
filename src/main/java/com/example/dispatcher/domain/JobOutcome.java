package com.example.dispatcher.domain;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

@Getter
@Builder
@ToString
public class JobOutcome {

    public enum Status {
        DUE,                // dump 模式：到期但未执行
        LOCKED,             // 被其它实例持有，跳过
        COMMAND_NOT_FOUND,  // 命令无法解析
        SUCCEEDED,          // exit code 0
        FAILED,             // 非 0 exit code（< 127）
        TIMED_OUT,          // 超时被终止
        ERROR               // 异常退出（>= 127）或内部错误
    }

    private final Long jobId;
    private final String name;
    private final Status status;

    /** 写回的 lastReturnCode；DUE / LOCKED 时为空 */
    private final Integer returnCode;

    /** dump 模式下计算的下一次执行时间 */
    private final Instant nextRun;

    private final String correlationId;

    /** 结果是否成功写回（锁已释放） */
    private final boolean recorded;
}
