package com.example.dispatcher.domain;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

@Getter
@Builder
@ToString
public class DispatchOptions {

    /** 只报告到期情况，不领取、不执行 */
    private final boolean dump;

    /** 关闭控制台信息输出（错误仍输出） */
    private final boolean noOutput;

    /** 为空时使用 dispatcher.default-timeout-seconds */
    private final Long timeoutSeconds;

    /** 非空时先解锁超过该秒数的作业 */
    private final Long unlockSeconds;

    public static DispatchOptions defaults() {
        return DispatchOptions.builder().build();
    }
}
