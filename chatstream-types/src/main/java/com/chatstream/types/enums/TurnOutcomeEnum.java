package com.chatstream.types.enums;

/**
 * 最近一轮生成的收敛方式。
 */
public enum TurnOutcomeEnum {
    NONE,
    COMPLETED,
    FAILED,
    STOPPED
}
