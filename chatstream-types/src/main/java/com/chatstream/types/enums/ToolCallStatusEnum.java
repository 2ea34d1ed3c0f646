package com.chatstream.types.enums;

/**
 * 工具调用状态。
 */
public enum ToolCallStatusEnum {
    PENDING,
    RUNNING,
    SUCCESS,
    ERROR;

    public boolean isTerminal() {
        return this == SUCCESS || this == ERROR;
    }
}
