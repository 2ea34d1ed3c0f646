package com.chatstream.types.enums;

/**
 * 会话生成状态。
 * <pre>
 * IDLE --(beginTurn)--> AWAITING_RESPONSE --(first chunk)--> STREAMING
 * AWAITING_RESPONSE | STREAMING --(complete | error | stop)--> IDLE
 * </pre>
 * 推理中（reasoningActive）是叠加标记，不是独立状态。
 */
public enum SessionStatusEnum {
    IDLE,
    AWAITING_RESPONSE,
    STREAMING;

    public boolean isGenerating() {
        return this == AWAITING_RESPONSE || this == STREAMING;
    }
}
