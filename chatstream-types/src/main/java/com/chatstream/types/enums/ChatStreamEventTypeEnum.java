package com.chatstream.types.enums;

import lombok.Getter;

/**
 * 生成后端推送的事件类型，wireName 为后端事件名。
 */
@Getter
public enum ChatStreamEventTypeEnum {

    CONTENT_CHUNK("chat-stream"),
    REASONING_CHUNK("chat-stream-reasoning"),
    REASONING_STARTED("reasoning-started"),
    TOOL_CALL_STARTED("tool-call-started"),
    TOOL_CALL_COMPLETED("tool-call-completed"),
    SEARCH_DECISION_STARTED("search-decision-started"),
    SEARCH_DECISION_COMPLETED("search-decision-complete"),
    ATTACHMENT_PROCESSING_STARTED("attachment-processing-started"),
    ATTACHMENT_PROCESSING_COMPLETED("attachment-processing-complete"),
    ATTACHMENT_PROCESSING_ERROR("attachment-processing-error"),
    ATTACHMENT_UPDATE("attachment-update"),
    GENERATION_COMPLETED("chat-complete"),
    GENERATION_ERROR("chat-error"),
    GENERATION_STOPPED("generation-stopped"),
    CONVERSATION_TITLE_UPDATED("conversation-updated");

    private final String wireName;

    ChatStreamEventTypeEnum(String wireName) {
        this.wireName = wireName;
    }

    /**
     * 按后端事件名解析，也接受枚举名；无法识别时返回 null。
     */
    public static ChatStreamEventTypeEnum fromWireName(String name) {
        if (name == null || name.isBlank()) {
            return null;
        }
        String normalized = name.trim();
        for (ChatStreamEventTypeEnum value : values()) {
            if (value.wireName.equals(normalized) || value.name().equalsIgnoreCase(normalized)) {
                return value;
            }
        }
        return null;
    }

    /**
     * 结束当前回合的事件。
     */
    public boolean isSettling() {
        return this == GENERATION_COMPLETED || this == GENERATION_ERROR || this == GENERATION_STOPPED;
    }
}
