package com.chatstream.types.enums;

import lombok.Getter;

/**
 * 消息发送方类型。
 */
@Getter
public enum SenderTypeEnum {

    USER("user"),
    MODEL("model"),
    ASSISTANT("assistant");

    private final String code;

    SenderTypeEnum(String code) {
        this.code = code;
    }

    public static SenderTypeEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        String normalized = code.trim();
        for (SenderTypeEnum value : values()) {
            if (value.code.equalsIgnoreCase(normalized) || value.name().equalsIgnoreCase(normalized)) {
                return value;
            }
        }
        return null;
    }
}
