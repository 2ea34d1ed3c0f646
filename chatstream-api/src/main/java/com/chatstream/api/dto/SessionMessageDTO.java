package com.chatstream.api.dto;

import lombok.Data;

import java.time.Instant;

/**
 * 会话消息 DTO。
 */
@Data
public class SessionMessageDTO {

    private String messageId;
    private String conversationId;
    private String senderType;
    private String senderId;
    private String content;
    private Integer tokens;
    private Instant createdAt;
}
