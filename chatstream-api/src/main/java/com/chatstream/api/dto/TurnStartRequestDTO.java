package com.chatstream.api.dto;

import lombok.Data;

import java.time.Instant;

/**
 * 回合开始请求 DTO：用户发送消息后由界面调用。
 */
@Data
public class TurnStartRequestDTO {

    /** 已持久化的用户消息 ID，可为空 */
    private String messageId;
    private String content;
    private String senderId;
    private Integer tokens;
    private Instant createdAt;
}
