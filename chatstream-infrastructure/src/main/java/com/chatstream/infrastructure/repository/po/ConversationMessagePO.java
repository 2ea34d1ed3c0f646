package com.chatstream.infrastructure.repository.po;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

/**
 * 生成后端返回的消息记录。
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ConversationMessagePO {

    private String id;

    @JsonProperty("conversation_id")
    private String conversationId;

    @JsonProperty("sender_type")
    private String senderType;

    @JsonProperty("sender_id")
    private String senderId;

    private String content;

    private Integer tokens;

    @JsonProperty("created_at")
    private String createdAt;
}
