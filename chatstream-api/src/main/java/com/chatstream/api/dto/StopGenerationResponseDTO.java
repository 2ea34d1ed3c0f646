package com.chatstream.api.dto;

import lombok.Data;

/**
 * 停止生成响应 DTO。
 */
@Data
public class StopGenerationResponseDTO {

    private String conversationId;
    /** 后端是否确认存在并停止了一个进行中的生成 */
    private boolean backendAcknowledged;
    private ConversationSessionDTO session;
}
