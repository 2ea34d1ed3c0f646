package com.chatstream.api.dto;

import lombok.Data;

/**
 * 事件上报响应 DTO。
 */
@Data
public class ChatEventIngressResponseDTO {

    private int received;
    private int published;
    private int rejected;
}
