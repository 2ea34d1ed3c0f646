package com.chatstream.api.dto;

import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * 生成后端事件上报请求 DTO。
 * <p>
 * 单条上报填写 event + payload；批量上报填写 events，两者同时出现时先处理单条。
 * </p>
 */
@Data
public class ChatEventIngressRequestDTO {

    /** 后端事件名，如 chat-stream */
    private String event;
    /** 事件载荷，字段为 snake_case */
    private Map<String, Object> payload;
    private List<ChatEventIngressRequestDTO> events;
}
