package com.chatstream.api.dto;

import lombok.Data;

/**
 * 工具调用记录 DTO。
 */
@Data
public class ToolCallRecordDTO {

    private String toolCallId;
    private String toolName;
    private Object input;
    private Object output;
    private String status;
    private int order;
    private String contentBefore;
    private String reasoningBefore;
}
