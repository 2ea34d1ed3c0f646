package com.chatstream.domain.session.model.valobj;

import com.chatstream.types.enums.ToolCallStatusEnum;

/**
 * 工具调用只读快照。
 */
public record ToolCallSnapshot(String id,
                               String toolName,
                               Object input,
                               Object output,
                               ToolCallStatusEnum status,
                               int order,
                               String contentBefore,
                               String reasoningBefore) {
}
