package com.chatstream.domain.session.model.entity;

import com.chatstream.domain.session.model.valobj.ToolCallSnapshot;
import com.chatstream.types.enums.ToolCallStatusEnum;
import lombok.Data;

/**
 * 工具调用记录实体。
 * <p>
 * order 为本回合内的开始顺序；contentBefore / reasoningBefore 记录调用开始时已流出的文本，
 * 用于界面按时间顺序穿插展示。
 * </p>
 */
@Data
public class ToolCallRecordEntity {

    private String id;
    private String toolName;
    private Object input;
    private Object output;
    private ToolCallStatusEnum status;
    private int order;
    private String contentBefore;
    private String reasoningBefore;

    public static ToolCallRecordEntity running(String id,
                                               String toolName,
                                               Object input,
                                               int order,
                                               String contentBefore,
                                               String reasoningBefore) {
        ToolCallRecordEntity entity = new ToolCallRecordEntity();
        entity.setId(id);
        entity.setToolName(toolName);
        entity.setInput(input);
        entity.setStatus(ToolCallStatusEnum.RUNNING);
        entity.setOrder(order);
        entity.setContentBefore(contentBefore == null ? "" : contentBefore);
        entity.setReasoningBefore(reasoningBefore == null ? "" : reasoningBefore);
        return entity;
    }

    public boolean isTerminal() {
        return status != null && status.isTerminal();
    }

    /**
     * 记录工具结果；已处于终态时忽略重复投递并返回 false。
     */
    public boolean complete(Object output, String error) {
        if (isTerminal()) {
            return false;
        }
        this.output = output;
        this.status = (error == null || error.isBlank()) ? ToolCallStatusEnum.SUCCESS : ToolCallStatusEnum.ERROR;
        if (this.status == ToolCallStatusEnum.ERROR && output == null) {
            this.output = error;
        }
        return true;
    }

    public ToolCallSnapshot toSnapshot() {
        return new ToolCallSnapshot(id, toolName, input, output, status, order, contentBefore, reasoningBefore);
    }
}
