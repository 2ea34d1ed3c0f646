package com.chatstream.domain.session.model.valobj;

import com.chatstream.types.enums.AttachmentStatusEnum;
import com.chatstream.types.enums.SessionStatusEnum;
import com.chatstream.types.enums.TurnOutcomeEnum;
import com.chatstream.types.enums.UrlFetchStatusEnum;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 会话状态只读快照，供查询接口与观察者使用。所有集合均不可修改。
 */
public record ConversationSessionSnapshot(String conversationId,
                                          SessionStatusEnum status,
                                          boolean reasoningActive,
                                          String streamingText,
                                          String reasoningText,
                                          List<ChatMessage> messages,
                                          List<ToolCallSnapshot> activeToolCalls,
                                          Set<String> pendingSearchDecisions,
                                          AttachmentStatusEnum attachmentStatus,
                                          Map<String, Map<String, UrlFetchStatusEnum>> urlStatuses,
                                          long attachmentRefreshKey,
                                          String lastError,
                                          TurnOutcomeEnum lastOutcome,
                                          String title,
                                          boolean loading,
                                          boolean turnCancelled,
                                          long version) {

    public boolean isGenerating() {
        return status != null && status.isGenerating();
    }
}
