package com.chatstream.api.dto;

import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * 会话流式状态快照 DTO。
 */
@Data
public class ConversationSessionDTO {

    private String conversationId;
    private String status;
    private boolean reasoningActive;
    private String streamingText;
    private String reasoningText;
    private List<SessionMessageDTO> messages;
    private List<ToolCallRecordDTO> activeToolCalls;
    private List<String> pendingSearchDecisions;
    private String attachmentStatus;
    private Map<String, Map<String, String>> urlStatuses;
    private long attachmentRefreshKey;
    private String lastError;
    private String lastOutcome;
    private String title;
    private boolean loading;
    private boolean turnCancelled;
    private long version;
}
