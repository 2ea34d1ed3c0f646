package com.chatstream.trigger.application.common;

import com.chatstream.api.dto.ConversationSessionDTO;
import com.chatstream.api.dto.SessionMessageDTO;
import com.chatstream.api.dto.ToolCallRecordDTO;
import com.chatstream.domain.session.model.valobj.ChatMessage;
import com.chatstream.domain.session.model.valobj.ConversationSessionSnapshot;
import com.chatstream.domain.session.model.valobj.ToolCallSnapshot;
import com.chatstream.types.enums.UrlFetchStatusEnum;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 会话快照视图组装。
 */
@Component
public class ConversationSessionViewAssembler {

    public ConversationSessionDTO toSessionDTO(ConversationSessionSnapshot snapshot) {
        if (snapshot == null) {
            return null;
        }
        ConversationSessionDTO dto = new ConversationSessionDTO();
        dto.setConversationId(snapshot.conversationId());
        dto.setStatus(snapshot.status() == null ? null : snapshot.status().name());
        dto.setReasoningActive(snapshot.reasoningActive());
        dto.setStreamingText(snapshot.streamingText());
        dto.setReasoningText(snapshot.reasoningText());
        dto.setMessages(toMessageDTOList(snapshot.messages()));
        dto.setActiveToolCalls(toToolCallDTOList(snapshot.activeToolCalls()));
        dto.setPendingSearchDecisions(new ArrayList<>(snapshot.pendingSearchDecisions()));
        dto.setAttachmentStatus(snapshot.attachmentStatus() == null ? null : snapshot.attachmentStatus().name());
        dto.setUrlStatuses(toUrlStatusView(snapshot.urlStatuses()));
        dto.setAttachmentRefreshKey(snapshot.attachmentRefreshKey());
        dto.setLastError(snapshot.lastError());
        dto.setLastOutcome(snapshot.lastOutcome() == null ? null : snapshot.lastOutcome().name());
        dto.setTitle(snapshot.title());
        dto.setLoading(snapshot.loading());
        dto.setTurnCancelled(snapshot.turnCancelled());
        dto.setVersion(snapshot.version());
        return dto;
    }

    public SessionMessageDTO toMessageDTO(ChatMessage message) {
        SessionMessageDTO dto = new SessionMessageDTO();
        dto.setMessageId(message.id());
        dto.setConversationId(message.conversationId());
        dto.setSenderType(message.senderType() == null ? null : message.senderType().getCode());
        dto.setSenderId(message.senderId());
        dto.setContent(message.content());
        dto.setTokens(message.tokens());
        dto.setCreatedAt(message.createdAt());
        return dto;
    }

    private List<SessionMessageDTO> toMessageDTOList(List<ChatMessage> messages) {
        if (messages == null || messages.isEmpty()) {
            return Collections.emptyList();
        }
        List<SessionMessageDTO> result = new ArrayList<>(messages.size());
        for (ChatMessage message : messages) {
            result.add(toMessageDTO(message));
        }
        return result;
    }

    private List<ToolCallRecordDTO> toToolCallDTOList(List<ToolCallSnapshot> toolCalls) {
        if (toolCalls == null || toolCalls.isEmpty()) {
            return Collections.emptyList();
        }
        List<ToolCallRecordDTO> result = new ArrayList<>(toolCalls.size());
        for (ToolCallSnapshot toolCall : toolCalls) {
            ToolCallRecordDTO dto = new ToolCallRecordDTO();
            dto.setToolCallId(toolCall.id());
            dto.setToolName(toolCall.toolName());
            dto.setInput(toolCall.input());
            dto.setOutput(toolCall.output());
            dto.setStatus(toolCall.status() == null ? null : toolCall.status().name());
            dto.setOrder(toolCall.order());
            dto.setContentBefore(toolCall.contentBefore());
            dto.setReasoningBefore(toolCall.reasoningBefore());
            result.add(dto);
        }
        return result;
    }

    private Map<String, Map<String, String>> toUrlStatusView(Map<String, Map<String, UrlFetchStatusEnum>> urlStatuses) {
        if (urlStatuses == null || urlStatuses.isEmpty()) {
            return Collections.emptyMap();
        }
        Map<String, Map<String, String>> result = new LinkedHashMap<>();
        for (Map.Entry<String, Map<String, UrlFetchStatusEnum>> entry : urlStatuses.entrySet()) {
            Map<String, String> statuses = new LinkedHashMap<>();
            entry.getValue().forEach((url, status) -> statuses.put(url, status.name()));
            result.put(entry.getKey(), statuses);
        }
        return result;
    }
}
