package com.chatstream.trigger.application.event;

import com.chatstream.domain.session.model.valobj.ChatMessage;
import com.chatstream.domain.session.model.valobj.ChatStreamEvent;
import com.chatstream.domain.session.model.valobj.RawChatEvent;
import com.chatstream.types.common.Constants;
import com.chatstream.types.enums.ChatStreamEventTypeEnum;
import com.chatstream.types.enums.ResponseCode;
import com.chatstream.types.enums.SenderTypeEnum;
import com.chatstream.types.exception.AppException;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * 原始事件解析器：事件名 + snake_case 载荷 -> 类型化会话事件。
 * <p>
 * 无法识别的事件名、缺失会话 ID 或必填字段时抛出 ILLEGAL_PARAMETER，由调用方丢弃并记录。
 * </p>
 */
@Component
public class ChatStreamEventParser {

    public ChatStreamEvent parse(RawChatEvent raw) {
        if (raw == null) {
            throw illegal("事件为空");
        }
        ChatStreamEventTypeEnum type = ChatStreamEventTypeEnum.fromWireName(raw.name());
        if (type == null) {
            throw illegal("未知事件类型: " + raw.name());
        }
        Map<String, Object> payload = raw.payload();
        String conversationId = text(payload.get(Constants.CONVERSATION_ID_KEY));
        if (StringUtils.isBlank(conversationId)) {
            throw illegal("conversation_id 不能为空, event=" + raw.name());
        }
        conversationId = conversationId.trim();

        switch (type) {
            case CONTENT_CHUNK:
                return new ChatStreamEvent.ContentChunk(conversationId, requiredContent(payload, raw.name()));
            case REASONING_CHUNK:
                return new ChatStreamEvent.ReasoningChunk(conversationId, requiredContent(payload, raw.name()));
            case REASONING_STARTED:
                return new ChatStreamEvent.ReasoningStarted(conversationId);
            case TOOL_CALL_STARTED:
                return new ChatStreamEvent.ToolCallStarted(conversationId,
                        required(payload, "tool_call_id", raw.name()),
                        text(payload.get("tool_name")),
                        payload.get("tool_input"));
            case TOOL_CALL_COMPLETED:
                return new ChatStreamEvent.ToolCallCompleted(conversationId,
                        required(payload, "tool_call_id", raw.name()),
                        payload.get("tool_output"),
                        text(payload.get("error")));
            case SEARCH_DECISION_STARTED:
                return new ChatStreamEvent.SearchDecisionStarted(conversationId,
                        required(payload, "message_id", raw.name()));
            case SEARCH_DECISION_COMPLETED:
                return new ChatStreamEvent.SearchDecisionCompleted(conversationId,
                        required(payload, "message_id", raw.name()));
            case ATTACHMENT_PROCESSING_STARTED:
                return new ChatStreamEvent.AttachmentProcessingStarted(conversationId,
                        text(payload.get("message_id")),
                        textList(payload.get("urls")));
            case ATTACHMENT_PROCESSING_COMPLETED:
                return new ChatStreamEvent.AttachmentProcessingCompleted(conversationId,
                        text(payload.get("message_id")),
                        textList(payload.get("attachment_ids")));
            case ATTACHMENT_PROCESSING_ERROR:
                return new ChatStreamEvent.AttachmentProcessingError(conversationId,
                        text(payload.get("message_id")),
                        StringUtils.defaultIfBlank(text(payload.get("error")), text(payload.get("message"))));
            case ATTACHMENT_UPDATE:
                return new ChatStreamEvent.AttachmentUpdate(conversationId,
                        text(payload.get("message_id")),
                        text(payload.get("completed_url")));
            case GENERATION_COMPLETED:
                return new ChatStreamEvent.GenerationCompleted(conversationId,
                        toMessage(conversationId, payload.get("message")),
                        Boolean.TRUE.equals(payload.get("cancelled")));
            case GENERATION_ERROR:
                return new ChatStreamEvent.GenerationError(conversationId,
                        StringUtils.defaultIfBlank(text(payload.get("error")), text(payload.get("message"))));
            case GENERATION_STOPPED:
                return new ChatStreamEvent.GenerationStopped(conversationId);
            case CONVERSATION_TITLE_UPDATED:
                return new ChatStreamEvent.ConversationTitleUpdated(conversationId, text(payload.get("title")));
            default:
                throw illegal("未支持的事件类型: " + type);
        }
    }

    private ChatMessage toMessage(String conversationId, Object value) {
        if (!(value instanceof Map<?, ?> message)) {
            throw illegal("chat-complete 缺少 message");
        }
        String id = text(message.get("id"));
        if (StringUtils.isBlank(id)) {
            throw illegal("chat-complete message.id 不能为空");
        }
        SenderTypeEnum senderType = SenderTypeEnum.fromCode(text(message.get("sender_type")));
        return new ChatMessage(
                id.trim(),
                StringUtils.defaultIfBlank(text(message.get("conversation_id")), conversationId),
                senderType == null ? SenderTypeEnum.ASSISTANT : senderType,
                text(message.get("sender_id")),
                text(message.get("content")),
                integer(message.get("tokens")),
                ChatMessage.parseCreatedAt(text(message.get("created_at")))
        );
    }

    private String requiredContent(Map<String, Object> payload, String eventName) {
        Object content = payload.get("content");
        if (!(content instanceof String chunk)) {
            throw illegal("content 缺失或不是字符串, event=" + eventName);
        }
        return chunk;
    }

    private String required(Map<String, Object> payload, String key, String eventName) {
        String value = text(payload.get(key));
        if (StringUtils.isBlank(value)) {
            throw illegal(key + " 不能为空, event=" + eventName);
        }
        return value.trim();
    }

    private List<String> textList(Object value) {
        if (!(value instanceof Collection<?> items)) {
            return List.of();
        }
        List<String> result = new ArrayList<>(items.size());
        for (Object item : items) {
            String normalized = text(item);
            if (StringUtils.isNotBlank(normalized)) {
                result.add(normalized.trim());
            }
        }
        return result;
    }

    private Integer integer(Object value) {
        if (value instanceof Number number) {
            return number.intValue();
        }
        return null;
    }

    private String text(Object value) {
        return value == null ? null : String.valueOf(value);
    }

    private AppException illegal(String message) {
        return new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), message);
    }
}
