package com.chatstream.domain.session.model.valobj;

import com.chatstream.types.enums.ChatStreamEventTypeEnum;

import java.util.List;

/**
 * 解析后的会话事件。每种后端事件对应一个记录类型，均携带 conversationId。
 */
public interface ChatStreamEvent {

    String conversationId();

    ChatStreamEventTypeEnum type();

    record ContentChunk(String conversationId, String content) implements ChatStreamEvent {
        @Override
        public ChatStreamEventTypeEnum type() {
            return ChatStreamEventTypeEnum.CONTENT_CHUNK;
        }
    }

    record ReasoningChunk(String conversationId, String content) implements ChatStreamEvent {
        @Override
        public ChatStreamEventTypeEnum type() {
            return ChatStreamEventTypeEnum.REASONING_CHUNK;
        }
    }

    record ReasoningStarted(String conversationId) implements ChatStreamEvent {
        @Override
        public ChatStreamEventTypeEnum type() {
            return ChatStreamEventTypeEnum.REASONING_STARTED;
        }
    }

    record ToolCallStarted(String conversationId,
                           String toolCallId,
                           String toolName,
                           Object input) implements ChatStreamEvent {
        @Override
        public ChatStreamEventTypeEnum type() {
            return ChatStreamEventTypeEnum.TOOL_CALL_STARTED;
        }
    }

    /**
     * error 非空表示工具执行失败。
     */
    record ToolCallCompleted(String conversationId,
                             String toolCallId,
                             Object output,
                             String error) implements ChatStreamEvent {
        @Override
        public ChatStreamEventTypeEnum type() {
            return ChatStreamEventTypeEnum.TOOL_CALL_COMPLETED;
        }
    }

    record SearchDecisionStarted(String conversationId, String messageId) implements ChatStreamEvent {
        @Override
        public ChatStreamEventTypeEnum type() {
            return ChatStreamEventTypeEnum.SEARCH_DECISION_STARTED;
        }
    }

    record SearchDecisionCompleted(String conversationId, String messageId) implements ChatStreamEvent {
        @Override
        public ChatStreamEventTypeEnum type() {
            return ChatStreamEventTypeEnum.SEARCH_DECISION_COMPLETED;
        }
    }

    record AttachmentProcessingStarted(String conversationId,
                                       String messageId,
                                       List<String> urls) implements ChatStreamEvent {
        public AttachmentProcessingStarted {
            urls = urls == null ? List.of() : List.copyOf(urls);
        }

        @Override
        public ChatStreamEventTypeEnum type() {
            return ChatStreamEventTypeEnum.ATTACHMENT_PROCESSING_STARTED;
        }
    }

    record AttachmentProcessingCompleted(String conversationId,
                                         String messageId,
                                         List<String> attachmentIds) implements ChatStreamEvent {
        public AttachmentProcessingCompleted {
            attachmentIds = attachmentIds == null ? List.of() : List.copyOf(attachmentIds);
        }

        @Override
        public ChatStreamEventTypeEnum type() {
            return ChatStreamEventTypeEnum.ATTACHMENT_PROCESSING_COMPLETED;
        }
    }

    record AttachmentProcessingError(String conversationId,
                                     String messageId,
                                     String error) implements ChatStreamEvent {
        @Override
        public ChatStreamEventTypeEnum type() {
            return ChatStreamEventTypeEnum.ATTACHMENT_PROCESSING_ERROR;
        }
    }

    record AttachmentUpdate(String conversationId,
                            String messageId,
                            String completedUrl) implements ChatStreamEvent {
        @Override
        public ChatStreamEventTypeEnum type() {
            return ChatStreamEventTypeEnum.ATTACHMENT_UPDATE;
        }
    }

    /**
     * cancelled 为 true 时 message 是用户停止后保存的部分回复。
     */
    record GenerationCompleted(String conversationId,
                               ChatMessage message,
                               boolean cancelled) implements ChatStreamEvent {
        @Override
        public ChatStreamEventTypeEnum type() {
            return ChatStreamEventTypeEnum.GENERATION_COMPLETED;
        }
    }

    record GenerationError(String conversationId, String error) implements ChatStreamEvent {
        @Override
        public ChatStreamEventTypeEnum type() {
            return ChatStreamEventTypeEnum.GENERATION_ERROR;
        }
    }

    record GenerationStopped(String conversationId) implements ChatStreamEvent {
        @Override
        public ChatStreamEventTypeEnum type() {
            return ChatStreamEventTypeEnum.GENERATION_STOPPED;
        }
    }

    record ConversationTitleUpdated(String conversationId, String title) implements ChatStreamEvent {
        @Override
        public ChatStreamEventTypeEnum type() {
            return ChatStreamEventTypeEnum.CONVERSATION_TITLE_UPDATED;
        }
    }
}
