package com.chatstream.domain.session.service;

import com.chatstream.domain.session.model.entity.ConversationSessionEntity;
import com.chatstream.domain.session.model.valobj.ChatMessage;
import com.chatstream.domain.session.model.valobj.ChatStreamEvent;
import com.chatstream.domain.session.model.valobj.ChatStreamEvent.AttachmentProcessingCompleted;
import com.chatstream.domain.session.model.valobj.ChatStreamEvent.AttachmentProcessingError;
import com.chatstream.domain.session.model.valobj.ChatStreamEvent.AttachmentProcessingStarted;
import com.chatstream.domain.session.model.valobj.ChatStreamEvent.AttachmentUpdate;
import com.chatstream.domain.session.model.valobj.ChatStreamEvent.ContentChunk;
import com.chatstream.domain.session.model.valobj.ChatStreamEvent.ConversationTitleUpdated;
import com.chatstream.domain.session.model.valobj.ChatStreamEvent.GenerationCompleted;
import com.chatstream.domain.session.model.valobj.ChatStreamEvent.GenerationError;
import com.chatstream.domain.session.model.valobj.ChatStreamEvent.GenerationStopped;
import com.chatstream.domain.session.model.valobj.ChatStreamEvent.ReasoningChunk;
import com.chatstream.domain.session.model.valobj.ChatStreamEvent.ReasoningStarted;
import com.chatstream.domain.session.model.valobj.ChatStreamEvent.SearchDecisionCompleted;
import com.chatstream.domain.session.model.valobj.ChatStreamEvent.SearchDecisionStarted;
import com.chatstream.domain.session.model.valobj.ChatStreamEvent.ToolCallCompleted;
import com.chatstream.domain.session.model.valobj.ChatStreamEvent.ToolCallStarted;
import com.chatstream.types.enums.SessionStatusEnum;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * 会话状态迁移领域服务：定义每种事件/意图对会话状态的影响。
 * <p>
 * 调用方需持有会话实例锁。所有 apply 方法返回状态是否发生变化，未变化时不通知观察者。
 * </p>
 */
@Slf4j
public class SessionTransitionDomainService {

    private final SessionMemoryBoundPolicy memoryBoundPolicy;

    public SessionTransitionDomainService(SessionMemoryBoundPolicy memoryBoundPolicy) {
        this.memoryBoundPolicy = memoryBoundPolicy;
    }

    /**
     * IDLE -> AWAITING_RESPONSE。正在生成时拒绝开始新回合。
     */
    public void beginTurn(ConversationSessionEntity session, ChatMessage userMessage) {
        if (session.isGenerating()) {
            throw new IllegalStateException("会话正在生成中，不能开始新回合: " + session.getConversationId());
        }
        session.startTurn(userMessage, memoryBoundPolicy.getMaxMessages());
    }

    /**
     * 应用一段节流合并后的正文。
     */
    public boolean applyContentFlush(ConversationSessionEntity session, String text) {
        if (text == null || text.isEmpty()) {
            return false;
        }
        if (session.isTurnCancelled()) {
            log.debug("SESSION_CHUNK_DROPPED conversationId={}, kind=content, reason=turn_cancelled, length={}",
                    session.getConversationId(), text.length());
            return false;
        }
        session.markStreaming();
        session.appendStreamingText(text);
        return true;
    }

    /**
     * 应用一段节流合并后的推理文本，同时打开推理标记。
     */
    public boolean applyReasoningFlush(ConversationSessionEntity session, String text) {
        if (text == null || text.isEmpty()) {
            return false;
        }
        if (session.isTurnCancelled()) {
            log.debug("SESSION_CHUNK_DROPPED conversationId={}, kind=reasoning, reason=turn_cancelled, length={}",
                    session.getConversationId(), text.length());
            return false;
        }
        session.markStreaming();
        session.activateReasoning();
        session.appendReasoningText(text);
        return true;
    }

    public boolean apply(ConversationSessionEntity session, ChatStreamEvent event) {
        if (event == null) {
            return false;
        }
        if (event instanceof ContentChunk chunk) {
            return applyContentFlush(session, chunk.content());
        }
        if (event instanceof ReasoningChunk chunk) {
            return applyReasoningFlush(session, chunk.content());
        }
        if (event instanceof ReasoningStarted) {
            if (session.isTurnCancelled()) {
                return false;
            }
            session.activateReasoning();
            return true;
        }
        if (event instanceof ToolCallStarted started) {
            return applyToolCallStarted(session, started);
        }
        if (event instanceof ToolCallCompleted completed) {
            return applyToolCallCompleted(session, completed);
        }
        if (event instanceof SearchDecisionStarted started) {
            return session.addPendingSearchDecision(started.messageId());
        }
        if (event instanceof SearchDecisionCompleted completed) {
            session.removePendingSearchDecision(completed.messageId());
            session.bumpAttachmentRefreshKey();
            return true;
        }
        if (event instanceof AttachmentProcessingStarted started) {
            session.startAttachmentProcessing(started.messageId(), started.urls());
            return true;
        }
        if (event instanceof AttachmentUpdate update) {
            session.markUrlFetched(update.messageId(), update.completedUrl());
            session.bumpAttachmentRefreshKey();
            session.removePendingSearchDecision(update.messageId());
            return true;
        }
        if (event instanceof AttachmentProcessingCompleted completed) {
            session.completeAttachmentProcessing(completed.messageId());
            return true;
        }
        if (event instanceof AttachmentProcessingError error) {
            log.warn("SESSION_ATTACHMENT_FAILED conversationId={}, messageId={}, error={}",
                    session.getConversationId(), error.messageId(), error.error());
            session.failAttachmentProcessing(error.messageId());
            return true;
        }
        if (event instanceof GenerationCompleted completed) {
            return applyCompleted(session, completed);
        }
        if (event instanceof GenerationError error) {
            session.settleFailed(error.error());
            return true;
        }
        if (event instanceof GenerationStopped) {
            // 后端确认停止后，被停止回合不会再有事件
            session.settleStoppedByBackend();
            return true;
        }
        if (event instanceof ConversationTitleUpdated updated) {
            session.updateTitle(updated.title());
            return true;
        }
        log.warn("SESSION_EVENT_UNHANDLED conversationId={}, type={}", session.getConversationId(), event.type());
        return false;
    }

    /**
     * 本地停止：清空流式状态回到 IDLE，已提交消息不受影响。
     * 被停止回合迟到的增量在后端送达终结事件前一律丢弃。
     */
    public void stop(ConversationSessionEntity session) {
        session.settleStopped();
    }

    /**
     * 视图卸载时重置瞬时状态。
     */
    public void cleanup(ConversationSessionEntity session) {
        session.resetTransient();
    }

    public void loadMessages(ConversationSessionEntity session, List<ChatMessage> history) {
        session.replaceMessages(memoryBoundPolicy.trim(history));
    }

    private boolean applyToolCallStarted(ConversationSessionEntity session, ToolCallStarted event) {
        if (session.isTurnCancelled()) {
            log.debug("SESSION_TOOL_CALL_DROPPED conversationId={}, toolCallId={}, reason=turn_cancelled",
                    session.getConversationId(), event.toolCallId());
            return false;
        }
        if (!session.startToolCall(event.toolCallId(), event.toolName(), event.input())) {
            log.debug("SESSION_TOOL_CALL_DUPLICATE conversationId={}, toolCallId={}",
                    session.getConversationId(), event.toolCallId());
            return false;
        }
        return true;
    }

    private boolean applyToolCallCompleted(ConversationSessionEntity session, ToolCallCompleted event) {
        if (!session.completeToolCall(event.toolCallId(), event.output(), event.error())) {
            log.debug("SESSION_TOOL_RESULT_IGNORED conversationId={}, toolCallId={}, status={}",
                    session.getConversationId(), event.toolCallId(), session.getStatus());
            return false;
        }
        return true;
    }

    private boolean applyCompleted(ConversationSessionEntity session, GenerationCompleted event) {
        SessionStatusEnum before = session.getStatus();
        boolean replaced = session.upsertMessage(event.message(), memoryBoundPolicy.getMaxMessages());
        if (replaced && before.isGenerating()) {
            // 上一回合的重复完成事件，不结束当前回合
            log.debug("SESSION_COMPLETION_DUPLICATE conversationId={}, messageId={}, status={}",
                    session.getConversationId(), event.message().id(), before);
            return true;
        }
        if (event.cancelled()) {
            session.settleStoppedByBackend();
        } else {
            session.settleCompleted();
        }
        return true;
    }
}
