package com.chatstream.trigger.application.command;

import com.chatstream.domain.session.adapter.repository.IConversationMessageRepository;
import com.chatstream.domain.session.model.valobj.ChatMessage;
import com.chatstream.domain.session.model.valobj.ConversationSessionSnapshot;
import com.chatstream.domain.session.service.ChunkAggregator;
import com.chatstream.domain.session.service.ConversationSerialExecutor;
import com.chatstream.domain.session.service.ConversationSessionStore;
import com.chatstream.domain.session.service.SessionTransitionDomainService;
import com.chatstream.types.enums.ResponseCode;
import com.chatstream.types.enums.SenderTypeEnum;
import com.chatstream.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;

/**
 * 会话写用例：回合开始、历史加载、清空消息、视图清理与会话删除。
 */
@Slf4j
@Service
public class ConversationSessionCommandService {

    private final ConversationSessionStore sessionStore;
    private final SessionTransitionDomainService transitionDomainService;
    private final ChunkAggregator chunkAggregator;
    private final ConversationSerialExecutor serialExecutor;
    private final IConversationMessageRepository messageRepository;

    public ConversationSessionCommandService(ConversationSessionStore sessionStore,
                                             SessionTransitionDomainService transitionDomainService,
                                             ChunkAggregator chunkAggregator,
                                             ConversationSerialExecutor serialExecutor,
                                             IConversationMessageRepository messageRepository) {
        this.sessionStore = sessionStore;
        this.transitionDomainService = transitionDomainService;
        this.chunkAggregator = chunkAggregator;
        this.serialExecutor = serialExecutor;
        this.messageRepository = messageRepository;
    }

    /**
     * 用户发送消息后进入等待回复状态；提供 messageId 时同时提交用户消息。
     */
    public ConversationSessionSnapshot beginTurn(String conversationId, TurnStartCommand command) {
        String normalizedId = requireConversationId(conversationId);
        ChatMessage userMessage = toUserMessage(normalizedId, command);
        chunkAggregator.cancel(normalizedId);
        try {
            ConversationSessionSnapshot snapshot = sessionStore.update(normalizedId, session -> {
                transitionDomainService.beginTurn(session, userMessage);
                return true;
            });
            log.info("CHAT_TURN_STARTED conversationId={}, userMessageId={}, version={}",
                    normalizedId, userMessage == null ? null : userMessage.id(), snapshot.version());
            return snapshot;
        } catch (IllegalStateException ex) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), ex.getMessage());
        }
    }

    /**
     * 从后端加载消息历史，只保留最近的 N 条。
     */
    public ConversationSessionSnapshot loadMessages(String conversationId) {
        String normalizedId = requireConversationId(conversationId);
        sessionStore.update(normalizedId, session -> {
            session.markLoading(true);
            return true;
        });
        List<ChatMessage> history;
        try {
            history = messageRepository.listByConversation(normalizedId);
        } catch (RuntimeException ex) {
            sessionStore.update(normalizedId, session -> {
                session.markLoading(false);
                return true;
            });
            log.warn("CHAT_MESSAGES_LOAD_FAILED conversationId={}, error={}", normalizedId, ex.getMessage());
            if (ex instanceof AppException) {
                throw ex;
            }
            throw new AppException(ResponseCode.BACKEND_UNAVAILABLE.getCode(), "加载消息历史失败: " + ex.getMessage(), ex);
        }
        ConversationSessionSnapshot snapshot = sessionStore.update(normalizedId, session -> {
            transitionDomainService.loadMessages(session, history);
            session.markLoading(false);
            return true;
        });
        log.info("CHAT_MESSAGES_LOADED conversationId={}, loaded={}, kept={}",
                normalizedId, history == null ? 0 : history.size(), snapshot.messages().size());
        return snapshot;
    }

    /**
     * 界面已清空持久化消息后，同步清空内存中的消息列表。
     */
    public ConversationSessionSnapshot clearMessages(String conversationId) {
        String normalizedId = requireConversationId(conversationId);
        return sessionStore.update(normalizedId, session -> {
            session.clearMessages();
            return true;
        });
    }

    /**
     * 视图卸载：取消待刷新增量并重置瞬时状态，已提交消息保留。
     */
    public ConversationSessionSnapshot cleanup(String conversationId) {
        String normalizedId = requireConversationId(conversationId);
        int discarded = chunkAggregator.cancel(normalizedId);
        ConversationSessionSnapshot snapshot = sessionStore.update(normalizedId, session -> {
            transitionDomainService.cleanup(session);
            return true;
        });
        log.info("CHAT_SESSION_CLEANED conversationId={}, discardedFragments={}", normalizedId, discarded);
        return snapshot;
    }

    /**
     * 会话被删除：取消定时刷新、释放串行邮箱并移除会话及其观察者，已打开的会话流随之关闭。
     */
    public boolean remove(String conversationId) {
        String normalizedId = requireConversationId(conversationId);
        int discarded = chunkAggregator.cancel(normalizedId);
        int droppedTasks = serialExecutor.release(normalizedId);
        boolean removed = sessionStore.remove(normalizedId);
        log.info("CHAT_SESSION_REMOVE conversationId={}, removed={}, discardedFragments={}, droppedTasks={}",
                normalizedId, removed, discarded, droppedTasks);
        return removed;
    }

    private ChatMessage toUserMessage(String conversationId, TurnStartCommand command) {
        if (command == null || StringUtils.isBlank(command.messageId())) {
            return null;
        }
        return new ChatMessage(
                command.messageId().trim(),
                conversationId,
                SenderTypeEnum.USER,
                command.senderId(),
                command.content(),
                command.tokens(),
                command.createdAt() == null ? Instant.now() : command.createdAt()
        );
    }

    private String requireConversationId(String conversationId) {
        if (StringUtils.isBlank(conversationId)) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), "conversationId 不能为空");
        }
        return conversationId.trim();
    }

    public record TurnStartCommand(String messageId,
                                   String content,
                                   String senderId,
                                   Integer tokens,
                                   Instant createdAt) {
    }
}
