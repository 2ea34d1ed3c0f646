package com.chatstream.trigger.event;

import com.chatstream.domain.session.adapter.gateway.ChatEventSubscription;
import com.chatstream.domain.session.adapter.gateway.IChatEventSource;
import com.chatstream.domain.session.model.valobj.ChatStreamEvent;
import com.chatstream.domain.session.model.valobj.RawChatEvent;
import com.chatstream.domain.session.service.ChunkAggregator;
import com.chatstream.domain.session.service.ChunkAggregator.ChunkKind;
import com.chatstream.domain.session.service.ConversationSerialExecutor;
import com.chatstream.domain.session.service.ConversationSessionStore;
import com.chatstream.domain.session.service.SessionTransitionDomainService;
import com.chatstream.trigger.application.event.ChatStreamEventParser;
import com.chatstream.types.exception.AppException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

/**
 * 会话事件分发器：订阅事件源，解析原始事件并按 conversationId 路由到各自的串行邮箱。
 * <p>
 * 正文与推理增量先进入节流合并器；完成、失败、停止事件应用前先按序刷新该会话未刷新的增量，
 * 是否结束回合由状态迁移决定，上一回合的重复完成事件不会抹掉当前回合已收到的片段。
 * 解析失败与处理异常只影响当前事件，不会中断其它会话。
 * </p>
 */
@Slf4j
@Component
public class ChatStreamEventDispatcher {

    private final IChatEventSource eventSource;
    private final ChatStreamEventParser eventParser;
    private final ConversationSessionStore sessionStore;
    private final SessionTransitionDomainService transitionDomainService;
    private final ChunkAggregator chunkAggregator;
    private final ConversationSerialExecutor serialExecutor;
    private final Counter acceptedCounter;
    private final Counter droppedCounter;
    private final Counter failedCounter;

    private volatile ChatEventSubscription subscription;

    public ChatStreamEventDispatcher(IChatEventSource eventSource,
                                     ChatStreamEventParser eventParser,
                                     ConversationSessionStore sessionStore,
                                     SessionTransitionDomainService transitionDomainService,
                                     ChunkAggregator chunkAggregator,
                                     ConversationSerialExecutor serialExecutor,
                                     ObjectProvider<MeterRegistry> meterRegistryProvider) {
        this.eventSource = eventSource;
        this.eventParser = eventParser;
        this.sessionStore = sessionStore;
        this.transitionDomainService = transitionDomainService;
        this.chunkAggregator = chunkAggregator;
        this.serialExecutor = serialExecutor;
        MeterRegistry meterRegistry = meterRegistryProvider.getIfAvailable(SimpleMeterRegistry::new);
        this.acceptedCounter = Counter.builder("chat.session.event.accepted.total").register(meterRegistry);
        this.droppedCounter = Counter.builder("chat.session.event.dropped.total").register(meterRegistry);
        this.failedCounter = Counter.builder("chat.session.event.failed.total").register(meterRegistry);
        FunctionCounter.builder("chat.session.chunk.flush.total", chunkAggregator, ChunkAggregator::getFlushCount)
                .register(meterRegistry);
        Gauge.builder("chat.session.active", sessionStore, ConversationSessionStore::size).register(meterRegistry);
        Gauge.builder("chat.session.mailbox.active", serialExecutor, ConversationSerialExecutor::activeMailboxCount)
                .register(meterRegistry);
        Gauge.builder("chat.session.chunk.pending", chunkAggregator, ChunkAggregator::pendingBufferCount)
                .register(meterRegistry);
    }

    @PostConstruct
    public void start() {
        this.subscription = subscribe();
        log.info("CHAT_EVENT_DISPATCHER_STARTED");
    }

    @PreDestroy
    public void shutdown() {
        ChatEventSubscription current = this.subscription;
        this.subscription = null;
        if (current != null) {
            current.close();
        }
        log.info("CHAT_EVENT_DISPATCHER_STOPPED");
    }

    /**
     * 在事件源上注册，返回的句柄用于取消注册。
     */
    public ChatEventSubscription subscribe() {
        return eventSource.subscribe(this::onEvent);
    }

    public void onEvent(RawChatEvent raw) {
        ChatStreamEvent event;
        try {
            event = eventParser.parse(raw);
        } catch (AppException ex) {
            droppedCounter.increment();
            log.warn("CHAT_EVENT_DROPPED event={}, reason={}", raw == null ? null : raw.name(), ex.getInfo());
            return;
        }
        acceptedCounter.increment();
        serialExecutor.execute(event.conversationId(), () -> handle(event));
    }

    private void handle(ChatStreamEvent event) {
        String conversationId = event.conversationId();
        try {
            if (event instanceof ChatStreamEvent.ContentChunk chunk) {
                chunkAggregator.append(conversationId, ChunkKind.CONTENT, chunk.content(), this::applyFlush);
                return;
            }
            if (event instanceof ChatStreamEvent.ReasoningChunk chunk) {
                chunkAggregator.append(conversationId, ChunkKind.REASONING, chunk.content(), this::applyFlush);
                return;
            }
            if (event.type().isSettling()) {
                chunkAggregator.flushPending(conversationId);
            }
            sessionStore.update(conversationId, session -> transitionDomainService.apply(session, event));
            if (event.type().isSettling()) {
                log.info("CHAT_SESSION_SETTLED conversationId={}, type={}", conversationId, event.type());
            }
        } catch (Exception ex) {
            failedCounter.increment();
            log.error("CHAT_EVENT_HANDLE_FAILED conversationId={}, type={}, error={}",
                    conversationId, event.type(), ex.getMessage(), ex);
        }
    }

    private void applyFlush(String conversationId, ChunkKind kind, String text) {
        sessionStore.update(conversationId, session -> kind == ChunkKind.REASONING
                ? transitionDomainService.applyReasoningFlush(session, text)
                : transitionDomainService.applyContentFlush(session, text));
    }
}
