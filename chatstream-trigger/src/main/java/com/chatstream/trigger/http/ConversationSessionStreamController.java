package com.chatstream.trigger.http;

import com.chatstream.api.dto.ConversationSessionDTO;
import com.chatstream.domain.session.model.valobj.ConversationSessionSnapshot;
import com.chatstream.domain.session.service.ConversationSessionStore;
import com.chatstream.trigger.application.common.ConversationSessionViewAssembler;
import com.chatstream.types.enums.ResponseCode;
import com.chatstream.types.exception.AppException;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.http.MediaType;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * 会话状态 SSE：订阅后先推送当前快照，之后每次状态变更推送一次 session.snapshot。
 * 事件 id 为快照 version，客户端可据此丢弃乱序的旧快照。会话被删除时关闭其所有流。
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/conversations")
public class ConversationSessionStreamController {

    private static final long SSE_TIMEOUT_MS = 30L * 60L * 1000L;
    private static final long SSE_RECONNECT_TIME_MS = 1500L;
    private static final String SNAPSHOT_EVENT = "session.snapshot";
    private static final String HEARTBEAT_EVENT = "stream.heartbeat";

    private final ConversationSessionStore sessionStore;
    private final ConversationSessionViewAssembler viewAssembler;
    private final ConcurrentMap<String, StreamSubscriber> subscribers = new ConcurrentHashMap<>();

    public ConversationSessionStreamController(ConversationSessionStore sessionStore,
                                               ConversationSessionViewAssembler viewAssembler) {
        this.sessionStore = sessionStore;
        this.viewAssembler = viewAssembler;
        sessionStore.addRemovalListener(this::closeConversationStreams);
    }

    @GetMapping(value = "/{id}/session/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream(@PathVariable("id") String conversationId, HttpServletResponse response) {
        if (StringUtils.isBlank(conversationId)) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), "conversationId 不能为空");
        }
        String normalizedId = conversationId.trim();
        applySseResponseHeaders(response);

        SseEmitter emitter = new SseEmitter(SSE_TIMEOUT_MS);
        String subscriberId = UUID.randomUUID().toString();
        StreamSubscriber subscriber = new StreamSubscriber(subscriberId, normalizedId, emitter);
        subscribers.put(subscriberId, subscriber);

        emitter.onCompletion(() -> removeSubscriber(subscriber));
        emitter.onTimeout(() -> removeSubscriber(subscriber));
        emitter.onError(ex -> {
            log.debug("SESSION_STREAM_EMITTER_ERROR conversationId={}, subscriberId={}, error={}",
                    normalizedId, subscriberId, ex == null ? "unknown" : ex.getMessage());
            removeSubscriber(subscriber);
        });

        sessionStore.subscribe(normalizedId, subscriberId, snapshot -> deliverSnapshot(subscriber, snapshot));
        log.info("SESSION_STREAM_SUBSCRIBED conversationId={}, subscriberId={}, observers={}",
                normalizedId, subscriberId, sessionStore.observerCount(normalizedId));
        deliverSnapshot(subscriber, sessionStore.snapshot(normalizedId));
        return emitter;
    }

    @Scheduled(fixedDelayString = "${sse.heartbeat-interval-ms:10000}", scheduler = "daemonScheduler")
    public void emitHeartbeat() {
        if (subscribers.isEmpty()) {
            return;
        }
        for (StreamSubscriber subscriber : subscribers.values()) {
            synchronized (subscriber) {
                if (!send(subscriber, HEARTBEAT_EVENT, Map.of("conversationId", subscriber.conversationId), null)) {
                    removeSubscriber(subscriber);
                }
            }
        }
    }

    public int subscriberCount() {
        return subscribers.size();
    }

    private void deliverSnapshot(StreamSubscriber subscriber, ConversationSessionSnapshot snapshot) {
        if (subscriber == null || snapshot == null) {
            return;
        }
        synchronized (subscriber) {
            // 观察者通知在锁外进行，可能乱序到达
            if (snapshot.version() < subscriber.lastVersion) {
                return;
            }
            ConversationSessionDTO payload = viewAssembler.toSessionDTO(snapshot);
            if (!send(subscriber, SNAPSHOT_EVENT, payload, String.valueOf(snapshot.version()))) {
                removeSubscriber(subscriber);
                return;
            }
            subscriber.lastVersion = snapshot.version();
        }
    }

    private boolean send(StreamSubscriber subscriber, String eventName, Object payload, String eventId) {
        try {
            SseEmitter.SseEventBuilder builder = SseEmitter.event()
                    .name(eventName)
                    .data(payload)
                    .reconnectTime(SSE_RECONNECT_TIME_MS);
            if (eventId != null) {
                builder.id(eventId);
            }
            subscriber.emitter.send(builder);
            return true;
        } catch (IOException | RuntimeException ex) {
            log.debug("SESSION_STREAM_SEND_FAILED conversationId={}, subscriberId={}, event={}, error={}",
                    subscriber.conversationId, subscriber.subscriberId, eventName, ex.getMessage());
            return false;
        }
    }

    private void applySseResponseHeaders(HttpServletResponse response) {
        if (response == null) {
            return;
        }
        response.setHeader("Cache-Control", "no-cache, no-transform");
        response.setHeader("X-Accel-Buffering", "no");
        response.setHeader("Connection", "keep-alive");
    }

    private void closeConversationStreams(String conversationId) {
        int closed = 0;
        for (StreamSubscriber subscriber : subscribers.values()) {
            if (!subscriber.conversationId.equals(conversationId)) {
                continue;
            }
            removeSubscriber(subscriber);
            try {
                subscriber.emitter.complete();
            } catch (RuntimeException ex) {
                log.debug("SESSION_STREAM_COMPLETE_FAILED conversationId={}, subscriberId={}, error={}",
                        conversationId, subscriber.subscriberId, ex.getMessage());
            }
            closed++;
        }
        if (closed > 0) {
            log.info("SESSION_STREAM_CLOSED conversationId={}, reason=session_removed, streams={}", conversationId, closed);
        }
    }

    private void removeSubscriber(StreamSubscriber subscriber) {
        if (subscriber == null) {
            return;
        }
        StreamSubscriber removed = subscribers.remove(subscriber.subscriberId);
        sessionStore.unsubscribe(subscriber.conversationId, subscriber.subscriberId);
        if (removed != null) {
            log.info("SESSION_STREAM_UNSUBSCRIBED conversationId={}, subscriberId={}",
                    subscriber.conversationId, subscriber.subscriberId);
        }
    }

    private static final class StreamSubscriber {
        private final String subscriberId;
        private final String conversationId;
        private final SseEmitter emitter;
        private long lastVersion = -1L;

        private StreamSubscriber(String subscriberId, String conversationId, SseEmitter emitter) {
            this.subscriberId = subscriberId;
            this.conversationId = conversationId;
            this.emitter = emitter;
        }
    }
}
