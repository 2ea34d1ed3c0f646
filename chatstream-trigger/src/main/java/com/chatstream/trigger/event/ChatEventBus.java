package com.chatstream.trigger.event;

import com.chatstream.domain.session.adapter.gateway.ChatEventSubscription;
import com.chatstream.domain.session.adapter.gateway.IChatEventSource;
import com.chatstream.domain.session.model.valobj.RawChatEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Consumer;

/**
 * 进程内聊天事件总线：事件上报入口发布，会话分发器订阅。
 * <p>
 * publish 在调用线程上同步回调所有监听器，因此同一发布方的事件顺序保持不变。
 * </p>
 */
@Slf4j
@Component
public class ChatEventBus implements IChatEventSource {

    private final ConcurrentMap<String, Consumer<RawChatEvent>> listeners = new ConcurrentHashMap<>();

    @Override
    public ChatEventSubscription subscribe(Consumer<RawChatEvent> listener) {
        if (listener == null) {
            return () -> { };
        }
        String listenerId = UUID.randomUUID().toString();
        listeners.put(listenerId, listener);
        log.info("CHAT_EVENT_LISTENER_REGISTERED listenerId={}, listeners={}", listenerId, listeners.size());
        return () -> {
            if (listeners.remove(listenerId) != null) {
                log.info("CHAT_EVENT_LISTENER_REMOVED listenerId={}, listeners={}", listenerId, listeners.size());
            }
        };
    }

    /**
     * @return 收到事件的监听器数量
     */
    public int publish(RawChatEvent event) {
        if (event == null || listeners.isEmpty()) {
            return 0;
        }
        int delivered = 0;
        for (Map.Entry<String, Consumer<RawChatEvent>> entry : listeners.entrySet()) {
            try {
                entry.getValue().accept(event);
                delivered++;
            } catch (Exception ex) {
                log.warn("CHAT_EVENT_LISTENER_FAILED listenerId={}, event={}, error={}",
                        entry.getKey(), event.name(), ex.getMessage());
            }
        }
        return delivered;
    }

    public int listenerCount() {
        return listeners.size();
    }
}
