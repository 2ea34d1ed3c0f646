package com.chatstream.domain.session.service;

import com.chatstream.domain.session.model.entity.ConversationSessionEntity;
import com.chatstream.domain.session.model.valobj.ConversationSessionSnapshot;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * 会话存储：conversationId -> 会话聚合根，并维护按会话的快照观察者。
 * <p>
 * 会话首次访问时惰性创建，只在 {@link #remove(String)} 时销毁。
 * 变更与快照读取均在实例锁内进行；观察者在锁外收到不可变快照。
 * </p>
 */
@Slf4j
public class ConversationSessionStore {

    private final ConcurrentMap<String, ConversationSessionEntity> sessions = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, ConcurrentMap<String, Consumer<ConversationSessionSnapshot>>> observersByConversation =
            new ConcurrentHashMap<>();
    private final List<Consumer<String>> removalListeners = new CopyOnWriteArrayList<>();

    public ConversationSessionEntity getOrCreate(String conversationId) {
        requireConversationId(conversationId);
        return sessions.computeIfAbsent(conversationId, key -> {
            log.debug("SESSION_CREATED conversationId={}", key);
            return new ConversationSessionEntity(key);
        });
    }

    /**
     * 读取快照；会话不存在时创建默认会话。
     */
    public ConversationSessionSnapshot snapshot(String conversationId) {
        ConversationSessionEntity session = getOrCreate(conversationId);
        synchronized (session) {
            return session.toSnapshot();
        }
    }

    /**
     * 在实例锁内执行变更；mutation 返回 true 时通知观察者。
     *
     * @return 变更后的快照
     */
    public ConversationSessionSnapshot update(String conversationId, Predicate<ConversationSessionEntity> mutation) {
        ConversationSessionEntity session = getOrCreate(conversationId);
        ConversationSessionSnapshot snapshot;
        boolean changed;
        synchronized (session) {
            changed = mutation.test(session);
            snapshot = session.toSnapshot();
        }
        if (changed) {
            notifyObservers(snapshot);
        }
        return snapshot;
    }

    public boolean remove(String conversationId) {
        if (conversationId == null) {
            return false;
        }
        ConversationSessionEntity removed = sessions.remove(conversationId);
        observersByConversation.remove(conversationId);
        if (removed != null) {
            log.info("SESSION_REMOVED conversationId={}", conversationId);
        }
        for (Consumer<String> listener : removalListeners) {
            try {
                listener.accept(conversationId);
            } catch (Exception ex) {
                log.warn("SESSION_REMOVAL_LISTENER_FAILED conversationId={}, error={}", conversationId, ex.getMessage());
            }
        }
        return removed != null;
    }

    /**
     * 注册会话删除监听，会话被 {@link #remove(String)} 后收到其 conversationId。
     */
    public void addRemovalListener(Consumer<String> listener) {
        if (listener != null) {
            removalListeners.add(listener);
        }
    }

    public Set<String> conversationIds() {
        return new TreeSet<>(sessions.keySet());
    }

    public int size() {
        return sessions.size();
    }

    public void subscribe(String conversationId, String subscriberId, Consumer<ConversationSessionSnapshot> listener) {
        if (conversationId == null || subscriberId == null || listener == null) {
            return;
        }
        observersByConversation.computeIfAbsent(conversationId, key -> new ConcurrentHashMap<>()).put(subscriberId, listener);
    }

    public void unsubscribe(String conversationId, String subscriberId) {
        if (conversationId == null || subscriberId == null) {
            return;
        }
        ConcurrentMap<String, Consumer<ConversationSessionSnapshot>> observers = observersByConversation.get(conversationId);
        if (observers == null) {
            return;
        }
        observers.remove(subscriberId);
        if (observers.isEmpty()) {
            observersByConversation.remove(conversationId, observers);
        }
    }

    public int observerCount(String conversationId) {
        ConcurrentMap<String, Consumer<ConversationSessionSnapshot>> observers =
                conversationId == null ? null : observersByConversation.get(conversationId);
        return observers == null ? 0 : observers.size();
    }

    private void notifyObservers(ConversationSessionSnapshot snapshot) {
        ConcurrentMap<String, Consumer<ConversationSessionSnapshot>> observers =
                observersByConversation.get(snapshot.conversationId());
        if (observers == null || observers.isEmpty()) {
            return;
        }
        for (Map.Entry<String, Consumer<ConversationSessionSnapshot>> entry : observers.entrySet()) {
            try {
                entry.getValue().accept(snapshot);
            } catch (Exception ex) {
                log.warn("SESSION_OBSERVER_FAILED conversationId={}, subscriberId={}, version={}, error={}",
                        snapshot.conversationId(), entry.getKey(), snapshot.version(), ex.getMessage());
            }
        }
    }

    private void requireConversationId(String conversationId) {
        if (conversationId == null || conversationId.isBlank()) {
            throw new IllegalArgumentException("conversationId cannot be blank");
        }
    }
}
