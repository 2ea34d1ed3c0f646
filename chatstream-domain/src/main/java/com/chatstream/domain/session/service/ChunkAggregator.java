package com.chatstream.domain.session.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 增量内容节流合并器。
 * <p>
 * 每个会话的正文与推理文本各有一个待刷新缓冲区。首个片段到达时安排一次延迟刷新，
 * 窗口内的后续片段只追加；到期后刷新任务投递到该会话的串行邮箱，按顺序拼接后一次性应用。
 * 窗口小于等于 0 时不缓冲，直接应用。
 * </p>
 */
@Slf4j
public class ChunkAggregator {

    private final TaskScheduler scheduler;
    private final ConversationSerialExecutor serialExecutor;
    private final Duration throttleWindow;
    private final ConcurrentMap<BufferKey, PendingChunkBuffer> buffers = new ConcurrentHashMap<>();
    private final AtomicLong flushCount = new AtomicLong();

    public ChunkAggregator(TaskScheduler scheduler, ConversationSerialExecutor serialExecutor, long throttleMillis) {
        this.scheduler = scheduler;
        this.serialExecutor = serialExecutor;
        this.throttleWindow = Duration.ofMillis(Math.max(0L, throttleMillis));
    }

    /**
     * 追加一个片段。应在该会话的串行邮箱内调用。
     */
    public void append(String conversationId, ChunkKind kind, String fragment, ChunkFlushHandler handler) {
        if (conversationId == null || kind == null || fragment == null || fragment.isEmpty() || handler == null) {
            return;
        }
        if (throttleWindow.isZero()) {
            flushCount.incrementAndGet();
            handler.onFlush(conversationId, kind, fragment);
            return;
        }
        BufferKey key = new BufferKey(conversationId, kind);
        buffers.compute(key, (k, existing) -> {
            PendingChunkBuffer buffer = existing == null ? new PendingChunkBuffer(handler) : existing;
            buffer.fragments.add(fragment);
            if (!buffer.scheduled) {
                buffer.scheduled = true;
                buffer.future = scheduler.schedule(() -> serialExecutor.execute(conversationId, () -> flush(k, buffer)),
                        Instant.now().plus(throttleWindow));
            }
            return buffer;
        });
    }

    /**
     * 丢弃该会话所有未刷新的片段并取消定时刷新。
     *
     * @return 被丢弃的片段数
     */
    public int cancel(String conversationId) {
        if (conversationId == null) {
            return 0;
        }
        int discarded = 0;
        for (ChunkKind kind : ChunkKind.values()) {
            PendingChunkBuffer buffer = buffers.remove(new BufferKey(conversationId, kind));
            if (buffer == null) {
                continue;
            }
            if (buffer.future != null) {
                buffer.future.cancel(false);
            }
            discarded += buffer.fragments.size();
        }
        if (discarded > 0) {
            log.debug("CHUNK_BUFFER_DISCARDED conversationId={}, fragments={}", conversationId, discarded);
        }
        return discarded;
    }

    /**
     * 立即按顺序应用该会话所有未刷新的片段并取消定时刷新。应在该会话的串行邮箱内调用。
     *
     * @return 被应用的片段数
     */
    public int flushPending(String conversationId) {
        if (conversationId == null) {
            return 0;
        }
        int flushed = 0;
        for (ChunkKind kind : ChunkKind.values()) {
            BufferKey key = new BufferKey(conversationId, kind);
            PendingChunkBuffer buffer = buffers.get(key);
            if (buffer == null) {
                continue;
            }
            if (buffer.future != null) {
                buffer.future.cancel(false);
            }
            int fragments = buffer.fragments.size();
            if (flush(key, buffer)) {
                flushed += fragments;
            }
        }
        return flushed;
    }

    /**
     * 尚未刷新的缓冲区数量（每个会话最多正文与推理各一个）。
     */
    public int pendingBufferCount() {
        return buffers.size();
    }

    public long getFlushCount() {
        return flushCount.get();
    }

    private boolean flush(BufferKey key, PendingChunkBuffer buffer) {
        // 已被 cancel 或已刷新的缓冲区不再应用
        if (!buffers.remove(key, buffer)) {
            return false;
        }
        String text = String.join("", buffer.fragments);
        if (text.isEmpty()) {
            return false;
        }
        flushCount.incrementAndGet();
        try {
            buffer.handler.onFlush(key.conversationId(), key.kind(), text);
        } catch (Exception ex) {
            log.error("CHUNK_FLUSH_FAILED conversationId={}, kind={}, length={}, error={}",
                    key.conversationId(), key.kind(), text.length(), ex.getMessage(), ex);
        }
        return true;
    }

    /**
     * 增量类型。
     */
    public enum ChunkKind {
        CONTENT,
        REASONING
    }

    /**
     * 刷新回调：收到按顺序拼接后的文本。
     */
    @FunctionalInterface
    public interface ChunkFlushHandler {
        void onFlush(String conversationId, ChunkKind kind, String text);
    }

    private record BufferKey(String conversationId, ChunkKind kind) {
        private BufferKey {
            Objects.requireNonNull(conversationId, "conversationId");
        }
    }

    private static final class PendingChunkBuffer {
        private final List<String> fragments = new ArrayList<>();
        private final ChunkFlushHandler handler;
        private boolean scheduled;
        private ScheduledFuture<?> future;

        private PendingChunkBuffer(ChunkFlushHandler handler) {
            this.handler = handler;
        }
    }
}
