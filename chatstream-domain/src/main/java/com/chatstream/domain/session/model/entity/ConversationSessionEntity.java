package com.chatstream.domain.session.model.entity;

import com.chatstream.domain.session.model.valobj.ChatMessage;
import com.chatstream.domain.session.model.valobj.ConversationSessionSnapshot;
import com.chatstream.domain.session.model.valobj.ToolCallSnapshot;
import com.chatstream.types.enums.AttachmentStatusEnum;
import com.chatstream.types.enums.SessionStatusEnum;
import com.chatstream.types.enums.TurnOutcomeEnum;
import com.chatstream.types.enums.UrlFetchStatusEnum;
import lombok.AccessLevel;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 会话流式状态聚合根。
 * <p>
 * 每个 conversationId 只有一个实例，由 {@code ConversationSessionStore} 创建和销毁。
 * 本类不做同步，调用方需持有实例锁后再调用任何方法。每次变更都会递增 version。
 * </p>
 */
@Getter
public class ConversationSessionEntity {

    private final String conversationId;
    private final List<ChatMessage> messages = new ArrayList<>();
    private final Map<String, ToolCallRecordEntity> activeToolCalls = new LinkedHashMap<>();
    private final Set<String> pendingSearchDecisions = new LinkedHashSet<>();
    private final Map<String, Map<String, UrlFetchStatusEnum>> urlStatuses = new LinkedHashMap<>();
    @Getter(AccessLevel.NONE)
    private final StringBuilder streamingBuffer = new StringBuilder();
    @Getter(AccessLevel.NONE)
    private final StringBuilder reasoningBuffer = new StringBuilder();

    private SessionStatusEnum status = SessionStatusEnum.IDLE;
    private boolean reasoningActive;
    private AttachmentStatusEnum attachmentStatus = AttachmentStatusEnum.IDLE;
    private long attachmentRefreshKey;
    private String lastError;
    private TurnOutcomeEnum lastOutcome = TurnOutcomeEnum.NONE;
    private String title;
    private boolean loading;
    private boolean turnCancelled;
    private int toolCallSequence;
    private long version;

    public ConversationSessionEntity(String conversationId) {
        if (conversationId == null || conversationId.isBlank()) {
            throw new IllegalArgumentException("Conversation id cannot be blank");
        }
        this.conversationId = conversationId;
    }

    public List<ChatMessage> getMessages() {
        return Collections.unmodifiableList(messages);
    }

    /**
     * 进行中工具调用的只读快照，按开始顺序排列。
     */
    public List<ToolCallSnapshot> getActiveToolCalls() {
        List<ToolCallSnapshot> toolCalls = new ArrayList<>(activeToolCalls.size());
        for (ToolCallRecordEntity record : activeToolCalls.values()) {
            toolCalls.add(record.toSnapshot());
        }
        return Collections.unmodifiableList(toolCalls);
    }

    public Set<String> getPendingSearchDecisions() {
        return Collections.unmodifiableSet(pendingSearchDecisions);
    }

    public Map<String, Map<String, UrlFetchStatusEnum>> getUrlStatuses() {
        return Collections.unmodifiableMap(urlStatuses);
    }

    public String getStreamingText() {
        return streamingBuffer.toString();
    }

    public String getReasoningText() {
        return reasoningBuffer.toString();
    }

    public boolean isGenerating() {
        return status.isGenerating();
    }

    // ---- 回合 ----

    public void startTurn(ChatMessage userMessage, int maxMessages) {
        if (userMessage != null) {
            upsertMessage(userMessage, maxMessages);
        }
        clearTransientBuffers();
        activeToolCalls.clear();
        toolCallSequence = 0;
        lastError = null;
        turnCancelled = false;
        lastOutcome = TurnOutcomeEnum.NONE;
        status = SessionStatusEnum.AWAITING_RESPONSE;
        touch();
    }

    public void markStreaming() {
        if (status != SessionStatusEnum.STREAMING) {
            status = SessionStatusEnum.STREAMING;
            touch();
        }
    }

    public void activateReasoning() {
        if (!reasoningActive) {
            reasoningActive = true;
            touch();
        }
    }

    public void appendStreamingText(String text) {
        if (text == null || text.isEmpty()) {
            return;
        }
        streamingBuffer.append(text);
        touch();
    }

    public void appendReasoningText(String text) {
        if (text == null || text.isEmpty()) {
            return;
        }
        reasoningBuffer.append(text);
        touch();
    }

    /**
     * 后端完成事件是该回合的最后一个事件，结算后解除停止屏蔽。
     */
    public void settleCompleted() {
        turnCancelled = false;
        settle(SessionStatusEnum.IDLE, TurnOutcomeEnum.COMPLETED);
    }

    public void settleFailed(String error) {
        lastError = (error == null || error.isBlank()) ? "Unknown generation error" : error;
        turnCancelled = false;
        settle(SessionStatusEnum.IDLE, TurnOutcomeEnum.FAILED);
    }

    /**
     * 本地停止：被停止回合迟到的增量与工具事件将被丢弃，
     * 直到后端送达该回合的终结事件或下一次 startTurn。
     */
    public void settleStopped() {
        turnCancelled = true;
        settle(SessionStatusEnum.IDLE, TurnOutcomeEnum.STOPPED);
    }

    /**
     * 后端确认停止或以 cancelled 完成：被停止回合不会再有事件，解除屏蔽。
     */
    public void settleStoppedByBackend() {
        turnCancelled = false;
        settle(SessionStatusEnum.IDLE, TurnOutcomeEnum.STOPPED);
    }

    /**
     * 界面卸载时重置瞬时状态，已提交消息不受影响。
     */
    public void resetTransient() {
        clearTransientBuffers();
        activeToolCalls.clear();
        pendingSearchDecisions.clear();
        urlStatuses.clear();
        status = SessionStatusEnum.IDLE;
        attachmentStatus = AttachmentStatusEnum.IDLE;
        turnCancelled = false;
        touch();
    }

    private void settle(SessionStatusEnum targetStatus, TurnOutcomeEnum outcome) {
        clearTransientBuffers();
        activeToolCalls.clear();
        pendingSearchDecisions.clear();
        status = targetStatus;
        lastOutcome = outcome;
        touch();
    }

    private void clearTransientBuffers() {
        streamingBuffer.setLength(0);
        reasoningBuffer.setLength(0);
        reasoningActive = false;
    }

    // ---- 消息 ----

    /**
     * 提交消息：同 id 原位替换，否则追加；随后只保留最近 maxMessages 条。
     *
     * @return true 表示替换了已有消息
     */
    public boolean upsertMessage(ChatMessage message, int maxMessages) {
        if (message == null) {
            return false;
        }
        boolean replaced = false;
        for (int i = 0; i < messages.size(); i++) {
            if (messages.get(i).id().equals(message.id())) {
                messages.set(i, message);
                replaced = true;
                break;
            }
        }
        if (!replaced) {
            messages.add(message);
        }
        retainLatest(maxMessages);
        touch();
        return replaced;
    }

    public void replaceMessages(List<ChatMessage> loaded) {
        messages.clear();
        if (loaded != null) {
            messages.addAll(loaded);
        }
        touch();
    }

    public void clearMessages() {
        messages.clear();
        touch();
    }

    public void retainLatest(int maxMessages) {
        if (maxMessages <= 0 || messages.size() <= maxMessages) {
            return;
        }
        messages.subList(0, messages.size() - maxMessages).clear();
    }

    public void markLoading(boolean loading) {
        if (this.loading != loading) {
            this.loading = loading;
            touch();
        }
    }

    // ---- 工具调用 ----

    /**
     * @return false 表示同 id 的调用已存在，本次开始事件被忽略
     */
    public boolean startToolCall(String toolCallId, String toolName, Object input) {
        if (activeToolCalls.containsKey(toolCallId)) {
            return false;
        }
        ToolCallRecordEntity record = ToolCallRecordEntity.running(toolCallId, toolName, input,
                toolCallSequence++, getStreamingText(), getReasoningText());
        activeToolCalls.put(toolCallId, record);
        touch();
        return true;
    }

    public boolean completeToolCall(String toolCallId, Object output, String error) {
        ToolCallRecordEntity record = activeToolCalls.get(toolCallId);
        if (record == null || !record.complete(output, error)) {
            return false;
        }
        touch();
        return true;
    }

    // ---- 搜索决策 / 附件 ----

    public boolean addPendingSearchDecision(String messageId) {
        boolean added = pendingSearchDecisions.add(messageId);
        if (added) {
            touch();
        }
        return added;
    }

    public boolean removePendingSearchDecision(String messageId) {
        boolean removed = messageId != null && pendingSearchDecisions.remove(messageId);
        if (removed) {
            touch();
        }
        return removed;
    }

    public void bumpAttachmentRefreshKey() {
        attachmentRefreshKey++;
        touch();
    }

    public void startAttachmentProcessing(String messageId, List<String> urls) {
        attachmentStatus = AttachmentStatusEnum.PROCESSING;
        if (messageId != null && urls != null && !urls.isEmpty()) {
            Map<String, UrlFetchStatusEnum> statuses = urlStatuses.computeIfAbsent(messageId, key -> new LinkedHashMap<>());
            for (String url : urls) {
                statuses.put(url, UrlFetchStatusEnum.FETCHING);
            }
        }
        touch();
    }

    public void markUrlFetched(String messageId, String url) {
        if (messageId == null || url == null) {
            return;
        }
        urlStatuses.computeIfAbsent(messageId, key -> new LinkedHashMap<>()).put(url, UrlFetchStatusEnum.FETCHED);
        touch();
    }

    public void completeAttachmentProcessing(String messageId) {
        attachmentStatus = AttachmentStatusEnum.COMPLETE;
        if (messageId != null) {
            urlStatuses.remove(messageId);
        }
        touch();
    }

    public void failAttachmentProcessing(String messageId) {
        attachmentStatus = AttachmentStatusEnum.ERROR;
        if (messageId != null) {
            urlStatuses.remove(messageId);
        }
        touch();
    }

    public void updateTitle(String title) {
        this.title = title;
        touch();
    }

    public ConversationSessionSnapshot toSnapshot() {
        Map<String, Map<String, UrlFetchStatusEnum>> urls = new LinkedHashMap<>();
        for (Map.Entry<String, Map<String, UrlFetchStatusEnum>> entry : urlStatuses.entrySet()) {
            urls.put(entry.getKey(), Collections.unmodifiableMap(new LinkedHashMap<>(entry.getValue())));
        }
        return new ConversationSessionSnapshot(
                conversationId,
                status,
                reasoningActive,
                getStreamingText(),
                getReasoningText(),
                List.copyOf(messages),
                getActiveToolCalls(),
                Collections.unmodifiableSet(new LinkedHashSet<>(pendingSearchDecisions)),
                attachmentStatus,
                Collections.unmodifiableMap(urls),
                attachmentRefreshKey,
                lastError,
                lastOutcome,
                title,
                loading,
                turnCancelled,
                version
        );
    }

    private void touch() {
        version++;
    }
}
