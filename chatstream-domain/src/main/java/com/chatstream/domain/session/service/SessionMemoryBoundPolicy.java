package com.chatstream.domain.session.service;

import com.chatstream.domain.session.model.valobj.ChatMessage;

import java.util.ArrayList;
import java.util.List;

/**
 * 内存消息上限策略：只保留最近 maxMessages 条，不影响持久化存储。
 */
public class SessionMemoryBoundPolicy {

    private final int maxMessages;

    public SessionMemoryBoundPolicy(int maxMessages) {
        if (maxMessages <= 0) {
            throw new IllegalArgumentException("maxMessages must be positive: " + maxMessages);
        }
        this.maxMessages = maxMessages;
    }

    public int getMaxMessages() {
        return maxMessages;
    }

    public List<ChatMessage> trim(List<ChatMessage> messages) {
        if (messages == null || messages.isEmpty()) {
            return new ArrayList<>();
        }
        int from = Math.max(0, messages.size() - maxMessages);
        return new ArrayList<>(messages.subList(from, messages.size()));
    }
}
