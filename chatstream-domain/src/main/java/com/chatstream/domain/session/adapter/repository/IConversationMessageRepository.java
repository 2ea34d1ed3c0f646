package com.chatstream.domain.session.adapter.repository;

import com.chatstream.domain.session.model.valobj.ChatMessage;

import java.util.List;

/**
 * 会话消息历史仓储接口（只读，持久化由外部负责）。
 */
public interface IConversationMessageRepository {

    /**
     * 按时间正序返回会话的全部消息。
     */
    List<ChatMessage> listByConversation(String conversationId);
}
