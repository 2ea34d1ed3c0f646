package com.chatstream.test.support;

import com.chatstream.domain.session.model.valobj.ChatMessage;
import com.chatstream.types.enums.SenderTypeEnum;

import java.time.Instant;

/**
 * 测试消息构造。
 */
public final class TestMessages {

    private TestMessages() {
    }

    public static ChatMessage user(String id, String conversationId, String content) {
        return new ChatMessage(id, conversationId, SenderTypeEnum.USER, null, content, null, Instant.now());
    }
}
