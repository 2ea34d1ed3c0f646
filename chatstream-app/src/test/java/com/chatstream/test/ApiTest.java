package com.chatstream.test;

import com.chatstream.api.dto.ConversationSessionDTO;
import com.chatstream.domain.session.model.valobj.RawChatEvent;
import com.chatstream.trigger.application.command.ConversationSessionCommandService;
import com.chatstream.trigger.application.query.ConversationSessionQueryService;
import com.chatstream.trigger.event.ChatEventBus;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.Map;

/**
 * 应用上下文冒烟测试：事件经总线进入分发器后，会话状态最终收敛。
 */
@Slf4j
@SpringBootTest
public class ApiTest {

    @Autowired
    private ChatEventBus chatEventBus;

    @Autowired
    private ConversationSessionCommandService commandService;

    @Autowired
    private ConversationSessionQueryService queryService;

    @Test
    public void shouldSettleConversationThroughEventBus() throws Exception {
        Assertions.assertEquals(1, chatEventBus.listenerCount());

        commandService.beginTurn("api-conv-1", null);
        chatEventBus.publish(new RawChatEvent("chat-stream", Map.of("conversation_id", "api-conv-1", "content", "Hel")));
        chatEventBus.publish(new RawChatEvent("chat-stream", Map.of("conversation_id", "api-conv-1", "content", "lo")));
        chatEventBus.publish(new RawChatEvent("chat-complete", Map.of("conversation_id", "api-conv-1",
                "message", Map.of("id", "m1", "content", "Hello", "sender_type", "model"))));

        ConversationSessionDTO session = awaitMessages("api-conv-1", 1);

        Assertions.assertEquals("IDLE", session.getStatus());
        Assertions.assertEquals("", session.getStreamingText());
        Assertions.assertEquals("Hello", session.getMessages().get(0).getContent());
        log.info("测试完成");
    }

    private ConversationSessionDTO awaitMessages(String conversationId, int expected) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000L;
        ConversationSessionDTO session = queryService.getSession(conversationId);
        while (session.getMessages().size() < expected && System.currentTimeMillis() < deadline) {
            Thread.sleep(20L);
            session = queryService.getSession(conversationId);
        }
        return session;
    }
}
