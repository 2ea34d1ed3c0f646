package com.chatstream.test;

import com.chatstream.domain.session.model.valobj.ChatMessage;
import com.chatstream.infrastructure.gateway.BackendHttpClient;
import com.chatstream.infrastructure.repository.HttpConversationMessageRepository;
import com.chatstream.infrastructure.util.JsonCodec;
import com.chatstream.types.enums.SenderTypeEnum;
import com.chatstream.types.exception.AppException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

public class HttpConversationMessageRepositoryTest {

    private BackendHttpClient httpClient;
    private HttpConversationMessageRepository repository;

    @BeforeEach
    public void setUp() {
        this.httpClient = mock(BackendHttpClient.class);
        this.repository = new HttpConversationMessageRepository(httpClient, new JsonCodec(new ObjectMapper()));
    }

    @Test
    public void shouldMapBackendMessages() {
        when(httpClient.get("/conversations/conv-1/messages")).thenReturn(new BackendHttpClient.HttpResult(200,
                "[{\"id\":\"m1\",\"sender_type\":\"user\",\"content\":\"hi\",\"created_at\":\"2026-03-01T10:00:00+08:00\"},"
                        + "{\"id\":\"m2\",\"sender_type\":\"model\",\"sender_id\":\"gpt\",\"content\":\"hello\",\"tokens\":5,\"extra\":1},"
                        + "{\"id\":\"\",\"content\":\"skipped\"}]"));

        List<ChatMessage> messages = repository.listByConversation("conv-1");

        Assertions.assertEquals(2, messages.size());
        Assertions.assertEquals(SenderTypeEnum.USER, messages.get(0).senderType());
        Assertions.assertEquals(Instant.parse("2026-03-01T02:00:00Z"), messages.get(0).createdAt());
        Assertions.assertEquals("conv-1", messages.get(0).conversationId());
        Assertions.assertEquals(SenderTypeEnum.MODEL, messages.get(1).senderType());
        Assertions.assertEquals(5, messages.get(1).tokens());
        Assertions.assertNull(messages.get(1).createdAt());
    }

    @Test
    public void shouldReturnEmptyListForUnknownConversation() {
        when(httpClient.get("/conversations/conv-9/messages")).thenReturn(new BackendHttpClient.HttpResult(404, ""));

        Assertions.assertTrue(repository.listByConversation("conv-9").isEmpty());
    }

    @Test
    public void shouldFailOnMalformedBody() {
        when(httpClient.get("/conversations/conv-1/messages")).thenReturn(new BackendHttpClient.HttpResult(200, "{broken"));

        Assertions.assertThrows(AppException.class, () -> repository.listByConversation("conv-1"));
    }
}
