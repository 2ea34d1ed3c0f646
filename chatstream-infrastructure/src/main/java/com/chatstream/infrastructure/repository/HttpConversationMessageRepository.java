package com.chatstream.infrastructure.repository;

import com.chatstream.domain.session.adapter.repository.IConversationMessageRepository;
import com.chatstream.domain.session.model.valobj.ChatMessage;
import com.chatstream.infrastructure.gateway.BackendHttpClient;
import com.chatstream.infrastructure.repository.po.ConversationMessagePO;
import com.chatstream.infrastructure.util.JsonCodec;
import com.chatstream.types.enums.ResponseCode;
import com.chatstream.types.enums.SenderTypeEnum;
import com.chatstream.types.exception.AppException;
import com.fasterxml.jackson.core.type.TypeReference;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 会话消息仓储实现：GET /conversations/{id}/messages。
 */
@Repository
@Slf4j
public class HttpConversationMessageRepository implements IConversationMessageRepository {

    private static final TypeReference<List<ConversationMessagePO>> MESSAGE_LIST_REF =
            new TypeReference<List<ConversationMessagePO>>() {};

    private final BackendHttpClient httpClient;
    private final JsonCodec jsonCodec;

    public HttpConversationMessageRepository(BackendHttpClient httpClient, JsonCodec jsonCodec) {
        this.httpClient = httpClient;
        this.jsonCodec = jsonCodec;
    }

    @Override
    public List<ChatMessage> listByConversation(String conversationId) {
        String path = "/conversations/" + BackendHttpClient.encodePathSegment(conversationId) + "/messages";
        BackendHttpClient.HttpResult result = httpClient.get(path);
        if (result.statusCode() == 404) {
            return Collections.emptyList();
        }
        if (!result.ok()) {
            throw new AppException(ResponseCode.BACKEND_UNAVAILABLE.getCode(),
                    "加载消息历史失败，HTTP " + result.statusCode());
        }
        List<ConversationMessagePO> records = jsonCodec.readValue(result.body(), MESSAGE_LIST_REF);
        if (records == null || records.isEmpty()) {
            return Collections.emptyList();
        }
        List<ChatMessage> messages = new ArrayList<>(records.size());
        for (ConversationMessagePO po : records) {
            ChatMessage message = toEntity(conversationId, po);
            if (message != null) {
                messages.add(message);
            }
        }
        log.debug("BACKEND_MESSAGES_LOADED conversationId={}, count={}", conversationId, messages.size());
        return messages;
    }

    private ChatMessage toEntity(String conversationId, ConversationMessagePO po) {
        if (po == null || StringUtils.isBlank(po.getId())) {
            log.warn("BACKEND_MESSAGE_SKIPPED conversationId={}, reason=blank_id", conversationId);
            return null;
        }
        SenderTypeEnum senderType = SenderTypeEnum.fromCode(po.getSenderType());
        return new ChatMessage(
                po.getId(),
                StringUtils.defaultIfBlank(po.getConversationId(), conversationId),
                senderType == null ? SenderTypeEnum.ASSISTANT : senderType,
                po.getSenderId(),
                po.getContent(),
                po.getTokens(),
                ChatMessage.parseCreatedAt(po.getCreatedAt())
        );
    }
}
