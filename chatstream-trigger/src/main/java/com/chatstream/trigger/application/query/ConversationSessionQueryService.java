package com.chatstream.trigger.application.query;

import com.chatstream.api.dto.ConversationSessionDTO;
import com.chatstream.domain.session.service.ConversationSessionStore;
import com.chatstream.trigger.application.common.ConversationSessionViewAssembler;
import com.chatstream.types.enums.ResponseCode;
import com.chatstream.types.exception.AppException;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * 会话状态读用例。只读取快照，不等待任何会话的事件处理。
 */
@Service
public class ConversationSessionQueryService {

    private final ConversationSessionStore sessionStore;
    private final ConversationSessionViewAssembler viewAssembler;

    public ConversationSessionQueryService(ConversationSessionStore sessionStore,
                                           ConversationSessionViewAssembler viewAssembler) {
        this.sessionStore = sessionStore;
        this.viewAssembler = viewAssembler;
    }

    /**
     * 读取会话快照，会话不存在时返回默认空闲状态。
     */
    public ConversationSessionDTO getSession(String conversationId) {
        if (StringUtils.isBlank(conversationId)) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), "conversationId 不能为空");
        }
        return viewAssembler.toSessionDTO(sessionStore.snapshot(conversationId.trim()));
    }

    public List<String> listSessions() {
        return new ArrayList<>(sessionStore.conversationIds());
    }
}
