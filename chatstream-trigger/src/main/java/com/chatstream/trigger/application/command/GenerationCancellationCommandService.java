package com.chatstream.trigger.application.command;

import com.chatstream.domain.session.adapter.gateway.IGenerationGateway;
import com.chatstream.domain.session.model.valobj.ConversationSessionSnapshot;
import com.chatstream.domain.session.service.ChunkAggregator;
import com.chatstream.domain.session.service.ConversationSessionStore;
import com.chatstream.domain.session.service.SessionTransitionDomainService;
import com.chatstream.types.enums.ResponseCode;
import com.chatstream.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

/**
 * 停止生成用例。
 * <p>
 * 本地状态立即回到 IDLE 并丢弃待刷新增量，随后通知后端停止；后端调用失败只记录日志。
 * 停止后当前回合迟到的增量会被丢弃，后端随后发送的部分完成消息仍会提交。
 * </p>
 */
@Slf4j
@Service
public class GenerationCancellationCommandService {

    private final IGenerationGateway generationGateway;
    private final ConversationSessionStore sessionStore;
    private final SessionTransitionDomainService transitionDomainService;
    private final ChunkAggregator chunkAggregator;

    public GenerationCancellationCommandService(IGenerationGateway generationGateway,
                                                ConversationSessionStore sessionStore,
                                                SessionTransitionDomainService transitionDomainService,
                                                ChunkAggregator chunkAggregator) {
        this.generationGateway = generationGateway;
        this.sessionStore = sessionStore;
        this.transitionDomainService = transitionDomainService;
        this.chunkAggregator = chunkAggregator;
    }

    public StopResult stop(String conversationId) {
        if (StringUtils.isBlank(conversationId)) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), "conversationId 不能为空");
        }
        String normalizedId = conversationId.trim();
        int discarded = chunkAggregator.cancel(normalizedId);
        ConversationSessionSnapshot snapshot = sessionStore.update(normalizedId, session -> {
            transitionDomainService.stop(session);
            return true;
        });

        boolean acknowledged = false;
        try {
            acknowledged = generationGateway.stopGeneration(normalizedId);
        } catch (Exception ex) {
            log.warn("CHAT_STOP_BACKEND_FAILED conversationId={}, error={}", normalizedId, ex.getMessage());
        }
        log.info("CHAT_GENERATION_STOPPED conversationId={}, backendAcknowledged={}, discardedFragments={}",
                normalizedId, acknowledged, discarded);
        return new StopResult(normalizedId, acknowledged, snapshot);
    }

    public record StopResult(String conversationId,
                             boolean backendAcknowledged,
                             ConversationSessionSnapshot snapshot) {
    }
}
