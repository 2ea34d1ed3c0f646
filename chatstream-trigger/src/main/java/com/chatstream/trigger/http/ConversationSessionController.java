package com.chatstream.trigger.http;

import com.chatstream.api.dto.ConversationSessionDTO;
import com.chatstream.api.dto.StopGenerationResponseDTO;
import com.chatstream.api.dto.TurnStartRequestDTO;
import com.chatstream.api.response.Response;
import com.chatstream.trigger.application.command.ConversationSessionCommandService;
import com.chatstream.trigger.application.command.ConversationSessionCommandService.TurnStartCommand;
import com.chatstream.trigger.application.command.GenerationCancellationCommandService;
import com.chatstream.trigger.application.common.ConversationSessionViewAssembler;
import com.chatstream.trigger.application.query.ConversationSessionQueryService;
import com.chatstream.types.enums.ResponseCode;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * 会话流式状态 API：查询快照、开始回合、停止生成、清理与删除。
 */
@RestController
@RequestMapping("/api/v1/conversations")
public class ConversationSessionController {

    private final ConversationSessionQueryService queryService;
    private final ConversationSessionCommandService commandService;
    private final GenerationCancellationCommandService cancellationCommandService;
    private final ConversationSessionViewAssembler viewAssembler;

    public ConversationSessionController(ConversationSessionQueryService queryService,
                                         ConversationSessionCommandService commandService,
                                         GenerationCancellationCommandService cancellationCommandService,
                                         ConversationSessionViewAssembler viewAssembler) {
        this.queryService = queryService;
        this.commandService = commandService;
        this.cancellationCommandService = cancellationCommandService;
        this.viewAssembler = viewAssembler;
    }

    @GetMapping("/sessions")
    public Response<List<String>> listSessions() {
        return success(queryService.listSessions());
    }

    @GetMapping("/{id}/session")
    public Response<ConversationSessionDTO> getSession(@PathVariable("id") String conversationId) {
        return success(queryService.getSession(conversationId));
    }

    @PostMapping("/{id}/turns")
    public Response<ConversationSessionDTO> beginTurn(@PathVariable("id") String conversationId,
                                                      @RequestBody(required = false) TurnStartRequestDTO request) {
        TurnStartCommand command = request == null ? null : new TurnStartCommand(
                request.getMessageId(),
                request.getContent(),
                request.getSenderId(),
                request.getTokens(),
                request.getCreatedAt());
        return success(viewAssembler.toSessionDTO(commandService.beginTurn(conversationId, command)));
    }

    @PostMapping("/{id}/stop")
    public Response<StopGenerationResponseDTO> stop(@PathVariable("id") String conversationId) {
        GenerationCancellationCommandService.StopResult result = cancellationCommandService.stop(conversationId);
        StopGenerationResponseDTO data = new StopGenerationResponseDTO();
        data.setConversationId(result.conversationId());
        data.setBackendAcknowledged(result.backendAcknowledged());
        data.setSession(viewAssembler.toSessionDTO(result.snapshot()));
        return success(data);
    }

    @PostMapping("/{id}/cleanup")
    public Response<ConversationSessionDTO> cleanup(@PathVariable("id") String conversationId) {
        return success(viewAssembler.toSessionDTO(commandService.cleanup(conversationId)));
    }

    @PostMapping("/{id}/messages/load")
    public Response<ConversationSessionDTO> loadMessages(@PathVariable("id") String conversationId) {
        return success(viewAssembler.toSessionDTO(commandService.loadMessages(conversationId)));
    }

    @DeleteMapping("/{id}/messages")
    public Response<ConversationSessionDTO> clearMessages(@PathVariable("id") String conversationId) {
        return success(viewAssembler.toSessionDTO(commandService.clearMessages(conversationId)));
    }

    @DeleteMapping("/{id}/session")
    public Response<Boolean> removeSession(@PathVariable("id") String conversationId) {
        return success(commandService.remove(conversationId));
    }

    private <T> Response<T> success(T data) {
        return Response.<T>builder()
                .code(ResponseCode.SUCCESS.getCode())
                .info(ResponseCode.SUCCESS.getInfo())
                .data(data)
                .build();
    }
}
