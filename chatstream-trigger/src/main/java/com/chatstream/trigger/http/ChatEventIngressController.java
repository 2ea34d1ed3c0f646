package com.chatstream.trigger.http;

import com.chatstream.api.dto.ChatEventIngressRequestDTO;
import com.chatstream.api.dto.ChatEventIngressResponseDTO;
import com.chatstream.api.response.Response;
import com.chatstream.domain.session.model.valobj.RawChatEvent;
import com.chatstream.trigger.event.ChatEventBus;
import com.chatstream.types.enums.ResponseCode;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.List;

/**
 * 生成后端事件上报入口：同进程部署的生成引擎通过该接口推送事件，按请求内顺序发布到事件总线。
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/chat-events")
public class ChatEventIngressController {

    private final ChatEventBus chatEventBus;

    public ChatEventIngressController(ChatEventBus chatEventBus) {
        this.chatEventBus = chatEventBus;
    }

    @PostMapping
    public Response<ChatEventIngressResponseDTO> publish(@RequestBody ChatEventIngressRequestDTO request) {
        List<ChatEventIngressRequestDTO> items = flatten(request);
        if (items.isEmpty()) {
            return illegal("事件不能为空");
        }
        int published = 0;
        int rejected = 0;
        for (ChatEventIngressRequestDTO item : items) {
            if (item == null || StringUtils.isBlank(item.getEvent())) {
                rejected++;
                continue;
            }
            chatEventBus.publish(new RawChatEvent(item.getEvent().trim(), item.getPayload()));
            published++;
        }
        if (rejected > 0) {
            log.warn("CHAT_EVENT_INGRESS_REJECTED received={}, rejected={}", items.size(), rejected);
        }
        ChatEventIngressResponseDTO data = new ChatEventIngressResponseDTO();
        data.setReceived(items.size());
        data.setPublished(published);
        data.setRejected(rejected);
        return Response.<ChatEventIngressResponseDTO>builder()
                .code(ResponseCode.SUCCESS.getCode())
                .info(ResponseCode.SUCCESS.getInfo())
                .data(data)
                .build();
    }

    private List<ChatEventIngressRequestDTO> flatten(ChatEventIngressRequestDTO request) {
        List<ChatEventIngressRequestDTO> items = new ArrayList<>();
        if (request == null) {
            return items;
        }
        if (StringUtils.isNotBlank(request.getEvent())) {
            items.add(request);
        }
        if (request.getEvents() != null) {
            items.addAll(request.getEvents());
        }
        return items;
    }

    private <T> Response<T> illegal(String message) {
        return Response.<T>builder()
                .code(ResponseCode.ILLEGAL_PARAMETER.getCode())
                .info(message)
                .build();
    }
}
