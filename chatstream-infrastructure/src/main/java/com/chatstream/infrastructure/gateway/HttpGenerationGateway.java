package com.chatstream.infrastructure.gateway;

import com.chatstream.domain.session.adapter.gateway.IGenerationGateway;
import com.chatstream.infrastructure.util.JsonCodec;
import com.chatstream.types.enums.ResponseCode;
import com.chatstream.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * 生成后端命令适配器：POST /conversations/{id}/stop，响应体 {"stopped": true|false}。
 */
@Slf4j
@Component
public class HttpGenerationGateway implements IGenerationGateway {

    private final BackendHttpClient httpClient;
    private final JsonCodec jsonCodec;

    public HttpGenerationGateway(BackendHttpClient httpClient, JsonCodec jsonCodec) {
        this.httpClient = httpClient;
        this.jsonCodec = jsonCodec;
    }

    @Override
    public boolean stopGeneration(String conversationId) {
        String path = "/conversations/" + BackendHttpClient.encodePathSegment(conversationId) + "/stop";
        BackendHttpClient.HttpResult result = httpClient.post(path, "{}");
        if (result.statusCode() == 404) {
            // 后端没有该会话的生成任务
            return false;
        }
        if (!result.ok()) {
            throw new AppException(ResponseCode.BACKEND_UNAVAILABLE.getCode(),
                    "停止生成失败，HTTP " + result.statusCode());
        }
        Map<String, Object> body = jsonCodec.readMap(result.body());
        boolean stopped = body != null && Boolean.TRUE.equals(body.get("stopped"));
        log.info("BACKEND_STOP_GENERATION conversationId={}, stopped={}", conversationId, stopped);
        return stopped;
    }
}
