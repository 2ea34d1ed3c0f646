package com.chatstream.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * HTTP 链路日志配置，前缀 observability.http-log。
 */
@Data
@ConfigurationProperties(prefix = "observability.http-log")
public class HttpTraceLogProperties {

    private boolean enabled = true;

    /** 超过该耗时的请求一律输出 HTTP_OUT，单位毫秒 */
    private long slowRequestThresholdMs = 1000L;

    /** 采样率，0~1 */
    private double sampleRate = 1.0D;

    /** 不记录链路日志的路径，默认排除 SSE 长连接 */
    private List<String> excludePathPatterns = new ArrayList<>(List.of("/api/v1/conversations/*/session/stream"));

}
