package com.chatstream.infrastructure.gateway;

import com.chatstream.types.enums.ResponseCode;
import com.chatstream.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.HttpURLConnection;
import java.net.URL;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * 生成后端 HTTP 客户端：基于 HttpURLConnection 的最小 JSON 请求封装。
 */
@Slf4j
@Component
public class BackendHttpClient {

    private final String baseUrl;
    private final int timeoutMs;

    public BackendHttpClient(@Value("${chat.backend.base-url:http://127.0.0.1:8790}") String baseUrl,
                             @Value("${chat.backend.timeout-ms:3000}") int timeoutMs) {
        this.baseUrl = StringUtils.removeEnd(StringUtils.defaultIfBlank(baseUrl, "http://127.0.0.1:8790").trim(), "/");
        this.timeoutMs = Math.max(timeoutMs, 500);
    }

    public HttpResult get(String path) {
        return execute("GET", path, null);
    }

    public HttpResult post(String path, String jsonBody) {
        return execute("POST", path, jsonBody);
    }

    /**
     * 路径片段编码，用于拼接 conversationId 等外部输入。
     */
    public static String encodePathSegment(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }

    private HttpResult execute(String method, String path, String jsonBody) {
        String link = baseUrl + path;
        HttpURLConnection connection = null;
        try {
            URL url = new URL(link);
            connection = (HttpURLConnection) url.openConnection();
            connection.setConnectTimeout(timeoutMs);
            connection.setReadTimeout(timeoutMs);
            connection.setRequestMethod(method);
            connection.setRequestProperty("Accept", "application/json");
            if (jsonBody != null) {
                connection.setDoOutput(true);
                connection.setRequestProperty("Content-Type", "application/json; charset=UTF-8");
                try (OutputStream out = connection.getOutputStream()) {
                    out.write(jsonBody.getBytes(StandardCharsets.UTF_8));
                }
            }
            int statusCode = connection.getResponseCode();
            InputStream stream = statusCode >= 400 ? connection.getErrorStream() : connection.getInputStream();
            String body = readBody(stream);
            return new HttpResult(statusCode, body);
        } catch (IOException ex) {
            log.warn("BACKEND_HTTP_FAILED method={}, url={}, error={}", method, link, ex.getMessage());
            throw new AppException(ResponseCode.BACKEND_UNAVAILABLE.getCode(),
                    "生成后端不可用: " + ex.getMessage(), ex);
        } finally {
            if (connection != null) {
                connection.disconnect();
            }
        }
    }

    private String readBody(InputStream stream) throws IOException {
        if (stream == null) {
            return "";
        }
        try (InputStream in = stream; ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            in.transferTo(out);
            return out.toString(StandardCharsets.UTF_8);
        }
    }

    public record HttpResult(int statusCode, String body) {

        public boolean ok() {
            return statusCode >= 200 && statusCode < 300;
        }
    }
}
