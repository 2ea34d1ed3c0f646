package com.chatstream.test;

import com.chatstream.api.response.Response;
import com.chatstream.config.HttpTraceLogProperties;
import com.chatstream.config.RequestTraceLoggingFilter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

public class RequestTraceLoggingFilterTest {

    private MockMvc mockMvc;

    @BeforeEach
    public void setUp() {
        HttpTraceLogProperties properties = new HttpTraceLogProperties();
        properties.setEnabled(true);
        properties.setSampleRate(1.0D);

        RequestTraceLoggingFilter filter = new RequestTraceLoggingFilter(properties);
        this.mockMvc = MockMvcBuilders.standaloneSetup(new TestController())
                .addFilters(filter)
                .build();
    }

    @Test
    public void shouldInjectTraceHeadersForApiRequests() throws Exception {
        mockMvc.perform(get("/api/v1/conversations/conv-1/session"))
                .andExpect(status().isOk())
                .andExpect(header().exists("X-Trace-Id"))
                .andExpect(header().exists("X-Request-Id"))
                .andExpect(jsonPath("$.code").value("0000"));
    }

    @Test
    public void shouldPropagateIncomingTraceId() throws Exception {
        mockMvc.perform(get("/api/v1/conversations/conv-1/session").header("X-Trace-Id", "trace-123"))
                .andExpect(status().isOk())
                .andExpect(header().string("X-Trace-Id", "trace-123"));
    }

    @Test
    public void shouldSkipExcludedSsePath() throws Exception {
        mockMvc.perform(get("/api/v1/conversations/conv-1/session/stream"))
                .andExpect(status().isOk())
                .andExpect(header().doesNotExist("X-Trace-Id"))
                .andExpect(header().doesNotExist("X-Request-Id"));
    }

    @RestController
    private static class TestController {

        @GetMapping("/api/v1/conversations/{id}/session")
        public Response<String> session(@PathVariable("id") String conversationId) {
            return Response.<String>builder()
                    .code("0000")
                    .info("成功")
                    .data(conversationId)
                    .build();
        }

        @GetMapping("/api/v1/conversations/{id}/session/stream")
        public Response<String> stream(@PathVariable("id") String conversationId) {
            return Response.<String>builder()
                    .code("0000")
                    .info("成功")
                    .data(conversationId)
                    .build();
        }
    }
}
