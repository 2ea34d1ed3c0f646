package com.chatstream.config;

import com.chatstream.domain.session.service.ChunkAggregator;
import com.chatstream.domain.session.service.ConversationSerialExecutor;
import com.chatstream.domain.session.service.ConversationSessionStore;
import com.chatstream.domain.session.service.SessionMemoryBoundPolicy;
import com.chatstream.domain.session.service.SessionTransitionDomainService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;

import java.util.concurrent.Executor;

/**
 * 会话领域组件装配。
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(ChatSessionProperties.class)
public class SessionComponentConfig {

    @Bean
    public SessionMemoryBoundPolicy sessionMemoryBoundPolicy(ChatSessionProperties properties) {
        return new SessionMemoryBoundPolicy(properties.getMaxMessagesInMemory());
    }

    @Bean
    public SessionTransitionDomainService sessionTransitionDomainService(SessionMemoryBoundPolicy memoryBoundPolicy) {
        return new SessionTransitionDomainService(memoryBoundPolicy);
    }

    @Bean
    public ConversationSessionStore conversationSessionStore() {
        return new ConversationSessionStore();
    }

    @Bean
    public ConversationSerialExecutor conversationSerialExecutor(
            @Qualifier("conversationWorkerExecutor") Executor conversationWorkerExecutor) {
        return new ConversationSerialExecutor(conversationWorkerExecutor);
    }

    @Bean
    public ChunkAggregator chunkAggregator(@Qualifier("chunkFlushScheduler") TaskScheduler chunkFlushScheduler,
                                           ConversationSerialExecutor conversationSerialExecutor,
                                           ChatSessionProperties properties) {
        log.info("CHAT_SESSION_CONFIG throttleMs={}, maxMessagesInMemory={}",
                properties.getThrottleMs(), properties.getMaxMessagesInMemory());
        return new ChunkAggregator(chunkFlushScheduler, conversationSerialExecutor, properties.getThrottleMs());
    }
}
