package com.chatstream.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 会话工作线程池配置属性，前缀 thread.pool.executor.config。
 * <p>
 * 该线程池用于排空各会话的串行邮箱，队列满时的拒绝策略默认 CallerRunsPolicy，
 * 保证事件不会被静默丢弃。
 * </p>
 *
 * @author chatstream
 * @since 2026-03-02
 */
@Data
@ConfigurationProperties(prefix = "thread.pool.executor.config", ignoreInvalidFields = true)
public class ThreadPoolConfigProperties {

    /** 核心线程数，默认8 */
    private Integer corePoolSize = 8;

    /** 最大线程数，默认32 */
    private Integer maxPoolSize = 32;

    /** 空闲线程最大存活时间（秒），默认30 */
    private Long keepAliveTime = 30L;

    /** 阻塞队列最大容量，默认5000 */
    private Integer blockQueueSize = 5000;

    /** 线程名前缀 */
    private String threadNamePrefix = "conversation-worker-";

    /**
     * 拒绝策略：AbortPolicy 或 CallerRunsPolicy。
     * AbortPolicy 下被拒绝的邮箱在提交线程上排空；Discard 类策略按 CallerRunsPolicy 处理。
     */
    private String policy = "CallerRunsPolicy";

}
