package com.chatstream.config;

import com.chatstream.types.common.Constants;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 会话流式状态配置，前缀 chat.session。
 */
@Data
@ConfigurationProperties(prefix = "chat.session")
public class ChatSessionProperties {

    /** 增量节流窗口（毫秒），0 表示不合并 */
    private long throttleMs = Constants.DEFAULT_THROTTLE_MS;

    /** 单个会话在内存中保留的最大消息数 */
    private int maxMessagesInMemory = Constants.MAX_MESSAGES_IN_MEMORY;

}
