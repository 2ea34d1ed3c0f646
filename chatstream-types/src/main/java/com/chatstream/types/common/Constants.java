package com.chatstream.types.common;

/**
 * 全局常量定义类。
 *
 * @author chatstream
 * @since 2026-03-02
 */
public class Constants {

    /** 增量内容节流窗口（毫秒） */
    public final static long DEFAULT_THROTTLE_MS = 50L;

    /** 单个会话在内存中保留的最大消息数 */
    public final static int MAX_MESSAGES_IN_MEMORY = 100;

    /** 事件载荷中的会话 ID 字段 */
    public final static String CONVERSATION_ID_KEY = "conversation_id";

}
