package com.chatstream.domain.session.adapter.gateway;

import com.chatstream.domain.session.model.valobj.RawChatEvent;

import java.util.function.Consumer;

/**
 * 事件源端口：生成后端的异步事件流。
 * <p>
 * 同一会话的事件按发出顺序投递；不同会话之间不保证顺序。
 * </p>
 */
public interface IChatEventSource {

    /**
     * 注册监听器。
     *
     * @param listener 事件回调，可能在任意线程上被调用
     * @return 用于取消注册的句柄
     */
    ChatEventSubscription subscribe(Consumer<RawChatEvent> listener);
}
