package com.chatstream.domain.session.adapter.gateway;

/**
 * 事件订阅句柄，close 后不再收到事件。重复 close 无副作用。
 */
@FunctionalInterface
public interface ChatEventSubscription extends AutoCloseable {

    @Override
    void close();
}
