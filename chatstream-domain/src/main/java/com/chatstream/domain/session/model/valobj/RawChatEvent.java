package com.chatstream.domain.session.model.valobj;

import java.util.Collections;
import java.util.Map;

/**
 * 事件源推送的原始事件：后端事件名 + 弱类型载荷。
 */
public record RawChatEvent(String name, Map<String, Object> payload) {

    public RawChatEvent {
        payload = payload == null ? Collections.emptyMap() : payload;
    }
}
