package com.chatstream.domain.session.adapter.gateway;

/**
 * 生成后端命令端口。
 */
public interface IGenerationGateway {

    /**
     * 请求后端停止指定会话正在进行的生成。
     *
     * @param conversationId 会话 ID
     * @return true 表示后端确实存在并停止了一个进行中的生成
     */
    boolean stopGeneration(String conversationId);
}
