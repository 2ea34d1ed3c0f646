/**
 * Session 领域 - 会话流式状态域
 *
 * <p>职责：接收生成后端推送的事件流，按会话隔离维护流式生成状态</p>
 *
 * <h3>核心概念</h3>
 * <ul>
 *   <li>会话隔离：每个 conversationId 对应一个独立的状态机，互不阻塞</li>
 *   <li>有序处理：同一会话的事件按到达顺序串行处理</li>
 *   <li>节流合并：高频增量内容在节流窗口内合并为一次更新</li>
 *   <li>内存上限：每个会话只在内存中保留最近 N 条消息</li>
 * </ul>
 *
 * <h3>聚合根</h3>
 * <ul>
 *   <li>{@link com.chatstream.domain.session.model.entity.ConversationSessionEntity}</li>
 * </ul>
 *
 * <h3>领域服务</h3>
 * <ul>
 *   <li>SessionTransitionDomainService - 状态迁移规则</li>
 *   <li>ChunkAggregator - 增量内容节流合并</li>
 *   <li>ConversationSessionStore - 会话存储与观察者通知</li>
 *   <li>ConversationSerialExecutor - 按会话串行执行</li>
 *   <li>SessionMemoryBoundPolicy - 内存消息上限</li>
 * </ul>
 *
 * @author chatstream
 * @since 2026-03-02
 */
package com.chatstream.domain.session;
