package com.chatstream.domain.session.service;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * 按会话串行的执行器。
 * <p>
 * 每个会话一个 FIFO 邮箱，在共享线程池上排空：同一会话的任务按提交顺序逐个执行，
 * 不同会话互不等待。邮箱空闲时自动回收，下次提交时重新创建。
 * </p>
 */
@Slf4j
public class ConversationSerialExecutor {

    private static final int DRAIN_BATCH_SIZE = 64;

    private final Executor executor;
    private final ConcurrentMap<String, Mailbox> mailboxes = new ConcurrentHashMap<>();

    public ConversationSerialExecutor(Executor executor) {
        this.executor = executor;
    }

    public void execute(String conversationId, Runnable task) {
        if (conversationId == null || task == null) {
            return;
        }
        while (true) {
            Mailbox mailbox = mailboxes.computeIfAbsent(conversationId, Mailbox::new);
            if (mailbox.offer(task)) {
                return;
            }
            mailboxes.remove(conversationId, mailbox);
        }
    }

    /**
     * 关闭会话邮箱并丢弃尚未执行的任务；正在执行的任务不受影响。
     *
     * @return 被丢弃的任务数
     */
    public int release(String conversationId) {
        if (conversationId == null) {
            return 0;
        }
        Mailbox mailbox = mailboxes.remove(conversationId);
        if (mailbox == null) {
            return 0;
        }
        int dropped = mailbox.close();
        if (dropped > 0) {
            log.info("CONVERSATION_MAILBOX_RELEASED conversationId={}, droppedTasks={}", conversationId, dropped);
        }
        return dropped;
    }

    /**
     * 当前存活的邮箱数，即有排队或执行中任务的会话数。
     */
    public int activeMailboxCount() {
        return mailboxes.size();
    }

    private final class Mailbox {

        private final String conversationId;
        private final Deque<Runnable> queue = new ArrayDeque<>();
        private boolean running;
        private boolean closed;

        private Mailbox(String conversationId) {
            this.conversationId = conversationId;
        }

        private boolean offer(Runnable task) {
            boolean schedule;
            synchronized (this) {
                if (closed) {
                    return false;
                }
                queue.addLast(task);
                schedule = !running;
                running = true;
            }
            if (schedule) {
                submitDrain();
            }
            return true;
        }

        private synchronized int close() {
            closed = true;
            int dropped = queue.size();
            queue.clear();
            return dropped;
        }

        private void submitDrain() {
            try {
                executor.execute(this::drain);
            } catch (RejectedExecutionException ex) {
                log.warn("CONVERSATION_MAILBOX_REJECTED conversationId={}, running on caller thread. error={}",
                        conversationId, ex.getMessage());
                drain();
            }
        }

        private void drain() {
            for (int i = 0; i < DRAIN_BATCH_SIZE; i++) {
                Runnable task;
                synchronized (this) {
                    task = queue.pollFirst();
                    if (task == null) {
                        running = false;
                        closed = true;
                        mailboxes.remove(conversationId, this);
                        return;
                    }
                }
                try {
                    task.run();
                } catch (Exception ex) {
                    log.error("CONVERSATION_TASK_FAILED conversationId={}, error={}", conversationId, ex.getMessage(), ex);
                }
            }
            // 让出线程，避免单个会话长期占用
            submitDrain();
        }
    }
}
