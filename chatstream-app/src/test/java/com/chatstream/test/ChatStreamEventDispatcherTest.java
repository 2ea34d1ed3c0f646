package com.chatstream.test;

import com.chatstream.domain.session.model.valobj.ConversationSessionSnapshot;
import com.chatstream.domain.session.model.valobj.RawChatEvent;
import com.chatstream.domain.session.service.ChunkAggregator;
import com.chatstream.domain.session.service.ConversationSerialExecutor;
import com.chatstream.domain.session.service.ConversationSessionStore;
import com.chatstream.domain.session.service.SessionMemoryBoundPolicy;
import com.chatstream.domain.session.service.SessionTransitionDomainService;
import com.chatstream.test.support.ManualTaskScheduler;
import com.chatstream.trigger.application.event.ChatStreamEventParser;
import com.chatstream.trigger.event.ChatEventBus;
import com.chatstream.trigger.event.ChatStreamEventDispatcher;
import com.chatstream.types.enums.SessionStatusEnum;
import com.chatstream.types.enums.TurnOutcomeEnum;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.support.DefaultListableBeanFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

public class ChatStreamEventDispatcherTest {

    private ChatEventBus eventBus;
    private ConversationSessionStore store;
    private SessionTransitionDomainService transitionService;
    private ManualTaskScheduler scheduler;
    private MeterRegistry meterRegistry;
    private ChatStreamEventDispatcher dispatcher;

    @BeforeEach
    public void setUp() {
        this.eventBus = new ChatEventBus();
        this.store = new ConversationSessionStore();
        this.transitionService = new SessionTransitionDomainService(new SessionMemoryBoundPolicy(100));
        this.scheduler = new ManualTaskScheduler();
        this.meterRegistry = new SimpleMeterRegistry();
        ConversationSerialExecutor serialExecutor = new ConversationSerialExecutor(Runnable::run);
        ChunkAggregator aggregator = new ChunkAggregator(scheduler, serialExecutor, 50L);

        DefaultListableBeanFactory beanFactory = new DefaultListableBeanFactory();
        beanFactory.registerSingleton("meterRegistry", meterRegistry);

        this.dispatcher = new ChatStreamEventDispatcher(
                eventBus,
                new ChatStreamEventParser(),
                store,
                transitionService,
                aggregator,
                serialExecutor,
                beanFactory.getBeanProvider(MeterRegistry.class));
        dispatcher.start();
    }

    @AfterEach
    public void tearDown() {
        dispatcher.shutdown();
    }

    @Test
    public void shouldCommitCompletionAfterStreamedChunks() {
        beginTurn("conv-1");
        publish("chat-stream", Map.of("conversation_id", "conv-1", "content", "Hel"));
        publish("chat-stream", Map.of("conversation_id", "conv-1", "content", "lo"));
        scheduler.runAll();

        ConversationSessionSnapshot streaming = store.snapshot("conv-1");
        Assertions.assertEquals(SessionStatusEnum.STREAMING, streaming.status());
        Assertions.assertEquals("Hello", streaming.streamingText());

        publish("chat-complete", Map.of("conversation_id", "conv-1",
                "message", Map.of("id", "m1", "content", "Hello", "sender_type", "model")));

        ConversationSessionSnapshot settled = store.snapshot("conv-1");
        Assertions.assertEquals(SessionStatusEnum.IDLE, settled.status());
        Assertions.assertEquals("", settled.streamingText());
        Assertions.assertEquals(1, settled.messages().size());
        Assertions.assertEquals("m1", settled.messages().get(0).id());
        Assertions.assertEquals("Hello", settled.messages().get(0).content());
    }

    @Test
    public void shouldCoalesceChunkBurstIntoOneObservedUpdate() {
        beginTurn("conv-1");
        List<String> observedTexts = new ArrayList<>();
        store.subscribe("conv-1", "observer", snapshot -> observedTexts.add(snapshot.streamingText()));

        StringBuilder expected = new StringBuilder();
        for (int i = 0; i < 10; i++) {
            String fragment = "part" + i + " ";
            expected.append(fragment);
            publish("chat-stream", Map.of("conversation_id", "conv-1", "content", fragment));
        }
        Assertions.assertTrue(observedTexts.isEmpty());

        scheduler.runAll();

        Assertions.assertEquals(List.of(expected.toString()), observedTexts);
        Assertions.assertEquals(1.0D, meterRegistry.find("chat.session.chunk.flush.total").functionCounter().count(), 0.0001D);
    }

    @Test
    public void shouldNotLeakPendingChunksPastSettledTurn() {
        beginTurn("conv-1");
        publish("chat-stream", Map.of("conversation_id", "conv-1", "content", "never shown"));
        publish("chat-complete", Map.of("conversation_id", "conv-1", "message", Map.of("id", "m1", "content", "final")));

        Assertions.assertEquals(0, scheduler.runAll());
        ConversationSessionSnapshot snapshot = store.snapshot("conv-1");
        Assertions.assertEquals("", snapshot.streamingText());
        Assertions.assertEquals("final", snapshot.messages().get(0).content());
    }

    @Test
    public void shouldKeepConversationsIsolated() {
        beginTurn("conv-a");
        beginTurn("conv-b");
        publish("chat-stream", Map.of("conversation_id", "conv-a", "content", "alpha"));
        publish("chat-stream", Map.of("conversation_id", "conv-b", "content", "beta"));
        scheduler.runAll();
        publish("chat-error", Map.of("conversation_id", "conv-a", "error", "boom"));

        ConversationSessionSnapshot a = store.snapshot("conv-a");
        ConversationSessionSnapshot b = store.snapshot("conv-b");
        Assertions.assertEquals(SessionStatusEnum.IDLE, a.status());
        Assertions.assertEquals("boom", a.lastError());
        Assertions.assertEquals(SessionStatusEnum.STREAMING, b.status());
        Assertions.assertEquals("beta", b.streamingText());
        Assertions.assertNull(b.lastError());
    }

    @Test
    public void shouldApplyDuplicateCompletionIdempotently() {
        beginTurn("conv-1");
        Map<String, Object> completion = Map.of("conversation_id", "conv-1",
                "message", Map.of("id", "m1", "content", "Hello"));
        publish("chat-complete", completion);
        publish("chat-complete", completion);

        ConversationSessionSnapshot snapshot = store.snapshot("conv-1");
        Assertions.assertEquals(1, snapshot.messages().size());
        Assertions.assertEquals(TurnOutcomeEnum.COMPLETED, snapshot.lastOutcome());
    }

    @Test
    public void shouldKeepCurrentTurnChunksWhenPreviousCompletionRedelivered() {
        Map<String, Object> firstCompletion = Map.of("conversation_id", "conv-1",
                "message", Map.of("id", "m1", "content", "first answer"));
        beginTurn("conv-1");
        publish("chat-complete", firstCompletion);

        beginTurn("conv-1");
        publish("chat-stream", Map.of("conversation_id", "conv-1", "content", "Hel"));
        publish("chat-complete", firstCompletion);
        publish("chat-stream", Map.of("conversation_id", "conv-1", "content", "lo"));
        scheduler.runAll();

        ConversationSessionSnapshot snapshot = store.snapshot("conv-1");
        Assertions.assertEquals(SessionStatusEnum.STREAMING, snapshot.status());
        Assertions.assertEquals("Hello", snapshot.streamingText());
        Assertions.assertEquals(1, snapshot.messages().size());
    }

    @Test
    public void shouldStreamNextTurnAfterStoppedTurnIsSettledByBackend() {
        beginTurn("conv-1");
        publish("chat-stream", Map.of("conversation_id", "conv-1", "content", "stopped "));
        store.update("conv-1", session -> {
            transitionService.stop(session);
            return true;
        });
        publish("chat-stream", Map.of("conversation_id", "conv-1", "content", "late"));
        publish("chat-complete", Map.of("conversation_id", "conv-1", "cancelled", true,
                "message", Map.of("id", "m1", "content", "stopped")));

        publish("chat-stream", Map.of("conversation_id", "conv-1", "content", "next "));
        publish("chat-stream", Map.of("conversation_id", "conv-1", "content", "turn"));
        scheduler.runAll();

        ConversationSessionSnapshot snapshot = store.snapshot("conv-1");
        Assertions.assertEquals(SessionStatusEnum.STREAMING, snapshot.status());
        Assertions.assertEquals("next turn", snapshot.streamingText());
        Assertions.assertEquals(1, snapshot.messages().size());
        Assertions.assertFalse(snapshot.turnCancelled());
    }

    @Test
    public void shouldStreamAfterBackendConfirmsStop() {
        beginTurn("conv-1");
        publish("generation-stopped", Map.of("conversation_id", "conv-1"));
        publish("chat-complete", Map.of("conversation_id", "conv-1", "cancelled", true,
                "message", Map.of("id", "m1", "content", "partial")));

        publish("chat-stream", Map.of("conversation_id", "conv-1", "content", "next "));
        publish("chat-stream", Map.of("conversation_id", "conv-1", "content", "turn"));
        scheduler.runAll();

        ConversationSessionSnapshot snapshot = store.snapshot("conv-1");
        Assertions.assertEquals(SessionStatusEnum.STREAMING, snapshot.status());
        Assertions.assertEquals("next turn", snapshot.streamingText());
    }

    @Test
    public void shouldReportSessionGauges() {
        beginTurn("conv-a");
        beginTurn("conv-b");
        publish("chat-stream", Map.of("conversation_id", "conv-a", "content", "pending"));

        Assertions.assertEquals(2.0D, meterRegistry.get("chat.session.active").gauge().value(), 0.0001D);
        Assertions.assertEquals(1.0D, meterRegistry.get("chat.session.chunk.pending").gauge().value(), 0.0001D);
        Assertions.assertEquals(0.0D, meterRegistry.get("chat.session.mailbox.active").gauge().value(), 0.0001D);

        scheduler.runAll();
        Assertions.assertEquals(0.0D, meterRegistry.get("chat.session.chunk.pending").gauge().value(), 0.0001D);
    }

    @Test
    public void shouldKeepPerConversationOrderOnSharedWorkerPool() throws Exception {
        ExecutorService workers = Executors.newFixedThreadPool(4);
        ExecutorService publishers = Executors.newFixedThreadPool(4);
        ChatEventBus pooledBus = new ChatEventBus();
        ConversationSessionStore pooledStore = new ConversationSessionStore();
        ConversationSerialExecutor pooledExecutor = new ConversationSerialExecutor(workers);
        ChatStreamEventDispatcher pooledDispatcher = new ChatStreamEventDispatcher(
                pooledBus,
                new ChatStreamEventParser(),
                pooledStore,
                transitionService,
                new ChunkAggregator(new ManualTaskScheduler(), pooledExecutor, 0L),
                pooledExecutor,
                new DefaultListableBeanFactory().getBeanProvider(MeterRegistry.class));
        pooledDispatcher.start();
        int conversations = 8;
        int chunks = 200;
        try {
            List<Future<?>> publishing = new ArrayList<>();
            for (int c = 0; c < conversations; c++) {
                String conversationId = "conv-" + c;
                pooledStore.update(conversationId, session -> {
                    transitionService.beginTurn(session, null);
                    return true;
                });
                publishing.add(publishers.submit(() -> {
                    for (int i = 0; i < chunks; i++) {
                        pooledBus.publish(new RawChatEvent("chat-stream",
                                Map.of("conversation_id", conversationId, "content", conversationId + ":" + i + ";")));
                    }
                }));
            }
            for (Future<?> future : publishing) {
                future.get(10, TimeUnit.SECONDS);
            }

            for (int c = 0; c < conversations; c++) {
                String conversationId = "conv-" + c;
                StringBuilder expected = new StringBuilder();
                for (int i = 0; i < chunks; i++) {
                    expected.append(conversationId).append(':').append(i).append(';');
                }
                long deadline = System.currentTimeMillis() + 10_000L;
                while (pooledStore.snapshot(conversationId).streamingText().length() < expected.length()
                        && System.currentTimeMillis() < deadline) {
                    Thread.sleep(10L);
                }
                Assertions.assertEquals(expected.toString(), pooledStore.snapshot(conversationId).streamingText());
                Assertions.assertEquals(SessionStatusEnum.STREAMING, pooledStore.snapshot(conversationId).status());
            }
        } finally {
            pooledDispatcher.shutdown();
            publishers.shutdownNow();
            workers.shutdown();
            workers.awaitTermination(5, TimeUnit.SECONDS);
        }
    }

    @Test
    public void shouldDropMalformedEventsWithoutAffectingSessions() {
        beginTurn("conv-1");
        publish("chat-stream", Map.of("content", "orphan"));
        publish("unknown-event", Map.of("conversation_id", "conv-1"));

        Assertions.assertEquals(2.0D, meterRegistry.counter("chat.session.event.dropped.total").count(), 0.0001D);
        Assertions.assertEquals(SessionStatusEnum.AWAITING_RESPONSE, store.snapshot("conv-1").status());
        Assertions.assertEquals(1, store.size());
    }

    @Test
    public void shouldLeaveAwaitingStateOnBackendStopWithoutContent() {
        beginTurn("conv-1");

        publish("generation-stopped", Map.of("conversation_id", "conv-1"));

        ConversationSessionSnapshot snapshot = store.snapshot("conv-1");
        Assertions.assertEquals(SessionStatusEnum.IDLE, snapshot.status());
        Assertions.assertTrue(snapshot.messages().isEmpty());
        Assertions.assertEquals(TurnOutcomeEnum.STOPPED, snapshot.lastOutcome());
    }

    @Test
    public void shouldStopReceivingEventsAfterShutdown() {
        dispatcher.shutdown();

        Assertions.assertEquals(0, eventBus.listenerCount());
        Assertions.assertEquals(0, eventBus.publish(new RawChatEvent("chat-stream",
                Map.of("conversation_id", "conv-1", "content", "x"))));
    }

    private void beginTurn(String conversationId) {
        store.update(conversationId, session -> {
            transitionService.beginTurn(session, null);
            return true;
        });
    }

    private void publish(String eventName, Map<String, Object> payload) {
        eventBus.publish(new RawChatEvent(eventName, payload));
    }
}
