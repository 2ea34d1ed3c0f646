package com.chatstream.test;

import com.chatstream.domain.session.adapter.repository.IConversationMessageRepository;
import com.chatstream.domain.session.model.valobj.ChatMessage;
import com.chatstream.domain.session.model.valobj.ConversationSessionSnapshot;
import com.chatstream.domain.session.service.ChunkAggregator;
import com.chatstream.domain.session.service.ChunkAggregator.ChunkKind;
import com.chatstream.domain.session.service.ConversationSerialExecutor;
import com.chatstream.domain.session.service.ConversationSessionStore;
import com.chatstream.domain.session.service.SessionMemoryBoundPolicy;
import com.chatstream.domain.session.service.SessionTransitionDomainService;
import com.chatstream.test.support.ManualTaskScheduler;
import com.chatstream.test.support.TestMessages;
import com.chatstream.trigger.application.command.ConversationSessionCommandService;
import com.chatstream.trigger.application.command.ConversationSessionCommandService.TurnStartCommand;
import com.chatstream.types.enums.ResponseCode;
import com.chatstream.types.enums.SenderTypeEnum;
import com.chatstream.types.enums.SessionStatusEnum;
import com.chatstream.types.exception.AppException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

public class ConversationSessionCommandServiceTest {

    private IConversationMessageRepository messageRepository;
    private ConversationSessionStore store;
    private ManualTaskScheduler scheduler;
    private ChunkAggregator aggregator;
    private SessionTransitionDomainService transitionService;
    private ConversationSessionCommandService service;

    @BeforeEach
    public void setUp() {
        this.messageRepository = mock(IConversationMessageRepository.class);
        this.store = new ConversationSessionStore();
        this.scheduler = new ManualTaskScheduler();
        ConversationSerialExecutor serialExecutor = new ConversationSerialExecutor(Runnable::run);
        this.aggregator = new ChunkAggregator(scheduler, serialExecutor, 50L);
        this.transitionService = new SessionTransitionDomainService(new SessionMemoryBoundPolicy(100));
        this.service = new ConversationSessionCommandService(store, transitionService, aggregator,
                serialExecutor, messageRepository);
    }

    @Test
    public void shouldCommitUserMessageWhenTurnBegins() {
        ConversationSessionSnapshot snapshot = service.beginTurn("conv-1",
                new TurnStartCommand("u1", "hello", "user-1", 3, null));

        Assertions.assertEquals(SessionStatusEnum.AWAITING_RESPONSE, snapshot.status());
        Assertions.assertEquals(1, snapshot.messages().size());
        Assertions.assertEquals(SenderTypeEnum.USER, snapshot.messages().get(0).senderType());
        Assertions.assertNotNull(snapshot.messages().get(0).createdAt());
    }

    @Test
    public void shouldRejectTurnWhileGenerating() {
        service.beginTurn("conv-1", null);

        AppException ex = Assertions.assertThrows(AppException.class, () -> service.beginTurn("conv-1", null));
        Assertions.assertEquals(ResponseCode.ILLEGAL_PARAMETER.getCode(), ex.getCode());
    }

    @Test
    public void shouldLoadOnlyMostRecentMessages() {
        List<ChatMessage> history = new ArrayList<>();
        for (int i = 0; i < 150; i++) {
            history.add(TestMessages.user("m" + i, "conv-1", "message " + i));
        }
        when(messageRepository.listByConversation("conv-1")).thenReturn(history);

        ConversationSessionSnapshot snapshot = service.loadMessages("conv-1");

        Assertions.assertEquals(100, snapshot.messages().size());
        Assertions.assertEquals("m50", snapshot.messages().get(0).id());
        Assertions.assertFalse(snapshot.loading());
    }

    @Test
    public void shouldClearLoadingFlagWhenHistoryLoadFails() {
        when(messageRepository.listByConversation("conv-1")).thenThrow(new IllegalStateException("disk error"));

        AppException ex = Assertions.assertThrows(AppException.class, () -> service.loadMessages("conv-1"));

        Assertions.assertEquals(ResponseCode.BACKEND_UNAVAILABLE.getCode(), ex.getCode());
        Assertions.assertFalse(store.snapshot("conv-1").loading());
    }

    @Test
    public void shouldClearMessages() {
        service.beginTurn("conv-1", new TurnStartCommand("u1", "hello", null, null, null));

        ConversationSessionSnapshot snapshot = service.clearMessages("conv-1");

        Assertions.assertTrue(snapshot.messages().isEmpty());
    }

    @Test
    public void shouldCancelPendingFlushOnCleanup() {
        service.beginTurn("conv-1", new TurnStartCommand("u1", "hello", null, null, null));
        aggregator.append("conv-1", ChunkKind.CONTENT, "partial", (id, kind, text) -> store.update(id,
                session -> transitionService.applyContentFlush(session, text)));

        ConversationSessionSnapshot snapshot = service.cleanup("conv-1");

        Assertions.assertEquals(0, scheduler.runAll());
        Assertions.assertEquals(SessionStatusEnum.IDLE, snapshot.status());
        Assertions.assertEquals(1, snapshot.messages().size());
    }

    @Test
    public void shouldRemoveOnlyTargetConversation() {
        service.beginTurn("conv-1", null);
        service.beginTurn("conv-2", null);
        aggregator.append("conv-1", ChunkKind.CONTENT, "x", (id, kind, text) -> store.update(id,
                session -> transitionService.applyContentFlush(session, text)));

        Assertions.assertTrue(service.remove("conv-1"));

        Assertions.assertEquals(0, aggregator.pendingBufferCount());
        Assertions.assertFalse(store.conversationIds().contains("conv-1"));
        Assertions.assertEquals(SessionStatusEnum.AWAITING_RESPONSE, store.snapshot("conv-2").status());
    }
}
