package com.chatstream.test.domain;

import com.chatstream.domain.session.model.valobj.ConversationSessionSnapshot;
import com.chatstream.domain.session.service.ConversationSessionStore;
import com.chatstream.types.enums.SessionStatusEnum;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

public class ConversationSessionStoreTest {

    private ConversationSessionStore store;

    @BeforeEach
    public void setUp() {
        this.store = new ConversationSessionStore();
    }

    @Test
    public void shouldCreateDefaultSessionOnFirstAccess() {
        ConversationSessionSnapshot snapshot = store.snapshot("conv-1");

        Assertions.assertEquals("conv-1", snapshot.conversationId());
        Assertions.assertEquals(SessionStatusEnum.IDLE, snapshot.status());
        Assertions.assertTrue(snapshot.messages().isEmpty());
        Assertions.assertEquals(Set.of("conv-1"), store.conversationIds());
    }

    @Test
    public void shouldNotifyObserversOnlyWhenStateChanged() {
        List<Long> versions = new ArrayList<>();
        store.subscribe("conv-1", "s1", snapshot -> versions.add(snapshot.version()));

        store.update("conv-1", session -> {
            session.updateTitle("hello");
            return true;
        });
        store.update("conv-1", session -> false);

        Assertions.assertEquals(1, versions.size());
    }

    @Test
    public void shouldIsolateObserversByConversation() {
        List<String> seen = new ArrayList<>();
        store.subscribe("conv-1", "s1", snapshot -> seen.add(snapshot.conversationId()));

        store.update("conv-2", session -> {
            session.updateTitle("other");
            return true;
        });

        Assertions.assertTrue(seen.isEmpty());
    }

    @Test
    public void shouldContainObserverFailure() {
        List<String> seen = new ArrayList<>();
        store.subscribe("conv-1", "broken", snapshot -> {
            throw new IllegalStateException("observer down");
        });
        store.subscribe("conv-1", "healthy", snapshot -> seen.add(snapshot.title()));

        ConversationSessionSnapshot snapshot = store.update("conv-1", session -> {
            session.updateTitle("ok");
            return true;
        });

        Assertions.assertEquals("ok", snapshot.title());
        Assertions.assertEquals(List.of("ok"), seen);
    }

    @Test
    public void shouldDropSessionAndObserversOnRemove() {
        store.subscribe("conv-1", "s1", snapshot -> { });
        store.snapshot("conv-1");
        store.snapshot("conv-2");

        Assertions.assertTrue(store.remove("conv-1"));
        Assertions.assertFalse(store.remove("conv-1"));
        Assertions.assertFalse(store.conversationIds().contains("conv-1"));
        Assertions.assertEquals(0, store.observerCount("conv-1"));
        Assertions.assertTrue(store.conversationIds().contains("conv-2"));
    }

    @Test
    public void shouldNotifyRemovalListeners() {
        List<String> removed = new ArrayList<>();
        store.addRemovalListener(removed::add);
        store.addRemovalListener(conversationId -> {
            throw new IllegalStateException("listener failure");
        });
        store.snapshot("conv-1");

        Assertions.assertTrue(store.remove("conv-1"));

        Assertions.assertEquals(List.of("conv-1"), removed);
    }

    @Test
    public void shouldUnsubscribeObserver() {
        store.subscribe("conv-1", "s1", snapshot -> { });
        store.unsubscribe("conv-1", "s1");

        Assertions.assertEquals(0, store.observerCount("conv-1"));
    }

    @Test
    public void shouldRejectBlankConversationId() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> store.getOrCreate(" "));
    }
}
