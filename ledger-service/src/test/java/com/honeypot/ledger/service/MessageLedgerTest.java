package com.honeypot.ledger.service;

import com.honeypot.common.exception.ConnectivityException;
import com.honeypot.common.model.ConversationState;
import com.honeypot.common.model.Sender;
import com.honeypot.ledger.dto.MessageCreateRequest;
import com.honeypot.ledger.model.Message;
import com.honeypot.ledger.repository.MessageRepository;
import io.r2dbc.spi.R2dbcTransientResourceException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MessageLedgerTest {

    private static final UUID SESSION = UUID.fromString("3f1c1f0e-7c2a-4d43-9d55-0a6b2a1c9e01");

    @Mock MessageRepository repository;

    private MessageLedger ledger;

    @BeforeEach
    void setUp() {
        ledger = new MessageLedger(repository, SessionChangeListener.NONE);
    }

    private static Message row(String sender, int turn, String text) {
        Message m = new Message();
        m.setId(UUID.randomUUID());
        m.setSessionId(SESSION);
        m.setSender(sender);
        m.setText(text);
        m.setTurnNumber(turn);
        m.setTimestamp(LocalDateTime.of(2025, 2, 1, 10, turn));
        m.setCreatedAt(LocalDateTime.of(2025, 2, 1, 10, turn));
        return m;
    }

    private void stubAppendEcho() {
        when(repository.append(any(UUID.class), anyString(), anyString(), anyInt(), any(LocalDateTime.class),
                               any(), any(), any(), any(), any(), any()))
            .thenAnswer(inv -> {
                Message m = row(inv.getArgument(1), inv.getArgument(3), inv.getArgument(2));
                m.setTimestamp(inv.getArgument(4));
                m.setStateAtMessage(inv.getArgument(8));
                return Mono.just(m);
            });
    }

    @Nested
    @DisplayName("appendMessage()")
    class Append {

        @Test
        @DisplayName("missing timestamp defaults to the current UTC time")
        void defaultTimestamp() {
            stubAppendEcho();
            LocalDateTime before = LocalDateTime.now(ZoneOffset.UTC).minusSeconds(1);

            StepVerifier.create(ledger.appendMessage(MessageCreateRequest.scammer(SESSION, "Send OTP now", 1)))
                .assertNext(m -> {
                    assertEquals(Sender.SCAMMER, m.sender());
                    assertFalse(m.timestamp().isBefore(before));
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("an append drops cached copies of the session, whose counter just moved")
        void notifiesChange() {
            stubAppendEcho();
            SessionChangeListener listener = mock(SessionChangeListener.class);
            when(listener.sessionChanged(SESSION)).thenReturn(Mono.empty());
            MessageLedger notifying = new MessageLedger(repository, listener);

            StepVerifier.create(notifying.appendMessage(MessageCreateRequest.scammer(SESSION, "Your KYC expired", 1)))
                .expectNextCount(1)
                .verifyComplete();

            verify(listener).sessionChanged(SESSION);
        }

        @Test
        @DisplayName("caller-supplied timestamp is kept")
        void suppliedTimestamp() {
            stubAppendEcho();
            LocalDateTime at = LocalDateTime.of(2025, 1, 31, 23, 59);
            MessageCreateRequest request = new MessageCreateRequest(SESSION, Sender.SCAMMER, "hello", 1, at,
                                                                    null, null, null, null, null, null);

            StepVerifier.create(ledger.appendMessage(request))
                .assertNext(m -> assertEquals(at, m.timestamp()))
                .verifyComplete();
        }

        @Test
        @DisplayName("agent message carries both response texts and the state snapshot")
        void agentMessage() {
            stubAppendEcho();
            MessageCreateRequest request = MessageCreateRequest.agent(
                SESSION, "Which bank is it?", "which bank is it", 2, 14, ConversationState.PROBING, 0.7, 0.1);

            StepVerifier.create(ledger.appendMessage(request))
                .assertNext(m -> {
                    assertEquals(Sender.AGENT, m.sender());
                    assertEquals(ConversationState.PROBING, m.stateAtMessage());
                })
                .verifyComplete();

            verify(repository).append(eq(SESSION), eq("agent"), eq("which bank is it"), eq(2),
                                      any(LocalDateTime.class), eq(14), eq("Which bank is it?"),
                                      eq("which bank is it"), eq("PROBING"), eq(0.7), eq(0.1));
        }

        @Test
        @DisplayName("turn numbers are stored as given, duplicates and gaps included")
        void turnNumbersNotPoliced() {
            stubAppendEcho();

            StepVerifier.create(ledger.appendMessage(MessageCreateRequest.scammer(SESSION, "a", 5))
                    .then(ledger.appendMessage(MessageCreateRequest.scammer(SESSION, "b", 5)))
                    .then(ledger.appendMessage(MessageCreateRequest.scammer(SESSION, "c", 2))))
                .assertNext(m -> assertEquals(2, m.turnNumber()))
                .verifyComplete();

            ArgumentCaptor<Integer> turns = ArgumentCaptor.forClass(Integer.class);
            verify(repository, times(3)).append(any(), any(), any(), turns.capture(), any(),
                                                any(), any(), any(), any(), any(), any());
            assertEquals(List.of(5, 5, 2), turns.getAllValues());
        }

        @Test
        @DisplayName("transient driver failure → ConnectivityException")
        void transientFailure() {
            when(repository.append(any(), any(), any(), anyInt(), any(), any(), any(), any(), any(), any(), any()))
                .thenReturn(Mono.error(new R2dbcTransientResourceException("pool exhausted")));

            StepVerifier.create(ledger.appendMessage(MessageCreateRequest.scammer(SESSION, "x", 1)))
                .expectError(ConnectivityException.class)
                .verify();
        }
    }

    @Nested
    @DisplayName("history")
    class History {

        @Test
        @DisplayName("default limit is 50")
        void defaultLimit() {
            when(repository.findHistory(SESSION, 50)).thenReturn(Flux.just(row("scammer", 1, "hi")));

            StepVerifier.create(ledger.getHistory(SESSION))
                .expectNextCount(1)
                .verifyComplete();
        }

        @Test
        @DisplayName("rows come back in repository order")
        void ordering() {
            when(repository.findHistory(SESSION, 3)).thenReturn(Flux.just(
                row("scammer", 1, "hi"), row("agent", 2, "who is this"), row("scammer", 3, "bank")));

            StepVerifier.create(ledger.getHistory(SESSION, 3))
                .assertNext(m -> assertEquals(1, m.turnNumber()))
                .assertNext(m -> assertEquals(2, m.turnNumber()))
                .assertNext(m -> assertEquals(3, m.turnNumber()))
                .verifyComplete();
        }

        @Test
        @DisplayName("limit below 1 is rejected without a query")
        void badLimit() {
            StepVerifier.create(ledger.getHistory(SESSION, 0))
                .expectError(IllegalArgumentException.class)
                .verify();
            verifyNoInteractions(repository);
        }

        @Test
        @DisplayName("last agent message is looked up by persisted sender")
        void lastAgentMessage() {
            when(repository.findFirstBySessionIdAndSenderOrderByTurnNumberDesc(SESSION, "agent"))
                .thenReturn(Mono.just(row("agent", 4, "ok sir")));

            StepVerifier.create(ledger.getLastAgentMessage(SESSION))
                .assertNext(m -> assertEquals("ok sir", m.text()))
                .verifyComplete();
        }

        @Test
        @DisplayName("no agent message yet completes empty")
        void noAgentMessage() {
            when(repository.findFirstBySessionIdAndSenderOrderByTurnNumberDesc(SESSION, "agent"))
                .thenReturn(Mono.empty());

            StepVerifier.create(ledger.getLastAgentMessage(SESSION)).verifyComplete();
        }
    }
}
