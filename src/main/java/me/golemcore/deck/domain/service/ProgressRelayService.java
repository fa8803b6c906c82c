/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.deck.domain.service;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.deck.domain.model.ChatReply;
import me.golemcore.deck.domain.model.ChatRequest;
import me.golemcore.deck.domain.model.ChatSession;
import me.golemcore.deck.domain.model.ProgressEvent;
import me.golemcore.deck.infrastructure.config.DeckProperties;
import me.golemcore.deck.port.outbound.SessionPort;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.SynchronousSink;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs a chat turn on a worker thread and relays its progress as a stream.
 *
 * <p>
 * The worker is the only producer and the subscriber the only consumer of an
 * unbounded queue. The worker enqueues a sentinel when the turn ends, however
 * it ends. The consumer relays events in order, emits a keepalive on every
 * idle poll interval, and after the sentinel commits the forked session and
 * emits exactly one terminal event. A worker that ended without a sentinel is
 * detected on an idle poll and reported as a failure.
 */
@Service
@Slf4j
public class ProgressRelayService {

    private final SessionPort sessionPort;
    private final ChatSessionService chatSessionService;
    private final ChatService chatService;
    private final ExecutorService relayExecutor;
    private final Duration pollInterval;

    public ProgressRelayService(SessionPort sessionPort, ChatSessionService chatSessionService,
            ChatService chatService, @Qualifier("deckRelayExecutor") ExecutorService relayExecutor,
            DeckProperties properties) {
        this.sessionPort = sessionPort;
        this.chatSessionService = chatSessionService;
        this.chatService = chatService;
        this.relayExecutor = relayExecutor;
        this.pollInterval = properties.getRelay().getPollInterval();
    }

    /**
     * Streams the progress of one chat turn. The stream always ends with a
     * single {@code COMPLETED} or {@code FAILED} event.
     */
    public Flux<ProgressEvent> runStreamed(String sessionId, ChatRequest request) {
        return Flux.<ProgressEvent, RelayState>generate(
                () -> start(sessionId, request),
                this::drainNext)
                .subscribeOn(Schedulers.boundedElastic());
    }

    private RelayState start(String sessionId, ChatRequest request) {
        RelayState state = new RelayState();
        try {
            ChatSession fork = chatSessionService.getOrCreate(sessionId).fork();
            state.fork = fork;
            state.worker = relayExecutor.submit(() -> runTurn(state, fork, request));
            log.debug("[Relay] Turn submitted for session {}", sessionId);
        } catch (RuntimeException e) {
            log.error("[Relay] Failed to start turn for session {}: {}", sessionId, e.getMessage(), e);
            state.startFailure = e;
        }
        return state;
    }

    private void runTurn(RelayState state, ChatSession fork, ChatRequest request) {
        AtomicReference<ChatReply> reply = new AtomicReference<>();
        AtomicReference<Throwable> failure = new AtomicReference<>();
        try {
            reply.set(chatService.sendMessage(fork, request,
                    event -> state.channel.add(Signal.event(event))));
        } catch (RuntimeException e) {
            failure.set(e);
            log.error("[Relay] Turn failed in session {}: {}", fork.getId(), e.getMessage(), e);
        } finally {
            state.channel.add(Signal.end(reply.get(), failure.get()));
        }
    }

    private RelayState drainNext(RelayState state, SynchronousSink<ProgressEvent> sink) {
        if (state.finished) {
            sink.complete();
            return state;
        }
        if (state.startFailure != null) {
            finish(state, sink, ProgressEvent.failed("Failed to start: " + state.startFailure.getMessage()));
            return state;
        }

        Signal signal;
        try {
            signal = state.channel.poll(pollInterval.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            finish(state, sink, ProgressEvent.failed("Interrupted while waiting for progress"));
            return state;
        }

        if (signal == null) {
            // Liveness fallback: a finished worker whose sentinel never arrived
            if (state.worker.isDone() && state.channel.isEmpty()) {
                log.warn("[Relay] Worker for session {} ended without completion signal", state.fork.getId());
                finish(state, sink, ProgressEvent.failed("Worker ended without completion signal"));
                return state;
            }
            sink.next(ProgressEvent.keepalive());
            return state;
        }

        if (!signal.isEnd()) {
            sink.next(signal.event());
            return state;
        }

        if (signal.failure() != null || signal.reply() == null) {
            String error = signal.failure() != null ? signal.failure().getMessage() : "No reply";
            finish(state, sink, ProgressEvent.failed(error));
            return state;
        }

        try {
            sessionPort.put(state.fork);
        } catch (RuntimeException e) {
            log.error("[Relay] Failed to store session {}: {}", state.fork.getId(), e.getMessage(), e);
            finish(state, sink, ProgressEvent.failed("Failed to store session: " + e.getMessage()));
            return state;
        }
        finish(state, sink, ProgressEvent.completed(signal.reply()));
        return state;
    }

    private void finish(RelayState state, SynchronousSink<ProgressEvent> sink, ProgressEvent terminal) {
        state.finished = true;
        sink.next(terminal);
    }

    private static final class RelayState {
        private final BlockingQueue<Signal> channel = new LinkedBlockingQueue<>();
        private ChatSession fork;
        private Future<?> worker;
        private RuntimeException startFailure;
        private boolean finished;
    }

    private record Signal(ProgressEvent event, ChatReply reply, Throwable failure, boolean isEnd) {

        static Signal event(ProgressEvent event) {
            return new Signal(event, null, null, false);
        }

        static Signal end(ChatReply reply, Throwable failure) {
            return new Signal(null, reply, failure, true);
        }
    }
}
