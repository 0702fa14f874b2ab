package com.openforge.storyagent.agent;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.storyagent.agent.event.EventType;
import com.openforge.storyagent.agent.event.StoryEvent;
import com.openforge.storyagent.config.StoryProperties;
import com.openforge.storyagent.engine.Exchange;
import com.openforge.storyagent.engine.SessionLoop;
import com.openforge.storyagent.engine.StorySession;
import com.openforge.storyagent.engine.ToolCallExtractor;
import com.openforge.storyagent.engine.TurnInProgressException;
import com.openforge.storyagent.engine.slot.SlotResultRouter;
import com.openforge.storyagent.llm.LlmRouter;
import com.openforge.storyagent.llm.model.ChatRequest;
import com.openforge.storyagent.llm.model.ChatResponse;
import com.openforge.storyagent.llm.model.Message;
import com.openforge.storyagent.tool.ToolInvoker;
import com.openforge.storyagent.tool.ToolRegistry;
import com.openforge.storyagent.tool.builtin.PrintStoryTool;
import com.openforge.storyagent.websocket.StoryEventPublisher;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class StoryAgentServiceTest {

    private static final String START = "<|startofthink|>";
    private static final String END = "<|endofthink|>";

    private ExecutorService executor;
    private LlmRouter llmRouter;
    private StoryEventPublisher publisher;
    private StoryAgentService service;
    private StorySession session;

    @BeforeEach
    void setUp() {
        executor = Executors.newCachedThreadPool();
        llmRouter = mock(LlmRouter.class);
        publisher = mock(StoryEventPublisher.class);

        StoryProperties properties = new StoryProperties(4, START, END, "<|user|>", "Hello", List.of(), 5, 20);
        ToolRegistry registry = new ToolRegistry(List.of(new PrintStoryTool()));
        SessionLoop loop = new SessionLoop(
                new ToolCallExtractor(new ObjectMapper(), START, END, "<|user|>"),
                new ToolInvoker(registry),
                new SlotResultRouter());
        ConversationContextService context = new ConversationContextService(new ObjectMapper(), registry, properties);

        service = new StoryAgentService(loop, context, llmRouter, publisher, properties, executor);
        session = new StorySession("s1", 4, "Hello");
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @SuppressWarnings("unchecked")
    private void replyWith(String... tokens) {
        doAnswer(invocation -> {
            Consumer<String> onToken = invocation.getArgument(1);
            StringBuilder reply = new StringBuilder();
            for (String token : tokens) {
                onToken.accept(token);
                reply.append(token);
            }
            return response(reply.toString());
        }).when(llmRouter).streamChat(any(ChatRequest.class), any(Consumer.class), any(Runnable.class));
    }

    private static ChatResponse response(String content) {
        return new ChatResponse("id", "model",
                List.of(new ChatResponse.Choice(0, Message.assistant(content), "stop")));
    }

    private void awaitTurnCompleted(int times) {
        verify(publisher, timeout(5000).times(times))
                .publish(argThat(event -> event.type() == EventType.TURN_COMPLETED));
    }

    // ===== Turns =====

    @Test
    void shouldStreamSnapshotsAndRecordExchange() {
        String call = START + "{\"api_name\": \"print_story_tool\", \"parameters\": {\"story\": \"The end.\"}}" + END;
        replyWith("Here ", "it is.", call);

        service.submitTurn(session, "print my story");
        awaitTurnCompleted(1);

        assertEquals(List.of(new Exchange("print my story", "Here it is." + call)), session.memory());
        assertEquals("The end.", session.snapshot().story());
        assertFalse(session.isTurnInFlight());

        ArgumentCaptor<StoryEvent> events = ArgumentCaptor.forClass(StoryEvent.class);
        verify(publisher, atLeastOnce()).publish(events.capture());
        assertEquals(EventType.TURN_STARTED, events.getAllValues().get(0).type());
        assertTrue(events.getAllValues().stream().anyMatch(event -> event.type() == EventType.SNAPSHOT));
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldSendMemoryAndStopMarkerToModel() {
        replyWith("Hi!");
        service.submitTurn(session, "first");
        awaitTurnCompleted(1);

        service.submitTurn(session, "second");
        awaitTurnCompleted(2);

        ArgumentCaptor<ChatRequest> requests = ArgumentCaptor.forClass(ChatRequest.class);
        verify(llmRouter, times(2)).streamChat(requests.capture(), any(Consumer.class), any(Runnable.class));
        ChatRequest second = requests.getAllValues().get(1);
        assertEquals(List.of("<|user|>"), second.stop());
        assertEquals("first", second.messages().get(1).content());
        assertEquals("Hi!", second.messages().get(2).content());
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldRejectTurnWhileAnotherRuns() throws InterruptedException {
        CountDownLatch release = new CountDownLatch(1);
        when(llmRouter.streamChat(any(ChatRequest.class), any(Consumer.class), any(Runnable.class)))
                .thenAnswer(invocation -> {
                    release.await(5, TimeUnit.SECONDS);
                    return response("done");
                });

        service.submitTurn(session, "one");

        assertThrows(TurnInProgressException.class, () -> service.submitTurn(session, "two"));
        release.countDown();
        awaitTurnCompleted(1);
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldPublishDiagnosticWhenModelFails() {
        when(llmRouter.streamChat(any(ChatRequest.class), any(Consumer.class), any(Runnable.class)))
                .thenThrow(new IllegalStateException("both providers down"));

        service.submitTurn(session, "hello");
        awaitTurnCompleted(1);

        String agent = session.state().currentTurn().agentText();
        assertEquals("generation failed: both providers down", agent);
        assertTrue(session.memory().isEmpty());
    }

    // ===== Regenerate & reset =====

    @Test
    void shouldRegenerateLastTurn() {
        replyWith("First try.");
        service.submitTurn(session, "tell me");
        awaitTurnCompleted(1);

        replyWith("Second try.");
        service.regenerate(session);
        awaitTurnCompleted(2);

        assertEquals(List.of(new Exchange("tell me", "Second try.")), session.memory());
        assertEquals(2, session.state().transcript().size());
        assertEquals("Second try.", session.state().currentTurn().agentText());
    }

    @Test
    void shouldRefuseRegenerateWithoutUserTurn() {
        assertThrows(IllegalStateException.class, () -> service.regenerate(session));
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldStopModelStreamWhenResetDuringTurn() throws InterruptedException {
        CountDownLatch streaming = new CountDownLatch(1);
        CountDownLatch resetDone = new CountDownLatch(1);
        CountDownLatch cancelled = new CountDownLatch(1);
        doAnswer(invocation -> {
            Consumer<String> onToken = invocation.getArgument(1);
            onToken.accept("Once");
            streaming.countDown();
            try {
                resetDone.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                // closing the source interrupts the stream; keep going to hit the cancelled callback
            }
            try {
                onToken.accept(" upon a time");
            } catch (CancellationException e) {
                cancelled.countDown();
                throw e;
            }
            return response("Once upon a time");
        }).when(llmRouter).streamChat(any(ChatRequest.class), any(Consumer.class), any(Runnable.class));

        service.submitTurn(session, "story");
        assertTrue(streaming.await(5, TimeUnit.SECONDS));
        service.reset(session);
        resetDone.countDown();

        assertTrue(cancelled.await(5, TimeUnit.SECONDS));
        awaitTurnCompleted(1);
        assertEquals(new StorySession("s1", 4, "Hello").snapshot(), session.snapshot());
        assertTrue(session.memory().isEmpty());
    }

    @Test
    void shouldPublishResetSnapshot() {
        service.reset(session);

        verify(publisher).publish(argThat(event -> event.type() == EventType.SESSION_RESET
                && event.snapshot().transcript().size() == 1));
    }
}
