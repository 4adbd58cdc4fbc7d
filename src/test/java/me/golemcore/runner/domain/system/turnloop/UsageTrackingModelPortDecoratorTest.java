package me.golemcore.runner.domain.system.turnloop;

import me.golemcore.runner.domain.model.ModelRequest;
import me.golemcore.runner.domain.model.ModelResponse;
import me.golemcore.runner.domain.model.ModelStreamEvent;
import me.golemcore.runner.domain.model.Usage;
import me.golemcore.runner.port.outbound.ModelPort;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

class UsageTrackingModelPortDecoratorTest {

    @Mock
    private ModelPort delegate;

    private AutoCloseable mocks;
    private Usage usage;
    private UsageTrackingModelPortDecorator decorator;
    private ModelRequest request;

    @BeforeEach
    void setUp() {
        mocks = MockitoAnnotations.openMocks(this);
        usage = new Usage();
        decorator = new UsageTrackingModelPortDecorator(delegate, usage);
        request = ModelRequest.builder().agentName("assistant").input(List.of()).build();
        when(delegate.getProviderId()).thenReturn("scripted");
        when(delegate.supportsStreaming()).thenReturn(true);
    }

    @AfterEach
    void tearDown() throws Exception {
        mocks.close();
    }

    private static ModelResponse response(int inputTokens, int outputTokens) {
        return ModelResponse.builder().usage(Usage.of(inputTokens, outputTokens)).responseId("resp_1").build();
    }

    @Test
    void shouldDelegateProviderDetails() {
        assertEquals("scripted", decorator.getProviderId());
        assertTrue(decorator.supportsStreaming());
    }

    @Test
    void shouldCountRequestAndTokensOnSuccess() {
        when(delegate.call(any())).thenReturn(CompletableFuture.completedFuture(response(100, 20)));

        decorator.call(request).join();

        assertEquals(1, usage.getRequests());
        assertEquals(100, usage.getInputTokens());
        assertEquals(20, usage.getOutputTokens());
        assertEquals(120, usage.getTotalTokens());
    }

    @Test
    void shouldCountRequestWhenProviderReportsNoUsage() {
        when(delegate.call(any())).thenReturn(CompletableFuture.completedFuture(new ModelResponse()));

        decorator.call(request).join();

        assertEquals(1, usage.getRequests());
        assertEquals(0, usage.getTotalTokens());
    }

    @Test
    void shouldCountFailedCalls() {
        when(delegate.call(any())).thenReturn(CompletableFuture.failedFuture(new IllegalStateException("boom")));

        CompletableFuture<ModelResponse> future = decorator.call(request);

        assertThrows(CompletionException.class, future::join);
        assertEquals(1, usage.getRequests());
    }

    @Test
    void shouldCountCallsThatThrowSynchronously() {
        when(delegate.call(any())).thenThrow(new IllegalStateException("boom"));

        assertThrows(IllegalStateException.class, () -> decorator.call(request));
        assertEquals(1, usage.getRequests());
    }

    @Test
    void shouldCountStreamOnceOnCompletion() {
        ModelResponse completed = response(50, 10);
        when(delegate.stream(any())).thenReturn(Flux.just(
                ModelStreamEvent.delta("response.output_text.delta", "Hel"),
                ModelStreamEvent.delta("response.output_text.delta", "lo"),
                ModelStreamEvent.completed(completed)));

        StepVerifier.create(decorator.stream(request))
                .expectNextCount(3)
                .verifyComplete();

        assertEquals(1, usage.getRequests());
        assertEquals(50, usage.getInputTokens());
    }

    @Test
    void shouldCountFailedStream() {
        when(delegate.stream(any())).thenReturn(Flux.error(new IllegalStateException("reset")));

        StepVerifier.create(decorator.stream(request))
                .verifyError(IllegalStateException.class);

        assertEquals(1, usage.getRequests());
    }
}
