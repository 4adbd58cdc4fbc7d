package me.golemcore.runner.domain.system.turnloop;

import me.golemcore.runner.domain.model.ModelRequest;
import me.golemcore.runner.domain.model.ModelResponse;
import me.golemcore.runner.domain.model.ModelStreamEvent;
import me.golemcore.runner.domain.model.Usage;
import me.golemcore.runner.port.outbound.ModelPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Counts every model call into the run's usage, including calls that fail
 * before the provider reports token counts.
 */
class UsageTrackingModelPortDecorator implements ModelPort {

    private static final Logger log = LoggerFactory.getLogger(UsageTrackingModelPortDecorator.class);

    private final ModelPort delegate;
    private final Usage usage;

    UsageTrackingModelPortDecorator(ModelPort delegate, Usage usage) {
        this.delegate = delegate;
        this.usage = usage;
    }

    @Override
    public String getProviderId() {
        return delegate.getProviderId();
    }

    @Override
    public CompletableFuture<ModelResponse> call(ModelRequest request) {
        CompletableFuture<ModelResponse> future;
        try {
            future = delegate.call(request);
        } catch (RuntimeException e) {
            usage.countRequest();
            throw e;
        }
        return future.whenComplete((response, error) -> recordUsage(response));
    }

    @Override
    public Flux<ModelStreamEvent> stream(ModelRequest request) {
        AtomicBoolean counted = new AtomicBoolean();
        return delegate.stream(request)
                .doOnNext(event -> {
                    if (event.isCompleted() && counted.compareAndSet(false, true)) {
                        recordUsage(event.response());
                    }
                })
                .doOnError(error -> {
                    if (counted.compareAndSet(false, true)) {
                        usage.countRequest();
                    }
                });
    }

    @Override
    public boolean supportsStreaming() {
        return delegate.supportsStreaming();
    }

    private void recordUsage(ModelResponse response) {
        usage.countRequest();
        if (response == null || response.getUsage() == null) {
            return;
        }
        try {
            usage.addTokens(response.getUsage());
        } catch (Exception e) { // NOSONAR
            log.warn("[TurnLoop] Failed to record usage: {}", e.getMessage());
        }
    }
}
