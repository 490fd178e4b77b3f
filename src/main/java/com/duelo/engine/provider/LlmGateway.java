package com.duelo.engine.provider;

import com.duelo.config.AgentEngineProperties;
import com.duelo.engine.cost.CostEstimator;
import com.duelo.engine.cost.ModelPricing;
import com.duelo.engine.cost.ModelPricingCatalog;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Single entry point for model calls. Chooses the provider from the model's pricing entry,
 * bounds each call by the configured timeout and reports every fault as an unsuccessful
 * {@link LlmCompletion}. One attempt per call.
 * <p>
 * The timeout covers the provider call itself, not the wait for a free {@code llmExecutor}
 * thread. A call that times out or is cancelled interrupts its worker thread.
 */
@Service
@Slf4j
public class LlmGateway {

    private static final long QUEUE_POLL_MS = 50;

    private final Map<ProviderType, LlmProvider> providers = new EnumMap<>(ProviderType.class);
    private final ModelPricingCatalog pricingCatalog;
    private final CostEstimator costEstimator;
    private final ExecutorService llmExecutor;
    private final Duration timeout;

    public LlmGateway(List<LlmProvider> providers,
                      ModelPricingCatalog pricingCatalog,
                      CostEstimator costEstimator,
                      @Qualifier("llmExecutor") ExecutorService llmExecutor,
                      AgentEngineProperties properties) {
        for (LlmProvider provider : providers) {
            this.providers.put(provider.type(), provider);
        }
        this.pricingCatalog = pricingCatalog;
        this.costEstimator = costEstimator;
        this.llmExecutor = llmExecutor;
        this.timeout = properties.getProvider().getTimeout();
    }

    public LlmCompletion complete(String prompt, String model, LlmParameters parameters) {
        return complete(prompt, model, parameters, CancellationSignal.none());
    }

    public LlmCompletion complete(String prompt, String model, LlmParameters parameters, CancellationSignal cancellation) {
        ModelPricing pricing = pricingCatalog.require(model);
        LlmProvider provider = providers.get(pricing.provider());
        if (provider == null || !provider.isAvailable()) {
            log.warn("No configured provider for model {} (provider={}).", model, pricing.provider());
            return LlmCompletion.failed("Provider " + pricing.provider() + " is not configured");
        }
        if (cancellation.isCancelled()) {
            return LlmCompletion.failed("cancelled");
        }

        CountDownLatch started = new CountDownLatch(1);
        Future<ProviderReply> future = llmExecutor.submit(() -> {
            started.countDown();
            return provider.generate(prompt, model, parameters);
        });
        cancellation.attach(future);
        try {
            awaitStart(started, future);
            ProviderReply reply = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return LlmCompletion.succeeded(reply,
                    costEstimator.monetaryCost(model, reply.promptTokens(), reply.completionTokens()));
        } catch (CancellationException ex) {
            log.info("Call to {} cancelled.", model);
            return LlmCompletion.failed("cancelled");
        } catch (TimeoutException ex) {
            future.cancel(true);
            log.warn("Call to {} timed out after {}s.", model, timeout.toSeconds());
            return LlmCompletion.failed("Timed out after " + timeout.toSeconds() + "s");
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
            log.warn("Call to {} failed: {}", model, cause.getMessage());
            return LlmCompletion.failed(cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            log.info("Interrupted while waiting for {}.", model);
            return LlmCompletion.failed("interrupted");
        } finally {
            cancellation.detach();
        }
    }

    /**
     * Blocks until a pool thread has picked the call up or it was cancelled while queued. The
     * call timeout only starts after this returns.
     */
    private static void awaitStart(CountDownLatch started, Future<?> future) throws InterruptedException {
        while (!started.await(QUEUE_POLL_MS, TimeUnit.MILLISECONDS)) {
            if (future.isDone()) {
                return;
            }
        }
    }
}
