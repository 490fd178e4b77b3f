package com.duelo.engine;

import com.duelo.entity.AgentType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.concurrent.atomic.AtomicLong;

@Service
@Slf4j
public class ExecutionMetricsService {

    private final AtomicLong llmRequestCount = new AtomicLong();
    private final AtomicLong parsedCount = new AtomicLong();
    private final AtomicLong degradedParseCount = new AtomicLong();
    private final AtomicLong failedExecutionCount = new AtomicLong();
    private final AtomicLong creditsCharged = new AtomicLong();

    public void recordLlmRequest(AgentType type, String model) {
        long count = llmRequestCount.incrementAndGet();
        log.info("LLM request #{} sent (purpose={}, model={}). Total requests={}.",
                count, type.name().toLowerCase(Locale.ROOT), model, count);
    }

    public void recordParse(AgentType type, boolean parsingSuccess, String strategy) {
        if (parsingSuccess) {
            parsedCount.incrementAndGet();
            return;
        }
        long degraded = degradedParseCount.incrementAndGet();
        log.info("{} answer not in the requested format (strategy={}). Total degraded parses={}.",
                type, strategy, degraded);
    }

    public void recordCharge(AgentType type, long credits) {
        long total = creditsCharged.addAndGet(credits);
        log.info("{} execution charged {} credits. Total credits charged={}.", type, credits, total);
    }

    public void recordFailure(AgentType type, String reason) {
        long failures = failedExecutionCount.incrementAndGet();
        log.info("{} execution failed ({}). Total failed executions={}.", type, reason, failures);
    }

    public long llmRequests() {
        return llmRequestCount.get();
    }

    public long failedExecutions() {
        return failedExecutionCount.get();
    }

    public void logSummary() {
        log.info("Engine stats: totalRequests={}, cleanParses={}, degradedParses={}, failedExecutions={}, creditsCharged={}.",
                llmRequestCount.get(), parsedCount.get(), degradedParseCount.get(), failedExecutionCount.get(),
                creditsCharged.get());
    }
}
