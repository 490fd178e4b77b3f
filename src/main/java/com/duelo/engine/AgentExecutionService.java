package com.duelo.engine;

import com.duelo.config.AgentEngineProperties;
import com.duelo.engine.audit.ExecutionAuditService;
import com.duelo.engine.cost.CostBreakdown;
import com.duelo.engine.cost.CostEstimator;
import com.duelo.engine.cost.ModelPricingCatalog;
import com.duelo.engine.debug.DebugLogRecord;
import com.duelo.engine.debug.DebugLogService;
import com.duelo.engine.exception.ExecutionCancelledException;
import com.duelo.engine.exception.InsufficientCreditsException;
import com.duelo.engine.exception.InvalidExecutionRequestException;
import com.duelo.engine.exception.ProviderException;
import com.duelo.engine.ledger.CreditLedgerService;
import com.duelo.engine.ledger.ExecutionSettlementService;
import com.duelo.engine.ledger.SettlementRequest;
import com.duelo.engine.model.JudgeCandidate;
import com.duelo.engine.model.JudgeContest;
import com.duelo.engine.model.JudgeOutput;
import com.duelo.engine.model.JudgeResult;
import com.duelo.engine.model.WriterContext;
import com.duelo.engine.model.WriterOutput;
import com.duelo.engine.model.WriterResult;
import com.duelo.engine.parse.JudgeResponseParser;
import com.duelo.engine.parse.WriterResponseParser;
import com.duelo.engine.prompt.PromptBuilder;
import com.duelo.engine.provider.CancellationSignal;
import com.duelo.engine.provider.LlmCompletion;
import com.duelo.engine.provider.LlmGateway;
import com.duelo.engine.provider.LlmParameters;
import com.duelo.entity.Agent;
import com.duelo.entity.AgentExecution;
import com.duelo.entity.AgentType;
import com.duelo.entity.ExecutionStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * Runs writer and judge agents end to end: balance precheck, provider call, parsing, then one
 * atomic settlement of the actual cost. Every execution that gets past request validation leaves
 * an audit row that ends {@code COMPLETED} or {@code FAILED}; failed executions are never charged.
 */
@Service
@Slf4j
public class AgentExecutionService {

    private final AgentCatalogService agentCatalog;
    private final ModelPricingCatalog pricingCatalog;
    private final CostEstimator costEstimator;
    private final PromptBuilder promptBuilder;
    private final LlmGateway gateway;
    private final WriterResponseParser writerParser;
    private final JudgeResponseParser judgeParser;
    private final CreditLedgerService ledgerService;
    private final ExecutionAuditService auditService;
    private final ExecutionSettlementService settlementService;
    private final ExecutionCancellationRegistry cancellations;
    private final SubmissionSource submissionSource;
    private final DebugLogService debugLogService;
    private final ExecutionMetricsService metrics;
    private final AgentEngineProperties.EstimationConfig estimation;

    public AgentExecutionService(
            AgentCatalogService agentCatalog,
            ModelPricingCatalog pricingCatalog,
            CostEstimator costEstimator,
            PromptBuilder promptBuilder,
            LlmGateway gateway,
            WriterResponseParser writerParser,
            JudgeResponseParser judgeParser,
            CreditLedgerService ledgerService,
            ExecutionAuditService auditService,
            ExecutionSettlementService settlementService,
            ExecutionCancellationRegistry cancellations,
            SubmissionSource submissionSource,
            DebugLogService debugLogService,
            ExecutionMetricsService metrics,
            AgentEngineProperties properties) {
        this.agentCatalog = agentCatalog;
        this.pricingCatalog = pricingCatalog;
        this.costEstimator = costEstimator;
        this.promptBuilder = promptBuilder;
        this.gateway = gateway;
        this.writerParser = writerParser;
        this.judgeParser = judgeParser;
        this.ledgerService = ledgerService;
        this.auditService = auditService;
        this.settlementService = settlementService;
        this.cancellations = cancellations;
        this.submissionSource = submissionSource;
        this.debugLogService = debugLogService;
        this.metrics = metrics;
        this.estimation = properties.getEstimation();
    }

    /**
     * Credits an execution of the given type is expected to cost, for a context of
     * {@code contextSize} characters.
     */
    public CostBreakdown estimateCost(AgentType agentType, String model, int contextSize) {
        if (!StringUtils.hasText(model)) {
            throw new InvalidExecutionRequestException("A model is required for an estimate");
        }
        pricingCatalog.require(model.trim());
        return costEstimator.estimate(agentType, model.trim(), contextSize);
    }

    public WriterResult executeWriter(Agent agent, UUID requesterId, @Nullable String model, WriterContext context) {
        Objects.requireNonNull(context, "context is required");
        String activeModel = prepare(agent, AgentType.WRITER, requesterId, model);
        String prompt = promptBuilder.writerPrompt(agent.getPersonalityPrompt(), context);
        LlmParameters parameters = new LlmParameters(estimation.getWriterTemperature(), estimation.getWriterMaxTokens(), null);

        Map<String, Object> strategyInput = new LinkedHashMap<>();
        strategyInput.put("strategy_type", "title-text");
        strategyInput.put("personality_prompt", agent.getPersonalityPrompt());
        strategyInput.put("contest_description", context.contestDescription());
        strategyInput.put("title_hint", context.titleHint());
        strategyInput.put("guidance", context.guidance());
        strategyInput.put("temperature", parameters.temperature());
        strategyInput.put("max_tokens", parameters.maxTokens());

        ExecutionPlan plan = new ExecutionPlan(agent, requesterId, AgentType.WRITER, activeModel,
                context.requestId(), prompt, parameters, strategyInput);
        Completed<WriterOutput> done = run(plan,
                raw -> writerParser.parse(raw, context.titleHint()),
                WriterOutput::unparsed,
                output -> new ParseSummary(output.parsingSuccess(), output.strategy()));
        return new WriterResult(done.executionId(), done.output(), done.cost(), done.creditsCharged());
    }

    public JudgeResult executeJudge(Agent agent, UUID requesterId, @Nullable String model, JudgeContest contest) {
        Objects.requireNonNull(contest, "contest is required");
        String activeModel = prepare(agent, AgentType.JUDGE, requesterId, model);
        List<JudgeCandidate> candidates = submissionSource.findSubmissions(contest.contestId());
        if (candidates.isEmpty()) {
            throw new InvalidExecutionRequestException("Contest " + contest.contestId() + " has no submissions to judge");
        }
        String prompt = promptBuilder.judgePrompt(agent.getPersonalityPrompt(), contest.description(), candidates);
        LlmParameters parameters = new LlmParameters(estimation.getJudgeTemperature(), estimation.getJudgeMaxTokens(),
                promptBuilder.judgeSystemMessage());

        Map<String, Object> strategyInput = new LinkedHashMap<>();
        strategyInput.put("strategy_type", "structured");
        strategyInput.put("personality_prompt", agent.getPersonalityPrompt());
        strategyInput.put("contest_description", contest.description());
        strategyInput.put("texts_count", candidates.size());
        strategyInput.put("texts_summary", candidates.stream().map(JudgeCandidate::title).toList());
        strategyInput.put("temperature", parameters.temperature());
        strategyInput.put("max_tokens", parameters.maxTokens());

        ExecutionPlan plan = new ExecutionPlan(agent, requesterId, AgentType.JUDGE, activeModel,
                contest.contestId(), prompt, parameters, strategyInput);
        Completed<JudgeOutput> done = run(plan,
                raw -> judgeParser.parse(raw, candidates),
                JudgeOutput::unparsed,
                output -> new ParseSummary(output.parsingSuccess(), output.strategy()));
        return new JudgeResult(done.executionId(), done.output(), done.cost(), done.creditsCharged());
    }

    /**
     * Requests cancellation of an in-flight execution. Takes effect if the provider has not yet
     * answered; the execution then ends {@code FAILED} without a charge.
     */
    public boolean cancel(UUID executionId) {
        return cancellations.cancel(executionId);
    }

    /**
     * Links a completed execution to the record its output was stored as. Called once the caller
     * has persisted the generated text or the votes.
     */
    public void recordResult(UUID executionId, UUID resultId) {
        Objects.requireNonNull(resultId, "resultId is required");
        AgentExecution execution = auditService.find(executionId)
                .orElseThrow(() -> new InvalidExecutionRequestException("Unknown execution " + executionId));
        if (execution.getStatus() != ExecutionStatus.COMPLETED) {
            throw new InvalidExecutionRequestException(
                    "Execution " + executionId + " is " + execution.getStatus() + ", not COMPLETED");
        }
        auditService.attachResult(executionId, resultId);
    }

    public List<AgentExecution> executionsFor(UUID userId) {
        return auditService.executionsFor(userId);
    }

    private String prepare(Agent agent, AgentType expectedType, UUID requesterId, @Nullable String model) {
        Objects.requireNonNull(agent, "agent is required");
        Objects.requireNonNull(requesterId, "requesterId is required");
        if (agent.getType() != expectedType) {
            throw new InvalidExecutionRequestException(
                    "Agent " + agent.getId() + " is a " + agent.getType() + " agent, not a " + expectedType + " agent");
        }
        agentCatalog.checkUsable(agent, requesterId);
        String activeModel = StringUtils.hasText(model) ? model.trim() : agent.getDefaultModel();
        pricingCatalog.require(activeModel);
        return activeModel;
    }

    private <T> Completed<T> run(ExecutionPlan plan,
                                 Function<String, T> parser,
                                 Function<String, T> unparsed,
                                 Function<T, ParseSummary> summary) {
        AgentExecution execution = auditService.open(plan.agent(), plan.requesterId(), plan.type(), plan.model(), plan.targetId());
        UUID executionId = execution.getId();
        CancellationSignal signal = cancellations.register(executionId);
        try {
            CostBreakdown estimate = costEstimator.estimate(plan.model(), plan.fullPromptText(),
                    costEstimator.expectedCompletionTokens(plan.type()));
            if (!ledgerService.hasSufficientCredits(plan.requesterId(), estimate.credits())) {
                throw new InsufficientCreditsException(estimate.credits(), ledgerService.balanceOf(plan.requesterId()));
            }
            auditService.markRunning(executionId, estimate.credits());

            metrics.recordLlmRequest(plan.type(), plan.model());
            long started = System.nanoTime();
            LlmCompletion completion = gateway.complete(plan.prompt(), plan.model(), plan.parameters(), signal);
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
            if (signal.isCancelled()) {
                throw new ExecutionCancelledException(executionId);
            }
            if (!completion.success()) {
                throw new ProviderException(AgentEngineConstants.PROVIDER_FAILED_MESSAGE + completion.error());
            }

            T output = parseOrDegrade(executionId, completion.text(), parser, unparsed);
            ParseSummary parse = summary.apply(output);
            metrics.recordParse(plan.type(), parse.success(), parse.strategy());
            CostBreakdown actual = costEstimator.finalize(plan.model(), completion.promptTokens(), completion.completionTokens());
            recordDebug(plan, completion, output, elapsedMs, actual);

            if (signal.isCancelled()) {
                throw new ExecutionCancelledException(executionId);
            }
            long charged = settlementService.settle(new SettlementRequest(executionId, plan.requesterId(),
                    describe(plan), actual, parse.success()));
            metrics.recordCharge(plan.type(), charged);
            if (charged < actual.credits()) {
                log.warn("Execution {} cost {} credits but only {} could be charged.", executionId, actual.credits(), charged);
            }
            return new Completed<>(executionId, output, actual, charged);
        } catch (RuntimeException ex) {
            String reason = ex instanceof ExecutionCancelledException
                    ? AgentEngineConstants.CANCELLED_MESSAGE
                    : Objects.requireNonNullElse(ex.getMessage(), ex.getClass().getSimpleName());
            recordFailure(executionId, reason, ex);
            metrics.recordFailure(plan.type(), reason);
            throw ex;
        } finally {
            cancellations.release(executionId);
            metrics.logSummary();
        }
    }

    /**
     * A parser fault yields the unparsed output; the answer is still charged.
     */
    private <T> T parseOrDegrade(UUID executionId, String raw, Function<String, T> parser, Function<String, T> unparsed) {
        try {
            return parser.apply(raw);
        } catch (RuntimeException ex) {
            log.error("Parsing the answer of execution {} failed; keeping it unparsed.", executionId, ex);
            return unparsed.apply(raw);
        }
    }

    private void recordFailure(UUID executionId, String reason, RuntimeException cause) {
        try {
            auditService.markFailed(executionId, reason);
        } catch (RuntimeException auditEx) {
            cause.addSuppressed(auditEx);
            log.error("Could not mark execution {} as failed ({}).", executionId, reason, auditEx);
        }
    }

    private void recordDebug(ExecutionPlan plan, LlmCompletion completion, Object output, long elapsedMs, CostBreakdown actual) {
        if (!debugLogService.isEnabled()) {
            return;
        }
        debugLogService.record(DebugLogRecord.builder()
                .operationType(plan.type())
                .userId(plan.requesterId())
                .agentId(plan.agent().getId())
                .contestId(plan.type() == AgentType.JUDGE ? plan.targetId() : null)
                .model(plan.model())
                .strategyInput(plan.strategyInput())
                .prompt(plan.fullPromptText())
                .response(completion.text())
                .parsedOutput(output)
                .executionTimeMs(elapsedMs)
                .promptTokens(completion.promptTokens())
                .completionTokens(completion.completionTokens())
                .costUsd(actual.costUsd())
                .build());
    }

    private static String describe(ExecutionPlan plan) {
        String kind = plan.type() == AgentType.JUDGE ? "Judge" : "Writer";
        return kind + " execution of agent '" + plan.agent().getName() + "' on " + plan.model();
    }

    private record ExecutionPlan(
            Agent agent,
            UUID requesterId,
            AgentType type,
            String model,
            @Nullable UUID targetId,
            String prompt,
            LlmParameters parameters,
            Map<String, Object> strategyInput
    ) {
        String fullPromptText() {
            return parameters.systemMessage() != null ? parameters.systemMessage() + "\n\n" + prompt : prompt;
        }
    }

    private record ParseSummary(boolean success, @Nullable String strategy) {
    }

    private record Completed<T>(UUID executionId, T output, CostBreakdown cost, long creditsCharged) {
    }
}
