package com.duelo.engine.provider;

import com.duelo.engine.cost.TokenCounter;
import com.duelo.engine.model.JudgeCandidate;
import com.duelo.engine.model.JudgeOutput;
import com.duelo.engine.model.WriterContext;
import com.duelo.engine.model.WriterOutput;
import com.duelo.engine.parse.JudgeResponseParser;
import com.duelo.engine.parse.RankingValidator;
import com.duelo.engine.parse.SubmissionTitleMatcher;
import com.duelo.engine.parse.WriterResponseParser;
import com.duelo.engine.prompt.PromptBuilder;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class MockLlmProviderTest {

    private final MockLlmProvider provider = new MockLlmProvider(new TokenCounter());
    private final PromptBuilder promptBuilder = new PromptBuilder();

    @Test
    void testJudgeAnswerRanksEveryText() {
        List<JudgeCandidate> candidates = List.of(
                new JudgeCandidate(UUID.randomUUID(), "Low Tide", "The sea went out and did not come back."),
                new JudgeCandidate(UUID.randomUUID(), "Storm", "Thunder rolled over the hills."),
                new JudgeCandidate(UUID.randomUUID(), "Ashes", "Nothing was left but the chimney."),
                new JudgeCandidate(UUID.randomUUID(), "Glass", "She saw herself in every window."));
        String prompt = promptBuilder.judgePrompt("Strict", "Short fiction", candidates);
        LlmParameters parameters = new LlmParameters(0.3, 2000, promptBuilder.judgeSystemMessage());

        ProviderReply reply = provider.generate(prompt, "duelo-mock", parameters);
        JudgeOutput output = new JudgeResponseParser(new RankingValidator(new SubmissionTitleMatcher()), new ObjectMapper())
                .parse(reply.text(), candidates);

        assertTrue(output.parsingSuccess());
        assertEquals(4, output.votes().size());
        assertTrue(reply.promptTokens() > 0);
        assertTrue(reply.completionTokens() > 0);
    }

    @Test
    void testAnswersAreDeterministic() {
        String prompt = promptBuilder.writerPrompt("Poet", new WriterContext(UUID.randomUUID(), "Autumn", null, null));

        assertEquals(provider.generate(prompt, "duelo-mock", LlmParameters.defaults()),
                provider.generate(prompt, "duelo-mock", LlmParameters.defaults()));
    }

    @Test
    void testWriterDraftKeepsRequestedTitle() {
        String prompt = promptBuilder.writerPrompt("Poet",
                new WriterContext(UUID.randomUUID(), "Autumn", "Falling Leaves", "a red kite"));

        ProviderReply reply = provider.generate(prompt, "duelo-mock", LlmParameters.defaults());
        WriterOutput output = new WriterResponseParser().parse(reply.text(), null);

        assertTrue(output.parsingSuccess());
        assertEquals("Falling Leaves", output.title());
        assertFalse(output.content().isBlank());
    }
}
