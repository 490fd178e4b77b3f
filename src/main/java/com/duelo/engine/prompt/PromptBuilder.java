package com.duelo.engine.prompt;

import com.duelo.engine.AgentEngineConstants;
import com.duelo.engine.model.JudgeCandidate;
import com.duelo.engine.model.WriterContext;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Assembles the exact text sent to the model. Output depends only on the arguments.
 */
@Component
public class PromptBuilder {

    private static final Pattern EXCESS_BLANK_LINES = Pattern.compile("\\n\\s*\\n\\s*\\n");
    private static final Pattern HORIZONTAL_WHITESPACE = Pattern.compile("[ \\t]+");

    public String writerPrompt(String personality, WriterContext context) {
        StringBuilder prompt = new StringBuilder();
        prompt.append(AgentEngineConstants.WRITER_BASE_PROMPT).append('\n');
        prompt.append("Personality Prompt:\n").append(orNone(personality)).append("\n\n");
        prompt.append("Contest Description:\n").append(orNone(context.contestDescription())).append("\n\n");
        prompt.append("User Guidance:\n");
        if (!StringUtils.hasText(context.titleHint()) && !StringUtils.hasText(context.guidance())) {
            prompt.append(AgentEngineConstants.NONE_PROVIDED).append('\n');
        } else {
            if (StringUtils.hasText(context.titleHint())) {
                prompt.append("Title: ").append(context.titleHint().trim()).append('\n');
            }
            if (StringUtils.hasText(context.guidance())) {
                prompt.append("Elements to include: ").append(context.guidance().trim()).append('\n');
            }
        }
        prompt.append('\n').append(AgentEngineConstants.WRITER_CLOSING_INSTRUCTION);
        return prompt.toString();
    }

    public String judgePrompt(String personality, @Nullable String contestDescription, List<JudgeCandidate> candidates) {
        StringBuilder prompt = new StringBuilder();
        prompt.append(AgentEngineConstants.JUDGE_BASE_PROMPT).append('\n');
        prompt.append("Personality Instructions:\n").append(orNone(personality)).append("\n\n");
        prompt.append("Judging Context:\nContest Description:\n").append(orNone(contestDescription)).append("\n\n");
        prompt.append("Texts to Judge:\n");
        for (int i = 0; i < candidates.size(); i++) {
            JudgeCandidate candidate = candidates.get(i);
            String title = StringUtils.hasText(candidate.title()) ? candidate.title().trim() : "Text " + (i + 1);
            if (i > 0) {
                prompt.append("\n\n");
            }
            prompt.append("Text: ").append(title).append('\n');
            prompt.append("Content:\n").append(normalizeWhitespace(candidate.content()));
        }
        prompt.append("\n\n").append(AgentEngineConstants.JUDGE_CLOSING_INSTRUCTION);
        return prompt.toString();
    }

    public String judgeSystemMessage() {
        return AgentEngineConstants.JUDGE_SYSTEM_MESSAGE;
    }

    static String normalizeWhitespace(@Nullable String content) {
        if (content == null || content.isEmpty()) {
            return "";
        }
        String cleaned = EXCESS_BLANK_LINES.matcher(content).replaceAll("\n\n");
        cleaned = HORIZONTAL_WHITESPACE.matcher(cleaned).replaceAll(" ");
        return cleaned.strip();
    }

    private static String orNone(@Nullable String value) {
        return StringUtils.hasText(value) ? value.trim() : AgentEngineConstants.NONE_PROVIDED;
    }
}
