package com.duelo.engine.provider;

import com.duelo.engine.cost.TokenCounter;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.zip.CRC32;

/**
 * Deterministic provider for local runs and tests. Judge prompts get a well-formed ranking of
 * every listed text, anything else gets a titled draft.
 */
@Component
@ConditionalOnProperty(prefix = "engine.provider", name = "mock-enabled", havingValue = "true")
public class MockLlmProvider implements LlmProvider {

    private static final String TEXTS_SECTION = "Texts to Judge:";
    private static final String TEXT_PREFIX = "Text: ";

    private final TokenCounter tokenCounter;

    public MockLlmProvider(TokenCounter tokenCounter) {
        this.tokenCounter = tokenCounter;
    }

    @Override
    public ProviderType type() {
        return ProviderType.MOCK;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public ProviderReply generate(String prompt, String model, LlmParameters parameters) {
        String text = prompt.contains(TEXTS_SECTION) ? ranking(prompt) : draft(prompt);
        String systemMessage = parameters.systemMessage() != null ? parameters.systemMessage() : "";
        return new ProviderReply(text,
                tokenCounter.count(systemMessage) + tokenCounter.count(prompt),
                tokenCounter.count(text));
    }

    private static String ranking(String prompt) {
        List<String> titles = new ArrayList<>();
        String section = prompt.substring(prompt.indexOf(TEXTS_SECTION) + TEXTS_SECTION.length());
        for (String line : section.split("\n")) {
            if (line.startsWith(TEXT_PREFIX)) {
                titles.add(line.substring(TEXT_PREFIX.length()).trim());
            }
        }
        titles.sort(Comparator.comparingLong((String title) -> checksum(prompt + "|" + title)).thenComparing(title -> title));
        StringBuilder out = new StringBuilder();
        for (int i = 0; i < titles.size(); i++) {
            if (i > 0) {
                out.append("\n\n");
            }
            out.append(i + 1).append(". ").append(titles.get(i)).append('\n');
            out.append("   Commentary: Mock ranking position ").append(i + 1).append(" of ").append(titles.size()).append('.');
        }
        return out.toString();
    }

    private static String draft(String prompt) {
        String title = null;
        int guidance = prompt.indexOf("User Guidance:");
        if (guidance >= 0) {
            for (String line : prompt.substring(guidance).split("\n")) {
                if (line.startsWith("Title: ")) {
                    title = line.substring("Title: ".length()).trim();
                    break;
                }
            }
        }
        long seed = checksum(prompt);
        if (title == null || title.isEmpty()) {
            title = "Mock Draft " + Long.toHexString(seed);
        }
        return "Title: " + title + "\n"
                + "Text: This deterministic draft was produced without contacting a model (seed "
                + seed + "). Use it for local runs only.";
    }

    private static long checksum(String value) {
        CRC32 crc = new CRC32();
        crc.update(value.getBytes(StandardCharsets.UTF_8));
        return crc.getValue();
    }
}
