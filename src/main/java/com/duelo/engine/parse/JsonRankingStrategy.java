package com.duelo.engine.parse;

import com.duelo.engine.AgentEngineConstants;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * A JSON array of {@code {rank, title, commentary}} objects, bare or under a {@code rankings} key,
 * possibly wrapped in prose or a code fence.
 */
@Slf4j
class JsonRankingStrategy extends RankingStrategy {

    private final ObjectMapper objectMapper;

    JsonRankingStrategy(RankingValidator validator, ObjectMapper objectMapper) {
        super(validator);
        this.objectMapper = objectMapper;
    }

    @Override
    public String name() {
        return AgentEngineConstants.STRATEGY_JSON_RANKING;
    }

    @Override
    protected List<RankedEntry> extract(String raw) {
        String json = extractJson(raw);
        if (json == null) {
            return List.of();
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (Exception ex) {
            log.debug("Judge answer holds no valid JSON: {}", ex.getMessage());
            return List.of();
        }
        JsonNode items = root.isArray() ? root : firstArray(root, "rankings", "ranking", "results");
        if (items == null) {
            return List.of();
        }
        List<RankedEntry> entries = new ArrayList<>();
        int position = 0;
        for (JsonNode item : items) {
            position++;
            String title = text(item, "title");
            if (title == null) {
                continue;
            }
            JsonNode rank = item.has("rank") ? item.get("rank") : item.get("position");
            int value = rank != null && rank.canConvertToInt() ? rank.asInt() : position;
            String commentary = text(item, "commentary");
            entries.add(new RankedEntry(value, title, commentary != null ? commentary : nullToEmpty(text(item, "comment"))));
        }
        return entries;
    }

    private static String extractJson(String raw) {
        String trimmed = raw.trim();
        int firstBracket = trimmed.indexOf('[');
        int firstBrace = trimmed.indexOf('{');
        if (firstBracket < 0 && firstBrace < 0) {
            return null;
        }
        boolean array = firstBracket >= 0 && (firstBrace < 0 || firstBracket < firstBrace);
        int start = array ? firstBracket : firstBrace;
        int end = trimmed.lastIndexOf(array ? ']' : '}');
        return end > start ? trimmed.substring(start, end + 1) : null;
    }

    private static JsonNode firstArray(JsonNode root, String... names) {
        for (String name : names) {
            JsonNode node = root.get(name);
            if (node != null && node.isArray()) {
                return node;
            }
        }
        return null;
    }

    private static String text(JsonNode item, String field) {
        JsonNode node = item.get(field);
        return node != null && !node.isNull() ? node.asText().trim() : null;
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
