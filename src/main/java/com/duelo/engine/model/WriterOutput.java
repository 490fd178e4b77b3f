package com.duelo.engine.model;

import com.duelo.engine.AgentEngineConstants;
import org.springframework.util.StringUtils;

public record WriterOutput(String title, String content, String rawResponse, boolean parsingSuccess, String strategy) {

    public static WriterOutput unparsed(String rawResponse) {
        String raw = rawResponse != null ? rawResponse : "";
        String content = StringUtils.hasText(raw) ? raw.strip() : AgentEngineConstants.EMPTY_RESPONSE_CONTENT;
        return new WriterOutput(AgentEngineConstants.DEFAULT_TITLE, content, raw, false,
                AgentEngineConstants.STRATEGY_DEFAULT_TITLE);
    }
}
