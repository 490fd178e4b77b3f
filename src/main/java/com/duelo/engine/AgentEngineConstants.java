package com.duelo.engine;

public final class AgentEngineConstants {

    private AgentEngineConstants() {
        // Private constructor to prevent instantiation
    }

    // Ledger references
    public static final String RELATED_ENTITY_EXECUTION = "agent_execution";

    // Execution failure messages
    public static final String CANCELLED_MESSAGE = "cancelled";
    public static final String PROVIDER_FAILED_MESSAGE = "Provider call failed: ";

    // Writer parsing
    public static final String DEFAULT_TITLE = "Untitled";
    public static final String EMPTY_RESPONSE_CONTENT = "(The model returned no text.)";
    public static final int MAX_TITLE_LENGTH = 200;
    public static final int MAX_FIRST_LINE_TITLE_LENGTH = 100;
    public static final int MIN_CONTENT_LENGTH = 10;
    public static final int SYNTHESIZED_TITLE_WORDS = 6;

    // Judge parsing
    public static final int PLACED_RANKS = 3;

    // Parsing strategy names
    public static final String STRATEGY_TITLE_TEXT_MARKERS = "title-text-markers";
    public static final String STRATEGY_FIRST_LINE_TITLE = "first-line-title";
    public static final String STRATEGY_CALLER_TITLE = "caller-title";
    public static final String STRATEGY_SYNTHESIZED_TITLE = "synthesized-title";
    public static final String STRATEGY_DEFAULT_TITLE = "default-title";
    public static final String STRATEGY_NUMBERED_COMMENTARY = "numbered-commentary";
    public static final String STRATEGY_NUMBERED_LINES = "numbered-lines";
    public static final String STRATEGY_JSON_RANKING = "json-ranking";

    // Prompt placeholders
    public static final String NONE_PROVIDED = "(None provided)";

    public static final String WRITER_BASE_PROMPT = """
            You are a creative writer taking part in a writing contest.
            Write an original, well-structured and engaging text that fits the contest theme and honours any guidance from the user.

            You receive, in this order:
            1. These base instructions.
            2. A personality prompt describing your voice and style.
            3. The contest description.
            4. Optional user guidance: a preferred title and/or elements the text must include.

            When the guidance gives no title, invent a fitting one.

            Answer in exactly this format and nothing else:

            Title: <the title>
            Text: <the full text>

            Example:
            Title: The Lighthouse Keeper's Last Night
            Text: The lamp had burned for ninety years...
            """;

    public static final String JUDGE_BASE_PROMPT = """
            You are a judge in a writing contest.
            Read every submitted text carefully, then rank all of them from best to worst and justify each position with a short commentary.

            Your answer MUST use exactly this format:
            1. <Title of the best text>
               Commentary: <concise, specific commentary>

            2. <Title of the second text>
               Commentary: <concise, specific commentary>

            3. <Title of the third text>
               Commentary: <concise, specific commentary>
            ...
            (continue until every text is ranked)

            Rank every text exactly once and copy each title exactly as given.
            Do not award scores or points.
            Judge overall quality, creativity and fit with the contest description, applying the criteria of your personality prompt.
            You will not see who wrote the texts.
            """;

    public static final String JUDGE_SYSTEM_MESSAGE =
            "You are a professional judge for writing contests. Always follow the exact output format specified in the prompt.";

    public static final String JUDGE_CLOSING_INSTRUCTION =
            "Remember: follow the exact ranking format above, rank every text once and give each a commentary.";

    public static final String WRITER_CLOSING_INSTRUCTION = "Your text:";
}
