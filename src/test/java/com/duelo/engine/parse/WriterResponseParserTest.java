package com.duelo.engine.parse;

import com.duelo.engine.AgentEngineConstants;
import com.duelo.engine.model.WriterOutput;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class WriterResponseParserTest {

    private final WriterResponseParser parser = new WriterResponseParser();

    @Test
    void testTitleAndTextMarkers() {
        WriterOutput output = parser.parse("Title: The Sea\nText: Once upon a time the tide went out.", null);

        assertTrue(output.parsingSuccess());
        assertEquals("The Sea", output.title());
        assertEquals("Once upon a time the tide went out.", output.content());
        assertEquals(AgentEngineConstants.STRATEGY_TITLE_TEXT_MARKERS, output.strategy());
    }

    @Test
    void testMarkdownDecoratedMarkers() {
        String raw = "Here you go!\n\n**Title:** \"Salt and Iron\"\n**Text:** The harbour woke before the gulls did.";

        WriterOutput output = parser.parse(raw, null);

        assertTrue(output.parsingSuccess());
        assertEquals("Salt and Iron", output.title());
        assertEquals("The harbour woke before the gulls did.", output.content());
    }

    @Test
    void testMultilineTextIsKept() {
        WriterOutput output = parser.parse("Title: Poem\nText: Line one of the poem\nLine two\n\nStanza two", null);

        assertTrue(output.parsingSuccess());
        assertEquals("Line one of the poem\nLine two\n\nStanza two", output.content());
    }

    @Test
    void testFirstLineFallback() {
        WriterOutput output = parser.parse("The Sea\nOnce upon a time the tide went out.", "Ignored hint");

        assertFalse(output.parsingSuccess());
        assertEquals("The Sea", output.title());
        assertEquals("Once upon a time the tide went out.", output.content());
        assertEquals(AgentEngineConstants.STRATEGY_FIRST_LINE_TITLE, output.strategy());
    }

    @Test
    void testShortTextAfterMarkersDegradesToFirstLine() {
        WriterOutput output = parser.parse("Title: Haiku\nText: Short.", null);

        assertFalse(output.parsingSuccess());
        assertEquals("Haiku", output.title());
        assertEquals("Short.", output.content());
    }

    @Test
    void testCallerTitleFallback() {
        String raw = "It was a dark and stormy night. The ship creaked.";

        WriterOutput output = parser.parse(raw, "Storm");

        assertFalse(output.parsingSuccess());
        assertEquals("Storm", output.title());
        assertEquals(raw, output.content());
        assertEquals(AgentEngineConstants.STRATEGY_CALLER_TITLE, output.strategy());
    }

    @Test
    void testSentenceFirstLineIsNotATitle() {
        String raw = "It was a dark and stormy night.\nThe ship creaked under the weight of the waves.";

        WriterOutput output = parser.parse(raw, null);

        assertEquals(AgentEngineConstants.STRATEGY_SYNTHESIZED_TITLE, output.strategy());
        assertEquals("It was a dark and stormy...", output.title());
        assertEquals(raw, output.content());
    }

    @Test
    void testEmptyAnswerStillProducesContent() {
        WriterOutput output = parser.parse("   ", null);

        assertFalse(output.parsingSuccess());
        assertEquals(AgentEngineConstants.DEFAULT_TITLE, output.title());
        assertEquals(AgentEngineConstants.EMPTY_RESPONSE_CONTENT, output.content());
        assertEquals(AgentEngineConstants.STRATEGY_DEFAULT_TITLE, output.strategy());
    }

    @Test
    void testNullAnswer() {
        WriterOutput output = parser.parse(null, "Hint");

        assertEquals(AgentEngineConstants.DEFAULT_TITLE, output.title());
        assertFalse(output.content().isEmpty());
        assertEquals("", output.rawResponse());
    }

    @Test
    void testMarkerTitleIsRejected() {
        WriterOutput output = parser.parse("Title: Text: nothing here\nText: A body that is long enough.", null);

        assertFalse(output.parsingSuccess());
        assertNotEquals("Text: nothing here", output.title());
    }

    @Test
    void testRawResponseIsPreserved() {
        String raw = "Title: X\nText: Something long enough to count.";

        assertEquals(raw, parser.parse(raw, null).rawResponse());
    }
}
