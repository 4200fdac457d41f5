package me.golemcore.gateway.adapter.outbound.agent;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.gateway.domain.model.JsonValue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AgentStreamParserTest {

    private AgentStreamParser parser;

    @BeforeEach
    void setUp() {
        parser = new AgentStreamParser(new ObjectMapper());
    }

    // ===== parse =====

    @Test
    void shouldTakeFirstSessionIdAndLastAnswer() {
        String stream = String.join("\n",
                "{\"session_id\":\"s1\"}",
                "{\"type\":\"assistant_message\",\"role\":\"assistant\",\"text\":\"A\"}",
                "not json at all",
                "{\"type\":\"assistant_message\",\"role\":\"assistant\",\"text\":\"B\",\"session_id\":\"s2\"}");

        AgentStreamParser.StreamOutcome outcome = parser.parse(stream);

        assertEquals("s1", outcome.sessionId());
        assertEquals("B", outcome.answer());
    }

    @Test
    void shouldReadThreadStartedAndCompletedItems() {
        String stream = String.join("\r\n",
                "{\"type\":\"thread.started\",\"thread_id\":\"0199-abc\"}",
                "{\"type\":\"turn.started\"}",
                "{\"type\":\"item.completed\",\"item\":{\"type\":\"reasoning\",\"text\":\"thinking\"}}",
                "{\"type\":\"item.completed\",\"item\":{\"type\":\"agent_message\",\"text\":\"Done.\"}}",
                "{\"type\":\"turn.completed\",\"usage\":{\"input_tokens\":10}}");

        AgentStreamParser.StreamOutcome outcome = parser.parse(stream);

        assertEquals("0199-abc", outcome.sessionId());
        assertEquals("Done.", outcome.answer());
    }

    @Test
    void shouldSkipBlankMalformedAndNonObjectLines() {
        String stream = "\n   \n[1,2,3]\n\"just a string\"\n{broken\n42\n";

        AgentStreamParser.StreamOutcome outcome = parser.parse(stream);

        assertNull(outcome.answer());
        assertNull(outcome.sessionId());
    }

    @Test
    void shouldRejectLinesWithTrailingContent() {
        String stream = String.join("\n",
                "{\"type\":\"message\",\"text\":\"partial\"} garbage",
                "{\"session_id\":\"s1\"} {\"type\":\"message\",\"text\":\"second object\"}");

        AgentStreamParser.StreamOutcome outcome = parser.parse(stream);

        assertNull(outcome.answer());
        assertNull(outcome.sessionId());
    }

    @Test
    void shouldKeepWellFormedLinesAroundRejectedOnes() {
        String stream = String.join("\n",
                "{\"session_id\":\"s1\"}",
                "{\"type\":\"message\",\"text\":\"final\"}",
                "{\"type\":\"message\",\"text\":\"cut off\"} {\"type\"");

        AgentStreamParser.StreamOutcome outcome = parser.parse(stream);

        assertEquals("s1", outcome.sessionId());
        assertEquals("final", outcome.answer());
    }

    @Test
    void shouldReturnEmptyOutcomeForEmptyOutput() {
        AgentStreamParser.StreamOutcome outcome = parser.parse("");

        assertNull(outcome.answer());
        assertNull(outcome.sessionId());
        assertNull(parser.parse(null).answer());
    }

    @Test
    void shouldIgnoreNonAssistantRoles() {
        String stream = "{\"type\":\"message\",\"role\":\"user\",\"content\":\"question\"}";

        assertNull(parser.parse(stream).answer());
    }

    @Test
    void shouldReadResponseOutputText() {
        String stream = "{\"response\":{\"output_text\":[\"Hello, \",\"world\"]}}";

        assertEquals("Hello, world", parser.parse(stream).answer());
    }

    @Test
    void shouldReadNestedMessageContentParts() {
        String stream = "{\"message\":{\"content\":[{\"type\":\"output_text\",\"text\":\"part one \"},"
                + "{\"type\":\"output_text\",\"text\":\"part two\"}]}}";

        assertEquals("part one part two", parser.parse(stream).answer());
    }

    // ===== session id =====

    @Test
    void shouldReadSessionIdFromSessionObjectAndEvent() {
        assertEquals("nested", AgentStreamParser.extractSessionId(obj(Map.of(
                "session", JsonValue.object(Map.of("id", JsonValue.string("nested")))))).orElseThrow());
        assertEquals("evt", AgentStreamParser.extractSessionId(obj(Map.of(
                "type", JsonValue.string("session"), "id", JsonValue.string("evt")))).orElseThrow());
        assertEquals("77", AgentStreamParser.extractSessionId(obj(Map.of(
                "thread_id", new JsonValue.Num("77")))).orElseThrow());
    }

    @Test
    void shouldNotUseBareIdOutsideSessionEvents() {
        assertTrue(AgentStreamParser.extractSessionId(obj(Map.of(
                "type", JsonValue.string("item.completed"), "id", JsonValue.string("item_1")))).isEmpty());
    }

    @Test
    void shouldIgnoreEmptySessionId() {
        assertTrue(AgentStreamParser.extractSessionId(obj(Map.of("session_id", JsonValue.string("")))).isEmpty());
    }

    // ===== text extraction =====

    @Test
    void shouldFlattenTextByKeyPriority() {
        JsonValue value = JsonValue.sequence(List.of(
                JsonValue.string("a"),
                JsonValue.object(Map.of("value", JsonValue.string("b"))),
                new JsonValue.Bool(true),
                JsonValue.object(Map.of("other", JsonValue.string("ignored")))));

        assertEquals("ab", AgentStreamParser.extractText(value));
        assertEquals("", AgentStreamParser.extractText(JsonValue.NULL));
    }

    private static JsonValue.Obj obj(Map<String, JsonValue> fields) {
        return (JsonValue.Obj) JsonValue.object(fields);
    }
}
