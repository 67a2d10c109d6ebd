package ai.svcs.semantic;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.core.JsonProcessingException;
import java.util.List;
import org.junit.jupiter.api.Test;

class EventJsonTest {

    @Test
    void writesWireNamesInContractOrder() {
        var event = SemanticEvent.rule(EventType.NODE_ADDED, "func:helper", "pkg/a.py:5", "New func added");

        assertEquals(
                "{\"event_type\":\"node_added\",\"node_id\":\"func:helper\",\"location\":\"pkg/a.py:5\","
                        + "\"layer\":\"1\",\"confidence\":1.0,\"details\":\"New func added\","
                        + "\"reasoning\":null,\"impact\":null}",
                EventJson.toJson(event));
    }

    @Test
    void patternEventsCarryReasoningAndLayerLabel() throws JsonProcessingException {
        var event = new SemanticEvent(
                EventType.REFACTORING_EXTRACT_METHOD,
                "func:parse_header",
                "pkg/a.py:12",
                Layer.PATTERN,
                0.75,
                "Extracted parse_header from parse",
                "new function shares body lines with parse",
                "medium");

        var json = EventJson.toJson(List.of(event), true);
        assertTrue(json.contains("\"layer\" : \"5a\""), json);

        var back = EventJson.fromJson(json);
        assertEquals(List.of(event), back);
    }

    @Test
    void deterministicEventsAlwaysHaveFullConfidence() {
        var event = new SemanticEvent(
                EventType.SIGNATURE_CHANGED, "func:f", "a.py:1", Layer.SYNTACTIC, 0.2, "d", "why", "high");

        assertEquals(1.0, event.confidence());
        assertNull(event.reasoning());
        assertNull(event.impact());
    }

    @Test
    void heuristicConfidenceIsClamped() {
        var high = new SemanticEvent(EventType.API_ENHANCEMENT, "func:f", "a.py:1", Layer.PATTERN, 3.0, "d", null, null);
        var nan = new SemanticEvent(
                EventType.REFACTORING, "module:a.py", "a.py", Layer.INTERPRETIVE, Double.NaN, "d", null, null);

        assertEquals(1.0, high.confidence());
        assertEquals(0.0, nan.confidence());
    }

    @Test
    void eventsMustComeFromAnAllowedLayer() {
        assertThrows(
                IllegalArgumentException.class,
                () -> new SemanticEvent(EventType.NODE_ADDED, "func:f", "a.py:1", Layer.SEMANTIC, 1.0, "d", null, null));
        assertThrows(
                IllegalArgumentException.class,
                () -> new SemanticEvent(EventType.REFACTORING, "func:f", "a.py:1", Layer.PATTERN, 0.9, "d", null, null));
        assertThrows(
                IllegalArgumentException.class,
                () -> new SemanticEvent(
                        EventType.NODE_ADDED, "func:f", "a.py:1", Layer.INTERPRETIVE, 0.9, "d", null, null));
    }

    @Test
    void wireNamesResolveBothWays() {
        assertEquals(EventType.API_BREAKING_CHANGE, EventType.fromWireName(" API_breaking_change ").orElseThrow());
        assertTrue(EventType.fromWireName("nope").isEmpty());
        assertEquals(Layer.PATTERN, Layer.fromLabel("5A").orElseThrow());
    }
}
