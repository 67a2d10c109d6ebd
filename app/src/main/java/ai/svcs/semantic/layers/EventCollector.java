package ai.svcs.semantic.layers;

import ai.svcs.semantic.EventType;
import ai.svcs.semantic.SemanticEvent;
import java.util.ArrayList;
import java.util.List;

/** Accumulates the rule events of one node, all sharing its id and location. */
public final class EventCollector {
    private final String nodeId;
    private final String location;
    private final List<SemanticEvent> events = new ArrayList<>();

    EventCollector(String nodeId, String location) {
        this.nodeId = nodeId;
        this.location = location;
    }

    public void emit(EventType type, String details) {
        events.add(SemanticEvent.rule(type, nodeId, location, details));
    }

    List<SemanticEvent> events() {
        return events;
    }
}
