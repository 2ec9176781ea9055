package tech.noetzold.trust_engine_api.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Comparator;

/**
 * Identity of a per-framework control, rendered as {@code framework:controlId}.
 */
public record ControlRef(String frameworkId, String controlId) implements Comparable<ControlRef> {

    private static final Comparator<ControlRef> ORDER = Comparator
            .comparing(ControlRef::frameworkId)
            .thenComparing(ControlRef::controlId);

    public ControlRef {
        if (frameworkId == null || frameworkId.isBlank() || controlId == null || controlId.isBlank()) {
            throw new IllegalArgumentException("frameworkId and controlId are required");
        }
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static ControlRef parse(String raw) {
        if (raw == null) {
            throw new IllegalArgumentException("control reference is null");
        }
        int idx = raw.indexOf(':');
        if (idx <= 0 || idx == raw.length() - 1) {
            throw new IllegalArgumentException("control reference must look like framework:controlId, got " + raw);
        }
        return new ControlRef(raw.substring(0, idx).trim(), raw.substring(idx + 1).trim());
    }

    @JsonValue
    @Override
    public String toString() {
        return frameworkId + ":" + controlId;
    }

    @Override
    public int compareTo(ControlRef other) {
        return ORDER.compare(this, other);
    }
}
