package io.governance.core.protocol;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Result of a successful invocation: the outbound messages to schedule, in order,
 * and the audit attributes describing what happened.
 */
public final class HandleResponse {

    public record Attribute(String key, String value) {}

    private final List<OutboundMessage> messages;
    private final List<Attribute> attributes;

    private HandleResponse(List<OutboundMessage> messages, List<Attribute> attributes) {
        this.messages = Collections.unmodifiableList(new ArrayList<>(messages));
        this.attributes = Collections.unmodifiableList(new ArrayList<>(attributes));
    }

    public static Builder builder() { return new Builder(); }

    public List<OutboundMessage> messages() { return messages; }
    public List<Attribute> attributes() { return attributes; }

    /** First attribute value recorded under {@code key}. */
    public Optional<String> attribute(String key) {
        for (Attribute a : attributes) {
            if (a.key().equals(key)) {
                return Optional.of(a.value());
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return "HandleResponse(messages=" + messages + ", attributes=" + attributes + ")";
    }

    public static final class Builder {
        private final List<OutboundMessage> messages = new ArrayList<>();
        private final List<Attribute> attributes = new ArrayList<>();

        public Builder message(OutboundMessage m) { messages.add(m); return this; }
        public Builder attribute(String key, Object value) {
            attributes.add(new Attribute(key, String.valueOf(value)));
            return this;
        }

        public HandleResponse build() {
            return new HandleResponse(messages, attributes);
        }
    }
}
