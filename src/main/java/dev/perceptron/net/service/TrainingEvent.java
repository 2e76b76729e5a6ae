package dev.perceptron.net.service;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Notification about a training job, independent of how it is delivered.
 *
 * @param type    event kind
 * @param payload field name to value, in a stable order; values may be null
 */
public record TrainingEvent(Type type, Map<String, Object> payload) {

    public enum Type {
        TRAINING_UPDATE("training_update"),
        TRAINING_COMPLETE("training_complete"),
        TRAINING_ERROR("training_error");

        private final String eventName;

        Type(String eventName) {
            this.eventName = eventName;
        }

        public String eventName() {
            return eventName;
        }
    }

    public TrainingEvent {
        payload = Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    public Object get(String field) {
        return payload.get(field);
    }
}
