package io.agentmesh.dispatch;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * @param agentId    agent that produced the answer, null for direct and orchestrated routes
 * @param workflowId set only for {@link Route#ORCHESTRATED}
 * @param error      true when {@code response} describes a failure
 */
public record DispatchResult(Route route, String agentId, String response, String workflowId, boolean error) {

    public enum Route {
        DIRECT("direct"),
        DELEGATED("delegated"),
        FALLBACK("fallback"),
        ORCHESTRATED("orchestrated");

        private final String wire;

        Route(String wire) {
            this.wire = wire;
        }

        @JsonValue
        public String wire() {
            return wire;
        }

        @JsonCreator
        public static Route fromString(String raw) {
            for (Route value : values()) {
                if (value.name().equalsIgnoreCase(raw) || value.wire.equalsIgnoreCase(raw)) {
                    return value;
                }
            }
            throw new IllegalArgumentException("Unknown route: " + raw);
        }
    }
}
