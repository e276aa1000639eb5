package ai.agentcap.router.model;

import lombok.Builder;

import java.util.List;

/**
 * Caller hints for execution. The router never interprets these; they are
 * handed to the selected executor as part of the {@link ExecutionContext}.
 */
@Builder
public record ExecutionPreferences(Double maxCost,
                                   boolean privacyRequired,
                                   boolean latencyPriority,
                                   List<String> preferredProviders,
                                   Integer privacyLevel,
                                   ExecutionMode executionMode) {

    public ExecutionPreferences {
        preferredProviders = preferredProviders == null ? List.of() : List.copyOf(preferredProviders);
    }
}
