package ai.agentcap.router.orch.schedule;

import ai.agentcap.router.model.Priority;

import java.util.Map;

/**
 * @param escalationCandidates queued requests that have waited past their escalation threshold
 */
public record QueueStats(int queued,
                         int active,
                         int maxConcurrent,
                         Map<Priority, Integer> byPriority,
                         int escalationCandidates) {

    public QueueStats {
        byPriority = Map.copyOf(byPriority);
    }
}
