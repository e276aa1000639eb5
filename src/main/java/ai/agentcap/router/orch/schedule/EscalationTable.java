package ai.agentcap.router.orch.schedule;

import ai.agentcap.router.model.Priority;

import java.util.EnumMap;
import java.util.Map;

/**
 * Wait-time based priority escalation. Advisory: the scheduler reports which queued requests
 * have waited long enough to deserve a higher priority but never reorders the live queue.
 */
public final class EscalationTable {

    public record Rule(Priority from, Priority to, long afterMs) {
    }

    private final Map<Priority, Rule> rules = new EnumMap<>(Priority.class);

    public EscalationTable(Rule... rules) {
        for (Rule r : rules) {
            this.rules.put(r.from(), r);
        }
    }

    /** low→normal after 5s, normal→high after 10s, high→critical after 15s. */
    public static EscalationTable defaults() {
        return new EscalationTable(
                new Rule(Priority.LOW, Priority.NORMAL, 5_000L),
                new Rule(Priority.NORMAL, Priority.HIGH, 10_000L),
                new Rule(Priority.HIGH, Priority.CRITICAL, 15_000L));
    }

    /**
     * Priority a request at {@code priority} deserves after waiting {@code waitMs}. One step at most.
     */
    public Priority escalate(Priority priority, long waitMs) {
        Rule r = rules.get(priority);
        if (r != null && waitMs >= r.afterMs()) {
            return r.to();
        }
        return priority;
    }
}
