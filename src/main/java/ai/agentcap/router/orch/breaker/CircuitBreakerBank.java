package ai.agentcap.router.orch.breaker;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One consecutive-failure circuit breaker per capability id.
 *
 * <ul>
 *   <li>CLOSED → OPEN after {@code failureThreshold} consecutive failures</li>
 *   <li>OPEN → HALF_OPEN lazily, at the first check after the cooldown has elapsed</li>
 *   <li>HALF_OPEN admits a single trial; success closes, failure reopens with a fresh cooldown</li>
 * </ul>
 *
 * <p>States are created on the first recorded outcome; a check for an unknown id is allowed
 * without creating anything.</p>
 */
@Slf4j
public class CircuitBreakerBank {

    private final ConcurrentHashMap<String, BreakerState> states = new ConcurrentHashMap<>();
    private final int failureThreshold;
    private final long cooldownMs;
    private final Clock clock;

    public CircuitBreakerBank(int failureThreshold, long cooldownMs, Clock clock) {
        if (failureThreshold <= 0) {
            throw new IllegalArgumentException("failureThreshold must be > 0: " + failureThreshold);
        }
        if (cooldownMs < 0) {
            throw new IllegalArgumentException("cooldownMs must be >= 0: " + cooldownMs);
        }
        this.failureThreshold = failureThreshold;
        this.cooldownMs = cooldownMs;
        this.clock = clock;
    }

    public BreakerDecision checkAllowed(String capabilityId) {
        BreakerState s = states.get(capabilityId);
        if (s == null) {
            return BreakerDecision.allow();
        }
        synchronized (s) {
            switch (s.mode) {
                case CLOSED:
                    return BreakerDecision.allow();
                case OPEN: {
                    long remaining = cooldownMs - (clock.millis() - s.lastFailureTime);
                    if (remaining <= 0) {
                        s.mode = BreakerMode.HALF_OPEN;
                        s.trialInFlight = true;
                        log.info("[breaker] {} half-open, admitting trial call", capabilityId);
                        return BreakerDecision.allow();
                    }
                    return BreakerDecision.reject(openReason(capabilityId, remaining), remaining);
                }
                case HALF_OPEN:
                default:
                    if (s.trialInFlight) {
                        return BreakerDecision.reject(
                                "Circuit breaker half-open for " + capabilityId + ". Trial call in progress", 0L);
                    }
                    s.trialInFlight = true;
                    return BreakerDecision.allow();
            }
        }
    }

    public void recordResult(String capabilityId, boolean success) {
        BreakerState s = states.computeIfAbsent(capabilityId, k -> new BreakerState());
        synchronized (s) {
            s.trialInFlight = false;
            if (success) {
                if (s.mode == BreakerMode.OPEN) {
                    // admitted before the breaker tripped; only a half-open trial may close it
                    log.debug("[breaker] {} ignoring late success while open", capabilityId);
                    return;
                }
                if (s.mode != BreakerMode.CLOSED) {
                    log.info("[breaker] {} closed after successful trial", capabilityId);
                }
                s.failures = 0;
                s.mode = BreakerMode.CLOSED;
                return;
            }
            s.failures++;
            s.lastFailureTime = clock.millis();
            if (s.mode == BreakerMode.HALF_OPEN) {
                s.mode = BreakerMode.OPEN;
                log.warn("[breaker] {} trial failed, reopened for {}ms", capabilityId, cooldownMs);
            } else if (s.mode == BreakerMode.CLOSED && s.failures >= failureThreshold) {
                s.mode = BreakerMode.OPEN;
                log.warn("[breaker] {} opened after {} consecutive failures", capabilityId, s.failures);
            }
        }
    }

    /**
     * Gives back a half-open trial slot that was granted but never dispatched.
     */
    public void release(String capabilityId) {
        BreakerState s = states.get(capabilityId);
        if (s == null) {
            return;
        }
        synchronized (s) {
            s.trialInFlight = false;
        }
    }

    public boolean reset(String capabilityId) {
        boolean existed = capabilityId != null && states.remove(capabilityId) != null;
        if (existed) {
            log.info("[breaker] {} reset", capabilityId);
        }
        return existed;
    }

    /**
     * Removes healthy breakers (closed with no failures) and stale ones whose last failure is
     * older than twice the cooldown.
     *
     * @return number of removed entries
     */
    public int cleanup() {
        long now = clock.millis();
        int before = states.size();
        states.entrySet().removeIf(e -> {
            BreakerState s = e.getValue();
            synchronized (s) {
                if (s.trialInFlight) {
                    return false;
                }
                boolean healthy = s.mode == BreakerMode.CLOSED && s.failures == 0;
                boolean stale = s.failures > 0 && now - s.lastFailureTime > 2 * cooldownMs;
                return healthy || stale;
            }
        });
        int removed = before - states.size();
        if (removed > 0) {
            log.debug("[breaker] cleanup removed {} entries", removed);
        }
        return Math.max(0, removed);
    }

    public BreakerSnapshot inspect(String capabilityId) {
        BreakerState s = states.get(capabilityId);
        if (s == null) {
            return null;
        }
        synchronized (s) {
            return s.snapshot();
        }
    }

    public Map<String, BreakerSnapshot> snapshot() {
        Map<String, BreakerSnapshot> out = new TreeMap<>();
        states.forEach((id, s) -> {
            synchronized (s) {
                out.put(id, s.snapshot());
            }
        });
        return out;
    }

    public BreakerDashboard dashboard() {
        long now = clock.millis();
        int open = 0;
        int halfOpen = 0;
        int closed = 0;
        List<BreakerDashboard.Row> rows = new ArrayList<>();
        for (Map.Entry<String, BreakerSnapshot> e : snapshot().entrySet()) {
            BreakerSnapshot s = e.getValue();
            switch (s.mode()) {
                case OPEN -> {
                    open++;
                    long retryIn = Math.max(0L, cooldownMs - (now - s.lastFailureTime()));
                    rows.add(new BreakerDashboard.Row(e.getKey(), s.mode(), s.failures(), s.lastFailureTime(), retryIn));
                }
                case HALF_OPEN -> {
                    halfOpen++;
                    rows.add(new BreakerDashboard.Row(e.getKey(), s.mode(), s.failures(), s.lastFailureTime(), null));
                }
                default -> {
                    closed++;
                    if (s.failures() > 0) {
                        rows.add(new BreakerDashboard.Row(e.getKey(), s.mode(), s.failures(), s.lastFailureTime(), null));
                    }
                }
            }
        }
        rows.sort(Comparator.comparingInt((BreakerDashboard.Row r) -> severity(r.mode()))
                .thenComparing(BreakerDashboard.Row::capabilityId));
        return new BreakerDashboard(open + halfOpen + closed, open, halfOpen, closed, rows);
    }

    public int size() {
        return states.size();
    }

    public void clear() {
        states.clear();
    }

    private static int severity(BreakerMode mode) {
        return switch (mode) {
            case OPEN -> 0;
            case HALF_OPEN -> 1;
            case CLOSED -> 2;
        };
    }

    private static String openReason(String capabilityId, long remainingMs) {
        long seconds = (long) Math.ceil(remainingMs / 1000d);
        return "Circuit breaker open for " + capabilityId + ". Too many failures. Retry after " + seconds + "s";
    }
}
