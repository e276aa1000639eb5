package ai.agentcap.router.orch.prefetch;

import ai.agentcap.router.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class DependencyLearnerTest {

    private final MutableClock clock = new MutableClock();
    private final DependencyLearner learner = new DependencyLearner(500, 30_000L, clock);

    @Test
    void learnsSuccessorsWithProbabilityAndMeanGap() {
        // price -> swap twice (gaps 1s and 3s), price -> balance once
        step("agent-1", "price", 0);
        step("agent-1", "swap", 1_000);
        step("agent-1", "price", 10_000);
        step("agent-1", "swap", 3_000);
        step("agent-1", "price", 10_000);
        step("agent-1", "balance", 2_000);

        List<Prediction> next = learner.predictNext("price", 3);

        assertThat(next).extracting(Prediction::capabilityId).containsExactly("swap", "balance");
        assertThat(next.get(0).probability()).isCloseTo(2d / 3d, within(1e-9));
        assertThat(next.get(0).avgGapMs()).isCloseTo(2_000d, within(1e-9));
        assertThat(next.get(1).probability()).isCloseTo(1d / 3d, within(1e-9));
    }

    @Test
    void ignoresRepeatsSlowFollowUpsAndOtherCallers() {
        step("agent-1", "price", 0);
        step("agent-1", "price", 100);
        step("agent-1", "swap", 30_000);
        step("agent-2", "balance", 10);

        assertThat(learner.predictNext("price", 3)).isEmpty();
        assertThat(learner.predictNext("swap", 3)).isEmpty();
    }

    @Test
    void topNLimitsResults() {
        String[] successors = {"a", "b", "c", "d"};
        for (String s : successors) {
            step("agent", "root", 40_000);
            step("agent", s, 10);
        }
        assertThat(learner.predictNext("root", 3)).hasSize(3);
        assertThat(learner.predictNext("root", 0)).isEmpty();
        assertThat(learner.predictNext("unknown", 3)).isEmpty();
    }

    private void step(String caller, String capability, long afterMs) {
        clock.advance(Duration.ofMillis(afterMs));
        learner.observe(caller, capability);
    }
}
