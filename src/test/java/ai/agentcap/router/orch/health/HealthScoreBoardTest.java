package ai.agentcap.router.orch.health;

import ai.agentcap.router.support.MutableClock;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class HealthScoreBoardTest {

    private final MutableClock clock = new MutableClock();

    @Test
    void tracksSuccessRateAndMeanLatency() {
        HealthScoreBoard board = new HealthScoreBoard(clock);
        board.record("cap.a", true, 100);
        board.record("cap.a", false, 300);
        board.record("cap.a", true, 200);
        board.record("cap.a", true, 400);

        HealthScore score = board.score("cap.a").orElseThrow();
        assertThat(score.totalCalls()).isEqualTo(4);
        assertThat(score.successRate()).isEqualTo(75d);
        assertThat(score.avgLatencyMs()).isCloseTo(250d, within(1e-9));
        assertThat(board.score("cap.unknown")).isEmpty();
    }

    @Test
    void evictsLeastRecentlyUpdatedWhenFull() {
        HealthScoreBoard board = new HealthScoreBoard(2, clock);
        board.record("cap.a", true, 1);
        clock.advanceMillis(10);
        board.record("cap.b", true, 1);
        clock.advanceMillis(10);
        board.record("cap.a", true, 1);
        clock.advanceMillis(10);
        board.record("cap.c", true, 1);

        assertThat(board.size()).isEqualTo(2);
        assertThat(board.score("cap.b")).isEmpty();
        assertThat(board.score("cap.a")).isPresent();
        assertThat(board.score("cap.c")).isPresent();
    }

    @Test
    void allIsOrderedByCallVolume() {
        HealthScoreBoard board = new HealthScoreBoard(clock);
        board.record("cap.b", true, 1);
        board.record("cap.c", true, 1);
        board.record("cap.c", true, 1);
        board.record("cap.a", true, 1);

        assertThat(board.all()).extracting(HealthScore::capabilityId).containsExactly("cap.c", "cap.a", "cap.b");
    }

    @Test
    void rejectsNonPositiveBound() {
        assertThatThrownBy(() -> new HealthScoreBoard(0, clock)).isInstanceOf(IllegalArgumentException.class);
    }
}
