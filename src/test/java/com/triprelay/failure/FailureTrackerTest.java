package com.triprelay.failure;

import com.triprelay.MutableClock;
import com.triprelay.domain.AttemptRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * FailureTracker unit tests
 * - Retry budget and poison decision
 * - Permanent failures
 * - Parse failure policy
 */
class FailureTrackerTest {

    private MutableClock clock;
    private FailureTracker tracker;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-03-01T10:00:00Z"));
        tracker = new FailureTracker(3, ParseFailurePolicy.COUNT_TOWARD_BUDGET, clock);
    }

    @Test
    @DisplayName("RETRY until the third failure, then POISON")
    void testRecordFailure_Budget() {
        assertThat(tracker.recordFailure("42", FailureCategory.REASONER, "timeout")).isEqualTo(FailureDecision.RETRY);
        assertThat(tracker.recordFailure("42", FailureCategory.REASONER, "timeout")).isEqualTo(FailureDecision.RETRY);
        assertThat(tracker.isExhausted("42")).isFalse();

        assertThat(tracker.recordFailure("42", FailureCategory.REASONER, "timeout")).isEqualTo(FailureDecision.POISON);
        assertThat(tracker.isExhausted("42")).isTrue();
    }

    @Test
    @DisplayName("A single allowed attempt poisons on the first failure")
    void testRecordFailure_SingleAttempt() {
        FailureTracker strict = new FailureTracker(1, ParseFailurePolicy.COUNT_TOWARD_BUDGET, clock);

        assertThat(strict.recordFailure("7", "boom")).isEqualTo(FailureDecision.POISON);
    }

    @Test
    @DisplayName("Record keeps count, time, reason and category")
    void testRecordFailure_Record() {
        tracker.recordFailure("42", FailureCategory.FETCH, "connection reset");
        clock.advance(Duration.ofMinutes(5));
        tracker.recordFailure("42", FailureCategory.SEND, "smtp down");

        AttemptRecord record = tracker.find("42").orElseThrow();
        assertThat(record.getCount()).isEqualTo(2);
        assertThat(record.getLastAttemptAt()).isEqualTo(Instant.parse("2025-03-01T10:05:00Z"));
        assertThat(record.getLastFailureReason()).isEqualTo("smtp down");
        assertThat(record.getLastCategory()).isEqualTo(FailureCategory.SEND);
    }

    @Test
    @DisplayName("find returns a copy that cannot change the tracker")
    void testFind_Copy() {
        tracker.recordFailure("42", "x");

        tracker.find("42").orElseThrow().setCount(99);

        assertThat(tracker.attempts("42")).isEqualTo(1);
    }

    @Test
    @DisplayName("Permanent failure poisons immediately")
    void testRecordPermanent() {
        assertThat(tracker.recordPermanent("9", "cannot decode")).isEqualTo(FailureDecision.POISON);
        assertThat(tracker.attempts("9")).isEqualTo(1);
    }

    @Test
    @DisplayName("Success clears the history")
    void testRecordSuccess() {
        tracker.recordFailure("42", "x");
        tracker.recordFailure("42", "x");

        tracker.recordSuccess("42");

        assertThat(tracker.attempts("42")).isZero();
        assertThat(tracker.find("42")).isEmpty();
        assertThat(tracker.recordFailure("42", "x")).isEqualTo(FailureDecision.RETRY);
    }

    @Test
    @DisplayName("Messages are tracked independently")
    void testRecordFailure_Independent() {
        tracker.recordFailure("1", "x");
        tracker.recordFailure("1", "x");
        tracker.recordFailure("2", "y");

        assertThat(tracker.trackedIds()).containsExactlyInAnyOrder("1", "2");
        assertThat(tracker.size()).isEqualTo(2);
        assertThat(tracker.recordFailure("2", "y")).isEqualTo(FailureDecision.RETRY);
    }

    @Test
    @DisplayName("POISON_ON_REPEAT: second parse failure in a row poisons")
    void testRecordFailure_PoisonOnRepeatedParse() {
        FailureTracker repeat = new FailureTracker(5, ParseFailurePolicy.POISON_ON_REPEAT, clock);

        assertThat(repeat.recordFailure("42", FailureCategory.PARSE, "no json")).isEqualTo(FailureDecision.RETRY);
        assertThat(repeat.recordFailure("42", FailureCategory.PARSE, "no json")).isEqualTo(FailureDecision.POISON);
    }

    @Test
    @DisplayName("POISON_ON_REPEAT: parse failures separated by another category keep retrying")
    void testRecordFailure_InterleavedParse() {
        FailureTracker repeat = new FailureTracker(5, ParseFailurePolicy.POISON_ON_REPEAT, clock);

        repeat.recordFailure("42", FailureCategory.PARSE, "no json");
        repeat.recordFailure("42", FailureCategory.REASONER, "timeout");

        assertThat(repeat.recordFailure("42", FailureCategory.PARSE, "no json")).isEqualTo(FailureDecision.RETRY);
    }

    @Test
    @DisplayName("COUNT_TOWARD_BUDGET: repeated parse failures use the normal budget")
    void testRecordFailure_ParseCountsTowardBudget() {
        assertThat(tracker.recordFailure("42", FailureCategory.PARSE, "no json")).isEqualTo(FailureDecision.RETRY);
        assertThat(tracker.recordFailure("42", FailureCategory.PARSE, "no json")).isEqualTo(FailureDecision.RETRY);
        assertThat(tracker.recordFailure("42", FailureCategory.PARSE, "no json")).isEqualTo(FailureDecision.POISON);
    }
}
