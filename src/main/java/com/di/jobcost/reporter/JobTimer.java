package com.di.jobcost.reporter;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Start time of a job, held by the caller and passed to the reporter when the job ends.
 *
 * <pre>{@code
 * JobTimer timer = JobTimer.start();
 * runJob();
 * costReporter.reportJobCost(customerId, usage, timer, true);
 * }</pre>
 */
public final class JobTimer {

    private final Clock clock;
    private final Instant startedAt;

    private JobTimer(Clock clock, Instant startedAt) {
        this.clock = clock;
        this.startedAt = startedAt;
    }

    public static JobTimer start() {
        return start(Clock.systemUTC());
    }

    public static JobTimer start(Clock clock) {
        return new JobTimer(clock, clock.instant());
    }

    /** A timer that began at a known instant (e.g. the job's recorded start time). */
    public static JobTimer startedAt(Instant startedAt, Clock clock) {
        return new JobTimer(clock, startedAt);
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    /** Seconds since start; never negative, even if the clock moved backwards. */
    public double elapsedSeconds() {
        Duration elapsed = Duration.between(startedAt, clock.instant());
        return elapsed.isNegative() ? 0.0 : elapsed.toMillis() / 1000.0;
    }
}
