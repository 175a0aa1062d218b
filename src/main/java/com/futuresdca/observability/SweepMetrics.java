package com.futuresdca.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import org.springframework.stereotype.Component;

/**
 * Micrometer meters for the parameter sweep:
 * <ul>
 *   <li><b>sweep.duration</b> (timer): wall time of a full sweep including ranking</li>
 *   <li><b>sweep.candidates.evaluated</b> (counter): candidates that produced metrics</li>
 *   <li><b>sweep.candidates.failed</b> (counter): candidates whose simulation threw</li>
 *   <li><b>sweep.candidates.skipped</b> (counter): candidates dropped by the sweep deadline</li>
 * </ul>
 */
@Component
public class SweepMetrics {

    private final Timer sweepTimer;
    private final Counter evaluatedCounter;
    private final Counter failedCounter;
    private final Counter skippedCounter;

    public SweepMetrics(MeterRegistry meterRegistry) {
        this.sweepTimer = Timer.builder("sweep.duration")
                .description("Wall time of a weekly-amount parameter sweep")
                .publishPercentiles(0.5, 0.95)
                .register(meterRegistry);

        this.evaluatedCounter = Counter.builder("sweep.candidates.evaluated")
                .description("Sweep candidates simulated successfully")
                .register(meterRegistry);

        this.failedCounter = Counter.builder("sweep.candidates.failed")
                .description("Sweep candidates whose simulation failed")
                .register(meterRegistry);

        this.skippedCounter = Counter.builder("sweep.candidates.skipped")
                .description("Sweep candidates not started before the sweep deadline")
                .register(meterRegistry);
    }

    public void recordSweep(Duration elapsed, int evaluated, int failed, int skipped) {
        sweepTimer.record(elapsed);
        evaluatedCounter.increment(evaluated);
        failedCounter.increment(failed);
        skippedCounter.increment(skipped);
    }
}
