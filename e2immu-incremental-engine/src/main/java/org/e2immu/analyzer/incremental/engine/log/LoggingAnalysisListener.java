package org.e2immu.analyzer.incremental.engine.log;

import org.e2immu.analyzer.incremental.engine.scope.EnvironmentRecord;
import org.e2immu.analyzer.incremental.engine.unit.AnalysisUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;

public class LoggingAnalysisListener implements AnalysisListener {
    private static final Logger LOGGER = LoggerFactory.getLogger(LoggingAnalysisListener.class);

    private final long slowNanos;

    public LoggingAnalysisListener(long slowUnitThresholdMillis) {
        this.slowNanos = TimeUnit.MILLISECONDS.toNanos(slowUnitThresholdMillis);
    }

    @Override
    public void enqueued(AnalysisUnit unit, int queueSize) {
        LOGGER.debug("Enqueue {}, queue size {}", unit, queueSize);
    }

    @Override
    public void dequeued(AnalysisUnit unit, int queueSize) {
        LOGGER.debug("Dequeue {}, queue size {}", unit, queueSize);
    }

    @Override
    public void unitAnalyzed(AnalysisUnit unit, long nanos) {
        long mean = unit.analysisCount() == 0 ? nanos : unit.analysisNanos() / unit.analysisCount();
        if (nanos >= slowNanos) {
            LOGGER.warn("Slow analysis of {}: {} ms", unit.fullName(), TimeUnit.NANOSECONDS.toMillis(nanos));
        } else if (mean >= slowNanos) {
            LOGGER.warn("Slow analysis of {}: mean {} ms over {} passes", unit.fullName(),
                    TimeUnit.NANOSECONDS.toMillis(mean), unit.analysisCount());
        } else {
            LOGGER.debug("Analyzed {} in {} us", unit, TimeUnit.NANOSECONDS.toMicros(nanos));
        }
    }

    @Override
    public void variableRemoved(EnvironmentRecord scope, String name) {
        LOGGER.debug("Removed variable {} from {}", name, scope);
    }
}
