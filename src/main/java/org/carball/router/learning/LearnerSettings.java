package org.carball.router.learning;

import lombok.Builder;
import lombok.Value;
import org.carball.router.config.RouterConfig;

/**
 * Tuning of the adaptive learner.
 */
@Value
@Builder
public class LearnerSettings {
    @Builder.Default
    int batchSize = 20;
    @Builder.Default
    long flushIntervalMs = 60_000;
    @Builder.Default
    double smoothingWeight = 0.1;
    @Builder.Default
    double clampMin = 0.5;
    @Builder.Default
    double clampMax = 2.0;
    @Builder.Default
    double coefficientFloor = 1e-6;
    @Builder.Default
    double costUnitMillis = 1000.0;
    @Builder.Default
    int queueCapacity = 10_000;

    public static LearnerSettings from(RouterConfig config) {
        return LearnerSettings.builder()
                .batchSize(config.getLearnerBatchSize())
                .flushIntervalMs(config.getLearnerFlushIntervalMs())
                .smoothingWeight(config.getLearnerSmoothingWeight())
                .clampMin(config.getLearnerClampMin())
                .clampMax(config.getLearnerClampMax())
                .coefficientFloor(config.getCoefficientFloor())
                .costUnitMillis(config.getCostUnitMillis())
                .queueCapacity(config.getLearnerQueueCapacity())
                .build();
    }
}
