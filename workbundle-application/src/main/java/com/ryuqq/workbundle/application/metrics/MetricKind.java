package com.ryuqq.workbundle.application.metrics;

import io.micrometer.core.instrument.Meter;

/**
 * 조회 대상 메트릭 종류.
 *
 * <p>Micrometer {@link Meter.Type}과의 대응:</p>
 * <ul>
 *   <li>COUNTER → COUNTER</li>
 *   <li>GAUGE → GAUGE</li>
 *   <li>TIMER, DISTRIBUTION_SUMMARY → HISTOGRAM</li>
 *   <li>LONG_TASK_TIMER → SUMMARY</li>
 *   <li>OTHER → UNTYPED</li>
 * </ul>
 *
 * @author WorkBundle Team
 * @since 1.0.0
 */
public enum MetricKind {

    COUNTER,
    GAUGE,
    HISTOGRAM,
    SUMMARY,
    UNTYPED;

    /**
     * Micrometer Meter 종류로부터 변환.
     *
     * @param type Meter 종류
     * @return MetricKind
     */
    public static MetricKind of(Meter.Type type) {
        switch (type) {
            case COUNTER:
                return COUNTER;
            case GAUGE:
                return GAUGE;
            case TIMER:
            case DISTRIBUTION_SUMMARY:
                return HISTOGRAM;
            case LONG_TASK_TIMER:
                return SUMMARY;
            default:
                return UNTYPED;
        }
    }
}
