package com.ryuqq.workbundle.application.metrics;

import com.ryuqq.workbundle.core.exception.ErrorCode;
import com.ryuqq.workbundle.core.exception.WorkBundleException;

/**
 * 메트릭 값 조회 실패.
 *
 * @author WorkBundle Team
 * @since 1.0.0
 */
public class MetricLookupException extends WorkBundleException {

    private final String metricName;

    public MetricLookupException(String metricName, String message) {
        super(ErrorCode.METRIC_LOOKUP_FAILED, message);
        this.metricName = metricName;
    }

    public String getMetricName() {
        return metricName;
    }
}
