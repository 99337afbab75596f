package com.ryuqq.workbundle.application.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.List;
import java.util.stream.Collectors;

/**
 * MeterRegistry에서 단일 메트릭 값을 조회.
 *
 * <p>이름으로 Meter를 선형 탐색한 뒤 종류를 확인하고 값을 반환합니다.
 * convergence 엔진과는 무관한 보조 유틸리티이며, 주로 테스트에서 사용합니다.</p>
 *
 * <p><strong>반환 값:</strong></p>
 * <ul>
 *   <li>COUNTER: 누적 카운트</li>
 *   <li>GAUGE: 현재 값</li>
 *   <li>HISTOGRAM: 샘플 수 (합계가 아님)</li>
 *   <li>SUMMARY, UNTYPED: 아직 지원하지 않음</li>
 * </ul>
 *
 * <p><strong>실패 조건 ({@link MetricLookupException}):</strong></p>
 * <ul>
 *   <li>레지스트리가 비어 있음</li>
 *   <li>이름에 해당하는 Meter가 없음</li>
 *   <li>요청한 종류와 실제 종류가 다름</li>
 *   <li>같은 이름의 Meter가 둘 이상 (태그만 다른 경우 포함)</li>
 * </ul>
 *
 * @author WorkBundle Team
 * @since 1.0.0
 */
public final class MetricValueReader {

    private final MeterRegistry registry;

    /**
     * 생성자.
     *
     * @param registry 조회할 레지스트리
     * @throws IllegalArgumentException registry가 null인 경우
     */
    public MetricValueReader(MeterRegistry registry) {
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        this.registry = registry;
    }

    /**
     * 단일 메트릭 값 조회.
     *
     * @param name 메트릭 이름
     * @param kind 기대하는 메트릭 종류
     * @return 메트릭 값
     * @throws MetricLookupException 조회 실패 시
     */
    public double getValue(String name, MetricKind kind) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }

        List<Meter> meters = registry.getMeters();
        if (meters.isEmpty()) {
            throw new MetricLookupException(name, "Registry contains no meters");
        }

        List<Meter> matching = meters.stream()
            .filter(meter -> meter.getId().getName().equals(name))
            .collect(Collectors.toList());
        if (matching.isEmpty()) {
            throw new MetricLookupException(name, "Could not find metric with name " + name);
        }

        MetricKind actual = MetricKind.of(matching.get(0).getId().getType());
        if (actual != kind) {
            throw new MetricLookupException(name,
                "Invalid metric kind for " + name + ": wanted " + kind + ", got " + actual);
        }
        if (matching.size() != 1) {
            throw new MetricLookupException(name,
                "Only a single meter per name is supported, found " + matching.size() + " for " + name);
        }

        if (kind == MetricKind.SUMMARY || kind == MetricKind.UNTYPED) {
            throw unsupported(name, kind);
        }
        return valueOf(matching.get(0), name, kind);
    }

    private static double valueOf(Meter meter, String name, MetricKind kind) {
        return meter.<Double>match(
            Gauge::value,
            Counter::count,
            timer -> (double) timer.count(),
            summary -> (double) summary.count(),
            longTaskTimer -> {
                throw unsupported(name, kind);
            },
            timeGauge -> timeGauge.value(),
            FunctionCounter::count,
            functionTimer -> functionTimer.count(),
            other -> {
                throw unsupported(name, kind);
            }
        );
    }

    private static MetricLookupException unsupported(String name, MetricKind kind) {
        return new MetricLookupException(name, "Metric kind " + kind + " is not supported yet");
    }
}
