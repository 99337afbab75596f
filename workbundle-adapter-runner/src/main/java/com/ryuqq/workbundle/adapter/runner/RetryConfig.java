package com.ryuqq.workbundle.adapter.runner;

/**
 * convergence 재시도 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>maxAttempts: 최초 호출을 포함한 최대 시도 횟수 (기본 5)</li>
 *   <li>baseDelayMs: 첫 재시도 전 대기 시간 (기본 1000ms)</li>
 *   <li>maxDelayMs: 재시도 간 최대 대기 시간 (기본 60000ms = 1분)</li>
 *   <li>jitterFactor: Jitter 비율 (기본 0.1)</li>
 * </ul>
 *
 * <p><strong>튜닝 가이드:</strong></p>
 * <ul>
 *   <li>충돌이 잦은 환경: baseDelayMs를 작게, maxAttempts를 크게</li>
 *   <li>원격 저장소 장애 대응: maxDelayMs를 reconcile 주기보다 짧게 유지</li>
 * </ul>
 *
 * @author WorkBundle Team
 * @since 1.0.0
 * @param maxAttempts 최대 시도 횟수 (1 이상, 1이면 재시도 없음)
 * @param baseDelayMs 기본 지연 시간 (밀리초, 양수여야 함)
 * @param maxDelayMs 최대 지연 시간 (밀리초, baseDelayMs 이상이어야 함)
 * @param jitterFactor Jitter 비율 (0.0 ~ 1.0)
 */
public record RetryConfig(int maxAttempts, long baseDelayMs, long maxDelayMs, double jitterFactor) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: maxAttempts=5, baseDelayMs=1000ms, maxDelayMs=60000ms, jitterFactor=0.1</p>
     */
    public RetryConfig() {
        this(5, 1000, 60000, 0.1);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public RetryConfig {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException(
                "maxAttempts must be positive (current: " + maxAttempts + ")"
            );
        }
        if (baseDelayMs <= 0) {
            throw new IllegalArgumentException(
                "baseDelayMs must be positive (current: " + baseDelayMs + ")"
            );
        }
        if (maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException(
                "maxDelayMs must be >= baseDelayMs (base: " + baseDelayMs + ", max: " + maxDelayMs + ")"
            );
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException(
                "jitterFactor must be between 0.0 and 1.0 (current: " + jitterFactor + ")"
            );
        }
    }

    /**
     * maxAttempts만 변경한 새 인스턴스 생성.
     *
     * @param maxAttempts 새로운 최대 시도 횟수
     * @return 새 RetryConfig 인스턴스
     */
    public RetryConfig withMaxAttempts(int maxAttempts) {
        return new RetryConfig(maxAttempts, this.baseDelayMs, this.maxDelayMs, this.jitterFactor);
    }

    /**
     * baseDelayMs만 변경한 새 인스턴스 생성.
     *
     * @param baseDelayMs 새로운 기본 지연 시간 (밀리초)
     * @return 새 RetryConfig 인스턴스
     */
    public RetryConfig withBaseDelayMs(long baseDelayMs) {
        return new RetryConfig(this.maxAttempts, baseDelayMs, this.maxDelayMs, this.jitterFactor);
    }

    /**
     * maxDelayMs만 변경한 새 인스턴스 생성.
     *
     * @param maxDelayMs 새로운 최대 지연 시간 (밀리초)
     * @return 새 RetryConfig 인스턴스
     */
    public RetryConfig withMaxDelayMs(long maxDelayMs) {
        return new RetryConfig(this.maxAttempts, this.baseDelayMs, maxDelayMs, this.jitterFactor);
    }

    /**
     * jitterFactor만 변경한 새 인스턴스 생성.
     *
     * @param jitterFactor 새로운 Jitter 비율
     * @return 새 RetryConfig 인스턴스
     */
    public RetryConfig withJitterFactor(double jitterFactor) {
        return new RetryConfig(this.maxAttempts, this.baseDelayMs, this.maxDelayMs, jitterFactor);
    }
}
