package com.ryuqq.workbundle.adapter.runner;

import com.ryuqq.workbundle.application.bundle.WorkSynchronizer;
import com.ryuqq.workbundle.core.context.OperationContext;
import com.ryuqq.workbundle.core.exception.OperationCancelledException;
import com.ryuqq.workbundle.core.exception.WorkBundleException;
import com.ryuqq.workbundle.core.model.WorkBundle;
import com.ryuqq.workbundle.core.outcome.SyncOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;

/**
 * 재시도 가능한 convergence 실패를 backoff 후 다시 시도하는 호출자 측 러너.
 *
 * <p>{@link WorkSynchronizer}는 충돌이나 원격 오류를 그대로 올려보냅니다.
 * 이 러너는 {@link WorkBundleException#isRetryable()}이 true인 실패만 재시도하며,
 * 매 시도마다 원격 상태를 새로 읽기 때문에 충돌 후 재시도가 안전합니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * 1. synchronizer.converge(ctx, desired)
 * 2. 성공 → SyncOutcome 반환
 * 3. 실패:
 *    - 재시도 불가 ErrorCode → 즉시 전파
 *    - maxAttempts 소진 → 마지막 예외 전파
 *    - 남은 deadline보다 backoff가 길면 → 마지막 예외 전파
 *    - 그 외 → backoff 대기 후 1로
 * </pre>
 *
 * <p><strong>취소:</strong> 대기 중 인터럽트되면 인터럽트 플래그를 복원하고
 * {@link OperationCancelledException}을 던집니다. 컨텍스트 취소는 다음 시도의
 * {@code checkActive}에서 감지됩니다.</p>
 *
 * @author WorkBundle Team
 * @since 1.0.0
 */
public final class ConvergeRetryRunner {

    private static final Logger log = LoggerFactory.getLogger(ConvergeRetryRunner.class);

    static final String OPERATION = "convergeWithRetry";

    private final WorkSynchronizer synchronizer;
    private final RetryConfig config;
    private final BackoffCalculator backoffCalculator;
    private final Sleeper sleeper;

    /**
     * 생성자 (Thread.sleep 기반 대기).
     *
     * @param synchronizer convergence 수행자
     * @param config 재시도 설정
     */
    public ConvergeRetryRunner(WorkSynchronizer synchronizer, RetryConfig config) {
        this(synchronizer, config, new BackoffCalculator(config), Sleeper.THREAD_SLEEP);
    }

    /**
     * 생성자.
     *
     * @param synchronizer convergence 수행자
     * @param config 재시도 설정
     * @param backoffCalculator 재시도 간격 계산기
     * @param sleeper 대기 전략
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public ConvergeRetryRunner(WorkSynchronizer synchronizer, RetryConfig config,
                               BackoffCalculator backoffCalculator, Sleeper sleeper) {
        if (synchronizer == null) {
            throw new IllegalArgumentException("synchronizer cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (backoffCalculator == null) {
            throw new IllegalArgumentException("backoffCalculator cannot be null");
        }
        if (sleeper == null) {
            throw new IllegalArgumentException("sleeper cannot be null");
        }
        this.synchronizer = synchronizer;
        this.config = config;
        this.backoffCalculator = backoffCalculator;
        this.sleeper = sleeper;
    }

    /**
     * 재시도를 포함한 convergence 수행.
     *
     * @param ctx 취소/deadline 컨텍스트
     * @param desired 원하는 WorkBundle
     * @return 마지막 성공 시도의 결과
     * @throws WorkBundleException 재시도 불가 실패, 재시도 소진, 또는 deadline 부족 시 마지막 예외
     */
    public SyncOutcome converge(OperationContext ctx, WorkBundle desired) {
        if (ctx == null) {
            throw new IllegalArgumentException("ctx cannot be null");
        }

        int attempt = 1;
        while (true) {
            try {
                return synchronizer.converge(ctx, desired);
            } catch (WorkBundleException e) {
                if (!e.isRetryable()) {
                    throw e;
                }
                if (attempt >= config.maxAttempts()) {
                    log.error("Giving up converging {} after {} attempts: {}",
                        desired.key(), attempt, e.getErrorCode().getCode(), e);
                    throw e;
                }

                long delay = backoffCalculator.calculate(attempt);
                Optional<Duration> remaining = ctx.remaining();
                if (remaining.isPresent() && remaining.get().toMillis() <= delay) {
                    log.warn("Not retrying {}: backoff {}ms exceeds remaining {}ms before deadline",
                        desired.key(), delay, remaining.get().toMillis());
                    throw e;
                }

                log.warn("Converge of {} failed with {} (attempt {}/{}), retrying in {}ms",
                    desired.key(), e.getErrorCode().getCode(), attempt, config.maxAttempts(), delay);
                pause(delay);
                attempt++;
            }
        }
    }

    private void pause(long delay) {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OperationCancelledException(OPERATION);
        }
    }
}
