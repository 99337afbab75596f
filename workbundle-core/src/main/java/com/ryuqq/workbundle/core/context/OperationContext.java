package com.ryuqq.workbundle.core.context;

import com.ryuqq.workbundle.core.exception.DeadlineExceededException;
import com.ryuqq.workbundle.core.exception.OperationCancelledException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 작업 취소 및 기한 정보를 전달하는 컨텍스트.
 *
 * <p>엔진의 모든 연산은 OperationContext를 받아 원격 저장소 호출에 그대로 전달합니다.
 * 각 원격 호출 직전에 {@link #checkActive(String)}로 취소/기한 여부를 확인합니다.</p>
 *
 * <p><strong>생성 방법:</strong></p>
 * <ul>
 *   <li>{@link #background()}: 기한 없음, 취소되지 않음</li>
 *   <li>{@link #withTimeout(Duration)}: 현재 시각 + timeout을 기한으로 설정</li>
 *   <li>{@link #withDeadline(Instant)}: 절대 시각 기한 설정</li>
 * </ul>
 *
 * <p><strong>Thread-safety:</strong> {@link #cancel()}은 다른 스레드에서 호출해도 안전합니다.
 * 부모 컨텍스트가 취소되면 파생된 컨텍스트도 취소된 것으로 간주됩니다.</p>
 *
 * @author WorkBundle Team
 * @since 1.0.0
 */
public final class OperationContext {

    private final Clock clock;
    private final Instant deadline;
    private final OperationContext parent;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    private OperationContext(Clock clock, Instant deadline, OperationContext parent) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.clock = clock;
        this.deadline = deadline;
        this.parent = parent;
    }

    /**
     * 기한 없는 루트 컨텍스트 생성 (시스템 UTC 시계 사용).
     *
     * @return 새 OperationContext
     */
    public static OperationContext background() {
        return background(Clock.systemUTC());
    }

    /**
     * 지정된 시계를 사용하는 루트 컨텍스트 생성.
     *
     * @param clock 기한 판정에 사용할 시계
     * @return 새 OperationContext
     * @throws IllegalArgumentException clock이 null인 경우
     */
    public static OperationContext background(Clock clock) {
        return new OperationContext(clock, null, null);
    }

    /**
     * 현재 시각 + timeout을 기한으로 하는 파생 컨텍스트 생성.
     *
     * <p>부모의 기한이 더 이르면 부모 기한이 유지됩니다.</p>
     *
     * @param timeout 허용 시간 (양수)
     * @return 파생 컨텍스트
     * @throws IllegalArgumentException timeout이 null이거나 음수인 경우
     */
    public OperationContext withTimeout(Duration timeout) {
        if (timeout == null || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout cannot be null or negative");
        }
        return withDeadline(clock.instant().plus(timeout));
    }

    /**
     * 절대 시각 기한을 갖는 파생 컨텍스트 생성.
     *
     * @param newDeadline 기한
     * @return 파생 컨텍스트
     * @throws IllegalArgumentException newDeadline이 null인 경우
     */
    public OperationContext withDeadline(Instant newDeadline) {
        if (newDeadline == null) {
            throw new IllegalArgumentException("deadline cannot be null");
        }
        Instant effective = deadline != null && deadline.isBefore(newDeadline) ? deadline : newDeadline;
        return new OperationContext(clock, effective, this);
    }

    /**
     * 컨텍스트 취소.
     *
     * <p>이미 취소된 경우 아무 동작도 하지 않습니다.</p>
     */
    public void cancel() {
        cancelled.set(true);
    }

    /**
     * 취소 여부 확인 (부모 포함).
     *
     * @return 취소되었으면 true
     */
    public boolean isCancelled() {
        return cancelled.get() || (parent != null && parent.isCancelled());
    }

    /**
     * 기한 경과 여부 확인.
     *
     * @return 기한이 설정되어 있고 현재 시각이 기한 이후이면 true
     */
    public boolean isDeadlineExceeded() {
        return deadline != null && !clock.instant().isBefore(deadline);
    }

    /**
     * 기한 조회.
     *
     * @return 기한 (없으면 empty)
     */
    public Optional<Instant> deadline() {
        return Optional.ofNullable(deadline);
    }

    /**
     * 기한까지 남은 시간.
     *
     * @return 남은 시간 (기한이 없으면 empty, 지났으면 {@link Duration#ZERO})
     */
    public Optional<Duration> remaining() {
        if (deadline == null) {
            return Optional.empty();
        }
        Duration left = Duration.between(clock.instant(), deadline);
        return Optional.of(left.isNegative() ? Duration.ZERO : left);
    }

    /**
     * 컨텍스트가 아직 유효한지 검사.
     *
     * @param operation 오류 메시지에 포함될 작업 이름
     * @throws OperationCancelledException 취소된 경우
     * @throws DeadlineExceededException 기한이 지난 경우
     */
    public void checkActive(String operation) {
        if (isCancelled()) {
            throw new OperationCancelledException(operation);
        }
        if (isDeadlineExceeded()) {
            throw new DeadlineExceededException(operation, deadline);
        }
    }

    /**
     * 컨텍스트가 사용하는 시계.
     *
     * @return Clock
     */
    public Clock clock() {
        return clock;
    }
}
