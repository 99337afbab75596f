package com.ryuqq.workbundle.adapter.runner;

/**
 * 재시도 사이 대기 전략.
 *
 * <p>테스트에서는 실제로 잠들지 않는 구현으로 교체합니다.</p>
 *
 * @author WorkBundle Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Sleeper {

    /**
     * {@link Thread#sleep(long)} 기반 기본 구현.
     */
    Sleeper THREAD_SLEEP = Thread::sleep;

    /**
     * 지정된 시간 동안 대기.
     *
     * @param millis 대기 시간 (밀리초)
     * @throws InterruptedException 대기 중 인터럽트 발생 시
     */
    void sleep(long millis) throws InterruptedException;
}
