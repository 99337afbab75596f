/**
 * Runner Adapter Layer - 호출자 측 재시도 러너.
 *
 * <h2>구성 요소</h2>
 * <ul>
 *   <li>{@link com.ryuqq.workbundle.adapter.runner.ConvergeRetryRunner} - 재시도 가능한 실패를 backoff 후 재시도</li>
 *   <li>{@link com.ryuqq.workbundle.adapter.runner.BackoffCalculator} - Exponential Backoff with Jitter</li>
 *   <li>{@link com.ryuqq.workbundle.adapter.runner.RetryConfig} - 재시도 설정</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-runner (ConvergeRetryRunner)
 *   ↓ wraps
 * application (WorkSynchronizer)
 *   ↓ depends on
 * core (WorkBundle, SyncOutcome, ErrorCode, RemoteStoreGateway SPI)
 * </pre>
 *
 * @author WorkBundle Team
 * @since 1.0.0
 */
package com.ryuqq.workbundle.adapter.runner;
