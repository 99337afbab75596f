/**
 * WorkBundle 조립, 수렴, 삭제.
 *
 * <h2>핵심 컴포넌트</h2>
 * <ul>
 *   <li>{@link com.ryuqq.workbundle.application.bundle.WorkBundleBuilder} - WorkBundle 조립 (provenance 어노테이션 주입)</li>
 *   <li>{@link com.ryuqq.workbundle.application.bundle.WorkSynchronizer} - create-or-update convergence</li>
 *   <li>{@link com.ryuqq.workbundle.application.bundle.WorkDeleter} - 멱등 삭제</li>
 * </ul>
 *
 * <p>모든 컴포넌트는 동기 호출만 수행하며 내부 스레드나 재시도가 없습니다.</p>
 *
 * @author WorkBundle Team
 * @since 1.0.0
 */
package com.ryuqq.workbundle.application.bundle;
