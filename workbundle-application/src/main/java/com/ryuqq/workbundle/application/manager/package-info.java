/**
 * 소유자 단위 WorkBundle 관리 Facade.
 *
 * <ul>
 *   <li>{@link com.ryuqq.workbundle.application.manager.WorkBundleManager} - 워크로드/네임스페이스/DR 클러스터 WorkBundle 관리</li>
 * </ul>
 *
 * @author WorkBundle Team
 * @since 1.0.0
 */
package com.ryuqq.workbundle.application.manager;
