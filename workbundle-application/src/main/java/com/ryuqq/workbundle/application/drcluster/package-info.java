/**
 * DR 클러스터 부트스트랩 WorkBundle 내용.
 *
 * <p>권한, 오퍼레이터 설치 객체, YAML 오퍼레이터 설정 ConfigMap을 생성합니다.
 * 이 패키지는 내용만 만들며, 전달과 수렴은
 * {@link com.ryuqq.workbundle.application.manager.WorkBundleManager}가 담당합니다.</p>
 *
 * @author WorkBundle Team
 * @since 1.0.0
 */
package com.ryuqq.workbundle.application.drcluster;
