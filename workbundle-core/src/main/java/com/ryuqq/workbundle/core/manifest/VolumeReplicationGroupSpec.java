package com.ryuqq.workbundle.core.manifest;

import java.util.List;

/**
 * 워크로드 복제 설정.
 *
 * @param pvcSelector 복제 대상 PVC 선택 조건
 * @param replicationState 복제 역할 (예: "primary", "secondary")
 * @param s3Profiles 메타데이터를 저장할 S3 프로파일 목록
 * @param schedulingInterval 복제 주기 (예: "5m", null 허용)
 *
 * @author WorkBundle Team
 * @since 1.0.0
 */
public record VolumeReplicationGroupSpec(
    LabelSelector pvcSelector,
    String replicationState,
    List<String> s3Profiles,
    String schedulingInterval
) {

    public VolumeReplicationGroupSpec {
        if (pvcSelector == null) {
            pvcSelector = new LabelSelector(null);
        }
        if (replicationState == null || replicationState.isBlank()) {
            throw new IllegalArgumentException("replicationState cannot be null or blank");
        }
        s3Profiles = s3Profiles == null ? List.of() : List.copyOf(s3Profiles);
    }
}
