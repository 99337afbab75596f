package com.ryuqq.workbundle.core.manifest;

/**
 * 워크로드 복제 상태 객체.
 *
 * <p>소유자별 워크로드 WorkBundle ("{name}-{namespace}-vrg-mw")의 유일한 Manifest입니다.</p>
 *
 * @param metadata 메타데이터
 * @param spec 복제 설정
 *
 * @author WorkBundle Team
 * @since 1.0.0
 */
public record VolumeReplicationGroup(
    ObjectMeta metadata,
    VolumeReplicationGroupSpec spec
) implements ManifestObject {

    public static final String API_VERSION = "ramendr.openshift.io/v1alpha1";
    public static final String KIND = "VolumeReplicationGroup";

    public VolumeReplicationGroup {
        if (metadata == null) {
            throw new IllegalArgumentException("metadata cannot be null");
        }
        if (spec == null) {
            throw new IllegalArgumentException("spec cannot be null");
        }
    }

    @Override
    public String apiVersion() {
        return API_VERSION;
    }

    @Override
    public String kind() {
        return KIND;
    }
}
