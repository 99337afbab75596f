package com.ryuqq.workbundle.core.manifest;

import java.util.List;

/**
 * 네임스페이스 범위 역할 바인딩.
 *
 * <p>ClusterRole을 특정 네임스페이스 안에서만 부여할 때 사용합니다.</p>
 *
 * @param metadata 메타데이터
 * @param subjects 바인딩 대상
 * @param roleRef 참조 역할
 *
 * @author WorkBundle Team
 * @since 1.0.0
 */
public record RoleBinding(
    ObjectMeta metadata,
    List<Subject> subjects,
    RoleRef roleRef
) implements ManifestObject {

    public static final String API_VERSION = ClusterRole.API_VERSION;
    public static final String KIND = "RoleBinding";

    public RoleBinding {
        if (metadata == null) {
            throw new IllegalArgumentException("metadata cannot be null");
        }
        if (roleRef == null) {
            throw new IllegalArgumentException("roleRef cannot be null");
        }
        subjects = subjects == null ? List.of() : List.copyOf(subjects);
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
