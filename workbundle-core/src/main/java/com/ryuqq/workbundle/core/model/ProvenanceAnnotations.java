package com.ryuqq.workbundle.core.model;

import java.util.Map;

/**
 * WorkBundle에 항상 부착되는 provenance 어노테이션 키.
 *
 * <p>추적 용도로만 사용되며, WorkBundle 조회 키로 사용되지 않습니다.</p>
 *
 * @author WorkBundle Team
 * @since 1.0.0
 */
public final class ProvenanceAnnotations {

    /**
     * 소유자 이름 어노테이션 키.
     */
    public static final String OWNER_NAME = "drplacementcontrol.ramendr.openshift.io/drpc-name";

    /**
     * 소유자 네임스페이스 어노테이션 키.
     */
    public static final String OWNER_NAMESPACE = "drplacementcontrol.ramendr.openshift.io/drpc-namespace";

    private ProvenanceAnnotations() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 소유자 정보로 어노테이션 맵 생성.
     *
     * @param owner 소유자
     * @return 두 개의 provenance 어노테이션을 담은 불변 맵
     * @throws IllegalArgumentException owner가 null인 경우
     */
    public static Map<String, String> of(OwnerRef owner) {
        if (owner == null) {
            throw new IllegalArgumentException("owner cannot be null");
        }
        return Map.of(
            OWNER_NAME, owner.name(),
            OWNER_NAMESPACE, owner.namespace()
        );
    }
}
