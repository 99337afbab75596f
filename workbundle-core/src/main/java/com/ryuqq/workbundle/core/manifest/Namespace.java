package com.ryuqq.workbundle.core.manifest;

/**
 * 원격 네임스페이스.
 *
 * <p>네임스페이스 생성은 되돌리지 않는 부수 효과로 취급되어,
 * 이를 담은 WorkBundle은 클러스터 단위 정리 시에도 삭제되지 않습니다.</p>
 *
 * @param metadata 메타데이터 (이름만 사용)
 *
 * @author WorkBundle Team
 * @since 1.0.0
 */
public record Namespace(ObjectMeta metadata) implements ManifestObject {

    public static final String API_VERSION = "v1";
    public static final String KIND = "Namespace";

    public Namespace {
        if (metadata == null) {
            throw new IllegalArgumentException("metadata cannot be null");
        }
    }

    /**
     * 이름으로 네임스페이스 생성.
     *
     * @param name 네임스페이스 이름
     * @return Namespace
     */
    public static Namespace named(String name) {
        return new Namespace(ObjectMeta.clusterScoped(name));
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
