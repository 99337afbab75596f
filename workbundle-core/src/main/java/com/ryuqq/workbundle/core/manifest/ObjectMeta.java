package com.ryuqq.workbundle.core.manifest;

/**
 * 객체 이름과 네임스페이스.
 *
 * @param name 객체 이름
 * @param namespace 네임스페이스 (클러스터 범위 객체는 null)
 *
 * @author WorkBundle Team
 * @since 1.0.0
 */
public record ObjectMeta(
    String name,
    String namespace
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException name이 null이거나 빈 문자열인 경우
     */
    public ObjectMeta {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
    }

    /**
     * 클러스터 범위 메타데이터 생성.
     *
     * @param name 객체 이름
     * @return ObjectMeta
     */
    public static ObjectMeta clusterScoped(String name) {
        return new ObjectMeta(name, null);
    }

    /**
     * 네임스페이스 범위 메타데이터 생성.
     *
     * @param name 객체 이름
     * @param namespace 네임스페이스
     * @return ObjectMeta
     */
    public static ObjectMeta namespaced(String name, String namespace) {
        if (namespace == null || namespace.isBlank()) {
            throw new IllegalArgumentException("namespace cannot be null or blank");
        }
        return new ObjectMeta(name, namespace);
    }
}
