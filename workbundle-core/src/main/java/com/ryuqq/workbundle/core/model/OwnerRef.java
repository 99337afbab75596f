package com.ryuqq.workbundle.core.model;

/**
 * WorkBundle을 요청한 소유자(owner) 식별자.
 *
 * <p>소유자와 WorkBundle은 서로 다른 관리 도메인(클러스터)에 존재할 수 있으므로
 * 구조적인 부모-자식 관계 대신 이 식별자만으로 추적합니다.
 * 이름 생성({@link com.ryuqq.workbundle.core.naming.NameFormatter})과
 * provenance 어노테이션({@link ProvenanceAnnotations})의 입력으로 사용됩니다.</p>
 *
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>name, namespace 모두 null 또는 빈 문자열 불가</li>
 * </ul>
 *
 * @param name 소유자 이름 (예: app1)
 * @param namespace 소유자 네임스페이스 (예: ns1)
 *
 * @author WorkBundle Team
 * @since 1.0.0
 */
public record OwnerRef(
    String name,
    String namespace
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException name 또는 namespace가 null이거나 빈 문자열인 경우
     */
    public OwnerRef {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("owner name cannot be null or blank");
        }
        if (namespace == null || namespace.isBlank()) {
            throw new IllegalArgumentException("owner namespace cannot be null or blank");
        }
    }

    /**
     * OwnerRef 생성.
     *
     * @param name 소유자 이름
     * @param namespace 소유자 네임스페이스
     * @return OwnerRef 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static OwnerRef of(String name, String namespace) {
        return new OwnerRef(name, namespace);
    }

    @Override
    public String toString() {
        return namespace + "/" + name;
    }
}
