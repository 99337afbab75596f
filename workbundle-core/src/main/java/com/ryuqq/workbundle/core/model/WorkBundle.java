package com.ryuqq.workbundle.core.model;

import com.ryuqq.workbundle.core.exception.InvalidTargetException;

import java.util.List;
import java.util.Map;

/**
 * 원격 클러스터로 전달되는 작업 묶음 (WorkBundle).
 *
 * <p>WorkBundle은 하나의 대상 위치(targetLocation)로 전달될 Manifest들의 이름 있는 묶음입니다.
 * 원격 측은 manifests를 선언된 순서대로 적용합니다.</p>
 *
 * <p><strong>필드 구성:</strong></p>
 * <ul>
 *   <li><strong>name:</strong> 결정적으로 생성된 이름 (저장하지 않고 항상 재계산)</li>
 *   <li><strong>targetLocation:</strong> 대상 클러스터/네임스페이스</li>
 *   <li><strong>labels:</strong> 자유 형식 분류 정보</li>
 *   <li><strong>annotations:</strong> 소유자 provenance 정보 ({@link ProvenanceAnnotations})</li>
 *   <li><strong>manifests:</strong> 순서가 의미 있는 Manifest 목록</li>
 *   <li><strong>resourceVersion:</strong> 원격 저장소가 부여한 버전 토큰 (로컬에서 생성한 경우 null)</li>
 *   <li><strong>conditions:</strong> 원격 측이 보고한 상태 (convergence 비교 대상 아님)</li>
 * </ul>
 *
 * <p><strong>불변성:</strong> 모든 컬렉션은 방어적 복사 후 불변으로 보관됩니다.
 * 변경은 {@code withXxx} 메서드로 새 인스턴스를 생성합니다.</p>
 *
 * @param name WorkBundle 이름
 * @param targetLocation 대상 위치
 * @param labels 라벨 (null이면 빈 맵)
 * @param annotations 어노테이션 (null이면 빈 맵)
 * @param manifests Manifest 목록 (null이면 빈 목록)
 * @param resourceVersion 원격 버전 토큰 (null 허용)
 * @param conditions 원격 상태 보고 (null이면 빈 목록)
 *
 * @author WorkBundle Team
 * @since 1.0.0
 */
public record WorkBundle(
    String name,
    String targetLocation,
    Map<String, String> labels,
    Map<String, String> annotations,
    List<Manifest> manifests,
    String resourceVersion,
    List<Condition> conditions
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException name이 null이거나 빈 문자열인 경우
     * @throws InvalidTargetException targetLocation이 null이거나 빈 문자열인 경우
     */
    public WorkBundle {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (targetLocation == null || targetLocation.isBlank()) {
            throw new InvalidTargetException(name);
        }
        labels = labels == null ? Map.of() : Map.copyOf(labels);
        annotations = annotations == null ? Map.of() : Map.copyOf(annotations);
        manifests = manifests == null ? List.of() : List.copyOf(manifests);
        conditions = conditions == null ? List.of() : List.copyOf(conditions);
        // resourceVersion은 null 허용
    }

    /**
     * 원격 조회 키.
     *
     * @return (name, targetLocation) 키
     */
    public BundleKey key() {
        return new BundleKey(name, targetLocation);
    }

    /**
     * Manifest 목록만 교체한 새 인스턴스 생성.
     *
     * <p>이름, 위치, 라벨, 어노테이션, resourceVersion, conditions는 그대로 유지됩니다.
     * 원격에서 조회한 객체의 버전 토큰을 보존한 채 내용을 덮어쓸 때 사용합니다.</p>
     *
     * @param newManifests 새로운 Manifest 목록
     * @return 새 WorkBundle 인스턴스
     */
    public WorkBundle withManifests(List<Manifest> newManifests) {
        return new WorkBundle(name, targetLocation, labels, annotations, newManifests, resourceVersion, conditions);
    }

    /**
     * resourceVersion만 변경한 새 인스턴스 생성.
     *
     * @param newResourceVersion 새로운 버전 토큰
     * @return 새 WorkBundle 인스턴스
     */
    public WorkBundle withResourceVersion(String newResourceVersion) {
        return new WorkBundle(name, targetLocation, labels, annotations, manifests, newResourceVersion, conditions);
    }

    /**
     * conditions만 변경한 새 인스턴스 생성.
     *
     * @param newConditions 원격 측이 보고한 상태
     * @return 새 WorkBundle 인스턴스
     */
    public WorkBundle withConditions(List<Condition> newConditions) {
        return new WorkBundle(name, targetLocation, labels, annotations, manifests, resourceVersion, newConditions);
    }

    @Override
    public String toString() {
        return "WorkBundle{" + targetLocation + "/" + name
            + ", manifests=" + manifests.size()
            + ", resourceVersion=" + resourceVersion + '}';
    }
}
