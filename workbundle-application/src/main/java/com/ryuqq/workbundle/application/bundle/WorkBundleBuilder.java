package com.ryuqq.workbundle.application.bundle;

import com.ryuqq.workbundle.core.exception.InvalidTargetException;
import com.ryuqq.workbundle.core.manifest.ManifestObject;
import com.ryuqq.workbundle.core.model.Manifest;
import com.ryuqq.workbundle.core.model.OwnerRef;
import com.ryuqq.workbundle.core.model.ProvenanceAnnotations;
import com.ryuqq.workbundle.core.model.WorkBundle;
import com.ryuqq.workbundle.core.spi.ManifestEncoder;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * WorkBundle 조립기.
 *
 * <p>이름, 대상 위치, 라벨, Manifest 목록과 소유자 정보를 받아 WorkBundle을 만듭니다.
 * 소유자 이름/네임스페이스 provenance 어노테이션은 항상 주입됩니다.</p>
 *
 * <p><strong>검증:</strong> targetLocation이 비어 있으면 {@link InvalidTargetException}.
 * 그 외의 값은 검증하지 않습니다.</p>
 *
 * <p>{@link #buildFromObjects}는 Manifest 인코딩을 함께 수행하며,
 * 하나라도 인코딩에 실패하면 WorkBundle을 만들지 않고 실패합니다.</p>
 *
 * @author WorkBundle Team
 * @since 1.0.0
 */
public final class WorkBundleBuilder {

    private final ManifestEncoder encoder;

    /**
     * 생성자.
     *
     * @param encoder Manifest 인코더
     * @throws IllegalArgumentException encoder가 null인 경우
     */
    public WorkBundleBuilder(ManifestEncoder encoder) {
        if (encoder == null) {
            throw new IllegalArgumentException("encoder cannot be null");
        }
        this.encoder = encoder;
    }

    /**
     * WorkBundle 조립.
     *
     * @param name WorkBundle 이름
     * @param targetLocation 대상 위치
     * @param labels 라벨 (null이면 빈 맵)
     * @param manifests 적용 순서대로 정렬된 Manifest 목록
     * @param ownerName 소유자 이름
     * @param ownerNamespace 소유자 네임스페이스
     * @return 새 WorkBundle (resourceVersion 없음)
     * @throws InvalidTargetException targetLocation이 비어 있는 경우
     */
    public WorkBundle build(String name, String targetLocation, Map<String, String> labels,
                            List<Manifest> manifests, String ownerName, String ownerNamespace) {
        requireTarget(name, targetLocation);
        return build(name, targetLocation, labels, manifests, OwnerRef.of(ownerName, ownerNamespace));
    }

    /**
     * WorkBundle 조립.
     *
     * @param name WorkBundle 이름
     * @param targetLocation 대상 위치
     * @param labels 라벨 (null이면 빈 맵)
     * @param manifests 적용 순서대로 정렬된 Manifest 목록
     * @param owner 소유자
     * @return 새 WorkBundle (resourceVersion 없음)
     * @throws InvalidTargetException targetLocation이 비어 있는 경우
     */
    public WorkBundle build(String name, String targetLocation, Map<String, String> labels,
                            List<Manifest> manifests, OwnerRef owner) {
        requireTarget(name, targetLocation);
        return new WorkBundle(
            name,
            targetLocation,
            labels,
            ProvenanceAnnotations.of(owner),
            manifests,
            null,
            null
        );
    }

    /**
     * 도메인 객체를 인코딩하여 WorkBundle 조립.
     *
     * @param name WorkBundle 이름
     * @param targetLocation 대상 위치
     * @param labels 라벨
     * @param objects 적용 순서대로 정렬된 도메인 객체
     * @param owner 소유자
     * @return 새 WorkBundle
     * @throws InvalidTargetException targetLocation이 비어 있는 경우 (인코딩 전에 검사)
     * @throws com.ryuqq.workbundle.core.exception.ManifestEncodeException 인코딩 실패 시
     */
    public WorkBundle buildFromObjects(String name, String targetLocation, Map<String, String> labels,
                                       List<? extends ManifestObject> objects, OwnerRef owner) {
        requireTarget(name, targetLocation);
        return build(name, targetLocation, labels, encodeAll(objects), owner);
    }

    /**
     * 도메인 객체 목록을 순서대로 인코딩.
     *
     * @param objects 도메인 객체 목록
     * @return Manifest 목록 (입력 순서 유지)
     */
    public List<Manifest> encodeAll(List<? extends ManifestObject> objects) {
        if (objects == null) {
            throw new IllegalArgumentException("objects cannot be null");
        }
        List<Manifest> manifests = new ArrayList<>(objects.size());
        for (ManifestObject object : objects) {
            manifests.add(encoder.encode(object));
        }
        return manifests;
    }

    private static void requireTarget(String name, String targetLocation) {
        if (targetLocation == null || targetLocation.isBlank()) {
            throw new InvalidTargetException(name);
        }
    }
}
