package com.ryuqq.workbundle.core.model;

import java.util.List;

/**
 * Manifest 시퀀스의 구조적 동등성 판정.
 *
 * <p>convergence 시 원격 WorkBundle이 이미 원하는 상태인지 판단하는 유일한 기준입니다.
 * 범용 reflection 비교 대신 명시적인 규칙만 적용합니다:</p>
 * <ul>
 *   <li>길이가 같아야 함</li>
 *   <li>같은 위치의 Manifest가 모두 {@link Manifest#equals(Object)} 기준으로 같아야 함 (순서 중요)</li>
 * </ul>
 *
 * <p>labels, annotations, resourceVersion, conditions는 비교 대상이 아닙니다.</p>
 *
 * @author WorkBundle Team
 * @since 1.0.0
 */
public final class ManifestSequences {

    private ManifestSequences() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 두 Manifest 시퀀스가 구조적으로 동일한지 확인.
     *
     * @param current 현재(원격) 시퀀스
     * @param desired 원하는 시퀀스
     * @return 길이와 순서별 payload가 모두 같으면 true
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public static boolean sameContent(List<Manifest> current, List<Manifest> desired) {
        if (current == null || desired == null) {
            throw new IllegalArgumentException("manifest sequences cannot be null");
        }
        if (current.size() != desired.size()) {
            return false;
        }
        for (int i = 0; i < current.size(); i++) {
            if (!current.get(i).equals(desired.get(i))) {
                return false;
            }
        }
        return true;
    }

    /**
     * 두 WorkBundle의 Manifest 시퀀스가 동일한지 확인.
     *
     * @param current 현재(원격) WorkBundle
     * @param desired 원하는 WorkBundle
     * @return Manifest 시퀀스가 동일하면 true
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public static boolean sameContent(WorkBundle current, WorkBundle desired) {
        if (current == null || desired == null) {
            throw new IllegalArgumentException("bundles cannot be null");
        }
        return sameContent(current.manifests(), desired.manifests());
    }
}
