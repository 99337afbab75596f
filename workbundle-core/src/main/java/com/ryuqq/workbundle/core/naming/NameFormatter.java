package com.ryuqq.workbundle.core.naming;

import com.ryuqq.workbundle.core.model.OwnerRef;

/**
 * WorkBundle 이름 생성 규칙.
 *
 * <p>이름은 {@code "{ownerName}-{ownerNamespace}-{bundleKind}-mw"} 형식이며,
 * 동일한 입력에 대해 프로세스와 시간에 관계없이 항상 같은 문자열을 반환합니다.
 * 이름은 원격 WorkBundle을 찾는 유일한 키이므로 형식을 변경하면 안 됩니다.</p>
 *
 * <p>bundleKind는 임의의 문자열을 허용하며, 엔진이 사용하는 예약 값은
 * {@link #WORKLOAD_KIND}와 {@link #NAMESPACE_KIND}입니다.</p>
 *
 * @author WorkBundle Team
 * @since 1.0.0
 */
public final class NameFormatter {

    /**
     * 이름 형식: name-namespace-kind-mw.
     */
    public static final String NAME_FORMAT = "%s-%s-%s-mw";

    /**
     * 워크로드 WorkBundle 종류.
     */
    public static final String WORKLOAD_KIND = "vrg";

    /**
     * 네임스페이스 WorkBundle 종류 (정리 대상에서 제외).
     */
    public static final String NAMESPACE_KIND = "ns";

    /**
     * 클러스터 부트스트랩 WorkBundle의 고정 이름 (소유자와 무관).
     */
    public static final String DR_CLUSTER_BUNDLE_NAME = "ramen-dr-cluster";

    private NameFormatter() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * WorkBundle 이름 생성.
     *
     * @param ownerName 소유자 이름
     * @param ownerNamespace 소유자 네임스페이스
     * @param bundleKind WorkBundle 종류
     * @return 결정적 이름
     * @throws IllegalArgumentException 인자 중 하나라도 null인 경우
     */
    public static String format(String ownerName, String ownerNamespace, String bundleKind) {
        if (ownerName == null) {
            throw new IllegalArgumentException("ownerName cannot be null");
        }
        if (ownerNamespace == null) {
            throw new IllegalArgumentException("ownerNamespace cannot be null");
        }
        if (bundleKind == null) {
            throw new IllegalArgumentException("bundleKind cannot be null");
        }
        return String.format(NAME_FORMAT, ownerName, ownerNamespace, bundleKind);
    }

    /**
     * 소유자 식별자로 WorkBundle 이름 생성.
     *
     * @param owner 소유자
     * @param bundleKind WorkBundle 종류
     * @return 결정적 이름
     */
    public static String format(OwnerRef owner, String bundleKind) {
        if (owner == null) {
            throw new IllegalArgumentException("owner cannot be null");
        }
        return format(owner.name(), owner.namespace(), bundleKind);
    }
}
