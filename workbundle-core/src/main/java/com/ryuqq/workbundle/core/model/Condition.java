package com.ryuqq.workbundle.core.model;

/**
 * 원격 적용 진행 상황의 한 측면을 나타내는 상태 보고.
 *
 * <p>type은 wire 문자열로 보관하여 엔진이 알지 못하는 종류(예: Progressing)도
 * 그대로 전달받을 수 있습니다. 엔진은 {@link ConditionType}에 정의된 세 종류만 해석합니다.</p>
 *
 * @param type Condition 종류 (wire 표현, 예: "Applied")
 * @param status 3상태 값
 *
 * @author WorkBundle Team
 * @since 1.0.0
 */
public record Condition(
    String type,
    ConditionStatus status
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException type이 null/blank이거나 status가 null인 경우
     */
    public Condition {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("type cannot be null or blank");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
    }

    /**
     * 알려진 Condition 종류로 생성.
     *
     * @param type Condition 종류
     * @param status 상태 값
     * @return Condition 인스턴스
     */
    public static Condition of(ConditionType type, ConditionStatus status) {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        return new Condition(type.wireName(), status);
    }

    /**
     * 주어진 종류이면서 status가 True인지 확인.
     *
     * @param expected 확인할 종류
     * @return 일치하고 True이면 true
     */
    public boolean isTrue(ConditionType expected) {
        return expected.wireName().equals(type) && status == ConditionStatus.TRUE;
    }
}
