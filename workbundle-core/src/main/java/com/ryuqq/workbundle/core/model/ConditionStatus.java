package com.ryuqq.workbundle.core.model;

/**
 * Condition의 3상태 값.
 *
 * <p>성공 판정에는 {@link #TRUE}만 의미가 있습니다.</p>
 *
 * @author WorkBundle Team
 * @since 1.0.0
 */
public enum ConditionStatus {

    TRUE("True"),
    FALSE("False"),
    UNKNOWN("Unknown");

    private final String wireName;

    ConditionStatus(String wireName) {
        this.wireName = wireName;
    }

    /**
     * wire 표현 조회.
     *
     * @return 예: "True"
     */
    public String wireName() {
        return wireName;
    }

    /**
     * wire 표현으로부터 변환.
     *
     * <p>인식할 수 없는 값은 {@link #UNKNOWN}으로 취급합니다.</p>
     *
     * @param value wire 값 (예: "True")
     * @return ConditionStatus
     */
    public static ConditionStatus fromWire(String value) {
        for (ConditionStatus status : values()) {
            if (status.wireName.equals(value)) {
                return status;
            }
        }
        return UNKNOWN;
    }
}
