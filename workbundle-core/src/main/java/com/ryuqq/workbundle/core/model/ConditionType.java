package com.ryuqq.workbundle.core.model;

/**
 * 원격 측이 보고하는 Condition 종류.
 *
 * <p>wire 표현은 대소문자까지 정확히 일치해야 합니다 ({@link #wireName()}).</p>
 *
 * @author WorkBundle Team
 * @since 1.0.0
 */
public enum ConditionType {

    /**
     * 원격 클러스터에 적용됨.
     */
    APPLIED("Applied"),

    /**
     * 적용된 리소스가 사용 가능함.
     */
    AVAILABLE("Available"),

    /**
     * 적용된 리소스가 저하 상태임.
     */
    DEGRADED("Degraded");

    private final String wireName;

    ConditionType(String wireName) {
        this.wireName = wireName;
    }

    /**
     * wire 표현 조회.
     *
     * @return 예: "Applied"
     */
    public String wireName() {
        return wireName;
    }
}
