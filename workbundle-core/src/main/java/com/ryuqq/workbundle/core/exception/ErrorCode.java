package com.ryuqq.workbundle.core.exception;

/**
 * WorkBundle 엔진 표준 에러 코드.
 *
 * <p>형식: {@code WB-{CATEGORY}{NUMBER}}</p>
 * <ul>
 *   <li>1xx: 입력/인코딩 오류</li>
 *   <li>3xx: 원격 리소스 상태 (not found, already exists, conflict)</li>
 *   <li>4xx: 원격 저장소 통신 오류</li>
 *   <li>5xx: 쓰기 안전성 위반</li>
 *   <li>6xx: 취소/기한 초과</li>
 *   <li>7xx: 메트릭 조회 오류</li>
 * </ul>
 *
 * <p>{@link #isRetryable()}이 true인 코드는 동일 요청을 나중에 다시 시도하면
 * 성공할 수 있는 일시적 실패를 의미합니다.</p>
 *
 * @author WorkBundle Team
 * @since 1.0.0
 */
public enum ErrorCode {

    // ==================== Input Errors (1xx) ====================

    MANIFEST_ENCODE_FAILED("WB-100", "Failed to encode manifest object", false),
    INVALID_TARGET("WB-101", "Target location is empty", false),

    // ==================== Remote Resource Errors (3xx) ====================

    BUNDLE_NOT_FOUND("WB-300", "WorkBundle not found", false),
    BUNDLE_ALREADY_EXISTS("WB-301", "WorkBundle already exists", false),
    BUNDLE_CONFLICT("WB-310", "WorkBundle was modified concurrently", true),

    // ==================== Remote Store Errors (4xx) ====================

    REMOTE_STORE_ERROR("WB-400", "Remote store error", true),
    BUNDLE_FETCH_FAILED("WB-401", "Failed to fetch WorkBundle", true),
    BUNDLE_WRITE_FAILED("WB-402", "Failed to write WorkBundle", true),

    // ==================== Write Safety Errors (5xx) ====================

    UNCONDITIONAL_WRITE("WB-500", "Refusing to update WorkBundle without a version token", false),

    // ==================== Context Errors (6xx) ====================

    OPERATION_CANCELLED("WB-600", "Operation cancelled", false),
    DEADLINE_EXCEEDED("WB-601", "Operation deadline exceeded", false),

    // ==================== Metric Errors (7xx) ====================

    METRIC_LOOKUP_FAILED("WB-700", "Metric lookup failed", false);

    private final String code;
    private final String defaultMessage;
    private final boolean retryable;

    ErrorCode(String code, String defaultMessage, boolean retryable) {
        this.code = code;
        this.defaultMessage = defaultMessage;
        this.retryable = retryable;
    }

    public String getCode() {
        return code;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
