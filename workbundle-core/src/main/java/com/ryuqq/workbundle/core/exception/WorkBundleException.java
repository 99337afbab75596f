package com.ryuqq.workbundle.core.exception;

/**
 * WorkBundle 엔진 예외의 최상위 타입.
 *
 * <p>모든 하위 예외는 {@link ErrorCode}를 가지며, 호출자는 코드 또는
 * {@link #isRetryable()}로 후속 조치를 결정할 수 있습니다.</p>
 *
 * @author WorkBundle Team
 * @since 1.0.0
 */
public abstract class WorkBundleException extends RuntimeException {

    private final ErrorCode errorCode;

    protected WorkBundleException(ErrorCode errorCode) {
        super(errorCode.getDefaultMessage());
        this.errorCode = errorCode;
    }

    protected WorkBundleException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected WorkBundleException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    /**
     * 재시도로 해소될 수 있는 실패인지 확인.
     *
     * @return 재시도 가능 여부
     */
    public boolean isRetryable() {
        return errorCode.isRetryable();
    }
}
