package com.ryuqq.workbundle.core.exception;

/**
 * 원격 저장소 통신 중 발생한 기타 실패.
 *
 * <p>게이트웨이 구현체가 전송 계층 오류를 표현할 때 사용합니다.</p>
 *
 * @author WorkBundle Team
 * @since 1.0.0
 */
public class RemoteStoreException extends WorkBundleException {

    public RemoteStoreException(String message) {
        super(ErrorCode.REMOTE_STORE_ERROR, message);
    }

    public RemoteStoreException(String message, Throwable cause) {
        super(ErrorCode.REMOTE_STORE_ERROR, message, cause);
    }
}
