package com.ryuqq.workbundle.core.exception;

/**
 * Manifest 객체를 wire 형식으로 변환하지 못한 경우.
 *
 * <p>부분적으로 인코딩된 결과는 반환되지 않습니다.</p>
 *
 * @author WorkBundle Team
 * @since 1.0.0
 */
public class ManifestEncodeException extends WorkBundleException {

    private final String kind;

    public ManifestEncodeException(String kind, Throwable cause) {
        super(ErrorCode.MANIFEST_ENCODE_FAILED,
            "Failed to encode manifest of kind " + kind, cause);
        this.kind = kind;
    }

    public ManifestEncodeException(String kind, String message) {
        super(ErrorCode.MANIFEST_ENCODE_FAILED, message);
        this.kind = kind;
    }

    public String getKind() {
        return kind;
    }
}
