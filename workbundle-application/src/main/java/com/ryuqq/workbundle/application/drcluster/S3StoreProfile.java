package com.ryuqq.workbundle.application.drcluster;

/**
 * 복제 메타데이터 저장용 S3 프로파일.
 *
 * @param s3ProfileName 프로파일 이름
 * @param s3Bucket 버킷 이름
 * @param s3CompatibleEndpoint S3 호환 엔드포인트
 * @param s3Region 리전
 * @param s3SecretRef 접근 키를 담은 Secret 이름
 *
 * @author WorkBundle Team
 * @since 1.0.0
 */
public record S3StoreProfile(
    String s3ProfileName,
    String s3Bucket,
    String s3CompatibleEndpoint,
    String s3Region,
    String s3SecretRef
) {

    public S3StoreProfile {
        if (s3ProfileName == null || s3ProfileName.isBlank()) {
            throw new IllegalArgumentException("s3ProfileName cannot be null or blank");
        }
    }
}
