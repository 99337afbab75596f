package com.ryuqq.workbundle.application.bundle;

import com.ryuqq.workbundle.core.context.OperationContext;
import com.ryuqq.workbundle.core.exception.BundleAlreadyExistsException;
import com.ryuqq.workbundle.core.exception.BundleConflictException;
import com.ryuqq.workbundle.core.exception.BundleNotFoundException;
import com.ryuqq.workbundle.core.exception.DeadlineExceededException;
import com.ryuqq.workbundle.core.exception.OperationCancelledException;
import com.ryuqq.workbundle.core.exception.UnconditionalWriteException;
import com.ryuqq.workbundle.core.exception.WorkBundleFetchException;
import com.ryuqq.workbundle.core.exception.WorkBundleWriteException;
import com.ryuqq.workbundle.core.model.BundleKey;
import com.ryuqq.workbundle.core.model.ManifestSequences;
import com.ryuqq.workbundle.core.model.WorkBundle;
import com.ryuqq.workbundle.core.outcome.Created;
import com.ryuqq.workbundle.core.outcome.SyncOutcome;
import com.ryuqq.workbundle.core.outcome.Unchanged;
import com.ryuqq.workbundle.core.outcome.Updated;
import com.ryuqq.workbundle.core.spi.RemoteStoreGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * WorkBundle create-or-update convergence.
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * 1. get(name, location)
 *    - NotFound → create(desired) → Created
 *    - 기타 실패 → WorkBundleFetchException
 * 2. 조회 성공 → Manifest 시퀀스 비교 ({@link ManifestSequences})
 *    - 동일 → 쓰기 없음 → Unchanged
 * 3. 다름 → 조회한 객체에 desired Manifest를 덮어써서 update → Updated
 *    (조회 시 받은 resourceVersion으로 조건부 갱신)
 * </pre>
 *
 * <p><strong>동시 생성 경쟁:</strong> create가 AlreadyExists로 실패하면 한 번 재조회하여
 * 2단계부터 이어갑니다. 다시 create를 시도하지는 않습니다.</p>
 *
 * <p><strong>갱신 안전성:</strong> 조회한 WorkBundle에 resourceVersion이 없으면 조건부 갱신이
 * 불가능하므로 {@link UnconditionalWriteException}으로 실패합니다.</p>
 *
 * <p><strong>예외 전파:</strong></p>
 * <ul>
 *   <li>BundleConflictException, 취소/기한 예외: 감싸지 않고 그대로 전파</li>
 *   <li>조회 실패: {@link WorkBundleFetchException}</li>
 *   <li>생성/갱신 실패: {@link WorkBundleWriteException}</li>
 * </ul>
 *
 * <p>내부 재시도는 없습니다. 재시도는 호출자(조정 루프)의 책임입니다.</p>
 *
 * @author WorkBundle Team
 * @since 1.0.0
 */
public final class WorkSynchronizer {

    private static final Logger log = LoggerFactory.getLogger(WorkSynchronizer.class);
    static final String OPERATION = "converge";

    private final RemoteStoreGateway gateway;

    /**
     * 생성자.
     *
     * @param gateway 원격 저장소 게이트웨이
     * @throws IllegalArgumentException gateway가 null인 경우
     */
    public WorkSynchronizer(RemoteStoreGateway gateway) {
        if (gateway == null) {
            throw new IllegalArgumentException("gateway cannot be null");
        }
        this.gateway = gateway;
    }

    /**
     * 원격 WorkBundle을 desired 상태로 수렴.
     *
     * @param ctx 취소/기한 컨텍스트
     * @param desired 원하는 WorkBundle
     * @return Created, Updated, Unchanged 중 하나
     * @throws WorkBundleFetchException 조회 실패 시
     * @throws WorkBundleWriteException 생성/갱신 실패 시
     * @throws BundleConflictException 조건부 갱신 충돌 시
     * @throws UnconditionalWriteException 조회 결과에 resourceVersion이 없는 경우
     * @throws OperationCancelledException 취소된 경우
     * @throws DeadlineExceededException 기한이 지난 경우
     */
    public SyncOutcome converge(OperationContext ctx, WorkBundle desired) {
        if (ctx == null) {
            throw new IllegalArgumentException("ctx cannot be null");
        }
        if (desired == null) {
            throw new IllegalArgumentException("desired cannot be null");
        }

        BundleKey key = desired.key();
        Optional<WorkBundle> fetched = fetch(ctx, key);

        WorkBundle current;
        if (fetched.isPresent()) {
            current = fetched.get();
        } else {
            Optional<WorkBundle> peerCreated = create(ctx, desired);
            if (peerCreated.isEmpty()) {
                return new Created(key);
            }
            current = peerCreated.get();
        }

        if (ManifestSequences.sameContent(current, desired)) {
            log.debug("WorkBundle {} is up to date (resourceVersion={})", key, current.resourceVersion());
            return new Unchanged(key);
        }

        update(ctx, key, current.withManifests(desired.manifests()));
        return new Updated(key);
    }

    private Optional<WorkBundle> fetch(OperationContext ctx, BundleKey key) {
        ctx.checkActive(OPERATION);
        try {
            return Optional.of(gateway.get(ctx, key));
        } catch (BundleNotFoundException e) {
            return Optional.empty();
        } catch (OperationCancelledException | DeadlineExceededException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new WorkBundleFetchException(OPERATION, key, e);
        }
    }

    /**
     * 생성 시도.
     *
     * @return 정상 생성 시 empty, 다른 작성자가 먼저 생성한 경우 재조회 결과
     */
    private Optional<WorkBundle> create(OperationContext ctx, WorkBundle desired) {
        BundleKey key = desired.key();
        ctx.checkActive(OPERATION);
        try {
            gateway.create(ctx, desired);
            log.info("Created WorkBundle {} with {} manifests", key, desired.manifests().size());
            return Optional.empty();
        } catch (BundleAlreadyExistsException e) {
            log.warn("WorkBundle {} was created concurrently, re-fetching", key);
            WorkBundle peer = fetch(ctx, key)
                .orElseThrow(() -> new WorkBundleFetchException(OPERATION, key, e));
            return Optional.of(peer);
        } catch (OperationCancelledException | DeadlineExceededException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new WorkBundleWriteException(OPERATION, key, e);
        }
    }

    private void update(OperationContext ctx, BundleKey key, WorkBundle replacement) {
        if (replacement.resourceVersion() == null) {
            throw new UnconditionalWriteException(key);
        }
        ctx.checkActive(OPERATION);
        try {
            gateway.update(ctx, replacement);
            log.info("Updated WorkBundle {} to {} manifests (from resourceVersion={})",
                key, replacement.manifests().size(), replacement.resourceVersion());
        } catch (BundleConflictException | OperationCancelledException | DeadlineExceededException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new WorkBundleWriteException(OPERATION, key, e);
        }
    }
}
