package com.ryuqq.workbundle.application.bundle;

import com.ryuqq.workbundle.core.context.OperationContext;
import com.ryuqq.workbundle.core.exception.BundleAlreadyExistsException;
import com.ryuqq.workbundle.core.exception.BundleConflictException;
import com.ryuqq.workbundle.core.exception.BundleNotFoundException;
import com.ryuqq.workbundle.core.exception.DeadlineExceededException;
import com.ryuqq.workbundle.core.exception.OperationCancelledException;
import com.ryuqq.workbundle.core.exception.RemoteStoreException;
import com.ryuqq.workbundle.core.exception.UnconditionalWriteException;
import com.ryuqq.workbundle.core.exception.WorkBundleFetchException;
import com.ryuqq.workbundle.core.exception.WorkBundleWriteException;
import com.ryuqq.workbundle.core.model.BundleKey;
import com.ryuqq.workbundle.core.model.Manifest;
import com.ryuqq.workbundle.core.model.WorkBundle;
import com.ryuqq.workbundle.core.outcome.Created;
import com.ryuqq.workbundle.core.outcome.SyncOutcome;
import com.ryuqq.workbundle.core.outcome.Unchanged;
import com.ryuqq.workbundle.core.outcome.Updated;
import com.ryuqq.workbundle.core.spi.RemoteStoreGateway;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * WorkSynchronizer 유닛 테스트.
 *
 * <p>create-or-update convergence 분기를 검증합니다:</p>
 * <ul>
 *   <li>NotFound → create → Created</li>
 *   <li>동일 → 쓰기 없음 → Unchanged</li>
 *   <li>다름 → 조회 객체 기준 조건부 update → Updated</li>
 *   <li>동시 생성 경쟁 → 재조회 후 비교/갱신</li>
 *   <li>예외 감싸기/전파 규칙</li>
 * </ul>
 *
 * @author WorkBundle Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class WorkSynchronizerTest {

    private static final BundleKey KEY = BundleKey.of("app1-ns1-vrg-mw", "cluster-a");
    private static final Manifest VRG_V1 = Manifest.of("ramendr.openshift.io/v1alpha1", "VolumeReplicationGroup",
        "{\"metadata\":{\"name\":\"app1\"},\"spec\":{\"replicationState\":\"primary\"}}");
    private static final Manifest VRG_V2 = Manifest.of("ramendr.openshift.io/v1alpha1", "VolumeReplicationGroup",
        "{\"metadata\":{\"name\":\"app1\"},\"spec\":{\"replicationState\":\"secondary\"}}");

    @Mock
    private RemoteStoreGateway gateway;

    private WorkSynchronizer synchronizer;
    private OperationContext ctx;

    @BeforeEach
    void setUp() {
        synchronizer = new WorkSynchronizer(gateway);
        ctx = OperationContext.background();
    }

    private static WorkBundle desired(Manifest... manifests) {
        return new WorkBundle(KEY.name(), KEY.location(), Map.of("app", "VRG"), Map.of(), List.of(manifests), null, null);
    }

    private static WorkBundle remote(String version, Manifest... manifests) {
        return new WorkBundle(KEY.name(), KEY.location(), Map.of("app", "VRG"), Map.of("owner", "remote"),
            List.of(manifests), version, null);
    }

    // ============================================================
    // 1. 생성 / 변경 없음 / 갱신
    // ============================================================

    @Test
    void converge_원격에_없으면_create_호출_후_Created() {
        // given
        WorkBundle bundle = desired(VRG_V1);
        when(gateway.get(any(), eq(KEY))).thenThrow(new BundleNotFoundException(KEY));
        when(gateway.create(any(), eq(bundle))).thenReturn(bundle.withResourceVersion("1"));

        // when
        SyncOutcome outcome = synchronizer.converge(ctx, bundle);

        // then
        assertThat(outcome).isEqualTo(new Created(KEY));
        verify(gateway).create(ctx, bundle);
        verify(gateway, never()).update(any(), any());
    }

    @Test
    void converge_Manifest_시퀀스가_같으면_쓰기_없이_Unchanged() {
        // given
        when(gateway.get(any(), eq(KEY))).thenReturn(remote("5", VRG_V1));

        // when
        SyncOutcome outcome = synchronizer.converge(ctx, desired(VRG_V1));

        // then
        assertThat(outcome).isEqualTo(new Unchanged(KEY));
        verify(gateway, never()).create(any(), any());
        verify(gateway, never()).update(any(), any());
    }

    @Test
    void converge_Manifest가_다르면_조회한_객체의_버전으로_update_후_Updated() {
        // given
        WorkBundle fetched = remote("5", VRG_V1);
        when(gateway.get(any(), eq(KEY))).thenReturn(fetched);
        when(gateway.update(any(), any())).thenAnswer(invocation -> invocation.getArgument(1));

        // when
        SyncOutcome outcome = synchronizer.converge(ctx, desired(VRG_V2));

        // then
        assertThat(outcome).isEqualTo(new Updated(KEY));

        ArgumentCaptor<WorkBundle> captor = ArgumentCaptor.forClass(WorkBundle.class);
        verify(gateway).update(eq(ctx), captor.capture());
        WorkBundle submitted = captor.getValue();
        assertThat(submitted.resourceVersion()).isEqualTo("5");
        assertThat(submitted.manifests()).containsExactly(VRG_V2);
        assertThat(submitted.annotations()).isEqualTo(fetched.annotations());
    }

    @Test
    void converge_Manifest_개수가_다르면_Updated() {
        // given
        when(gateway.get(any(), eq(KEY))).thenReturn(remote("2", VRG_V1));
        when(gateway.update(any(), any())).thenAnswer(invocation -> invocation.getArgument(1));

        // when
        SyncOutcome outcome = synchronizer.converge(ctx, desired(VRG_V1, VRG_V2));

        // then
        assertThat(outcome.isUpdated()).isTrue();
    }

    @Test
    void converge_순서만_달라도_Updated() {
        // given
        when(gateway.get(any(), eq(KEY))).thenReturn(remote("2", VRG_V1, VRG_V2));
        when(gateway.update(any(), any())).thenAnswer(invocation -> invocation.getArgument(1));

        // when
        SyncOutcome outcome = synchronizer.converge(ctx, desired(VRG_V2, VRG_V1));

        // then
        assertThat(outcome.isUpdated()).isTrue();
    }

    // ============================================================
    // 2. 동시 생성 경쟁
    // ============================================================

    @Test
    void converge_create가_AlreadyExists면_재조회_후_같으면_Unchanged() {
        // given
        WorkBundle bundle = desired(VRG_V1);
        when(gateway.get(any(), eq(KEY)))
            .thenThrow(new BundleNotFoundException(KEY))
            .thenReturn(remote("1", VRG_V1));
        when(gateway.create(any(), any())).thenThrow(new BundleAlreadyExistsException(KEY));

        // when
        SyncOutcome outcome = synchronizer.converge(ctx, bundle);

        // then
        assertThat(outcome.isUnchanged()).isTrue();
        verify(gateway, times(2)).get(ctx, KEY);
        verify(gateway, times(1)).create(any(), any());
        verify(gateway, never()).update(any(), any());
    }

    @Test
    void converge_create가_AlreadyExists면_재조회_후_다르면_Updated() {
        // given
        when(gateway.get(any(), eq(KEY)))
            .thenThrow(new BundleNotFoundException(KEY))
            .thenReturn(remote("1", VRG_V1));
        when(gateway.create(any(), any())).thenThrow(new BundleAlreadyExistsException(KEY));
        when(gateway.update(any(), any())).thenAnswer(invocation -> invocation.getArgument(1));

        // when
        SyncOutcome outcome = synchronizer.converge(ctx, desired(VRG_V2));

        // then
        assertThat(outcome.isUpdated()).isTrue();
        verify(gateway, times(1)).create(any(), any());
    }

    @Test
    void converge_AlreadyExists_후_재조회도_NotFound면_WorkBundleFetchException() {
        // given
        when(gateway.get(any(), eq(KEY))).thenThrow(new BundleNotFoundException(KEY));
        when(gateway.create(any(), any())).thenThrow(new BundleAlreadyExistsException(KEY));

        // when & then
        assertThatThrownBy(() -> synchronizer.converge(ctx, desired(VRG_V1)))
            .isInstanceOf(WorkBundleFetchException.class)
            .hasCauseInstanceOf(BundleAlreadyExistsException.class);
        verify(gateway, times(1)).create(any(), any());
    }

    // ============================================================
    // 3. 예외 감싸기 / 전파
    // ============================================================

    @Test
    void converge_조회_실패는_WorkBundleFetchException으로_감싸짐() {
        // given
        RemoteStoreException cause = new RemoteStoreException("connection refused");
        when(gateway.get(any(), eq(KEY))).thenThrow(cause);

        // when & then
        assertThatThrownBy(() -> synchronizer.converge(ctx, desired(VRG_V1)))
            .isInstanceOf(WorkBundleFetchException.class)
            .hasMessageContaining("converge")
            .hasMessageContaining(KEY.name())
            .hasMessageContaining(KEY.location())
            .hasCause(cause);
        verify(gateway, never()).create(any(), any());
    }

    @Test
    void converge_생성_실패는_WorkBundleWriteException으로_감싸짐() {
        // given
        when(gateway.get(any(), eq(KEY))).thenThrow(new BundleNotFoundException(KEY));
        when(gateway.create(any(), any())).thenThrow(new RemoteStoreException("503"));

        // when & then
        assertThatThrownBy(() -> synchronizer.converge(ctx, desired(VRG_V1)))
            .isInstanceOf(WorkBundleWriteException.class)
            .hasCauseInstanceOf(RemoteStoreException.class);
    }

    @Test
    void converge_update_충돌은_감싸지_않고_그대로_전파() {
        // given
        BundleConflictException conflict = new BundleConflictException(KEY, "5", "6");
        when(gateway.get(any(), eq(KEY))).thenReturn(remote("5", VRG_V1));
        when(gateway.update(any(), any())).thenThrow(conflict);

        // when & then
        assertThatThrownBy(() -> synchronizer.converge(ctx, desired(VRG_V2)))
            .isSameAs(conflict);
    }

    @Test
    void converge_update_기타_실패는_WorkBundleWriteException() {
        // given
        when(gateway.get(any(), eq(KEY))).thenReturn(remote("5", VRG_V1));
        when(gateway.update(any(), any())).thenThrow(new IllegalStateException("broken pipe"));

        // when & then
        assertThatThrownBy(() -> synchronizer.converge(ctx, desired(VRG_V2)))
            .isInstanceOf(WorkBundleWriteException.class)
            .hasCauseInstanceOf(IllegalStateException.class);
    }

    @Test
    void converge_조회_객체에_버전이_없으면_update하지_않고_UnconditionalWriteException() {
        // given
        when(gateway.get(any(), eq(KEY))).thenReturn(remote(null, VRG_V1));

        // when & then
        assertThatThrownBy(() -> synchronizer.converge(ctx, desired(VRG_V2)))
            .isInstanceOf(UnconditionalWriteException.class);
        verify(gateway, never()).update(any(), any());
    }

    @Test
    void converge_버전이_없어도_내용이_같으면_Unchanged() {
        // given
        when(gateway.get(any(), eq(KEY))).thenReturn(remote(null, VRG_V1));

        // when
        SyncOutcome outcome = synchronizer.converge(ctx, desired(VRG_V1));

        // then
        assertThat(outcome.isUnchanged()).isTrue();
    }

    // ============================================================
    // 4. 취소 / 기한
    // ============================================================

    @Test
    void converge_취소된_컨텍스트면_원격_호출_없이_OperationCancelledException() {
        // given
        ctx.cancel();

        // when & then
        assertThatThrownBy(() -> synchronizer.converge(ctx, desired(VRG_V1)))
            .isInstanceOf(OperationCancelledException.class);
        verifyNoInteractions(gateway);
    }

    @Test
    void converge_기한이_지난_컨텍스트면_DeadlineExceededException() {
        // given
        OperationContext expired = OperationContext.background().withDeadline(Instant.now().minusSeconds(1));

        // when & then
        assertThatThrownBy(() -> synchronizer.converge(expired, desired(VRG_V1)))
            .isInstanceOf(DeadlineExceededException.class);
        verifyNoInteractions(gateway);
    }

    @Test
    void converge_조회와_생성_사이에_취소되면_create하지_않음() {
        // given
        when(gateway.get(any(), eq(KEY))).thenAnswer(invocation -> {
            ctx.cancel();
            throw new BundleNotFoundException(KEY);
        });

        // when & then
        assertThatThrownBy(() -> synchronizer.converge(ctx, desired(VRG_V1)))
            .isInstanceOf(OperationCancelledException.class);
        verify(gateway, never()).create(any(), any());
    }

    @Test
    void converge_게이트웨이가_던진_기한_초과는_감싸지_않음() {
        // given
        DeadlineExceededException deadline = new DeadlineExceededException("get", Instant.now());
        when(gateway.get(any(), eq(KEY))).thenThrow(deadline);

        // when & then
        assertThatThrownBy(() -> synchronizer.converge(ctx, desired(VRG_V1)))
            .isSameAs(deadline);
    }

    @Test
    void constructor_gateway가_null이면_예외() {
        assertThatThrownBy(() -> new WorkSynchronizer(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("gateway cannot be null");
    }
}
