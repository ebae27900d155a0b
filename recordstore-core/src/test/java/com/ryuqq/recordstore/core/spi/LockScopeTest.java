package com.ryuqq.recordstore.core.spi;

import com.ryuqq.recordstore.core.exception.NotHolderException;
import com.ryuqq.recordstore.core.model.HolderId;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

/**
 * LockScope 유닛 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class LockScopeTest {

    private static final String KEY = "txn-1";

    @Mock
    private RecordStore store;

    @Test
    void open_획득_후_close_시_해제() {
        // given
        HolderId holder = HolderId.of("holder1");
        when(store.acquireLock(KEY, holder, null, null)).thenReturn(true);

        // when
        try (LockScope scope = LockScope.open(store, KEY, holder, null)) {
            assertThat(scope.key()).isEqualTo(KEY);
            assertThat(scope.holder()).isEqualTo(holder);
        }

        // then
        InOrder inOrder = inOrder(store);
        inOrder.verify(store).acquireLock(KEY, holder, null, null);
        inOrder.verify(store).releaseLock(KEY, holder);
    }

    @Test
    void holder_생략_시_기본_holder로_획득_및_해제() {
        // given
        when(store.acquireLock(eq(KEY), eq(HolderId.DEFAULT), isNull(), isNull())).thenReturn(true);

        // when
        LockScope scope = LockScope.open(store, KEY, null, null);
        scope.close();

        // then
        assertThat(scope.holder()).isSameAs(HolderId.DEFAULT);
        verify(store).releaseLock(KEY, HolderId.DEFAULT);
    }

    @Test
    void holdTimeout_전달() {
        // given
        Duration holdTimeout = Duration.ofSeconds(30);
        when(store.acquireLock(KEY, HolderId.DEFAULT, holdTimeout, null)).thenReturn(true);

        // when
        LockScope.open(store, KEY, null, holdTimeout).close();

        // then
        verify(store).acquireLock(KEY, HolderId.DEFAULT, holdTimeout, null);
    }

    @Test
    void 본문_예외_발생해도_해제됨() {
        // given
        when(store.acquireLock(any(), any(), any(), any())).thenReturn(true);

        // when & then
        assertThatThrownBy(() -> {
            try (LockScope ignored = LockScope.open(store, KEY, null, null)) {
                throw new IllegalStateException("computation failed");
            }
        }).isInstanceOf(IllegalStateException.class).hasMessage("computation failed");

        verify(store).releaseLock(KEY, HolderId.DEFAULT);
    }

    @Test
    void 본문_예외와_해제_실패가_겹치면_해제_실패는_suppressed() {
        // given
        when(store.acquireLock(any(), any(), any(), any())).thenReturn(true);
        NotHolderException releaseFailure = new NotHolderException(KEY, HolderId.DEFAULT);
        doThrow(releaseFailure).when(store).releaseLock(KEY, HolderId.DEFAULT);

        // when & then
        assertThatThrownBy(() -> {
            try (LockScope ignored = LockScope.open(store, KEY, null, null)) {
                throw new IllegalStateException("computation failed");
            }
        }).isInstanceOf(IllegalStateException.class)
            .satisfies(e -> assertThat(e.getSuppressed()).containsExactly(releaseFailure));
    }

    @Test
    void close_중복_호출은_한_번만_해제() {
        // given
        when(store.acquireLock(any(), any(), any(), any())).thenReturn(true);
        LockScope scope = LockScope.open(store, KEY, null, null);

        // when
        scope.close();
        scope.close();

        // then
        verify(store, times(1)).releaseLock(KEY, HolderId.DEFAULT);
        assertThat(scope.isHeld()).isFalse();
    }

    @Test
    void 획득_실패_시_IllegalStateException() {
        // given
        when(store.acquireLock(any(), any(), any(), any())).thenReturn(false);

        // when & then
        assertThatThrownBy(() -> LockScope.open(store, KEY, null, null))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining(KEY);
        verify(store, never()).releaseLock(any(), any());
    }

    @Test
    void store_null_이면_예외() {
        // when & then
        assertThatThrownBy(() -> LockScope.open(null, KEY, null, null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("store cannot be null");
    }
}
