package com.ryuqq.recordstore.adapter.inmemory.store;

import com.ryuqq.recordstore.core.model.HolderId;
import com.ryuqq.recordstore.core.spi.RecordStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * InMemoryRecordStore 프로세스 단일 인스턴스 및 진단 메서드 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class InMemoryRecordStoreTest {

    @BeforeEach
    void setUp() {
        InMemoryRecordStore.resetInstance();
    }

    @AfterEach
    void tearDown() {
        InMemoryRecordStore.resetInstance();
    }

    @Test
    void getInstance_두_번_호출_시_동일_인스턴스() {
        // when
        InMemoryRecordStore store1 = InMemoryRecordStore.getInstance();
        InMemoryRecordStore store2 = InMemoryRecordStore.getInstance();

        // then
        assertThat(store1).isSameAs(store2);
    }

    @Test
    void getInstance_재호출해도_내부_상태_유지() {
        // given
        InMemoryRecordStore.getInstance().write("txn-1", "value");
        InMemoryRecordStore.getInstance().acquireLock("txn-2", HolderId.of("holder1"));

        // when
        RecordStore again = InMemoryRecordStore.getInstance();

        // then
        assertThat(again.read("txn-1").result()).isEqualTo("value");
        assertThat(again.isLockHolder("txn-2", HolderId.of("holder1"))).isTrue();
    }

    @Test
    void getInstance_동시_최초_호출_시_하나의_인스턴스만_생성() throws Exception {
        // given
        int threadCount = 16;
        ExecutorService executorService = Executors.newFixedThreadPool(threadCount);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<InMemoryRecordStore>> futures = new ArrayList<>();

        // when
        for (int i = 0; i < threadCount; i++) {
            futures.add(executorService.submit(() -> {
                start.await();
                return InMemoryRecordStore.getInstance();
            }));
        }
        start.countDown();

        List<InMemoryRecordStore> instances = new ArrayList<>();
        for (Future<InMemoryRecordStore> future : futures) {
            instances.add(future.get(5, TimeUnit.SECONDS));
        }
        executorService.shutdown();

        // then
        assertThat(instances).allSatisfy(instance -> assertThat(instance).isSameAs(instances.get(0)));
    }

    @Test
    void resetInstance_이후_새_인스턴스_생성() {
        // given
        InMemoryRecordStore before = InMemoryRecordStore.getInstance();
        before.write("txn-1", "value");

        // when
        InMemoryRecordStore.resetInstance();
        InMemoryRecordStore after = InMemoryRecordStore.getInstance();

        // then
        assertThat(after).isNotSameAs(before);
        assertThat(after.exists("txn-1")).isFalse();
        assertThat(after.recordCount()).isZero();
    }

    @Test
    void recordCount_덮어쓰기는_개수_증가_없음() {
        // given
        InMemoryRecordStore store = InMemoryRecordStore.getInstance();

        // when
        store.write("txn-1", "a");
        store.write("txn-1", "b");
        store.write("txn-2", "c");

        // then
        assertThat(store.recordCount()).isEqualTo(2);
    }

    @Test
    void 해제된_키의_락_관리_정보는_남지_않음() {
        // given
        InMemoryRecordStore store = InMemoryRecordStore.getInstance();
        HolderId holder = HolderId.of("holder1");

        // when
        for (int i = 0; i < 100; i++) {
            String key = "txn-" + i;
            store.acquireLock(key, holder);
            store.write(key, i, holder);
            store.releaseLock(key, holder);
        }
        store.write("unlocked", "value");
        store.isLocked("never-locked");
        store.waitForLock("never-locked", Duration.ZERO);

        // then
        assertThat(store.trackedLockCount()).isZero();
        assertThat(store.recordCount()).isEqualTo(101);
    }

    @Test
    void reapExpiredLocks_만료된_락만_제거() {
        // given
        InMemoryRecordStore store = InMemoryRecordStore.getInstance();
        store.acquireLock("live", HolderId.of("holder1"));
        store.acquireLock("expired-1", HolderId.of("holder2"), Duration.ofMillis(20));
        store.acquireLock("expired-2", HolderId.of("holder3"), Duration.ofMillis(20));
        sleep(100);

        // when
        int reaped = store.reapExpiredLocks(10);

        // then
        assertThat(reaped).isEqualTo(2);
        assertThat(store.trackedLockCount()).isEqualTo(1);
        assertThat(store.isLockHolder("live", HolderId.of("holder1"))).isTrue();
    }

    @Test
    void reapExpiredLocks_batchSize_만큼만_제거() {
        // given
        InMemoryRecordStore store = InMemoryRecordStore.getInstance();
        for (int i = 0; i < 5; i++) {
            store.acquireLock("expired-" + i, HolderId.of("holder" + i), Duration.ofMillis(20));
        }
        sleep(100);

        // when
        int first = store.reapExpiredLocks(3);
        int second = store.reapExpiredLocks(3);

        // then
        assertThat(first).isEqualTo(3);
        assertThat(second).isEqualTo(2);
        assertThat(store.trackedLockCount()).isZero();
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException("Sleep interrupted", e);
        }
    }
}
