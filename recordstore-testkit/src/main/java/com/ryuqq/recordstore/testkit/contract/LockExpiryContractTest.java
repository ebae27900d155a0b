package com.ryuqq.recordstore.testkit.contract;

import com.ryuqq.recordstore.core.exception.NotHolderException;
import com.ryuqq.recordstore.core.spi.LockScope;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for hold timeouts and lazy expiry.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>A lock with a hold timeout is no longer locked once the timeout passes</li>
 *   <li>A blocked acquirer obtains the lock when the previous holder's hold expires</li>
 *   <li>Re-acquisition by the holder keeps the original deadline</li>
 *   <li>An expired lock can no longer be released by its former holder</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public abstract class LockExpiryContractTest extends AbstractRecordStoreContractTest {

    @Test
    void testAcquireLock_WithHoldTimeout_ExpiresAfterTimeout() {
        // Given
        String key = newKey();

        // When
        assertTrue(store.acquireLock(key, null, Duration.ofMillis(100)));
        assertTrue(store.isLocked(key));
        sleep(200);

        // Then
        assertUnlocked(key);
    }

    @Test
    void testAcquireLock_PreviousHolderTimedOut_BlocksThenAcquires() {
        // Given
        String key = newKey();
        assertTrue(store.acquireLock(key, HOLDER_1, Duration.ofMillis(100)));
        assertTrue(store.isLocked(key));

        // When: blocks and acquires the lock
        long start = System.nanoTime();
        assertTrue(store.acquireLock(key, HOLDER_2));
        long elapsed = elapsedMillis(start);

        // Then
        assertTrue(elapsed >= 50, "Acquire should have waited for the hold to expire, waited " + elapsed + "ms");
        assertLockedBy(key, HOLDER_2);
        assertFalse(store.isLockHolder(key, HOLDER_1));
        store.releaseLock(key, HOLDER_2);
        assertUnlocked(key);
    }

    @Test
    void testAcquireLock_AcquireTimeoutLongerThanHold_Acquires() {
        // Given
        String key = newKey();
        assertTrue(store.acquireLock(key, HOLDER_1, Duration.ofMillis(100)));

        // When & Then
        assertTrue(store.acquireLock(key, HOLDER_2, null, Duration.ofSeconds(5)));
        assertLockedBy(key, HOLDER_2);
        store.releaseLock(key, HOLDER_2);
    }

    @Test
    void testAcquireLock_SameHolderAgain_KeepsOriginalDeadline() {
        // Given
        String key = newKey();
        assertTrue(store.acquireLock(key, HOLDER_1, Duration.ofMillis(150)));
        sleep(50);

        // When: re-entrant acquire with a much longer hold timeout
        assertTrue(store.acquireLock(key, HOLDER_1, Duration.ofSeconds(30)));
        sleep(200);

        // Then: the first deadline still applies
        assertUnlocked(key);
    }

    @Test
    void testWaitForLock_ExpiringLock_ReturnsTrue() {
        // Given
        String key = newKey();
        assertTrue(store.acquireLock(key, HOLDER_1, Duration.ofMillis(100)));
        assertTrue(store.isLocked(key));

        // When & Then
        assertTrue(store.waitForLock(key));
        assertUnlocked(key);
    }

    @Test
    void testWaitForLock_TimeoutShorterThanHold_ReturnsFalse() {
        // Given
        String key = newKey();
        assertTrue(store.acquireLock(key, HOLDER_1, Duration.ofSeconds(5)));

        // When & Then
        assertFalse(store.waitForLock(key, Duration.ofMillis(100)));
        assertLockedBy(key, HOLDER_1);
        store.releaseLock(key, HOLDER_1);
    }

    @Test
    void testReleaseLock_AfterExpiry_ThrowsNotHolder() {
        // Given
        String key = newKey();
        assertTrue(store.acquireLock(key, HOLDER_1, Duration.ofMillis(50)));
        sleep(150);

        // When & Then
        assertThrows(NotHolderException.class, () -> store.releaseLock(key, HOLDER_1));
        assertUnlocked(key);
    }

    @Test
    void testLock_ScopedHoldExpiredInside_CloseThrowsNotHolder() {
        // Given
        String key = newKey();

        // When & Then
        assertThrows(NotHolderException.class, () -> {
            try (LockScope scope = store.lock(key, HOLDER_1, Duration.ofMillis(50))) {
                sleep(150);
                assertFalse(scope.isHeld());
            }
        });
        assertUnlocked(key);
    }

    @Test
    void testReapExpiredLocks_NeverRemovesLiveLocks() {
        // Given
        String live = newKey();
        String expired = newKey();
        assertTrue(store.acquireLock(live, HOLDER_1));
        assertTrue(store.acquireLock(expired, HOLDER_2, Duration.ofMillis(50)));
        sleep(150);

        // When
        int reaped = store.reapExpiredLocks(100);

        // Then
        assertTrue(reaped >= 0);
        assertLockedBy(live, HOLDER_1);
        assertUnlocked(expired);
        store.releaseLock(live, HOLDER_1);
    }

    @Test
    void testReapExpiredLocks_NonPositiveBatch_ThrowsIllegalArgumentException() {
        assertThrows(IllegalArgumentException.class, () -> store.reapExpiredLocks(0));
    }
}
