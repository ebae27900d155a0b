package com.ryuqq.recordstore.application.transaction;

import com.ryuqq.recordstore.core.exception.NotHolderException;
import com.ryuqq.recordstore.core.model.HolderId;
import com.ryuqq.recordstore.core.model.TransactionRecord;
import com.ryuqq.recordstore.core.spi.LockScope;
import com.ryuqq.recordstore.core.spi.RecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Supplier;

/**
 * 트랜잭션 실행기.
 *
 * <p>같은 키의 트랜잭션을 정확히 한 번만 계산하고, 이후 호출에는 저장된 결과를 돌려줍니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * 1. store.lock(key, holder, holdTimeout) → 키 단위 배타 구간 진입
 * 2. store.read(key)
 *    - 존재: TransactionHandle.cached(...)
 *    - 부재: computation.get() → store.write(key, result, holder) → TransactionHandle.computed(...)
 * 3. LockScope.close() → 락 해제 (예외 발생 시에도, 이미 만료된 락은 건너뜀)
 * </pre>
 *
 * <p><strong>실패 처리:</strong></p>
 * <ul>
 *   <li>computation 예외: 아무것도 기록하지 않고 락 해제 후 그대로 전파</li>
 *   <li>보유 시간 만료 후 다른 holder가 획득한 경우: write가 HolderConflictException 발생</li>
 *   <li>보유 시간 만료 후 아무도 획득하지 않은 경우: 결과를 기록하고 computed 핸들 반환</li>
 * </ul>
 *
 * <p>RecordStore는 생성자로 주입받습니다. 프로세스 전역 인스턴스를 공유하려면
 * 호출 측에서 {@code InMemoryRecordStore.getInstance()}를 넘깁니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class TransactionExecutor {

    private static final Logger log = LoggerFactory.getLogger(TransactionExecutor.class);

    private final RecordStore store;
    private final ExecutorConfig config;

    /**
     * 생성자.
     *
     * @param store 레코드 저장소
     * @param config 실행 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public TransactionExecutor(RecordStore store, ExecutorConfig config) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.store = store;
        this.config = config;
    }

    /**
     * 트랜잭션 실행.
     *
     * @param key 트랜잭션 키
     * @param holder 락 보유자 (null이면 {@link HolderId#DEFAULT})
     * @param computation 결과 계산 함수 (캐시 적중 시 호출되지 않음)
     * @return 실행 핸들
     * @throws IllegalArgumentException key 또는 computation이 null인 경우
     * @throws com.ryuqq.recordstore.core.exception.HolderConflictException 보유 시간 만료로 다른 holder가 락을 가져간 경우
     */
    public TransactionHandle execute(String key, HolderId holder, Supplier<?> computation) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        if (computation == null) {
            throw new IllegalArgumentException("computation cannot be null");
        }

        LockScope scope = store.lock(key, holder, config.holdTimeout());
        try {
            TransactionRecord cached = store.read(key);
            if (cached != null) {
                log.debug("Transaction served from cache: key={}, holder={}", key, scope.holder());
                return TransactionHandle.cached(key, cached);
            }

            Object result = computation.get();
            store.write(key, result, scope.holder());
            TransactionRecord written = store.read(key);
            log.debug("Transaction computed: key={}, holder={}", key, scope.holder());
            return TransactionHandle.computed(key, written);
        } finally {
            release(scope);
        }
    }

    /**
     * 기본 holder로 트랜잭션 실행.
     *
     * @param key 트랜잭션 키
     * @param computation 결과 계산 함수
     * @return 실행 핸들
     */
    public TransactionHandle execute(String key, Supplier<?> computation) {
        return execute(key, null, computation);
    }

    /**
     * 락 해제.
     *
     * <p>계산이 holdTimeout보다 오래 걸려 락이 이미 만료된 경우 해제할 락이 없으므로
     * NotHolderException을 DEBUG로 기록하고 넘어갑니다. 이미 저장된 결과나 계산 예외는
     * 그대로 호출자에게 전달됩니다.</p>
     */
    private void release(LockScope scope) {
        try {
            scope.close();
        } catch (NotHolderException e) {
            log.debug("Lock hold expired before release: key={}, holder={}", scope.key(), scope.holder());
        }
    }
}
