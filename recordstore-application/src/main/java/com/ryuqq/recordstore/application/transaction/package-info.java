/**
 * 트랜잭션 실행 계층.
 *
 * <p>{@link com.ryuqq.recordstore.application.transaction.TransactionExecutor}는 RecordStore의
 * 키 단위 락과 레코드 테이블을 조합하여 "한 번만 계산하고 이후에는 캐시 반환"하는
 * 호출 패턴을 제공합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.recordstore.application.transaction;
