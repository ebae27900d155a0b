/**
 * 백그라운드 유지보수 컴포넌트.
 *
 * <p>{@link com.ryuqq.recordstore.adapter.runner.ExpiredLockReaper}는 아무도 다시 조회하지 않아
 * 지연 만료되지 못한 락 엔트리를 주기적으로 정리합니다.</p>
 */
package com.ryuqq.recordstore.adapter.runner;
