package com.ryuqq.breakfast.core.sync;

import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 공유 출력 대상 보호용 상호 배제 잠금.
 *
 * <p>동시에 실행되는 WorkUnit들의 시작 메시지가 문자 단위로 섞이지 않도록
 * 한 번에 하나의 호출자만 보호 구간을 실행하도록 보장합니다.</p>
 *
 * <p><strong>소유권:</strong></p>
 * <ul>
 *   <li>전역 상태가 아니며 Scheduler 인스턴스가 생성하고 소유합니다.</li>
 *   <li>각 WorkUnit 실행에 빌려주기만 하며 소유권 이전은 없습니다.</li>
 * </ul>
 *
 * <p><strong>제약:</strong></p>
 * <ul>
 *   <li>공정성 보장 없음 (대기자 간 순서 미정)</li>
 *   <li>재진입 불가: 보호 구간 안에서 다시 withLock() 호출 시 IllegalStateException</li>
 * </ul>
 *
 * @author Breakfast Team
 * @since 1.0.0
 */
public final class OutputGuard {

    private final ReentrantLock lock = new ReentrantLock();
    private final AtomicLong acquisitions = new AtomicLong();

    /**
     * 잠금을 보유한 상태로 action 실행.
     *
     * <p>action이 예외로 종료되더라도 잠금은 반드시 해제됩니다.</p>
     *
     * @param action 보호 구간에서 실행할 동작
     * @throws IllegalArgumentException action이 null인 경우
     * @throws IllegalStateException 현재 스레드가 이미 잠금을 보유한 경우
     */
    public void withLock(Runnable action) {
        if (action == null) {
            throw new IllegalArgumentException("action cannot be null");
        }
        if (lock.isHeldByCurrentThread()) {
            throw new IllegalStateException("OutputGuard is not reentrant");
        }
        lock.lock();
        try {
            acquisitions.incrementAndGet();
            action.run();
        } finally {
            lock.unlock();
        }
    }

    /**
     * 누적 잠금 획득 횟수.
     *
     * @return 생성 이후 withLock()으로 잠금을 획득한 횟수
     */
    public long acquisitionCount() {
        return acquisitions.get();
    }

    /**
     * 현재 잠금이 보유 중인지 확인 (모니터링 용도).
     *
     * @return 어떤 스레드든 보유 중이면 true
     */
    public boolean isLocked() {
        return lock.isLocked();
    }
}
