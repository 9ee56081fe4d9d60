package com.ryuqq.breakfast.application.scheduler;

import com.ryuqq.breakfast.core.model.WorkUnit;

import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;

/**
 * 디스패치된 WorkUnit 1개에 대한 핸들.
 *
 * <p>join은 {@link #await()}로 정확히 한 번만 수행합니다.
 * 작업 실패는 예외로 던지지 않고 Optional로 반환하여,
 * 호출자가 나머지 핸들을 모두 join한 뒤 실패를 보고할 수 있게 합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * UnitHandle handle = UnitHandle.of(unit, pool.submit(task));
 * Optional&lt;Throwable&gt; failure = handle.await();
 * </pre>
 *
 * @author Breakfast Team
 * @since 1.0.0
 */
public final class UnitHandle {

    private final WorkUnit unit;
    private final Future<?> future;
    private boolean awaited;

    private UnitHandle(WorkUnit unit, Future<?> future) {
        if (unit == null) {
            throw new IllegalArgumentException("unit cannot be null");
        }
        if (future == null) {
            throw new IllegalArgumentException("future cannot be null");
        }
        this.unit = unit;
        this.future = future;
    }

    /**
     * UnitHandle 생성.
     *
     * @param unit 디스패치된 WorkUnit
     * @param future 실행 Future
     * @return UnitHandle 인스턴스
     * @throws IllegalArgumentException unit 또는 future가 null인 경우
     */
    public static UnitHandle of(WorkUnit unit, Future<?> future) {
        return new UnitHandle(unit, future);
    }

    /**
     * 작업 완료까지 대기.
     *
     * <p>호출 스레드가 대기 중 인터럽트되면 인터럽트 플래그를 복원하고
     * IllegalStateException을 던집니다. 이 경우 핸들은 아직 join되지 않은 것으로 남습니다.</p>
     *
     * @return 작업이 실패했다면 그 원인, 성공했다면 empty
     * @throws IllegalStateException 이미 await()된 핸들이거나 대기 중 인터럽트된 경우
     */
    public synchronized Optional<Throwable> await() {
        if (awaited) {
            throw new IllegalStateException("UnitHandle already awaited: " + unit.getName());
        }
        try {
            future.get();
            awaited = true;
            return Optional.empty();
        } catch (ExecutionException e) {
            awaited = true;
            return Optional.of(e.getCause() != null ? e.getCause() : e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while awaiting " + unit.getName(), e);
        }
    }

    public WorkUnit getUnit() {
        return unit;
    }

    /**
     * join 여부.
     *
     * @return await()가 완료된 경우 true
     */
    public synchronized boolean isAwaited() {
        return awaited;
    }

    @Override
    public String toString() {
        return "UnitHandle{" + unit.getName() + ", awaited=" + isAwaited() + '}';
    }
}
