package com.ryuqq.breakfast.core.model;

import com.ryuqq.breakfast.core.spi.OutputSink;
import com.ryuqq.breakfast.core.sync.OutputGuard;

/**
 * 이름과 고정된 소요 시간을 가진 모의 블로킹 작업 단위.
 *
 * <p>WorkUnit은 실행 시 다음 순서로 동작합니다:</p>
 * <ol>
 *   <li>시작 메시지 출력: {@code Creating {name}...}</li>
 *   <li>durationMillis 동안 현재 스레드 블로킹</li>
 *   <li>완료 메시지 출력: {@code Created {name}!}</li>
 * </ol>
 *
 * <p><strong>동기화 범위:</strong> OutputGuard가 주어진 경우 시작 메시지 출력만
 * 잠금 안에서 수행됩니다. 블로킹 구간과 완료 메시지는 잠금 밖에서 수행됩니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>name: null 또는 빈 문자열 불가</li>
 *   <li>durationMillis: 0 이상</li>
 * </ul>
 *
 * @author Breakfast Team
 * @since 1.0.0
 */
public final class WorkUnit {

    private final String name;
    private final long durationMillis;

    private WorkUnit(String name, long durationMillis) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (durationMillis < 0) {
            throw new IllegalArgumentException("durationMillis must be non-negative (current: " + durationMillis + ")");
        }
        this.name = name;
        this.durationMillis = durationMillis;
    }

    /**
     * WorkUnit 생성.
     *
     * @param name 작업 이름 (예: coffee, toast)
     * @param durationMillis 블로킹 시간 (밀리초, 0 이상)
     * @return WorkUnit 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static WorkUnit of(String name, long durationMillis) {
        return new WorkUnit(name, durationMillis);
    }

    /**
     * 동기화 없이 실행.
     *
     * @param sink 출력 대상
     * @throws IllegalArgumentException sink가 null인 경우
     * @throws IllegalStateException 블로킹 중 인터럽트 발생 시
     */
    public void execute(OutputSink sink) {
        if (sink == null) {
            throw new IllegalArgumentException("sink cannot be null");
        }
        sink.write(startMessage());
        block();
        sink.write(finishMessage());
    }

    /**
     * 시작 메시지를 OutputGuard 안에서 출력하며 실행.
     *
     * <p>guard는 시작 메시지 한 줄을 쓰는 동안만 보유되고,
     * 블로킹 구간이 시작되기 전에 해제됩니다.</p>
     *
     * @param sink 출력 대상
     * @param guard 시작 메시지 출력 보호용 잠금
     * @throws IllegalArgumentException sink 또는 guard가 null인 경우
     * @throws IllegalStateException 블로킹 중 인터럽트 발생 시
     */
    public void execute(OutputSink sink, OutputGuard guard) {
        if (sink == null) {
            throw new IllegalArgumentException("sink cannot be null");
        }
        if (guard == null) {
            throw new IllegalArgumentException("guard cannot be null");
        }
        guard.withLock(() -> sink.write(startMessage()));
        block();
        sink.write(finishMessage());
    }

    /**
     * 시작 메시지.
     *
     * @return {@code Creating {name}...}
     */
    public String startMessage() {
        return "Creating " + name + "...";
    }

    /**
     * 완료 메시지.
     *
     * @return {@code Created {name}!}
     */
    public String finishMessage() {
        return "Created " + name + "!";
    }

    public String getName() {
        return name;
    }

    public long getDurationMillis() {
        return durationMillis;
    }

    /**
     * durationMillis 동안 블로킹.
     *
     * <p>InterruptedException 발생 시 현재 스레드의 인터럽트 플래그를 복원하고
     * IllegalStateException으로 래핑하여 던집니다.</p>
     */
    private void block() {
        if (durationMillis == 0) {
            return;
        }
        try {
            Thread.sleep(durationMillis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Work unit interrupted: " + name, e);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WorkUnit workUnit = (WorkUnit) o;
        return durationMillis == workUnit.durationMillis && name.equals(workUnit.name);
    }

    @Override
    public int hashCode() {
        return 31 * name.hashCode() + Long.hashCode(durationMillis);
    }

    @Override
    public String toString() {
        return "WorkUnit{" + name + ", " + durationMillis + "ms}";
    }
}
