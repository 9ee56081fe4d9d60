package com.ryuqq.breakfast.core.model;

import java.util.concurrent.TimeUnit;

/**
 * Scheduler 실행 결과.
 *
 * <p>실행 1회당 한 번 생성되며, 디스패치 직전부터 모든 작업 완료 직후까지의
 * 벽시계 시간을 담습니다.</p>
 *
 * @param mode 실행 모드
 * @param unitCount 실행된 WorkUnit 수
 * @param elapsedNanos 총 경과 시간 (나노초)
 *
 * @author Breakfast Team
 * @since 1.0.0
 */
public record RunResult(
    ExecutionMode mode,
    int unitCount,
    long elapsedNanos
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException mode가 null이거나 수치가 음수인 경우
     */
    public RunResult {
        if (mode == null) {
            throw new IllegalArgumentException("mode cannot be null");
        }
        if (unitCount < 0) {
            throw new IllegalArgumentException("unitCount must be non-negative (current: " + unitCount + ")");
        }
        if (elapsedNanos < 0) {
            throw new IllegalArgumentException("elapsedNanos must be non-negative (current: " + elapsedNanos + ")");
        }
    }

    /**
     * 총 경과 시간 (밀리초).
     *
     * @return 경과 밀리초
     */
    public long totalElapsedMillis() {
        return TimeUnit.NANOSECONDS.toMillis(elapsedNanos);
    }

    /**
     * 총 경과 시간 (초, 소수점 이하 버림).
     *
     * @return 경과 초
     */
    public long elapsedSeconds() {
        return TimeUnit.NANOSECONDS.toSeconds(elapsedNanos);
    }
}
