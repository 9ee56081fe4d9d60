package com.ryuqq.breakfast.adapter.runner;

/**
 * DefaultScheduler 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>threadNamePrefix: 워커 스레드 이름 접두사 (기본 breakfast-worker)</li>
 *   <li>shutdownTimeoutMs: 실행 종료 후 워커 풀 종료 대기 시간 (기본 60000ms)</li>
 * </ul>
 *
 * @author Breakfast Team
 * @since 1.0.0
 * @param threadNamePrefix 워커 스레드 이름 접두사 (빈 문자열 불가)
 * @param shutdownTimeoutMs 워커 풀 종료 대기 시간 (밀리초, 양수여야 함)
 */
public record SchedulerConfig(
    String threadNamePrefix,
    long shutdownTimeoutMs
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: threadNamePrefix=breakfast-worker, shutdownTimeoutMs=60000ms</p>
     */
    public SchedulerConfig() {
        this("breakfast-worker", 60_000);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public SchedulerConfig {
        if (threadNamePrefix == null || threadNamePrefix.isBlank()) {
            throw new IllegalArgumentException("threadNamePrefix cannot be null or blank");
        }
        if (shutdownTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "shutdownTimeoutMs must be positive (current: " + shutdownTimeoutMs + ")"
            );
        }
    }

    /**
     * threadNamePrefix만 변경한 새 인스턴스 생성.
     */
    public SchedulerConfig withThreadNamePrefix(String threadNamePrefix) {
        return new SchedulerConfig(threadNamePrefix, shutdownTimeoutMs);
    }

    /**
     * shutdownTimeoutMs만 변경한 새 인스턴스 생성.
     */
    public SchedulerConfig withShutdownTimeoutMs(long shutdownTimeoutMs) {
        return new SchedulerConfig(threadNamePrefix, shutdownTimeoutMs);
    }
}
