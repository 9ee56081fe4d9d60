package com.ryuqq.breakfast.adapter.runner;

/**
 * BreakfastRunner 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>defaultModeId: 인자/시스템 프로퍼티가 없을 때 실행할 모드 (기본 3)</li>
 *   <li>coffeeMillis: coffee 작업 소요 시간 (기본 2000ms)</li>
 *   <li>toastMillis: toast 작업 소요 시간 (기본 3000ms)</li>
 * </ul>
 *
 * @author Breakfast Team
 * @since 1.0.0
 * @param defaultModeId 기본 모드 식별자
 * @param coffeeMillis coffee 소요 시간 (밀리초, 0 이상)
 * @param toastMillis toast 소요 시간 (밀리초, 0 이상)
 */
public record RunnerConfig(
    int defaultModeId,
    long coffeeMillis,
    long toastMillis
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: defaultModeId=3, coffeeMillis=2000ms, toastMillis=3000ms</p>
     */
    public RunnerConfig() {
        this(3, 2000, 3000);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public RunnerConfig {
        if (coffeeMillis < 0) {
            throw new IllegalArgumentException(
                "coffeeMillis must be non-negative (current: " + coffeeMillis + ")"
            );
        }
        if (toastMillis < 0) {
            throw new IllegalArgumentException(
                "toastMillis must be non-negative (current: " + toastMillis + ")"
            );
        }
    }

    /**
     * defaultModeId만 변경한 새 인스턴스 생성.
     */
    public RunnerConfig withDefaultModeId(int defaultModeId) {
        return new RunnerConfig(defaultModeId, coffeeMillis, toastMillis);
    }

    /**
     * coffeeMillis만 변경한 새 인스턴스 생성.
     */
    public RunnerConfig withCoffeeMillis(long coffeeMillis) {
        return new RunnerConfig(defaultModeId, coffeeMillis, toastMillis);
    }

    /**
     * toastMillis만 변경한 새 인스턴스 생성.
     */
    public RunnerConfig withToastMillis(long toastMillis) {
        return new RunnerConfig(defaultModeId, coffeeMillis, toastMillis);
    }
}
