package com.ryuqq.breakfast.core.model;

import java.util.Optional;

/**
 * WorkUnit 실행 방식.
 *
 * <p><strong>모드 식별자:</strong></p>
 * <ul>
 *   <li>1 → SEQUENTIAL</li>
 *   <li>2 → CONCURRENT_UNSYNCHRONIZED</li>
 *   <li>3 → CONCURRENT_SYNCHRONIZED</li>
 *   <li>그 외 → 해당 없음 (실행하지 않음)</li>
 * </ul>
 *
 * @author Breakfast Team
 * @since 1.0.0
 */
public enum ExecutionMode {

    /**
     * 호출 스레드에서 순서대로 실행.
     */
    SEQUENTIAL(1),

    /**
     * 작업마다 별도 스레드에서 동시 실행 (출력 보호 없음).
     *
     * <p>시작/완료 메시지가 서로 섞일 수 있습니다.</p>
     */
    CONCURRENT_UNSYNCHRONIZED(2),

    /**
     * 작업마다 별도 스레드에서 동시 실행 (시작 메시지를 OutputGuard로 보호).
     */
    CONCURRENT_SYNCHRONIZED(3);

    private final int id;

    ExecutionMode(int id) {
        this.id = id;
    }

    /**
     * 식별자로 모드 조회.
     *
     * @param id 모드 식별자
     * @return 해당 모드, 알 수 없는 식별자면 empty
     */
    public static Optional<ExecutionMode> fromId(int id) {
        for (ExecutionMode mode : values()) {
            if (mode.id == id) {
                return Optional.of(mode);
            }
        }
        return Optional.empty();
    }

    public int getId() {
        return id;
    }

    /**
     * 동시 실행 모드인지 확인.
     *
     * @return SEQUENTIAL이 아니면 true
     */
    public boolean isConcurrent() {
        return this != SEQUENTIAL;
    }

    /**
     * 시작 메시지 출력이 OutputGuard로 보호되는지 확인.
     *
     * @return CONCURRENT_SYNCHRONIZED인 경우 true
     */
    public boolean isSynchronized() {
        return this == CONCURRENT_SYNCHRONIZED;
    }
}
