package com.ryuqq.breakfast.core.exception;

/**
 * 하나 이상의 WorkUnit이 실패했을 때 모든 작업을 join한 뒤 발생하는 예외.
 *
 * <p>cause는 디스패치 순서상 첫 번째 실패이며,
 * 나머지 실패는 suppressed로 첨부됩니다.</p>
 *
 * @author Breakfast Team
 * @since 1.0.0
 */
public class WorkUnitFailedException extends RuntimeException {

    private final String unitName;

    /**
     * 생성자.
     *
     * @param unitName 첫 번째로 실패한 WorkUnit 이름
     * @param cause 첫 번째 실패 원인
     */
    public WorkUnitFailedException(String unitName, Throwable cause) {
        super("Work unit failed: " + unitName, cause);
        this.unitName = unitName;
    }

    public String getUnitName() {
        return unitName;
    }
}
