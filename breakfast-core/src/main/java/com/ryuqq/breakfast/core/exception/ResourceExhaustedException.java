package com.ryuqq.breakfast.core.exception;

/**
 * 실행 컨텍스트(워커 스레드)를 할당할 수 없을 때 발생하는 예외.
 *
 * <p>현재 실행 전체를 중단시키며 부분 결과는 보고하지 않습니다.
 * Runner까지 전파되어 프로세스를 종료시킵니다.</p>
 *
 * @author Breakfast Team
 * @since 1.0.0
 */
public class ResourceExhaustedException extends RuntimeException {

    private final int dispatchedCount;

    /**
     * 생성자.
     *
     * @param message 오류 메시지
     * @param dispatchedCount 실패 전까지 디스패치된 작업 수
     * @param cause 원인
     */
    public ResourceExhaustedException(String message, int dispatchedCount, Throwable cause) {
        super(message, cause);
        this.dispatchedCount = dispatchedCount;
    }

    /**
     * 실패 전까지 디스패치된 작업 수.
     *
     * @return 디스패치 성공 수
     */
    public int getDispatchedCount() {
        return dispatchedCount;
    }
}
