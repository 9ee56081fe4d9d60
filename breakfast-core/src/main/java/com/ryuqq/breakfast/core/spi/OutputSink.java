package com.ryuqq.breakfast.core.spi;

/**
 * 쓰기 전용 출력 대상 SPI.
 *
 * <p>WorkUnit의 시작/완료 메시지와 Runner의 총 소요 시간 메시지가 기록되는 곳입니다.</p>
 *
 * <p><strong>구현 요구사항:</strong></p>
 * <ul>
 *   <li>여러 스레드에서 동시에 호출될 수 있습니다.</li>
 *   <li>줄 단위 원자성은 요구하지 않습니다. 출력 보호가 필요하면 호출자가 OutputGuard를 사용합니다.</li>
 * </ul>
 *
 * @author Breakfast Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface OutputSink {

    /**
     * 한 줄 출력.
     *
     * @param line 출력할 메시지 (줄바꿈 제외)
     */
    void write(String line);
}
