/**
 * Service Provider Interface - 외부 출력 대상 추상화.
 *
 * <h2>SPI 목록</h2>
 * <ul>
 *   <li>{@link com.ryuqq.breakfast.core.spi.OutputSink} - 콘솔 등 쓰기 전용 출력 대상</li>
 * </ul>
 *
 * @author Breakfast Team
 * @since 1.0.0
 */
package com.ryuqq.breakfast.core.spi;
