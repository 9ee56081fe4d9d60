/**
 * Breakfast Core 도메인 모델.
 *
 * <h2>핵심 타입</h2>
 * <ul>
 *   <li>{@link com.ryuqq.breakfast.core.model.WorkUnit} - 모의 블로킹 작업 단위</li>
 *   <li>{@link com.ryuqq.breakfast.core.model.ExecutionMode} - 순차/동시 실행 방식</li>
 *   <li>{@link com.ryuqq.breakfast.core.model.RunResult} - 실행 1회의 경과 시간</li>
 * </ul>
 *
 * @author Breakfast Team
 * @since 1.0.0
 */
package com.ryuqq.breakfast.core.model;
