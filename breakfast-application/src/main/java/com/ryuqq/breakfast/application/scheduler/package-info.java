/**
 * Scheduler Application Layer.
 *
 * <h2>핵심 타입</h2>
 * <ul>
 *   <li>{@link com.ryuqq.breakfast.application.scheduler.Scheduler} - 디스패치/join/시간 측정 포트</li>
 *   <li>{@link com.ryuqq.breakfast.application.scheduler.UnitHandle} - 디스패치된 작업 핸들</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-runner (DefaultScheduler, BreakfastRunner)
 *   ↓ implements
 * application (Scheduler interface)
 *   ↓ depends on
 * core (WorkUnit, ExecutionMode, RunResult, OutputGuard, OutputSink)
 * </pre>
 *
 * @author Breakfast Team
 * @since 1.0.0
 */
package com.ryuqq.breakfast.application.scheduler;
