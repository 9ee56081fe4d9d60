/**
 * Runner Adapter Layer - Scheduler 구현체와 프로세스 진입점.
 *
 * <h2>구현체</h2>
 * <ul>
 *   <li>{@link com.ryuqq.breakfast.adapter.runner.DefaultScheduler} - 순차/동시 실행 Scheduler</li>
 *   <li>{@link com.ryuqq.breakfast.adapter.runner.BreakfastRunner} - 모드 선택 및 총 소요 시간 보고</li>
 *   <li>{@link com.ryuqq.breakfast.adapter.runner.ConsoleOutputSink} - 콘솔 출력 대상</li>
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
package com.ryuqq.breakfast.adapter.runner;
