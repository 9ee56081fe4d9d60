package com.ryuqq.breakfast.application.scheduler;

import com.ryuqq.breakfast.core.model.ExecutionMode;
import com.ryuqq.breakfast.core.model.RunResult;
import com.ryuqq.breakfast.core.model.WorkUnit;

import java.util.List;

/**
 * WorkUnit 묶음의 디스패치, join, 시간 측정을 담당하는 포트.
 *
 * <p><strong>모드별 동작:</strong></p>
 * <ul>
 *   <li><strong>SEQUENTIAL:</strong> 호출 스레드에서 목록 순서대로 실행.
 *       총 소요 시간 ≈ 각 duration의 합</li>
 *   <li><strong>CONCURRENT_UNSYNCHRONIZED:</strong> 작업마다 독립 스레드에서 실행 후 전부 join.
 *       총 소요 시간 ≈ duration의 최댓값. 출력 순서와 섞임은 보장하지 않음</li>
 *   <li><strong>CONCURRENT_SYNCHRONIZED:</strong> 위와 같되 시작 메시지 출력을
 *       Scheduler가 소유한 OutputGuard로 보호</li>
 * </ul>
 *
 * <p><strong>처리 흐름 (동시 모드):</strong></p>
 * <pre>
 * run(mode, units)
 *   ↓
 * 시작 시각 기록
 *   ↓
 * For each WorkUnit: dispatch → UnitHandle
 *   ↓
 * For each UnitHandle: await() (정확히 1회)
 *   ↓
 * 종료 시각 기록 → RunResult
 * </pre>
 *
 * <p><strong>실패 처리:</strong></p>
 * <ul>
 *   <li>워커 스레드 생성 실패 → 이미 디스패치된 작업을 join한 뒤 ResourceExhaustedException</li>
 *   <li>WorkUnit 실패 → 모든 작업을 join한 뒤 WorkUnitFailedException (첫 번째 실패가 cause)</li>
 *   <li>취소/타임아웃 없음: 디스패치된 작업은 항상 끝까지 실행됩니다</li>
 * </ul>
 *
 * @author Breakfast Team
 * @since 1.0.0
 */
public interface Scheduler {

    /**
     * 주어진 모드로 WorkUnit 묶음을 실행하고 총 경과 시간을 반환.
     *
     * @param mode 실행 모드
     * @param units 실행할 WorkUnit 목록 (순서 유지, 1개 이상)
     * @return 실행 결과
     * @throws IllegalArgumentException mode 또는 units가 null이거나 units가 비어 있는 경우
     * @throws com.ryuqq.breakfast.core.exception.ResourceExhaustedException 워커 스레드를 할당할 수 없는 경우
     * @throws com.ryuqq.breakfast.core.exception.WorkUnitFailedException 하나 이상의 WorkUnit이 실패한 경우
     */
    RunResult run(ExecutionMode mode, List<WorkUnit> units);
}
