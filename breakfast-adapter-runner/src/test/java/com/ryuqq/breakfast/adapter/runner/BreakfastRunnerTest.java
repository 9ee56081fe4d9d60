package com.ryuqq.breakfast.adapter.runner;

import com.ryuqq.breakfast.application.scheduler.Scheduler;
import com.ryuqq.breakfast.core.exception.ResourceExhaustedException;
import com.ryuqq.breakfast.core.model.ExecutionMode;
import com.ryuqq.breakfast.core.model.RunResult;
import com.ryuqq.breakfast.core.model.WorkUnit;
import com.ryuqq.breakfast.core.spi.OutputSink;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * BreakfastRunner 유닛 테스트.
 *
 * <p>Scheduler를 모킹하여 Runner의 책임만 검증합니다:</p>
 * <ul>
 *   <li>모드 식별자 → ExecutionMode 변환</li>
 *   <li>고정 작업 목록 (coffee 2000ms, toast 3000ms)</li>
 *   <li>총 소요 시간 출력</li>
 *   <li>알 수 없는 모드는 아무 작업도 하지 않음</li>
 *   <li>ResourceExhaustedException 전파</li>
 * </ul>
 *
 * @author Breakfast Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class BreakfastRunnerTest {

    @Mock
    private Scheduler scheduler;

    @Mock
    private OutputSink sink;

    @Captor
    private ArgumentCaptor<List<WorkUnit>> unitsCaptor;

    private BreakfastRunner runner;

    @BeforeEach
    void setUp() {
        runner = new BreakfastRunner(scheduler, sink, new RunnerConfig());
    }

    // ============================================================
    // 1. 모드 선택
    // ============================================================

    @Test
    void 모드_1은_순차_실행_후_총_소요_시간_출력() {
        // given
        RunResult result = new RunResult(ExecutionMode.SEQUENTIAL, 2, 5_012_000_000L);
        when(scheduler.run(eq(ExecutionMode.SEQUENTIAL), anyList())).thenReturn(result);

        // when
        Optional<RunResult> returned = runner.run(1);

        // then
        assertThat(returned).contains(result);
        verify(sink).write("Total time = 5 seconds");
        verifyNoMoreInteractions(sink);
    }

    @Test
    void 모드_2와_3은_각각_동시_모드로_변환됨() {
        // given
        when(scheduler.run(any(), anyList())).thenAnswer(invocation ->
            new RunResult(invocation.getArgument(0), 2, 3_001_000_000L));

        // when
        runner.run(2);
        runner.run(3);

        // then
        verify(scheduler).run(eq(ExecutionMode.CONCURRENT_UNSYNCHRONIZED), anyList());
        verify(scheduler).run(eq(ExecutionMode.CONCURRENT_SYNCHRONIZED), anyList());
        verify(sink, times(2)).write("Total time = 3 seconds");
    }

    @ParameterizedTest
    @ValueSource(ints = {0, 4, -7, 99})
    void 알_수_없는_모드는_아무_작업도_하지_않음(int modeId) {
        // when
        Optional<RunResult> returned = runner.run(modeId);

        // then
        assertThat(returned).isEmpty();
        verifyNoInteractions(scheduler, sink);
    }

    // ============================================================
    // 2. 작업 목록
    // ============================================================

    @Test
    void 고정_작업_목록은_coffee_2000ms_toast_3000ms() {
        // given
        when(scheduler.run(any(), anyList()))
            .thenReturn(new RunResult(ExecutionMode.SEQUENTIAL, 2, 0));

        // when
        runner.run(1);

        // then
        verify(scheduler).run(eq(ExecutionMode.SEQUENTIAL), unitsCaptor.capture());
        assertThat(unitsCaptor.getValue()).containsExactly(
            WorkUnit.of("coffee", 2000),
            WorkUnit.of("toast", 3000)
        );
    }

    @Test
    void 작업_시간은_RunnerConfig를_따름() {
        // given
        BreakfastRunner custom = new BreakfastRunner(scheduler, sink,
            new RunnerConfig().withCoffeeMillis(20).withToastMillis(30));

        // when
        List<WorkUnit> workload = custom.workload();

        // then
        assertThat(workload).containsExactly(WorkUnit.of("coffee", 20), WorkUnit.of("toast", 30));
    }

    // ============================================================
    // 3. 오류 전파
    // ============================================================

    @Test
    void ResourceExhausted는_그대로_전파되고_총_소요_시간은_출력하지_않음() {
        // given
        ResourceExhaustedException exhausted =
            new ResourceExhaustedException("no threads", 1, new OutOfMemoryError("unable to create native thread"));
        when(scheduler.run(any(), anyList())).thenThrow(exhausted);

        // when & then
        assertThatThrownBy(() -> runner.run(3)).isSameAs(exhausted);
        verifyNoInteractions(sink);
    }

    @Test
    void 생성자_의존성이_null이면_예외() {
        assertThatThrownBy(() -> new BreakfastRunner(null, sink, new RunnerConfig()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("scheduler cannot be null");
        assertThatThrownBy(() -> new BreakfastRunner(scheduler, null, new RunnerConfig()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("sink cannot be null");
        assertThatThrownBy(() -> new BreakfastRunner(scheduler, sink, null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("config cannot be null");
    }

    // ============================================================
    // 4. 모드 식별자 결정
    // ============================================================

    @Test
    void 명령행_인자가_시스템_프로퍼티보다_우선함() {
        assertThat(BreakfastRunner.resolveModeId(new String[] {"1"}, "2", new RunnerConfig()))
            .isEqualTo(OptionalInt.of(1));
    }

    @Test
    void 인자가_없으면_시스템_프로퍼티_사용() {
        assertThat(BreakfastRunner.resolveModeId(new String[0], " 2 ", new RunnerConfig()))
            .isEqualTo(OptionalInt.of(2));
    }

    @Test
    void 인자와_프로퍼티가_없으면_기본_모드_3() {
        assertThat(BreakfastRunner.resolveModeId(new String[0], null, new RunnerConfig()))
            .isEqualTo(OptionalInt.of(3));
        assertThat(BreakfastRunner.resolveModeId(null, null, new RunnerConfig().withDefaultModeId(1)))
            .isEqualTo(OptionalInt.of(1));
    }

    @Test
    void 숫자가_아닌_식별자는_empty() {
        assertThat(BreakfastRunner.resolveModeId(new String[] {"coffee"}, null, new RunnerConfig()))
            .isEmpty();
    }
}
