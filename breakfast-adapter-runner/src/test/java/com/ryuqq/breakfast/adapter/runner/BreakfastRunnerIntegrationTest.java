package com.ryuqq.breakfast.adapter.runner;

import com.ryuqq.breakfast.core.model.RunResult;
import com.ryuqq.breakfast.testkit.contract.InMemoryOutputSink;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * BreakfastRunner + DefaultScheduler 통합 테스트.
 *
 * <p>실제 콘솔 출력 계약 (Creating / Created / Total time)을 검증합니다.</p>
 *
 * @author Breakfast Team
 * @since 1.0.0
 */
class BreakfastRunnerIntegrationTest {

    @Test
    void 순차_모드_실제_작업_시간으로_총_5초_출력() {
        // given
        InMemoryOutputSink sink = new InMemoryOutputSink();
        BreakfastRunner runner = new BreakfastRunner(new DefaultScheduler(sink), sink, new RunnerConfig());

        // when
        Optional<RunResult> result = runner.run(1);

        // then
        assertThat(result).isPresent();
        assertThat(result.get().totalElapsedMillis()).isBetween(5000L, 5300L);
        assertThat(sink.lines()).containsExactly(
            "Creating coffee...",
            "Created coffee!",
            "Creating toast...",
            "Created toast!",
            "Total time = 5 seconds"
        );
    }

    @Test
    void 동시_동기화_모드는_모든_완료_메시지_후_총_소요_시간_출력() {
        // given
        InMemoryOutputSink sink = new InMemoryOutputSink();
        RunnerConfig config = new RunnerConfig().withCoffeeMillis(200).withToastMillis(300);
        BreakfastRunner runner = new BreakfastRunner(new DefaultScheduler(sink), sink, config);

        // when
        Optional<RunResult> result = runner.run(3);

        // then
        assertThat(result).isPresent();
        assertThat(result.get().totalElapsedMillis()).isBetween(300L, 599L);
        List<String> lines = sink.lines();
        assertThat(lines).hasSize(5);
        assertThat(lines.subList(0, 2)).containsExactlyInAnyOrder("Creating coffee...", "Creating toast...");
        assertThat(lines.subList(2, 5)).containsExactly("Created coffee!", "Created toast!", "Total time = 0 seconds");
    }

    @Test
    void 알_수_없는_모드는_아무것도_출력하지_않음() {
        // given
        InMemoryOutputSink sink = new InMemoryOutputSink();
        BreakfastRunner runner = new BreakfastRunner(new DefaultScheduler(sink), sink, new RunnerConfig());

        // when
        Optional<RunResult> result = runner.run(7);

        // then
        assertThat(result).isEmpty();
        assertThat(sink.lines()).isEmpty();
    }

    @Test
    void ConsoleOutputSink는_PrintStream에_줄_단위로_출력() {
        // given
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8);
        ConsoleOutputSink sink = new ConsoleOutputSink(out);
        RunnerConfig config = new RunnerConfig().withCoffeeMillis(0).withToastMillis(0);
        BreakfastRunner runner = new BreakfastRunner(new DefaultScheduler(sink), sink, config);

        // when
        runner.run(1);

        // then
        assertThat(buffer.toString(StandardCharsets.UTF_8).lines()).containsExactly(
            "Creating coffee...",
            "Created coffee!",
            "Creating toast...",
            "Created toast!",
            "Total time = 0 seconds"
        );
    }
}
