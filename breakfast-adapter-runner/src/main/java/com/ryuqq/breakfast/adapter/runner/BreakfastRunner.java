package com.ryuqq.breakfast.adapter.runner;

import com.ryuqq.breakfast.application.scheduler.Scheduler;
import com.ryuqq.breakfast.core.model.ExecutionMode;
import com.ryuqq.breakfast.core.model.RunResult;
import com.ryuqq.breakfast.core.model.WorkUnit;
import com.ryuqq.breakfast.core.spi.OutputSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * 프로세스 진입점.
 *
 * <p>모드 식별자를 ExecutionMode로 변환하고, 고정된 두 작업(coffee, toast)을
 * Scheduler로 실행한 뒤 총 소요 시간을 출력합니다.</p>
 *
 * <p><strong>모드 식별자 결정 순서:</strong></p>
 * <ol>
 *   <li>첫 번째 명령행 인자</li>
 *   <li>시스템 프로퍼티 {@code breakfast.mode}</li>
 *   <li>RunnerConfig.defaultModeId (기본 3)</li>
 * </ol>
 *
 * <p><strong>출력 예시 (모드 1):</strong></p>
 * <pre>
 * Creating coffee...
 * Created coffee!
 * Creating toast...
 * Created toast!
 * Total time = 5 seconds
 * </pre>
 *
 * <p>알 수 없는 식별자는 경고 로그만 남기고 아무 작업도 하지 않습니다.
 * ResourceExhaustedException은 잡지 않고 main 밖으로 전파하여 프로세스를 종료시킵니다.</p>
 *
 * @author Breakfast Team
 * @since 1.0.0
 */
public final class BreakfastRunner {

    private static final Logger log = LoggerFactory.getLogger(BreakfastRunner.class);

    static final String MODE_PROPERTY = "breakfast.mode";

    private final Scheduler scheduler;
    private final OutputSink sink;
    private final RunnerConfig config;

    /**
     * 생성자.
     *
     * @param scheduler 작업 실행 Scheduler
     * @param sink 출력 대상
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public BreakfastRunner(Scheduler scheduler, OutputSink sink, RunnerConfig config) {
        if (scheduler == null) {
            throw new IllegalArgumentException("scheduler cannot be null");
        }
        if (sink == null) {
            throw new IllegalArgumentException("sink cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.scheduler = scheduler;
        this.sink = sink;
        this.config = config;
    }

    /**
     * 모드 식별자에 해당하는 실행 수행.
     *
     * @param modeId 모드 식별자 (1: 순차, 2: 동시, 3: 동시 + 출력 동기화)
     * @return 실행 결과, 알 수 없는 식별자면 empty
     * @throws com.ryuqq.breakfast.core.exception.ResourceExhaustedException 워커 스레드를 할당할 수 없는 경우
     */
    public Optional<RunResult> run(int modeId) {
        Optional<ExecutionMode> mode = ExecutionMode.fromId(modeId);
        if (mode.isEmpty()) {
            log.warn("Unknown mode id {}, nothing to run", modeId);
            return Optional.empty();
        }

        RunResult result = scheduler.run(mode.get(), workload());
        sink.write("Total time = " + result.elapsedSeconds() + " seconds");
        return Optional.of(result);
    }

    /**
     * 고정 작업 목록.
     *
     * @return [coffee, toast]
     */
    public List<WorkUnit> workload() {
        return List.of(
            WorkUnit.of("coffee", config.coffeeMillis()),
            WorkUnit.of("toast", config.toastMillis())
        );
    }

    /**
     * 모드 식별자 결정.
     *
     * @param args 명령행 인자
     * @param propertyValue 시스템 프로퍼티 값 (null 가능)
     * @param config 설정 (기본 모드 제공)
     * @return 모드 식별자, 숫자가 아니면 empty
     */
    static OptionalInt resolveModeId(String[] args, String propertyValue, RunnerConfig config) {
        String raw = args != null && args.length > 0 ? args[0] : propertyValue;
        if (raw == null || raw.isBlank()) {
            return OptionalInt.of(config.defaultModeId());
        }
        try {
            return OptionalInt.of(Integer.parseInt(raw.trim()));
        } catch (NumberFormatException e) {
            log.warn("Mode id is not a number: '{}', nothing to run", raw);
            return OptionalInt.empty();
        }
    }

    public static void main(String[] args) {
        RunnerConfig config = new RunnerConfig();
        OptionalInt modeId = resolveModeId(args, System.getProperty(MODE_PROPERTY), config);
        if (modeId.isEmpty()) {
            return;
        }

        log.info("Running program {}...", modeId.getAsInt());
        OutputSink sink = new ConsoleOutputSink();
        new BreakfastRunner(new DefaultScheduler(sink), sink, config).run(modeId.getAsInt());
    }
}
