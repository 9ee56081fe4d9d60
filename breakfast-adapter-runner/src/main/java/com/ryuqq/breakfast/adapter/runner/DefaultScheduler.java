package com.ryuqq.breakfast.adapter.runner;

import com.ryuqq.breakfast.application.scheduler.Scheduler;
import com.ryuqq.breakfast.application.scheduler.UnitHandle;
import com.ryuqq.breakfast.core.exception.ResourceExhaustedException;
import com.ryuqq.breakfast.core.exception.WorkUnitFailedException;
import com.ryuqq.breakfast.core.model.ExecutionMode;
import com.ryuqq.breakfast.core.model.RunResult;
import com.ryuqq.breakfast.core.model.WorkUnit;
import com.ryuqq.breakfast.core.spi.OutputSink;
import com.ryuqq.breakfast.core.sync.OutputGuard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;

/**
 * Scheduler 기본 구현체.
 *
 * <p>순차 모드는 호출 스레드에서, 동시 모드는 실행마다 새로 만든 고정 크기 워커 풀
 * (WorkUnit 수만큼의 스레드)에서 작업을 실행합니다.</p>
 *
 * <p><strong>처리 흐름 (동시 모드):</strong></p>
 * <pre>
 * run(mode, units)
 *   ↓
 * newFixedThreadPool(units.size())
 *   ↓
 * For each WorkUnit:
 *   submit → UnitHandle (스레드 생성 실패 또는 null 스레드 시 디스패치 중단)
 *   ↓
 * For each UnitHandle: await() → 실패 수집
 *   ↓
 * 디스패치 실패 → ResourceExhaustedException
 * 작업 실패 → WorkUnitFailedException
 *   ↓
 * 워커 풀 종료 (finally)
 * </pre>
 *
 * <p><strong>OutputGuard 소유권:</strong></p>
 * <ul>
 *   <li>인스턴스마다 별도의 OutputGuard를 소유합니다 (전역 상태 없음)</li>
 *   <li>CONCURRENT_SYNCHRONIZED 모드에서만 각 WorkUnit에 빌려줍니다</li>
 *   <li>서로 다른 DefaultScheduler 인스턴스의 실행은 서로 간섭하지 않습니다</li>
 * </ul>
 *
 * @author Breakfast Team
 * @since 1.0.0
 */
public final class DefaultScheduler implements Scheduler {

    private static final Logger log = LoggerFactory.getLogger(DefaultScheduler.class);

    private final OutputSink sink;
    private final SchedulerConfig config;
    private final OutputGuard guard;
    private final ThreadFactory threadFactory;

    /**
     * 생성자 (기본 설정).
     *
     * @param sink 출력 대상
     * @throws IllegalArgumentException sink가 null인 경우
     */
    public DefaultScheduler(OutputSink sink) {
        this(sink, new SchedulerConfig());
    }

    /**
     * 생성자 (설정 지정).
     *
     * @param sink 출력 대상
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public DefaultScheduler(OutputSink sink, SchedulerConfig config) {
        this(sink, config, new OutputGuard(), null);
    }

    /**
     * 생성자 (OutputGuard, ThreadFactory 주입).
     *
     * @param sink 출력 대상
     * @param config 설정
     * @param guard 시작 메시지 보호용 잠금
     * @param threadFactory 워커 스레드 팩토리 (null이면 실행마다 {prefix}-{n} 이름의 팩토리 사용)
     * @throws IllegalArgumentException sink, config, guard가 null인 경우
     */
    public DefaultScheduler(OutputSink sink, SchedulerConfig config, OutputGuard guard, ThreadFactory threadFactory) {
        if (sink == null) {
            throw new IllegalArgumentException("sink cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (guard == null) {
            throw new IllegalArgumentException("guard cannot be null");
        }
        this.sink = sink;
        this.config = config;
        this.guard = guard;
        this.threadFactory = threadFactory;
    }

    @Override
    public RunResult run(ExecutionMode mode, List<WorkUnit> units) {
        validateInput(mode, units);
        log.debug("Run started: mode={}, units={}", mode, units.size());

        long startNanos = System.nanoTime();
        switch (mode) {
            case SEQUENTIAL -> runSequentially(units);
            case CONCURRENT_UNSYNCHRONIZED, CONCURRENT_SYNCHRONIZED -> runConcurrently(mode, units);
        }
        long elapsedNanos = System.nanoTime() - startNanos;

        RunResult result = new RunResult(mode, units.size(), elapsedNanos);
        log.info("Run completed: mode={}, units={}, elapsed={}ms", mode, units.size(), result.totalElapsedMillis());
        return result;
    }

    /**
     * 이 Scheduler가 소유한 OutputGuard.
     *
     * @return OutputGuard
     */
    public OutputGuard getGuard() {
        return guard;
    }

    /**
     * 입력 유효성 검증.
     *
     * @param mode 실행 모드
     * @param units WorkUnit 목록
     * @throws IllegalArgumentException 유효하지 않은 입력인 경우
     */
    private void validateInput(ExecutionMode mode, List<WorkUnit> units) {
        if (mode == null) {
            throw new IllegalArgumentException("mode cannot be null");
        }
        if (units == null || units.isEmpty()) {
            throw new IllegalArgumentException("units cannot be null or empty");
        }
        for (WorkUnit unit : units) {
            if (unit == null) {
                throw new IllegalArgumentException("units cannot contain null");
            }
        }
    }

    /**
     * 호출 스레드에서 목록 순서대로 실행.
     *
     * <p>실패한 작업 이후의 작업은 시작하지 않습니다.</p>
     *
     * @param units WorkUnit 목록
     * @throws WorkUnitFailedException 작업 실패 시
     */
    private void runSequentially(List<WorkUnit> units) {
        for (WorkUnit unit : units) {
            try {
                unit.execute(sink);
            } catch (RuntimeException e) {
                log.error("Work unit {} failed in sequential run", unit.getName(), e);
                throw new WorkUnitFailedException(unit.getName(), e);
            }
        }
    }

    /**
     * 작업마다 독립 스레드에서 실행하고 전부 join.
     *
     * @param mode CONCURRENT_UNSYNCHRONIZED 또는 CONCURRENT_SYNCHRONIZED
     * @param units WorkUnit 목록
     * @throws ResourceExhaustedException 워커 스레드 생성 실패 시
     * @throws WorkUnitFailedException 작업 실패 시
     */
    private void runConcurrently(ExecutionMode mode, List<WorkUnit> units) {
        ThreadFactory factory = refusingNull(threadFactory != null
            ? threadFactory
            : new WorkerThreadFactory(config.threadNamePrefix()));
        ExecutorService workers = Executors.newFixedThreadPool(units.size(), factory);

        try {
            // 1. 디스패치
            List<UnitHandle> handles = new ArrayList<>(units.size());
            Throwable dispatchFailure = null;
            for (WorkUnit unit : units) {
                try {
                    handles.add(UnitHandle.of(unit, workers.submit(() -> executeUnit(mode, unit))));
                    log.debug("Dispatched {}", unit);
                } catch (RejectedExecutionException | OutOfMemoryError e) {
                    dispatchFailure = e;
                    break;
                }
            }

            // 2. join (디스패치된 핸들 전부, 각 1회)
            List<UnitFailure> failures = awaitAll(handles);

            // 3. 실패 보고
            if (dispatchFailure != null) {
                log.error("Could not allocate worker for unit {} of {}", handles.size() + 1, units.size(), dispatchFailure);
                ResourceExhaustedException exhausted = new ResourceExhaustedException(
                    "Cannot allocate worker thread (dispatched " + handles.size() + " of " + units.size() + ")",
                    handles.size(),
                    dispatchFailure
                );
                failures.forEach(failure -> exhausted.addSuppressed(failure.cause()));
                throw exhausted;
            }
            if (!failures.isEmpty()) {
                throw toException(failures);
            }
        } finally {
            shutdown(workers);
        }
    }

    /**
     * 스레드 생성을 거부한 팩토리(null 반환)를 RejectedExecutionException으로 변환.
     *
     * <p>ThreadPoolExecutor는 null 스레드를 받으면 작업을 큐에 넣고 조용히 넘어가므로,
     * 디스패치 실패 경로로 보내기 위해 예외로 바꿉니다.</p>
     *
     * @param delegate 실제 스레드 팩토리
     * @return null을 반환하지 않는 스레드 팩토리
     */
    private static ThreadFactory refusingNull(ThreadFactory delegate) {
        return task -> {
            Thread thread = delegate.newThread(task);
            if (thread == null) {
                throw new RejectedExecutionException("ThreadFactory refused to create a worker thread");
            }
            return thread;
        };
    }

    /**
     * 모드에 따라 OutputGuard를 빌려주며 WorkUnit 실행.
     *
     * @param mode 실행 모드
     * @param unit WorkUnit
     */
    private void executeUnit(ExecutionMode mode, WorkUnit unit) {
        if (mode.isSynchronized()) {
            unit.execute(sink, guard);
        } else {
            unit.execute(sink);
        }
    }

    /**
     * 모든 핸들을 디스패치 순서대로 join하고 실패를 수집.
     *
     * @param handles 디스패치된 핸들
     * @return 실패 목록 (디스패치 순서)
     */
    private List<UnitFailure> awaitAll(List<UnitHandle> handles) {
        List<UnitFailure> failures = new ArrayList<>();
        for (UnitHandle handle : handles) {
            Optional<Throwable> failure = handle.await();
            if (failure.isPresent()) {
                log.error("Work unit {} failed in concurrent run", handle.getUnit().getName(), failure.get());
                failures.add(new UnitFailure(handle.getUnit(), failure.get()));
            }
        }
        return failures;
    }

    /**
     * 첫 번째 실패를 cause로, 나머지를 suppressed로 묶은 예외 생성.
     *
     * @param failures 실패 목록 (비어 있지 않음)
     * @return WorkUnitFailedException
     */
    private WorkUnitFailedException toException(List<UnitFailure> failures) {
        UnitFailure first = failures.get(0);
        WorkUnitFailedException exception = new WorkUnitFailedException(first.unit().getName(), first.cause());
        for (int i = 1; i < failures.size(); i++) {
            exception.addSuppressed(failures.get(i).cause());
        }
        return exception;
    }

    /**
     * 워커 풀 종료.
     *
     * <p>정상 경로에서는 모든 작업이 이미 join된 상태이므로 즉시 종료됩니다.</p>
     *
     * @param workers 워커 풀
     */
    private void shutdown(ExecutorService workers) {
        workers.shutdown();
        try {
            if (!workers.awaitTermination(config.shutdownTimeoutMs(), TimeUnit.MILLISECONDS)) {
                log.warn("Worker pool did not terminate within {}ms", config.shutdownTimeoutMs());
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workers.shutdownNow();
        }
    }

    private record UnitFailure(WorkUnit unit, Throwable cause) {
    }
}
