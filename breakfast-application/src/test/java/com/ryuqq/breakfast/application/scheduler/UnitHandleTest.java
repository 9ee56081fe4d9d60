package com.ryuqq.breakfast.application.scheduler;

import com.ryuqq.breakfast.core.model.WorkUnit;
import org.junit.jupiter.api.Test;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * UnitHandle 테스트.
 *
 * @author Breakfast Team
 * @since 1.0.0
 */
class UnitHandleTest {

    private final WorkUnit coffee = WorkUnit.of("coffee", 0);

    @Test
    void await_CompletedFuture_ReturnsEmpty() {
        // Given
        UnitHandle handle = UnitHandle.of(coffee, CompletableFuture.completedFuture(null));

        // When
        Optional<Throwable> failure = handle.await();

        // Then
        assertThat(failure).isEmpty();
        assertThat(handle.isAwaited()).isTrue();
    }

    @Test
    void await_FailedFuture_ReturnsCause() {
        // Given
        IllegalStateException boom = new IllegalStateException("boom");
        UnitHandle handle = UnitHandle.of(coffee, CompletableFuture.failedFuture(boom));

        // When
        Optional<Throwable> failure = handle.await();

        // Then
        assertThat(failure).containsSame(boom);
        assertThat(handle.isAwaited()).isTrue();
    }

    @Test
    void await_Twice_ThrowsException() {
        // Given
        UnitHandle handle = UnitHandle.of(coffee, CompletableFuture.completedFuture(null));
        handle.await();

        // When & Then
        assertThatThrownBy(handle::await)
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("already awaited");
    }

    @Test
    void await_Interrupted_RestoresFlag() {
        // Given
        UnitHandle handle = UnitHandle.of(coffee, new CompletableFuture<Void>());
        Thread.currentThread().interrupt();

        // When & Then
        try {
            assertThatThrownBy(handle::await).isInstanceOf(IllegalStateException.class);
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
            assertThat(handle.isAwaited()).isFalse();
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void of_NullArguments_ThrowsException() {
        assertThatThrownBy(() -> UnitHandle.of(null, CompletableFuture.completedFuture(null)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("unit cannot be null");
        assertThatThrownBy(() -> UnitHandle.of(coffee, null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("future cannot be null");
    }

    @Test
    void toString_ContainsUnitName() {
        UnitHandle handle = UnitHandle.of(coffee, CompletableFuture.completedFuture(null));

        assertThat(handle.toString()).contains("coffee");
    }
}
