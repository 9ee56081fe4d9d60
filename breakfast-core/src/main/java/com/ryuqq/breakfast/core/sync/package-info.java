/**
 * 출력 동기화.
 *
 * <p>{@link com.ryuqq.breakfast.core.sync.OutputGuard}는 시작 메시지 한 줄을 쓰는
 * 최소 구간만 보호합니다. 블로킹 구간을 보호하면 동시 실행 자체가 직렬화되므로
 * 잠금은 출력 직후 해제됩니다.</p>
 *
 * @author Breakfast Team
 * @since 1.0.0
 */
package com.ryuqq.breakfast.core.sync;
