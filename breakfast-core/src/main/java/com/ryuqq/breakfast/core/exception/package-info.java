/**
 * Breakfast 예외.
 *
 * <p>모두 unchecked 예외입니다. 입력 검증 실패는 IllegalArgumentException을 그대로 사용합니다.</p>
 *
 * @author Breakfast Team
 * @since 1.0.0
 */
package com.ryuqq.breakfast.core.exception;
