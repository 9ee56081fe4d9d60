package com.ryuqq.breakfast.adapter.runner;

import com.ryuqq.breakfast.core.spi.OutputSink;

import java.io.PrintStream;

/**
 * PrintStream 기반 콘솔 출력 대상.
 *
 * <p>본문과 줄바꿈을 별도 호출로 출력합니다. 따라서 보호되지 않은 동시 출력에서는
 * 다른 스레드의 메시지가 본문과 줄바꿈 사이에 끼어들 수 있습니다.</p>
 *
 * @author Breakfast Team
 * @since 1.0.0
 */
public final class ConsoleOutputSink implements OutputSink {

    private final PrintStream out;

    /**
     * 표준 출력 대상 생성.
     */
    public ConsoleOutputSink() {
        this(System.out);
    }

    /**
     * 생성자.
     *
     * @param out 출력 스트림
     * @throws IllegalArgumentException out이 null인 경우
     */
    public ConsoleOutputSink(PrintStream out) {
        if (out == null) {
            throw new IllegalArgumentException("out cannot be null");
        }
        this.out = out;
    }

    @Override
    public void write(String line) {
        out.print(line);
        out.println();
        out.flush();
    }
}
