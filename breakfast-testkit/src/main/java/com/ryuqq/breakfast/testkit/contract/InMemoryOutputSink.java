package com.ryuqq.breakfast.testkit.contract;

import com.ryuqq.breakfast.core.spi.OutputSink;

import java.util.List;
import java.util.stream.Collectors;

/**
 * In-memory implementation of OutputSink for testing purposes.
 *
 * <p>All writes are appended to a single shared transcript, one line per write.</p>
 *
 * <p><strong>Modes:</strong></p>
 * <ul>
 *   <li>Line mode (default): each line is appended atomically</li>
 *   <li>Char-by-char mode: each character is appended separately with a yield in between,
 *       so unguarded concurrent writes visibly interleave inside a line</li>
 * </ul>
 *
 * @author Breakfast Team
 * @since 1.0.0
 */
public class InMemoryOutputSink implements OutputSink {

    private final StringBuffer transcript = new StringBuffer();
    private final boolean charByChar;

    /**
     * Creates a sink in line mode.
     */
    public InMemoryOutputSink() {
        this(false);
    }

    /**
     * Creates a sink.
     *
     * @param charByChar true to append one character at a time
     */
    public InMemoryOutputSink(boolean charByChar) {
        this.charByChar = charByChar;
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public void write(String line) {
        if (line == null) {
            throw new IllegalArgumentException("line cannot be null");
        }
        if (!charByChar) {
            transcript.append(line + '\n');
            return;
        }
        for (int i = 0; i < line.length(); i++) {
            transcript.append(line.charAt(i));
            Thread.yield();
        }
        transcript.append('\n');
    }

    /**
     * Returns the raw transcript including line separators.
     *
     * @return transcript text
     */
    public String transcript() {
        return transcript.toString();
    }

    /**
     * Returns the transcript split into lines.
     *
     * @return lines in write order
     */
    public List<String> lines() {
        return transcript().lines().collect(Collectors.toList());
    }

    /**
     * Clears the transcript.
     */
    public void clear() {
        transcript.setLength(0);
    }
}
