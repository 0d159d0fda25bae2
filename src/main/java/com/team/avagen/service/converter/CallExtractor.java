package com.team.avagen.service.converter;

import com.team.avagen.dsl.EspressoVocabulary;
import com.team.avagen.model.NormalizedCall;
import com.team.avagen.model.SourceDialect;
import com.team.avagen.util.ArgumentSplitter;
import com.team.avagen.util.StatementText;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Finds multi-line Espresso statements in raw test source and joins each one into a
 * single {@link NormalizedCall}. Subclasses decide when a collected statement is complete.
 */
@Slf4j
public abstract class CallExtractor {

    protected static final Pattern PERFORM_MARKER = Pattern.compile("\\.\\s*perform\\s*\\(");

    protected final EspressoVocabulary vocabulary;

    protected CallExtractor(EspressoVocabulary vocabulary) {
        this.vocabulary = vocabulary;
    }

    public abstract SourceDialect dialect();

    /**
     * Whether the collected text forms a complete action statement.
     *
     * @param joined  collected lines joined with single spaces
     * @param balance open minus close parentheses so far, string literals excluded
     * @param marker  whether {@code .perform(} has been seen
     */
    protected abstract boolean isComplete(String joined, int balance, boolean marker);

    /**
     * Whether the collected text is a finished statement that never reaches {@code perform},
     * such as an assertion. Such statements are discarded instead of swallowing the next one.
     */
    protected abstract boolean isFinishedWithoutAction(String joined, int balance, boolean marker);

    /**
     * Extract every complete statement in source order. A statement still open at end of input is dropped.
     */
    public List<NormalizedCall> extract(String source) {
        List<NormalizedCall> calls = new ArrayList<>();
        CallCollector collector = newCollector();
        for (String line : source.split("\\R", -1)) {
            if (!collector.isCollecting() && !vocabulary.startsCall(line)) {
                continue;
            }
            collector.accept(line).ifPresent(calls::add);
        }
        if (collector.isCollecting()) {
            log.debug("Dropping unterminated statement: {}", collector.pending());
        }
        return calls;
    }

    public boolean startsCall(String line) {
        return vocabulary.startsCall(line);
    }

    public CallCollector newCollector() {
        return new CallCollector();
    }

    public NormalizedCall normalize(List<String> lines) {
        return new NormalizedCall(StatementText.joinStatement(lines), dialect());
    }

    /**
     * Collect/flush state machine for one pass over a source. Idle until fed a line,
     * then collecting until the statement completes or is discarded.
     */
    public class CallCollector {

        private final List<String> buffer = new ArrayList<>();
        private int balance;
        private boolean marker;

        public boolean isCollecting() {
            return !buffer.isEmpty();
        }

        /**
         * Feed one raw line. Blank lines are ignored.
         *
         * @return the normalized statement when this line completes it
         */
        public Optional<NormalizedCall> accept(String line) {
            String stripped = line.strip();
            if (stripped.isEmpty()) {
                return Optional.empty();
            }
            buffer.add(stripped);
            balance += ArgumentSplitter.parenBalance(stripped);
            String joined = String.join(" ", buffer);
            marker = marker || PERFORM_MARKER.matcher(joined).find();

            if (isComplete(joined, balance, marker)) {
                NormalizedCall call = normalize(buffer);
                reset();
                return Optional.of(call);
            }
            if (isFinishedWithoutAction(joined, balance, marker)) {
                log.debug("Skipping statement without perform: {}", joined);
                reset();
            }
            return Optional.empty();
        }

        String pending() {
            return String.join(" ", buffer);
        }

        private void reset() {
            buffer.clear();
            balance = 0;
            marker = false;
        }
    }
}
