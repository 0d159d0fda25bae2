package com.team.avagen.util;

import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Brace-depth tracking shared by the test method splitter, the method assembler
 * and the action plan parser.
 */
@Slf4j
public final class BalancedBlockExtractor {

    private BalancedBlockExtractor() {
    }

    /**
     * Line range of a brace-delimited block.
     *
     * @param openLine  index of the line holding the opening brace
     * @param closeLine index of the line where depth returns to zero, or the last line if the block never closes
     * @param closed    whether the block was closed before end of input
     */
    public record Block(int openLine, int closeLine, boolean closed) {

        /** Lines strictly between the opening and closing lines. */
        public List<String> inner(List<String> lines) {
            int end = closed ? closeLine : closeLine + 1;
            if (openLine + 1 >= end) return List.of();
            return lines.subList(openLine + 1, end);
        }
    }

    /**
     * Find the block whose opening brace is on {@code fromLine} or the first later line containing one.
     *
     * @return the block, or {@code null} when no opening brace follows
     */
    public static Block find(List<String> lines, int fromLine) {
        int openLine = fromLine;
        while (openLine < lines.size() && lines.get(openLine).indexOf('{') < 0) {
            openLine++;
        }
        if (openLine >= lines.size()) {
            return null;
        }

        int depth = 0;
        for (int i = openLine; i < lines.size(); i++) {
            depth += ArgumentSplitter.balance(lines.get(i), '{', '}');
            if (depth <= 0) {
                return new Block(openLine, i, true);
            }
        }
        log.warn("Unclosed block starting at line {}", openLine + 1);
        return new Block(openLine, lines.size() - 1, false);
    }
}
