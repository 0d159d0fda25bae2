package com.team.avagen.service.method;

import com.team.avagen.dsl.EspressoVocabulary;
import com.team.avagen.exception.StatementConversionException;
import com.team.avagen.model.NormalizedCall;
import com.team.avagen.model.SourceDialect;
import com.team.avagen.model.TestMethodBlock;
import com.team.avagen.service.converter.CallExtractor;
import com.team.avagen.service.converter.CallExtractorRegistry;
import com.team.avagen.service.converter.StatementConverter;
import com.team.avagen.util.BalancedBlockExtractor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;

/**
 * Turns one test method into a synthesized method: the test suffix is removed from the name,
 * Espresso statements are replaced by their converted form, helper statements are kept and
 * everything else is dropped. Statement order is preserved.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class MethodAssembler {

    static final String TEST_SUFFIX = "Test";
    private static final String INDENT = "    ";

    private final CallExtractorRegistry extractors;
    private final StatementConverter converter;
    private final EspressoVocabulary vocabulary;

    public String assemble(TestMethodBlock block) {
        SourceDialect dialect = block.dialect();
        List<String> lines = block.lines().stream()
                .filter(line -> !line.strip().startsWith(TestMethodSplitter.TEST_ANNOTATION))
                .toList();

        int headerIndex = findHeader(lines, dialect);
        String header = renameHeader(lines.get(headerIndex), dialect);
        String headerIndent = leadingWhitespace(header);
        String statementIndent = headerIndent + INDENT;

        List<String> out = new ArrayList<>();
        out.add(header.contains("{") ? header : header + " {");

        BalancedBlockExtractor.Block body = BalancedBlockExtractor.find(lines, headerIndex);
        List<String> bodyLines = body == null ? List.of() : body.inner(lines);

        CallExtractor extractor = extractors.forDialect(dialect);
        CallExtractor.CallCollector collector = extractor.newCollector();

        for (String line : bodyLines) {
            String stripped = line.strip();

            if (collector.isCollecting() || (!stripped.isEmpty() && extractor.startsCall(stripped))) {
                collector.accept(line).ifPresent(call -> convert(call).ifPresent(s -> out.add(statementIndent + s)));
                continue;
            }
            if (stripped.isEmpty()) {
                continue;
            }
            if (vocabulary.isAssertion(stripped)) {
                log.debug("Dropping assertion: {}", stripped);
                continue;
            }
            if (vocabulary.isHelperStatement(stripped, dialect)) {
                out.add(statementIndent + stripped);
                continue;
            }
            log.debug("Dropping unsupported line: {}", stripped);
        }

        out.add(headerIndent + "}");
        return String.join("\n", out);
    }

    /** Method name without a trailing {@code Test}. */
    public static String synthesizedName(String methodName) {
        return methodName.endsWith(TEST_SUFFIX)
                ? methodName.substring(0, methodName.length() - TEST_SUFFIX.length())
                : methodName;
    }

    String renameHeader(String header, SourceDialect dialect) {
        Matcher m = dialect.getRenamePattern().matcher(header);
        if (!m.find()) {
            return header;
        }
        return header.substring(0, m.start(2)) + synthesizedName(m.group(2)) + header.substring(m.end(2));
    }

    private Optional<String> convert(NormalizedCall call) {
        try {
            return Optional.of(converter.convert(call).statement());
        } catch (StatementConversionException e) {
            log.debug("Dropping statement {}: {}", call, e.getMessage());
            return Optional.empty();
        }
    }

    private int findHeader(List<String> lines, SourceDialect dialect) {
        for (int i = 0; i < lines.size(); i++) {
            if (dialect.getHeaderPattern().matcher(lines.get(i)).find()) {
                return i;
            }
        }
        throw new IllegalArgumentException("Could not locate method header in test method");
    }

    private static String leadingWhitespace(String line) {
        int i = 0;
        while (i < line.length() && Character.isWhitespace(line.charAt(i))) {
            i++;
        }
        return line.substring(0, i);
    }
}
