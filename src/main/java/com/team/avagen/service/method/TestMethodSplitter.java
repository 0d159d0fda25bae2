package com.team.avagen.service.method;

import com.team.avagen.model.SourceDialect;
import com.team.avagen.model.TestMethodBlock;
import com.team.avagen.util.BalancedBlockExtractor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;

/**
 * Cuts a test class into its {@code @Test} methods. Each slice runs from the annotation
 * line to the line closing the method body.
 */
@Component
@Slf4j
public class TestMethodSplitter {

    static final String TEST_ANNOTATION = "@Test";

    /**
     * @return method name to block, in source order; a repeated name keeps the last block
     */
    public Map<String, TestMethodBlock> split(String source, SourceDialect dialect) {
        List<String> lines = List.of(source.split("\\R", -1));
        Map<String, TestMethodBlock> methods = new LinkedHashMap<>();

        int i = 0;
        while (i < lines.size()) {
            if (!lines.get(i).strip().equals(TEST_ANNOTATION)) {
                i++;
                continue;
            }

            int header = i + 1;
            while (header < lines.size() && lines.get(header).isBlank()) {
                header++;
            }
            if (header >= lines.size()) {
                break;
            }

            Matcher m = dialect.getHeaderPattern().matcher(lines.get(header));
            if (!m.find()) {
                log.warn("Skipping @Test at line {}: unrecognized {} header '{}'",
                        i + 1, dialect, lines.get(header).strip());
                i = header + 1;
                continue;
            }

            BalancedBlockExtractor.Block block = BalancedBlockExtractor.find(lines, header);
            if (block == null) {
                log.warn("Method {} has no body", m.group(1));
                break;
            }

            String name = m.group(1);
            if (methods.containsKey(name)) {
                log.warn("Test method {} appears more than once, keeping the last one", name);
            }
            methods.put(name, new TestMethodBlock(name, lines.subList(i, block.closeLine() + 1), dialect));
            i = block.closeLine() + 1;
        }
        return methods;
    }
}
