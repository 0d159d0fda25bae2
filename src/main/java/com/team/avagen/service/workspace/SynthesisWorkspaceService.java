package com.team.avagen.service.workspace;

import com.team.avagen.config.WorkspaceConfig;
import com.team.avagen.exception.WorkspaceNotFoundException;
import com.team.avagen.model.SourceDialect;
import com.team.avagen.model.SynthesisReport;
import com.team.avagen.model.TestMethodBlock;
import com.team.avagen.service.method.MethodAssembler;
import com.team.avagen.service.method.TestMethodSplitter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Runs test method extraction and method synthesis over one app's workspace.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SynthesisWorkspaceService {

    private final WorkspaceConfig workspaceConfig;
    private final TestMethodSplitter splitter;
    private final MethodAssembler assembler;

    /**
     * Copy a test source (or the app introduction) into the app's input directory.
     *
     * @return the copied file
     */
    public Path prepare(String appId, Path source) {
        Path inputDir = workspaceConfig.inputPath(appId);
        Path target = inputDir.resolve(source.getFileName());
        try {
            Files.createDirectories(inputDir);
            Files.copy(source, target, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to copy " + source + " to " + target, e);
        }
        log.info("Copied {} into {}", source, inputDir);
        return target;
    }

    /**
     * Split every test source of the app into methods and synthesize each one.
     *
     * @throws WorkspaceNotFoundException if the app has no input directory
     */
    public SynthesisReport processApp(String appId) {
        Path inputDir = workspaceConfig.inputPath(appId);
        if (!Files.isDirectory(inputDir)) {
            throw new WorkspaceNotFoundException(appId, inputDir);
        }
        Path extractedDir = workspaceConfig.extractedPath(appId);
        Path synthesizedDir = workspaceConfig.synthesizedPath(appId);
        createDirectories(extractedDir);
        createDirectories(synthesizedDir);

        int filesRead = 0;
        List<Path> extracted = new ArrayList<>();
        List<Path> synthesized = new ArrayList<>();

        for (Path file : listInputs(inputDir)) {
            String fileName = file.getFileName().toString();
            if (fileName.equals(workspaceConfig.getAppIntroductionFile())) {
                log.info("Found app introduction: {}", file);
                continue;
            }
            Optional<SourceDialect> dialect = SourceDialect.fromFileName(fileName);
            if (dialect.isEmpty()) {
                log.warn("Skipping non-test file: {}", fileName);
                continue;
            }

            filesRead++;
            Map<String, TestMethodBlock> methods = splitter.split(read(file), dialect.get());
            if (methods.isEmpty()) {
                log.warn("No @Test methods found in {}", fileName);
                continue;
            }
            log.info("Extracted {} test methods from {}", methods.size(), fileName);

            String extension = dialect.get().getExtension();
            for (TestMethodBlock block : methods.values()) {
                Path slice = extractedDir.resolve(block.methodName() + extension);
                write(slice, block.source() + "\n");
                extracted.add(slice);

                Path method = synthesizedDir.resolve(MethodAssembler.synthesizedName(block.methodName()) + extension);
                write(method, assembler.assemble(block) + "\n");
                synthesized.add(method);
            }
        }

        log.info("App {}: {} source files, {} test methods, {} synthesized methods",
                appId, filesRead, extracted.size(), synthesized.size());
        return new SynthesisReport(appId, filesRead, extracted, synthesized);
    }

    private List<Path> listInputs(Path dir) {
        try (Stream<Path> files = Files.list(dir)) {
            return files.filter(Files::isRegularFile).sorted().toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list " + dir, e);
        }
    }

    private static void createDirectories(Path dir) {
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create " + dir, e);
        }
    }

    private static String read(Path file) {
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + file, e);
        }
    }

    private static void write(Path file, String content) {
        try {
            Files.writeString(file, content, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + file, e);
        }
    }
}
