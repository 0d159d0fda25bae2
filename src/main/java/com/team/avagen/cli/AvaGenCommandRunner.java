package com.team.avagen.cli;

import com.team.avagen.exception.WorkspaceNotFoundException;
import com.team.avagen.model.SynthesisReport;
import com.team.avagen.model.actionplan.AppActionPlans;
import com.team.avagen.service.actionplan.ActionPlanGenerationService;
import com.team.avagen.service.workspace.SynthesisWorkspaceService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Command line entry.
 *
 * Commands:
 * - prepare &lt;app_id&gt; &lt;file&gt;   copy a test class into the app's input directory
 * - extract &lt;app_id&gt;            split test methods and synthesize methods
 * - generate-va &lt;app_id&gt;        same as extract
 * - actionplan &lt;app_id&gt;         build the action plan JSON from synthesized methods
 * - pipeline &lt;app_id&gt;           extract followed by actionplan
 *
 * The workspace root is set with --avagen.workspace.root=&lt;dir&gt;.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class AvaGenCommandRunner implements ApplicationRunner, ExitCodeGenerator {

    static final int EXIT_USAGE = 2;
    static final int EXIT_FAILURE = 1;

    private final SynthesisWorkspaceService synthesisService;
    private final ActionPlanGenerationService actionPlanService;

    private int exitCode = 0;

    @Override
    public void run(ApplicationArguments args) {
        List<String> params = args.getNonOptionArgs();
        if (params.isEmpty()) {
            log.info(usage());
            return;
        }
        exitCode = execute(params);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    int execute(List<String> params) {
        String command = params.get(0);
        try {
            switch (command) {
                case "prepare" -> {
                    if (params.size() < 3) return usageError();
                    Path source = Path.of(params.get(2));
                    if (!Files.isRegularFile(source)) {
                        log.error("File not found: {}", source);
                        return EXIT_FAILURE;
                    }
                    synthesisService.prepare(params.get(1), source);
                }
                case "extract", "generate-va" -> {
                    if (params.size() < 2) return usageError();
                    reportSynthesis(synthesisService.processApp(params.get(1)));
                }
                case "actionplan" -> {
                    if (params.size() < 2) return usageError();
                    reportPlans(actionPlanService.generateForApp(params.get(1)));
                }
                case "pipeline" -> {
                    if (params.size() < 2) return usageError();
                    reportSynthesis(synthesisService.processApp(params.get(1)));
                    reportPlans(actionPlanService.generateForApp(params.get(1)));
                }
                default -> {
                    log.error("Unknown command: {}", command);
                    return usageError();
                }
            }
            return 0;
        } catch (WorkspaceNotFoundException e) {
            log.error(e.getMessage());
            return EXIT_FAILURE;
        }
    }

    private void reportSynthesis(SynthesisReport report) {
        log.info("{}: {} test methods extracted, {} methods synthesized",
                report.appId(), report.extractedFiles().size(), report.synthesizedFiles().size());
    }

    private void reportPlans(AppActionPlans plans) {
        log.info("{}: {} action plans generated", plans.getAppId(), plans.getActionPlans().size());
    }

    private int usageError() {
        log.error(usage());
        return EXIT_USAGE;
    }

    private static String usage() {
        return """
                Usage: ava-gen <command> [args]
                  prepare <app_id> <file>   copy a test class into <root>/<app_id>/input
                  extract <app_id>          split @Test methods and synthesize methods
                  generate-va <app_id>      same as extract
                  actionplan <app_id>       build <root>/actionplan/<app_id>_actionplan.json
                  pipeline <app_id>         extract, then actionplan
                Options:
                  --avagen.workspace.root=<dir>""";
    }
}
