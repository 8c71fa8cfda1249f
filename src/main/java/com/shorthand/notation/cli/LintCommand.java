package com.shorthand.notation.cli;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.shorthand.notation.cli.exception.OptionsValidationException;
import com.shorthand.notation.cli.model.LintOptions;
import com.shorthand.notation.cli.output.DocumentJsonWriter;
import com.shorthand.notation.cli.output.LintResultsPrinter;
import com.shorthand.notation.cli.validation.CommandOptionsValidator;
import com.shorthand.notation.service.ShorthandDiscoveryService;
import com.shorthand.notation.service.ShorthandLintService;
import com.shorthand.notation.service.model.LintReport;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Validates shorthand files. Exit code 1 when any file has errors, or
 * warnings under {@code --strict}.
 */
@Command(
        name = "lint",
        mixinStandardHelpOptions = true,
        description = "Validate and lint shorthand files."
)
public class LintCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(LintCommand.class);

    @Spec
    private CommandSpec spec;

    @Mixin
    private LintOptions options = new LintOptions();

    private final CommandOptionsValidator validator = new CommandOptionsValidator();
    private final ShorthandDiscoveryService discoveryService = new ShorthandDiscoveryService();
    private final ShorthandLintService lintService = new ShorthandLintService();
    private final DocumentJsonWriter jsonWriter = new DocumentJsonWriter();

    @Override
    public Integer call() {
        try {
            validator.validate(options);
            LintResultsPrinter printer = new LintResultsPrinter(spec.commandLine().getOut());

            List<Path> files = discoveryService.discover(options.getInput());
            if (files.isEmpty()) {
                log.error("No {} files found in {}", ShorthandDiscoveryService.EXTENSION, options.getInput());
                return 1;
            }

            List<LintReport> reports = new ArrayList<>();
            for (Path file : files) {
                reports.add(lintService.lint(file, options.getLineLength()));
            }

            if (options.isJson()) {
                printer.printJson(jsonWriter.write(reports, true));
            } else {
                reports.forEach(printer::printReport);
                printer.printSummary(reports, options.isStrict());
            }

            boolean passed = reports.stream().allMatch(r -> r.passes(options.isStrict()));
            return passed ? 0 : 1;

        } catch (OptionsValidationException e) {
            e.getErrors().forEach(log::error);
            return 1;
        } catch (Exception e) {
            log.error("Lint failed with exception", e);
            return 1;
        }
    }
}
