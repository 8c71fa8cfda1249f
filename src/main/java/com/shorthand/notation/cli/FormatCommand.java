package com.shorthand.notation.cli;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.shorthand.notation.cli.exception.OptionsValidationException;
import com.shorthand.notation.cli.model.FormatOptions;
import com.shorthand.notation.cli.model.ValidatedFormatOptions;
import com.shorthand.notation.cli.output.FormatResultsPrinter;
import com.shorthand.notation.cli.validation.CommandOptionsValidator;
import com.shorthand.notation.formatter.FormatConfig;
import com.shorthand.notation.formatter.ShorthandFormatter;
import com.shorthand.notation.service.ShorthandDiscoveryService;
import com.shorthand.notation.service.ShorthandFileService;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Formats shorthand files to stdout, in place, or as a check.
 * Exit code 1 when a check finds unformatted files or any file fails.
 */
@Command(
        name = "format",
        mixinStandardHelpOptions = true,
        description = "Format shorthand files for consistency.",
        footer = "Example: shorthand format src/ --write"
)
public class FormatCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(FormatCommand.class);

    @Spec
    private CommandSpec spec;

    @Mixin
    private FormatOptions options = new FormatOptions();

    private final CommandOptionsValidator validator = new CommandOptionsValidator();
    private final ShorthandDiscoveryService discoveryService = new ShorthandDiscoveryService();
    private final ShorthandFileService fileService = new ShorthandFileService();
    private final ShorthandFormatter formatter = new ShorthandFormatter();

    @Override
    public Integer call() {
        try {
            ValidatedFormatOptions validated = validator.validate(options);
            FormatConfig config = validated.getConfig();
            FormatResultsPrinter printer = new FormatResultsPrinter(spec.commandLine().getOut());

            List<Path> files = discoveryService.discover(validated.getInput());
            if (files.isEmpty()) {
                log.error("No {} files found in {}", ShorthandDiscoveryService.EXTENSION, options.getInput());
                return 1;
            }
            if (options.isVerbose()) {
                printer.printBanner(validated, files.size());
            }

            int needingFormat = 0;
            for (Path file : files) {
                try {
                    if (options.isCheck()) {
                        String original = fileService.read(file);
                        String formatted = formatter.format(original, config);
                        if (!original.equals(formatted)) {
                            needingFormat++;
                            printer.printWouldReformat(file);
                            if (options.isDiff()) {
                                printer.printDiff(file, original, formatted);
                            }
                        }
                    } else if (options.isWrite()) {
                        printer.printWritten(file, fileService.formatInPlace(file, config));
                    } else {
                        String formatted = fileService.format(file, config);
                        printer.printFormatted(file, formatted, files.size() > 1);
                        if (options.isVerbose()) {
                            printer.printOverlongLines(file, formatter.findOverlongLines(formatted, config),
                                    config.getMaxLineLength());
                        }
                    }
                } catch (Exception e) {
                    printer.printFailure(file, e, options.isVerbose());
                    return 1;
                }
            }

            if (options.isCheck()) {
                printer.printCheckSummary(files.size(), needingFormat);
                return needingFormat == 0 ? 0 : 1;
            }
            return 0;

        } catch (OptionsValidationException e) {
            e.getErrors().forEach(log::error);
            return 1;
        } catch (Exception e) {
            log.error("Format failed with exception", e);
            return 1;
        }
    }
}
