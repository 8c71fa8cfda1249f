package com.shorthand.notation.cli;

import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.shorthand.notation.cli.exception.OptionsValidationException;
import com.shorthand.notation.cli.model.ParseOptions;
import com.shorthand.notation.cli.output.DocumentJsonWriter;
import com.shorthand.notation.cli.validation.CommandOptionsValidator;
import com.shorthand.notation.model.Diagnostic;
import com.shorthand.notation.model.ShorthandDocument;
import com.shorthand.notation.parser.exception.ParseException;
import com.shorthand.notation.service.ShorthandFileService;
import com.shorthand.notation.util.FileWriteUtil;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Parses one shorthand file and writes the document as JSON.
 */
@Command(
        name = "parse",
        mixinStandardHelpOptions = true,
        description = "Parse a shorthand file and emit its structure as JSON."
)
public class ParseCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ParseCommand.class);

    @Spec
    private CommandSpec spec;

    @Mixin
    private ParseOptions options = new ParseOptions();

    private final CommandOptionsValidator validator = new CommandOptionsValidator();
    private final ShorthandFileService fileService = new ShorthandFileService();
    private final DocumentJsonWriter jsonWriter = new DocumentJsonWriter();

    @Override
    public Integer call() {
        try {
            validator.validate(options);

            ShorthandDocument document = fileService.parse(options.getInput());
            for (Diagnostic diagnostic : document.getDiagnostics()) {
                log.warn("{}: {}", options.getInput(), diagnostic);
            }

            String json = jsonWriter.write(document, options.isPretty());
            if (options.getOutput() != null) {
                FileWriteUtil.safeWriteString(options.getOutput(), json + System.lineSeparator());
                log.info("Wrote {}", options.getOutput());
            } else {
                spec.commandLine().getOut().println(json);
                spec.commandLine().getOut().flush();
            }
            return 0;

        } catch (OptionsValidationException e) {
            e.getErrors().forEach(log::error);
            return 1;
        } catch (ParseException e) {
            log.error("{}: {}", options.getInput(), e.getMessage());
            return 1;
        } catch (Exception e) {
            log.error("Parse failed with exception", e);
            return 1;
        }
    }
}
