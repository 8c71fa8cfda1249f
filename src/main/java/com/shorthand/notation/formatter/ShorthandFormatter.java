package com.shorthand.notation.formatter;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.shorthand.notation.model.EntityNode;
import com.shorthand.notation.model.FunctionNode;
import com.shorthand.notation.model.Metadata;
import com.shorthand.notation.model.Reference;
import com.shorthand.notation.model.ShorthandDocument;
import com.shorthand.notation.model.StateVariable;
import com.shorthand.notation.model.Tag;
import com.shorthand.notation.model.TypeSpec;
import com.shorthand.notation.parser.ShorthandParser;

/**
 * Writes a document back out in canonical form.
 *
 * Output order is metadata, module-level state, entities, functions, with one
 * blank line between sections. Comments and blank-line layout of the input
 * are not kept. Formatting the output again yields the same text.
 */
public class ShorthandFormatter {
    private static final Logger log = LoggerFactory.getLogger(ShorthandFormatter.class);

    private final FormatConfigValidator validator = new FormatConfigValidator();

    /**
     * Parse and format source text. Parse failures propagate unchanged.
     */
    public String format(String source, FormatConfig config) {
        validator.validate(config);
        return format(ShorthandParser.parseText(source), config);
    }

    public String format(ShorthandDocument document, FormatConfig config) {
        validator.validate(config);
        SymbolSet symbols = SymbolSet.forPreference(config.isPreferUnicode());

        List<List<String>> sections = new ArrayList<>();
        sections.add(List.of(formatMetadata(document.getMetadata())));

        if (!document.getModuleState().isEmpty()) {
            sections.add(formatStateBlock(document.getModuleState(), "", config, symbols));
        }

        for (EntityNode entity : document.getEntities()) {
            sections.add(formatEntity(entity, config, symbols));
        }

        if (!document.getFunctions().isEmpty()) {
            sections.add(document.getFunctions().stream()
                    .map(f -> formatFunction(f, symbols))
                    .toList());
        }

        String text = sections.stream()
                .map(lines -> String.join("\n", lines))
                .collect(Collectors.joining("\n\n", "", "\n"));

        List<Integer> overlong = findOverlongLines(text, config);
        if (!overlong.isEmpty()) {
            log.debug("Formatted module {} has {} lines over {} characters",
                    document.getMetadata().getModuleName(), overlong.size(), config.getMaxLineLength());
        }
        return text;
    }

    /**
     * 1-based numbers of the lines longer than the configured maximum.
     * Reporting them is up to the caller; the formatter never wraps.
     */
    public List<Integer> findOverlongLines(String text, FormatConfig config) {
        List<Integer> result = new ArrayList<>();
        String[] lines = text.split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            if (lines[i].codePointCount(0, lines[i].length()) > config.getMaxLineLength()) {
                result.add(i + 1);
            }
        }
        return result;
    }

    private String formatMetadata(Metadata metadata) {
        StringBuilder sb = new StringBuilder("# [M:").append(metadata.getModuleName()).append(']');
        if (metadata.getRole() != null) {
            sb.append(" [Role:").append(metadata.getRole()).append(']');
        }
        return sb.toString();
    }

    private List<String> formatEntity(EntityNode entity, FormatConfig config, SymbolSet symbols) {
        List<String> lines = new ArrayList<>();
        lines.add("[C:" + entity.getName() + "]");

        String indent = " ".repeat(config.getIndent());
        for (Reference dependency : entity.getDependencies()) {
            lines.add(indent + symbols.getDependency() + " [Ref:" + dependency.getName() + "]");
        }
        lines.addAll(formatStateBlock(entity.getState(), indent, config, symbols));
        return lines;
    }

    private List<String> formatStateBlock(List<StateVariable> state, String indent, FormatConfig config,
                                          SymbolSet symbols) {
        List<StateVariable> ordered = orderState(state, config.getSortStateBy());

        // Alignment is per block, never file-wide
        int width = config.isAlignTypes()
                ? ordered.stream().mapToInt(v -> v.getName().length()).max().orElse(0)
                : 0;

        List<String> lines = new ArrayList<>();
        for (StateVariable variable : ordered) {
            String name = padRight(variable.getName(), width);
            lines.add(indent + name + " " + symbols.getMembership() + " " + formatType(variable.getTypeSpec(), symbols));
        }
        return lines;
    }

    private static List<StateVariable> orderState(List<StateVariable> state, StateSortOrder order) {
        switch (order) {
            case LOCATION:
                return state.stream()
                        .sorted(Comparator.comparingInt(StateVariable::getSourceLine))
                        .toList();
            case NAME:
                return state.stream()
                        .sorted(Comparator.comparing(StateVariable::getName))
                        .toList();
            case NONE:
            default:
                return state;
        }
    }

    private String formatFunction(FunctionNode function, SymbolSet symbols) {
        String parameters = function.getParameters().stream()
                .map(p -> p.getName() + ": " + formatType(p.getTypeSpec(), symbols))
                .collect(Collectors.joining(", "));

        StringBuilder sb = new StringBuilder("F:")
                .append(function.getName())
                .append('(').append(parameters).append(')')
                .append(' ').append(symbols.getArrow()).append(' ')
                .append(formatType(function.getReturnType(), symbols));

        for (Tag tag : function.getTags()) {
            sb.append(' ').append(symbols.render(tag.toString()));
        }
        return sb.toString();
    }

    private static String formatType(TypeSpec type, SymbolSet symbols) {
        return symbols.render(type.toString());
    }

    private static String padRight(String text, int width) {
        if (text.length() >= width) {
            return text;
        }
        return text + " ".repeat(width - text.length());
    }
}
