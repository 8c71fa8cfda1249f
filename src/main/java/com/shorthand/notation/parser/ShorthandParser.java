package com.shorthand.notation.parser;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.shorthand.notation.model.DecoratorVocabulary;
import com.shorthand.notation.model.EntityNode;
import com.shorthand.notation.model.FunctionNode;
import com.shorthand.notation.model.Metadata;
import com.shorthand.notation.model.Parameter;
import com.shorthand.notation.model.Placement;
import com.shorthand.notation.model.Reference;
import com.shorthand.notation.model.ShorthandDocument;
import com.shorthand.notation.model.StateVariable;
import com.shorthand.notation.model.Tag;
import com.shorthand.notation.model.TagType;
import com.shorthand.notation.model.TypeSpec;
import com.shorthand.notation.parser.ShorthandToken.TokenType;
import com.shorthand.notation.parser.exception.ParseException;

/**
 * Recursive-descent parser for shorthand documents.
 *
 * Hard failures (missing metadata, unterminated or empty tags, tag invariant
 * violations) throw {@link ParseException}. Everything else is recorded as a
 * diagnostic and the offending line is skipped.
 *
 * A parser instance holds the cursor for one token list; create a new one per
 * parse.
 */
public class ShorthandParser {
    private static final Logger log = LoggerFactory.getLogger(ShorthandParser.class);

    private static final Pattern MODULE_PATTERN = Pattern.compile("\\[M:([^\\]]+)\\]");
    private static final Pattern ROLE_PATTERN = Pattern.compile("\\[Role:([^\\]]+)\\]");

    private static final String ENTITY_TAG = "C";
    private static final String REFERENCE_TAG = "Ref";
    private static final String FUNCTION_PREFIX = "F";
    private static final String ASCII_MEMBERSHIP = "in";

    private final List<ShorthandToken> tokens;
    private final TagClassifier tagClassifier;
    private final ParseDiagnostics diagnostics = new ParseDiagnostics();
    private int pos = 0;

    private boolean firstLineSeen;
    private Metadata metadata;
    private final List<StateVariable> moduleState = new ArrayList<>();
    private final List<EntityNode> entities = new ArrayList<>();
    private final List<FunctionNode> functions = new ArrayList<>();
    private final Set<String> entityNames = new HashSet<>();

    public ShorthandParser(List<ShorthandToken> tokens) {
        this(tokens, DecoratorVocabulary.DEFAULT);
    }

    public ShorthandParser(List<ShorthandToken> tokens, DecoratorVocabulary vocabulary) {
        this.tokens = tokens;
        this.tagClassifier = new TagClassifier(vocabulary);
    }

    /**
     * Tokenize and parse source text.
     */
    public static ShorthandDocument parseText(String text) {
        return parseText(text, DecoratorVocabulary.DEFAULT);
    }

    public static ShorthandDocument parseText(String text, DecoratorVocabulary vocabulary) {
        List<ShorthandToken> tokens = new ShorthandTokenizer(text).tokenize();
        return new ShorthandParser(tokens, vocabulary).parse();
    }

    public ShorthandDocument parse() {
        while (!isAtEnd()) {
            parseTopLevelLine();
        }

        if (metadata == null) {
            throw new ParseException("Missing metadata header: first line must be '# [M:<name>]'", 1, 1);
        }

        log.debug("Parsed module {}: {} entities, {} functions, {} diagnostics",
                metadata.getModuleName(), entities.size(), functions.size(), diagnostics.getEntries().size());

        return ShorthandDocument.builder()
                .metadata(metadata)
                .moduleState(moduleState)
                .entities(entities)
                .functions(functions)
                .diagnostics(diagnostics.getEntries())
                .build();
    }

    private void parseTopLevelLine() {
        ShorthandToken token = peek();

        if (!firstLineSeen && !token.is(TokenType.NEWLINE) && !token.is(TokenType.INDENT)
                && !token.is(TokenType.DEDENT)) {
            firstLineSeen = true;
            if (token.is(TokenType.COMMENT)) {
                metadata = extractMetadata(token.getValue());
            }
        }

        switch (token.getType()) {
            case NEWLINE:
            case DEDENT:
            case COMMENT:
                advance();
                return;
            case INDENT:
                diagnostics.warn(token.getLine(), token.getColumn(), "Unexpected indentation at top level");
                advance();
                return;
            case BRACKET_OPEN:
                parseBracketStatement();
                return;
            case IDENTIFIER:
                if (FUNCTION_PREFIX.equals(token.getValue()) && checkNext(TokenType.COLON)) {
                    parseFunctionLine();
                    return;
                }
                if (isStateVariableStart()) {
                    moduleState.add(parseStateVariable());
                    expectEndOfLine();
                    return;
                }
                break;
            default:
                break;
        }

        skipUnrecognized(token, "Unrecognized top-level statement");
    }

    private Metadata extractMetadata(String comment) {
        Matcher module = MODULE_PATTERN.matcher(comment);
        if (!module.find()) {
            return null;
        }
        Matcher role = ROLE_PATTERN.matcher(comment);
        String roleName = role.find() ? role.group(1).trim() : null;
        return new Metadata(module.group(1).trim(), roleName);
    }

    private void parseBracketStatement() {
        ShorthandToken open = peek();
        Tag tag = parseTag();

        if (isEntityHeader(tag)) {
            parseEntity(tag.getQualifiers().get(0), open);
            return;
        }

        diagnostics.warn(open.getLine(), open.getColumn(), "Tag " + tag + " is not attached to a function and was ignored");
        skipToEndOfLine();
    }

    private static boolean isEntityHeader(Tag tag) {
        return tag.getTagType() == TagType.OPERATION
                && ENTITY_TAG.equals(tag.getBase())
                && tag.getQualifiers().size() == 1;
    }

    // ---- Entities ----

    private void parseEntity(String name, ShorthandToken header) {
        EntityNode.EntityNodeBuilder entity = EntityNode.builder()
                .name(name)
                .sourceLine(header.getLine());
        expectEndOfLine();

        // Comment-only and blank lines never open or close a block
        while (check(TokenType.COMMENT) || check(TokenType.NEWLINE)) {
            advance();
        }

        if (check(TokenType.INDENT)) {
            advance();
            parseEntityBody(name, entity);
        }

        if (!entityNames.add(name)) {
            diagnostics.error(header.getLine(), header.getColumn(), "Duplicate entity '" + name + "'");
        }

        EntityNode node = entity.build();
        entities.add(node);

        log.debug("Parsed entity: {} at line {} ({} dependencies, {} state variables)",
                name, header.getLine(), node.getDependencies().size(), node.getState().size());
    }

    private void parseEntityBody(String entityName, EntityNode.EntityNodeBuilder entity) {
        int depth = 1;
        Set<String> seenState = new HashSet<>();

        while (!isAtEnd() && depth > 0) {
            ShorthandToken token = peek();

            switch (token.getType()) {
                case INDENT:
                    depth++;
                    advance();
                    continue;
                case DEDENT:
                    depth--;
                    advance();
                    continue;
                case NEWLINE:
                case COMMENT:
                    advance();
                    continue;
                default:
                    break;
            }

            if (token.isSymbol(ShorthandTokenizer.DEPENDENCY)) {
                parseDependency(entityName).ifPresent(entity::dependency);
                continue;
            }

            if (isStateVariableStart()) {
                StateVariable variable = parseStateVariable();
                if (!seenState.add(variable.getName())) {
                    diagnostics.warn(token.getLine(), token.getColumn(),
                            "Duplicate state variable '" + variable.getName() + "' in entity '" + entityName + "'");
                }
                entity.stateVariable(variable);
                expectEndOfLine();
                continue;
            }

            skipUnrecognized(token, "Unrecognized content in entity '" + entityName + "'");
        }
    }

    private Optional<Reference> parseDependency(String entityName) {
        ShorthandToken marker = advance();

        if (!check(TokenType.BRACKET_OPEN)) {
            skipUnrecognized(marker, "Expected [Ref:<Name>] after dependency marker in entity '" + entityName + "'");
            return Optional.empty();
        }

        Tag tag = parseTag();
        if (!REFERENCE_TAG.equals(tag.getBase()) || tag.getQualifiers().size() != 1) {
            diagnostics.warn(marker.getLine(), marker.getColumn(),
                    "Expected [Ref:<Name>] dependency in entity '" + entityName + "' but found " + tag);
            skipToEndOfLine();
            return Optional.empty();
        }

        expectEndOfLine();
        return Optional.of(Reference.builder()
                .name(tag.getQualifiers().get(0))
                .sourceLine(marker.getLine())
                .build());
    }

    // ---- State variables and types ----

    private boolean isStateVariableStart() {
        if (!check(TokenType.IDENTIFIER) || pos + 1 >= tokens.size()) {
            return false;
        }
        ShorthandToken next = tokens.get(pos + 1);
        return next.isSymbol(ShorthandTokenizer.MEMBERSHIP)
                || (next.is(TokenType.IDENTIFIER) && ASCII_MEMBERSHIP.equals(next.getValue()));
    }

    private StateVariable parseStateVariable() {
        ShorthandToken name = advance();
        advance(); // ∈ or in

        TypeSpec type = parseTypeSpec("state variable '" + name.getValue() + "'");
        return StateVariable.builder()
                .name(name.getValue())
                .typeSpec(type)
                .sourceLine(name.getLine())
                .build();
    }

    private TypeSpec parseTypeSpec(String owner) {
        ShorthandToken start = peek();

        if (start.isSymbol("?")) {
            advance();
            diagnostics.warn(start.getLine(), start.getColumn(),
                    "Unresolved type '?' for " + owner + " defaulting to " + TypeSpec.UNKNOWN_NAME);
            return TypeSpec.UNKNOWN;
        }

        if (!check(TokenType.IDENTIFIER)) {
            diagnostics.warn(start.getLine(), start.getColumn(),
                    "Missing type for " + owner + ", defaulting to " + TypeSpec.UNKNOWN_NAME);
            return TypeSpec.UNKNOWN;
        }

        TypeSpec.TypeSpecBuilder type = TypeSpec.builder().baseType(advance().getValue());

        // Shape and placement must touch the base name; a spaced '[' starts a tag
        if (check(TokenType.BRACKET_OPEN) && isAdjacent(previous(), peek())) {
            type.shape(parseShape());
        }

        if (check(TokenType.AT) && isAdjacent(previous(), peek())) {
            ShorthandToken at = advance();
            if (check(TokenType.IDENTIFIER) && isAdjacent(at, peek())) {
                ShorthandToken location = advance();
                Optional<Placement> placement = Placement.fromNotation(location.getValue());
                if (placement.isPresent()) {
                    type.placement(placement.get());
                } else {
                    diagnostics.warn(location.getLine(), location.getColumn(),
                            "Unknown placement '@" + location.getValue() + "' for " + owner + " was ignored");
                }
            } else {
                diagnostics.warn(at.getLine(), at.getColumn(), "Missing placement after '@' for " + owner);
            }
        }

        return type.build();
    }

    private List<String> parseShape() {
        ShorthandToken open = advance();
        List<String> dims = new ArrayList<>();
        StringBuilder dim = new StringBuilder();

        while (!check(TokenType.BRACKET_CLOSE)) {
            if (isAtEnd() || check(TokenType.NEWLINE) || check(TokenType.COMMENT)) {
                diagnostics.warn(open.getLine(), open.getColumn(), "Unterminated shape");
                addDimension(dims, dim);
                return dims;
            }
            ShorthandToken token = advance();
            if (token.is(TokenType.COMMA)) {
                addDimension(dims, dim);
                dim.setLength(0);
            } else {
                dim.append(token.getValue());
            }
        }
        advance(); // ]

        addDimension(dims, dim);
        return dims;
    }

    private static void addDimension(List<String> dims, StringBuilder dim) {
        if (dim.length() > 0) {
            dims.add(dim.toString());
        }
    }

    // ---- Functions ----

    private void parseFunctionLine() {
        ShorthandToken start = advance(); // F
        advance(); // :

        if (!check(TokenType.IDENTIFIER)) {
            skipMalformedFunction(start, "Expected function name after 'F:'");
            return;
        }
        String name = advance().getValue();
        FunctionNode.FunctionNodeBuilder function = FunctionNode.builder()
                .name(name)
                .sourceLine(start.getLine());

        if (!match(TokenType.LPAREN)) {
            skipMalformedFunction(start, "Expected '(' after function name '" + name + "'");
            return;
        }

        if (!check(TokenType.RPAREN)) {
            do {
                Parameter parameter = parseParameter(name);
                if (parameter == null) {
                    skipMalformedFunction(start, "Malformed parameter list for function '" + name + "'");
                    return;
                }
                function.parameter(parameter);
            } while (match(TokenType.COMMA));
        }

        if (!match(TokenType.RPAREN)) {
            skipMalformedFunction(start, "Expected ')' in signature of function '" + name + "'");
            return;
        }

        if (match(TokenType.ARROW)) {
            function.returnType(parseTypeSpec("return type of function '" + name + "'"));
        } else {
            ShorthandToken here = peek();
            diagnostics.warn(here.getLine(), here.getColumn(),
                    "Function '" + name + "' has no return type, defaulting to " + TypeSpec.UNKNOWN_NAME);
            function.returnType(TypeSpec.UNKNOWN);
        }

        while (check(TokenType.BRACKET_OPEN)) {
            function.tag(parseTag());
        }

        FunctionNode node = function.build();
        functions.add(node);
        expectEndOfLine();

        log.debug("Parsed function: {} at line {} with {} tags", name, start.getLine(), node.getTags().size());
    }

    private Parameter parseParameter(String functionName) {
        StringBuilder name = new StringBuilder();
        while (peek().isSymbol("*")) {
            name.append(advance().getValue());
        }

        if (!check(TokenType.IDENTIFIER)) {
            return null;
        }
        ShorthandToken nameToken = advance();
        name.append(nameToken.getValue());

        if (match(TokenType.COLON)) {
            return new Parameter(name.toString(),
                    parseTypeSpec("parameter '" + name + "' of function '" + functionName + "'"));
        }

        diagnostics.warn(nameToken.getLine(), nameToken.getColumn(), "Parameter '" + name + "' of function '"
                + functionName + "' has no type, defaulting to " + TypeSpec.UNKNOWN_NAME);
        return new Parameter(name.toString(), TypeSpec.UNKNOWN);
    }

    private void skipMalformedFunction(ShorthandToken start, String message) {
        diagnostics.warn(start.getLine(), start.getColumn(), message);
        skipToEndOfLine();
    }

    // ---- Tags ----

    /**
     * Parse one bracketed tag starting at the current {@code [} token.
     */
    public Tag parseTag() {
        ShorthandToken open = peek();
        if (!open.is(TokenType.BRACKET_OPEN)) {
            throw new ParseException("Expected '[' but found '" + open.getValue() + "'", open.getLine(), open.getColumn());
        }
        advance();

        if (check(TokenType.BRACKET_CLOSE)) {
            throw new ParseException("Empty tag", open.getLine(), open.getColumn());
        }

        StringBuilder raw = new StringBuilder();
        StringBuilder fragment = new StringBuilder();
        List<String> fragments = new ArrayList<>();
        ShorthandToken previous = open;

        while (!check(TokenType.BRACKET_CLOSE)) {
            if (isAtEnd() || check(TokenType.NEWLINE) || check(TokenType.COMMENT) || check(TokenType.BRACKET_OPEN)) {
                throw new ParseException("Unterminated tag", open.getLine(), open.getColumn());
            }

            ShorthandToken token = advance();
            String gap = " ".repeat(Math.max(0, token.getColumn() - previous.getEndColumn()));
            String text = sourceText(token);
            raw.append(gap).append(text);

            if (token.is(TokenType.COLON)) {
                fragments.add(fragment.toString().trim());
                fragment.setLength(0);
            } else {
                fragment.append(gap).append(text);
            }
            previous = token;
        }
        advance(); // ]
        fragments.add(fragment.toString().trim());

        try {
            return tagClassifier.classify(raw.toString(), fragments);
        } catch (IllegalArgumentException e) {
            throw new ParseException(e.getMessage(), open.getLine(), open.getColumn(), e);
        }
    }

    private static String sourceText(ShorthandToken token) {
        return token.is(TokenType.STRING) ? "\"" + token.getValue() + "\"" : token.getValue();
    }

    // ---- Line handling ----

    private void expectEndOfLine() {
        if (check(TokenType.COMMENT)) {
            advance();
        }
        if (check(TokenType.NEWLINE)) {
            advance();
            return;
        }
        if (isAtEnd()) {
            return;
        }
        ShorthandToken extra = peek();
        diagnostics.warn(extra.getLine(), extra.getColumn(), "Unexpected trailing content: '" + restOfLine() + "'");
        skipToEndOfLine();
    }

    private void skipUnrecognized(ShorthandToken token, String message) {
        log.debug("Skipping unrecognized line {}", token.getLine());
        diagnostics.warn(token.getLine(), token.getColumn(), message + ": '" + restOfLine() + "'");
        skipToEndOfLine();
    }

    private String restOfLine() {
        StringBuilder sb = new StringBuilder();
        ShorthandToken previous = null;
        for (int i = pos; i < tokens.size(); i++) {
            ShorthandToken token = tokens.get(i);
            if (token.is(TokenType.NEWLINE) || token.is(TokenType.EOF) || token.is(TokenType.COMMENT)) {
                break;
            }
            if (previous != null && token.getColumn() > previous.getEndColumn()) {
                sb.append(' ');
            }
            sb.append(sourceText(token));
            previous = token;
        }
        return sb.toString();
    }

    private void skipToEndOfLine() {
        while (!isAtEnd() && !check(TokenType.NEWLINE)) {
            advance();
        }
        if (check(TokenType.NEWLINE)) {
            advance();
        }
    }

    private static boolean isAdjacent(ShorthandToken left, ShorthandToken right) {
        return left.getLine() == right.getLine() && left.getEndColumn() == right.getColumn();
    }

    // ---- Cursor ----

    private boolean isAtEnd() {
        return peek().getType() == TokenType.EOF;
    }

    private ShorthandToken peek() {
        return tokens.get(pos);
    }

    private ShorthandToken previous() {
        return tokens.get(pos - 1);
    }

    private boolean check(TokenType type) {
        if (isAtEnd()) return false;
        return peek().getType() == type;
    }

    private boolean checkNext(TokenType type) {
        return pos + 1 < tokens.size() && tokens.get(pos + 1).getType() == type;
    }

    private boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    private ShorthandToken advance() {
        if (!isAtEnd()) pos++;
        return previous();
    }
}
