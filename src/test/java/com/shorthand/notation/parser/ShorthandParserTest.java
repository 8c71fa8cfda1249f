package com.shorthand.notation.parser;

import com.shorthand.notation.model.Diagnostic;
import com.shorthand.notation.model.EntityNode;
import com.shorthand.notation.model.FunctionNode;
import com.shorthand.notation.model.Parameter;
import com.shorthand.notation.model.Placement;
import com.shorthand.notation.model.Reference;
import com.shorthand.notation.model.Severity;
import com.shorthand.notation.model.ShorthandDocument;
import com.shorthand.notation.model.StateVariable;
import com.shorthand.notation.model.Tag;
import com.shorthand.notation.model.TagType;
import com.shorthand.notation.model.TypeSpec;
import com.shorthand.notation.parser.exception.ParseException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for ShorthandParser: tags, entities, functions and diagnostics.
 */
class ShorthandParserTest {

    // ---- Tags ----

    @Test
    void testParseOperationTagWithComplexity() {
        Tag tag = parseTag("[Lin:MatMul:O(N*D)]");

        assertThat(tag.getTagType()).isEqualTo(TagType.OPERATION);
        assertThat(tag.getBase()).isEqualTo("Lin");
        assertThat(tag.getQualifiers()).containsExactly("MatMul", "O(N*D)");
        assertThat(tag.getComplexity()).contains("O(N*D)");
    }

    @Test
    void testParseHttpRouteTag() {
        Tag tag = parseTag("[GET/users/{id}]");

        assertThat(tag.getTagType()).isEqualTo(TagType.HTTP_ROUTE);
        assertThat(tag.getHttpMethod()).isEqualTo("GET");
        assertThat(tag.getHttpPath()).isEqualTo("/users/{id}");
    }

    @Test
    void testParseComplexityTag() {
        Tag tag = parseTag("[O(N log N)]");

        assertThat(tag.isComplexity()).isTrue();
        assertThat(tag.getBase()).isEqualTo("O(N log N)");
    }

    @Test
    void testParseDecoratorTag() {
        Tag tag = parseTag("[Cached:TTL:60]");

        assertThat(tag.isDecorator()).isTrue();
        assertThat(tag.getBase()).isEqualTo("Cached");
        assertThat(tag.getQualifiers()).containsExactly("TTL", "60");
    }

    @Test
    void testMethodNameWithColonIsNotRoute() {
        Tag tag = parseTag("[GET:cache]");

        assertThat(tag.getTagType()).isEqualTo(TagType.OPERATION);
        assertThat(tag.getBase()).isEqualTo("GET");
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "[Lin:MatMul:O(N*D)]",
            "[O(N)]",
            "[O(N log N)]",
            "[Prop]",
            "[Cached:TTL:60]",
            "[GET/users/{id}]",
            "[POST/api/v1/items]",
            "[NN:∇:Lin:MatMul]",
            "[IO:Disk:Block]",
            "[Iter:Hot:O(N)]"
    })
    void testCanonicalTagsRoundTrip(String text) {
        assertThat(parseTag(text).toString()).isEqualTo(text);
    }

    @Test
    void testEmptyTagFails() {
        assertThatThrownBy(() -> ShorthandParser.parseText("[]"))
                .isInstanceOf(ParseException.class)
                .hasMessageContaining("Empty tag");
    }

    @Test
    void testUnterminatedTagFails() {
        assertThatThrownBy(() -> ShorthandParser.parseText("[Lin:MatMul"))
                .isInstanceOf(ParseException.class)
                .hasMessageContaining("Unterminated tag");
    }

    @Test
    void testTagInvariantViolationCarriesPosition() {
        String source = """
            # [M:Test]
            F:f() → i32 [O()]
            """;

        ParseException e = catchThrowableOfType(() -> ShorthandParser.parseText(source), ParseException.class);

        assertThat(e.getReason()).contains("Invalid complexity notation");
        assertThat(e.getLine()).isEqualTo(2);
        assertThat(e.getColumn()).isEqualTo(13);
    }

    // ---- Metadata ----

    @Test
    void testMissingMetadataFails() {
        ParseException e = catchThrowableOfType(
                () -> ShorthandParser.parseText("[C:A]\n  x ∈ i32\n"), ParseException.class);

        assertThat(e.getReason()).contains("Missing metadata");
        assertThat(e.getLine()).isEqualTo(1);
    }

    @Test
    void testMetadataWithRole() {
        ShorthandDocument doc = ShorthandParser.parseText("# [M:Physics] [Role:Core]\n");

        assertThat(doc.getMetadata().getModuleName()).isEqualTo("Physics");
        assertThat(doc.getMetadata().getRole()).isEqualTo("Core");
    }

    @Test
    void testMetadataMustBeFirstLine() {
        assertThatThrownBy(() -> ShorthandParser.parseText("# plain comment\n# [M:Late]\n"))
                .isInstanceOf(ParseException.class)
                .hasMessageContaining("Missing metadata");
    }

    // ---- Entities ----

    @Test
    void testParseEntityWithState() {
        ShorthandDocument doc = ShorthandParser.parseText(
                "# [M:Test]\n\n[C:VHE]\n  pos ∈ f32[N]@GPU\n  vel ∈ f32[N]@GPU\n");

        assertThat(doc.getEntities()).hasSize(1);
        EntityNode entity = doc.getEntities().get(0);
        assertThat(entity.getName()).isEqualTo("VHE");
        assertThat(entity.getState()).hasSize(2);
        assertThat(entity.getDependencies()).isEmpty();
        assertThat(doc.getDiagnostics()).isEmpty();

        StateVariable pos = entity.getState().get(0);
        assertThat(pos.getName()).isEqualTo("pos");
        assertThat(pos.getTypeSpec().getBaseType()).isEqualTo("f32");
        assertThat(pos.getTypeSpec().getShape()).containsExactly("N");
        assertThat(pos.getTypeSpec().getPlacement()).isEqualTo(Placement.GPU);
    }

    @Test
    void testParseEntityWithDependencies() {
        String source = """
            # [M:Net]

            [C:Encoder]
              ◊ [Ref:Embedding]
              ◊ [Ref:Attention]
              weights ∈ f32[D,D]@GPU
              hidden ∈ f32[B,N,D]
            """;

        EntityNode entity = ShorthandParser.parseText(source).findEntity("Encoder").orElseThrow();

        assertThat(entity.getDependencies()).extracting(Reference::getName)
                .containsExactly("Embedding", "Attention");
        assertThat(entity.findState("hidden").orElseThrow().getTypeSpec().getShape())
                .containsExactly("B", "N", "D");
        assertThat(entity.findState("hidden").orElseThrow().getTypeSpec().getPlacement()).isNull();
    }

    @Test
    void testAsciiAliasesParse() {
        String source = """
            # [M:Ascii]
            [C:A]
              <> [Ref:B]
              x in f32[N]@CPU
            F:step(x: f32) -> f32 [NN:\\/]
            """;

        ShorthandDocument doc = ShorthandParser.parseText(source);

        EntityNode entity = doc.getEntities().get(0);
        assertThat(entity.getDependencies()).hasSize(1);
        assertThat(entity.getState().get(0).getTypeSpec().toString()).isEqualTo("f32[N]@CPU");
        FunctionNode step = doc.getFunctions().get(0);
        assertThat(step.getReturnType().getBaseType()).isEqualTo("f32");
        assertThat(step.getTags().get(0).getQualifiers()).containsExactly("∇");
        assertThat(doc.getDiagnostics()).isEmpty();
    }

    @Test
    void testDuplicateEntityIsError() {
        String source = """
            # [M:Test]
            [C:A]
              x ∈ i32
            [C:A]
              y ∈ i32
            """;

        ShorthandDocument doc = ShorthandParser.parseText(source);

        assertThat(doc.getEntities()).hasSize(2);
        assertThat(doc.hasErrors()).isTrue();
        assertThat(doc.getDiagnostics()).extracting(Diagnostic::getMessage)
                .anyMatch(m -> m.contains("Duplicate entity 'A'"));
    }

    @Test
    void testDuplicateStateVariableIsWarning() {
        String source = """
            # [M:Test]
            [C:A]
              x ∈ i32
              x ∈ f32
            """;

        ShorthandDocument doc = ShorthandParser.parseText(source);

        assertThat(doc.hasErrors()).isFalse();
        assertThat(doc.getWarnings()).extracting(Diagnostic::getMessage)
                .anyMatch(m -> m.contains("Duplicate state variable 'x'"));
    }

    @Test
    void testUnrecognizedEntityContentIsSkipped() {
        String source = """
            # [M:Test]
            [C:A]
              x ∈ i32
              this is not notation
              y ∈ i32
            """;

        ShorthandDocument doc = ShorthandParser.parseText(source);

        assertThat(doc.getEntities().get(0).getState()).extracting(StateVariable::getName)
                .containsExactly("x", "y");
        assertThat(doc.getWarnings()).hasSize(1);
        assertThat(doc.getWarnings().get(0).getLine()).isEqualTo(4);
        assertThat(doc.getWarnings().get(0).getMessage()).contains("Unrecognized content in entity 'A'");
    }

    @Test
    void testInconsistentDedentStaysInsideEntity() {
        String source = """
            # [M:Test]

            [C:A]
                x ∈ f32
              y ∈ f32
            F:run() → i32
            """;

        ShorthandDocument doc = ShorthandParser.parseText(source);

        assertThat(doc.getEntities()).hasSize(1);
        assertThat(doc.getEntities().get(0).getState()).extracting(StateVariable::getName)
                .containsExactly("x", "y");
        assertThat(doc.getModuleState()).isEmpty();
        assertThat(doc.getFunctions()).extracting(FunctionNode::getName).containsExactly("run");
        assertThat(doc.getDiagnostics()).isEmpty();
    }

    @Test
    void testUnresolvedTypeDefaultsToUnknown() {
        ShorthandDocument doc = ShorthandParser.parseText("# [M:Test]\n[C:A]\n  x ∈ ?\n");

        StateVariable x = doc.getEntities().get(0).getState().get(0);
        assertThat(x.getTypeSpec().isUnknown()).isTrue();
        assertThat(doc.getWarnings()).hasSize(1);
        assertThat(doc.getWarnings().get(0).getSeverity()).isEqualTo(Severity.WARNING);
    }

    @Test
    void testUnknownPlacementIsDropped() {
        ShorthandDocument doc = ShorthandParser.parseText("# [M:Test]\n[C:A]\n  x ∈ f32@FPGA\n");

        TypeSpec type = doc.getEntities().get(0).getState().get(0).getTypeSpec();
        assertThat(type.getPlacement()).isNull();
        assertThat(doc.getWarnings()).extracting(Diagnostic::getMessage)
                .anyMatch(m -> m.contains("Unknown placement '@FPGA'"));
    }

    @Test
    void testModuleLevelState() {
        ShorthandDocument doc = ShorthandParser.parseText("# [M:Test]\nconfig ∈ Config\n[C:A]\n  x ∈ i32\n");

        assertThat(doc.getModuleState()).extracting(StateVariable::getName).containsExactly("config");
        assertThat(doc.getEntities()).hasSize(1);
    }

    @Test
    void testEmptyEntity() {
        ShorthandDocument doc = ShorthandParser.parseText("# [M:Test]\n[C:Marker]\n[C:Other]\n  x ∈ i32\n");

        assertThat(doc.getEntities()).extracting(EntityNode::getName).containsExactly("Marker", "Other");
        assertThat(doc.findEntity("Marker").orElseThrow().getState()).isEmpty();
    }

    // ---- Functions ----

    @Test
    void testParseFunctionLine() {
        String source = """
            # [M:Net]
            F:forward(x: f32[B,N,D]@GPU, mask: bool[B,N]) → f32[B,N,D]@GPU [NN:Lin:MatMul:O(B*N*D)] [Cached]
            """;

        FunctionNode forward = ShorthandParser.parseText(source).findFunction("forward").orElseThrow();

        assertThat(forward.getParameters()).hasSize(2);
        assertThat(forward.getParameters().get(0).getName()).isEqualTo("x");
        assertThat(forward.getParameters().get(0).getTypeSpec().toString()).isEqualTo("f32[B,N,D]@GPU");
        assertThat(forward.getParameters().get(1).getTypeSpec().getShape()).containsExactly("B", "N");
        assertThat(forward.getReturnType().toString()).isEqualTo("f32[B,N,D]@GPU");
        assertThat(forward.getTags()).hasSize(2);
        assertThat(forward.getComplexity()).contains("O(B*N*D)");
        assertThat(forward.hasDecorator("Cached")).isTrue();
    }

    @Test
    void testParseHttpFunction() {
        String source = """
            # [M:Api] [Role:Service]
            F:get_user(id: i64) → User [GET/users/{id}] [Auth] [O(1)]
            """;

        FunctionNode function = ShorthandParser.parseText(source).getFunctions().get(0);

        assertThat(function.getHttpRoute()).isPresent();
        assertThat(function.getHttpRoute().get().getHttpPath()).isEqualTo("/users/{id}");
        assertThat(function.getComplexity()).contains("O(1)");
    }

    @Test
    void testVariadicParameters() {
        FunctionNode function = ShorthandParser.parseText("# [M:T]\nF:call(*args: Any, **kwargs: Any) → None\n")
                .getFunctions().get(0);

        assertThat(function.getParameters()).extracting(Parameter::getName).containsExactly("*args", "**kwargs");
    }

    @Test
    void testMissingReturnTypeWarns() {
        ShorthandDocument doc = ShorthandParser.parseText("# [M:T]\nF:run(x: i32) [IO:Disk]\n");

        FunctionNode run = doc.getFunctions().get(0);
        assertThat(run.getReturnType().isUnknown()).isTrue();
        assertThat(run.getTags()).hasSize(1);
        assertThat(doc.getWarnings()).hasSize(1);
    }

    @Test
    void testMissingParameterTypeWarns() {
        ShorthandDocument doc = ShorthandParser.parseText("# [M:T]\nF:run(x) → i32\n");

        assertThat(doc.getFunctions().get(0).getParameters().get(0).getTypeSpec().isUnknown()).isTrue();
        assertThat(doc.getWarnings()).hasSize(1);
    }

    @Test
    void testMalformedFunctionIsSkipped() {
        ShorthandDocument doc = ShorthandParser.parseText("# [M:T]\nF:broken → i32\nF:ok() → i32\n");

        assertThat(doc.getFunctions()).extracting(FunctionNode::getName).containsExactly("ok");
        assertThat(doc.getWarnings()).hasSize(1);
    }

    @Test
    void testSpacedBracketAfterTypeIsTag() {
        FunctionNode f = ShorthandParser.parseText("# [M:T]\nF:f() → f32 [Lin:MatMul]\n").getFunctions().get(0);

        assertThat(f.getReturnType().hasShape()).isFalse();
        assertThat(f.getTags()).extracting(Tag::getBase).containsExactly("Lin");
    }

    @Test
    void testCommentsAreIgnored() {
        String source = """
            # [M:T]
            # section header
            [C:A]
              # inner note
              x ∈ i32  // trailing
            """;

        ShorthandDocument doc = ShorthandParser.parseText(source);

        assertThat(doc.getEntities().get(0).getState()).hasSize(1);
        assertThat(doc.getDiagnostics()).isEmpty();
    }

    @Test
    void testSourceLinesRecorded() {
        ShorthandDocument doc = ShorthandParser.parseText("# [M:T]\n\n[C:A]\n  x ∈ i32\n\nF:f() → i32\n");

        assertThat(doc.getEntities().get(0).getSourceLine()).isEqualTo(3);
        assertThat(doc.getEntities().get(0).getState().get(0).getSourceLine()).isEqualTo(4);
        assertThat(doc.getFunctions().get(0).getSourceLine()).isEqualTo(6);
    }

    private Tag parseTag(String text) {
        List<ShorthandToken> tokens = new ShorthandTokenizer(text).tokenize();
        return new ShorthandParser(tokens).parseTag();
    }
}
