package com.shorthand.notation.cli.output;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.shorthand.notation.parser.ShorthandParser;
import com.shorthand.notation.service.ShorthandLintService;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class DocumentJsonWriterTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final DocumentJsonWriter writer = new DocumentJsonWriter(objectMapper);

    @Test
    void testDocumentJson() throws Exception {
        String source = """
            # [M:Api] [Role:Service]
            [C:User]
              ◊ [Ref:Store]
              id ∈ i64
            F:get_user(id: i64) → User [GET/users/{id}] [O(1)]
            """;

        JsonNode root = objectMapper.readTree(writer.write(ShorthandParser.parseText(source), false));

        assertThat(root.path("metadata").path("module_name").asText()).isEqualTo("Api");
        assertThat(root.path("metadata").path("role").asText()).isEqualTo("Service");

        JsonNode entity = root.path("entities").get(0);
        assertThat(entity.path("name").asText()).isEqualTo("User");
        assertThat(entity.path("dependencies").get(0).asText()).isEqualTo("Store");
        assertThat(entity.path("state").get(0).path("type").path("base_type").asText()).isEqualTo("i64");

        JsonNode function = root.path("functions").get(0);
        assertThat(function.path("complexity").asText()).isEqualTo("O(1)");
        JsonNode route = function.path("tags").get(0);
        assertThat(route.path("tag_type").asText()).isEqualTo("http_route");
        assertThat(route.path("http_method").asText()).isEqualTo("GET");
        assertThat(route.path("http_path").asText()).isEqualTo("/users/{id}");
        assertThat(root.path("diagnostics").size()).isZero();
    }

    @Test
    void testShapeAndPlacement() throws Exception {
        JsonNode root = objectMapper.readTree(
                writer.write(ShorthandParser.parseText("# [M:T]\nx ∈ f32[B,N]@GPU\n"), true));

        JsonNode type = root.path("module_state").get(0).path("type");
        assertThat(type.path("shape").size()).isEqualTo(2);
        assertThat(type.path("location").asText()).isEqualTo("GPU");
        assertThat(root.path("metadata").path("role").isNull()).isTrue();
    }

    @Test
    void testLintReportJson() throws Exception {
        ShorthandLintService lintService = new ShorthandLintService();
        String json = writer.write(List.of(lintService.lint(Path.of("a.pys"), "# [M:T]\n[C:A]\n  x ∈ ?\n", 100)), false);

        JsonNode file = objectMapper.readTree(json).get(0);
        assertThat(file.path("file").asText()).isEqualTo("a.pys");
        assertThat(file.path("warnings").asLong()).isEqualTo(1);
        assertThat(file.path("diagnostics").get(0).path("severity").asText()).isEqualTo("warning");
        assertThat(file.path("diagnostics").get(0).path("line").asInt()).isEqualTo(3);
    }
}
