package com.shorthand.notation.cli.output;

import java.util.List;
import java.util.Locale;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.shorthand.notation.model.Diagnostic;
import com.shorthand.notation.model.EntityNode;
import com.shorthand.notation.model.FunctionNode;
import com.shorthand.notation.model.Parameter;
import com.shorthand.notation.model.Reference;
import com.shorthand.notation.model.Severity;
import com.shorthand.notation.model.ShorthandDocument;
import com.shorthand.notation.model.StateVariable;
import com.shorthand.notation.model.Tag;
import com.shorthand.notation.model.TypeSpec;
import com.shorthand.notation.service.model.LintReport;

/**
 * Renders documents and lint reports as JSON trees. Field names are snake_case
 * to match the notation's other tooling.
 */
public class DocumentJsonWriter {

    private final ObjectMapper objectMapper;

    public DocumentJsonWriter() {
        this(new ObjectMapper());
    }

    public DocumentJsonWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String write(ShorthandDocument document, boolean pretty) throws JsonProcessingException {
        return render(toJson(document), pretty);
    }

    public String write(List<LintReport> reports, boolean pretty) throws JsonProcessingException {
        ArrayNode files = objectMapper.createArrayNode();
        for (LintReport report : reports) {
            ObjectNode node = files.addObject();
            node.put("file", report.getFile().toString());
            node.put("module", report.getModuleName());
            node.put("errors", report.count(Severity.ERROR));
            node.put("warnings", report.count(Severity.WARNING));
            ArrayNode diagnostics = node.putArray("diagnostics");
            report.getDiagnostics().forEach(d -> diagnostics.add(toJson(d)));
        }
        return render(files, pretty);
    }

    public ObjectNode toJson(ShorthandDocument document) {
        ObjectNode root = objectMapper.createObjectNode();

        ObjectNode metadata = root.putObject("metadata");
        metadata.put("module_name", document.getMetadata().getModuleName());
        metadata.put("role", document.getMetadata().getRole());

        ArrayNode moduleState = root.putArray("module_state");
        document.getModuleState().forEach(v -> moduleState.add(toJson(v)));

        ArrayNode entities = root.putArray("entities");
        for (EntityNode entity : document.getEntities()) {
            ObjectNode node = entities.addObject();
            node.put("name", entity.getName());
            node.put("line", entity.getSourceLine());
            ArrayNode dependencies = node.putArray("dependencies");
            for (Reference dependency : entity.getDependencies()) {
                dependencies.add(dependency.getName());
            }
            ArrayNode state = node.putArray("state");
            entity.getState().forEach(v -> state.add(toJson(v)));
        }

        ArrayNode functions = root.putArray("functions");
        document.getFunctions().forEach(f -> functions.add(toJson(f)));

        ArrayNode diagnostics = root.putArray("diagnostics");
        document.getDiagnostics().forEach(d -> diagnostics.add(toJson(d)));
        return root;
    }

    private ObjectNode toJson(StateVariable variable) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("name", variable.getName());
        node.set("type", toJson(variable.getTypeSpec()));
        node.put("line", variable.getSourceLine());
        return node;
    }

    private ObjectNode toJson(FunctionNode function) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("name", function.getName());
        ArrayNode parameters = node.putArray("params");
        for (Parameter parameter : function.getParameters()) {
            ObjectNode p = parameters.addObject();
            p.put("name", parameter.getName());
            p.set("type", toJson(parameter.getTypeSpec()));
        }
        node.set("return_type", toJson(function.getReturnType()));
        ArrayNode tags = node.putArray("tags");
        function.getTags().forEach(t -> tags.add(toJson(t)));
        function.getComplexity().ifPresent(c -> node.put("complexity", c));
        node.put("line", function.getSourceLine());
        return node;
    }

    private ObjectNode toJson(TypeSpec type) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("base_type", type.getBaseType());
        if (type.hasShape()) {
            ArrayNode shape = node.putArray("shape");
            type.getShape().forEach(shape::add);
        }
        if (type.getPlacement() != null) {
            node.put("location", type.getPlacement().name());
        }
        return node;
    }

    private ObjectNode toJson(Tag tag) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("base", tag.getBase());
        node.put("tag_type", tag.getTagType().name().toLowerCase(Locale.ROOT));
        if (!tag.getQualifiers().isEmpty()) {
            ArrayNode qualifiers = node.putArray("qualifiers");
            tag.getQualifiers().forEach(qualifiers::add);
        }
        if (tag.isHttpRoute()) {
            node.put("http_method", tag.getHttpMethod());
            node.put("http_path", tag.getHttpPath());
        }
        node.put("text", tag.toString());
        return node;
    }

    private ObjectNode toJson(Diagnostic diagnostic) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("severity", diagnostic.getSeverity().name().toLowerCase(Locale.ROOT));
        node.put("line", diagnostic.getLine());
        node.put("column", diagnostic.getColumn());
        node.put("message", diagnostic.getMessage());
        return node;
    }

    private String render(Object node, boolean pretty) throws JsonProcessingException {
        return pretty
                ? objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(node)
                : objectMapper.writeValueAsString(node);
    }
}
