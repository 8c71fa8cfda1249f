package com.shorthand.notation.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for Tag construction invariants and derived properties.
 */
class TagTest {

    @Test
    void testInvalidComplexityRejected() {
        assertThatThrownBy(() -> Tag.builder().base("O(").tagType(TagType.COMPLEXITY).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Invalid complexity notation");
    }

    @Test
    void testHttpRouteRequiresMethodAndPath() {
        assertThatThrownBy(() -> Tag.builder().base("GET").tagType(TagType.HTTP_ROUTE).httpMethod("GET").build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("must have both http_method and http_path");
    }

    @Test
    void testHttpRouteRejectsUnknownMethod() {
        assertThatThrownBy(() -> Tag.builder()
                .base("INVALID")
                .tagType(TagType.HTTP_ROUTE)
                .httpMethod("INVALID")
                .httpPath("/x")
                .build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Invalid HTTP method");
    }

    @Test
    void testHttpPathMustStartWithSlash() {
        assertThatThrownBy(() -> Tag.builder()
                .base("GET")
                .tagType(TagType.HTTP_ROUTE)
                .httpMethod("GET")
                .httpPath("users")
                .build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("must start with '/'");
    }

    @Test
    void testUnknownDecoratorDowngradesToCustom() {
        Tag tag = Tag.builder().base("UnknownDecorator").tagType(TagType.DECORATOR).build();

        assertThat(tag.getTagType()).isEqualTo(TagType.CUSTOM);
        assertThat(tag.isDecorator()).isFalse();
    }

    @Test
    void testKnownDecoratorStaysDecorator() {
        Tag tag = Tag.builder().base("Cached").qualifiers(List.of("TTL", "60")).tagType(TagType.DECORATOR).build();

        assertThat(tag.isDecorator()).isTrue();
        assertThat(tag.toString()).isEqualTo("[Cached:TTL:60]");
    }

    @Test
    void testCustomVocabulary() {
        DecoratorVocabulary vocabulary = DecoratorVocabulary.DEFAULT.with("Traced");
        Tag tag = Tag.builder().base("Traced").tagType(TagType.DECORATOR).vocabulary(vocabulary).build();

        assertThat(tag.isDecorator()).isTrue();
        assertThat(DecoratorVocabulary.DEFAULT.contains("Traced")).isFalse();
    }

    @Test
    void testEmptyBaseRejected() {
        assertThatThrownBy(() -> Tag.builder().base("").build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Tag base must not be empty");
    }

    @Test
    void testEmptyQualifierRejected() {
        assertThatThrownBy(() -> Tag.builder().base("Lin").qualifiers(List.of("MatMul", "")).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("qualifiers must not be empty");
    }

    @Test
    void testComplexityFromQualifier() {
        Tag tag = Tag.builder().base("Iter").qualifiers(List.of("Hot", "O(N)")).build();

        assertThat(tag.isOperation()).isTrue();
        assertThat(tag.getComplexity()).contains("O(N)");
    }

    @Test
    void testComplexityTag() {
        Tag tag = Tag.builder().base("O(N log N)").tagType(TagType.COMPLEXITY).build();

        assertThat(tag.getComplexity()).contains("O(N log N)");
        assertThat(tag.toString()).isEqualTo("[O(N log N)]");
    }

    @Test
    void testHttpRouteCanonicalForm() {
        Tag tag = Tag.builder()
                .base("GET/users/{id}")
                .tagType(TagType.HTTP_ROUTE)
                .httpMethod("GET")
                .httpPath("/users/{id}")
                .build();

        assertThat(tag.toString()).isEqualTo("[GET/users/{id}]");
    }

    @Test
    void testIoAndSyncFlags() {
        assertThat(Tag.builder().base("IO").qualifiers(List.of("Disk")).build().isIo()).isTrue();
        assertThat(Tag.builder().base("Sync").build().isSync()).isTrue();
    }

    @Test
    void testValueEquality() {
        Tag a = Tag.builder().base("Lin").qualifiers(List.of("MatMul")).build();
        Tag b = Tag.builder().base("Lin").qualifiers(List.of("MatMul")).build();

        assertThat(a).isEqualTo(b).hasSameHashCodeAs(b);
    }

    @Test
    void testComplexityNotationBalance() {
        assertThat(Tag.isComplexityNotation("O(N*(M+1))")).isTrue();
        assertThat(Tag.isComplexityNotation("O(N))")).isFalse();
        assertThat(Tag.isComplexityNotation("O( )")).isFalse();
        assertThat(Tag.isComplexityNotation("N")).isFalse();
    }
}
