package com.sift.index;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for IndexDefinitionLoader
 */
class IndexDefinitionLoaderTest {

    private IndexRegistry registry;
    private IndexDefinitionLoader loader;

    @BeforeEach
    void setUp() {
        registry = new IndexRegistry();
        loader = new IndexDefinitionLoader(registry, new DefaultResourceLoader());
    }

    @Test
    void testParseDeclarations() throws IOException {
        // Given: A YAML document declaring one index
        String yaml = """
                indexes:
                  - document: Product
                    index-name: products
                    fields:
                      - name: Title
                        kind: text
                      - name: Price
                        kind: NUMERIC
                      - name: Sku
                        kind: INDEXED
                        numeric: false
                      - name: Internal
                        searchable: false
                """;

        // When: Parsing it
        List<DocumentIndex> indexes = loader.parse(stream(yaml));

        // Then: The declaration and its fields are read
        assertThat(indexes).hasSize(1);
        DocumentIndex index = indexes.get(0);
        assertThat(index.getDocumentType()).isEqualTo("Product");
        assertThat(index.getIndexName()).isEqualTo("products");
        assertThat(index.findField("Title").get().getKind()).isEqualTo(FieldKind.TEXT);
        assertThat(index.findField("Price").get().isNumericValue()).isTrue();
        assertThat(index.findField("Sku").get().getEffectiveKind()).isEqualTo(FieldKind.TAG);
        assertThat(index.findField("Internal").get().isSearchable()).isFalse();
    }

    @Test
    void testParseRejectsUnknownKind() {
        String yaml = """
                indexes:
                  - document: Product
                    fields:
                      - name: Title
                        kind: VECTOR
                """;

        assertThatThrownBy(() -> loader.parse(stream(yaml)))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("VECTOR");
    }

    @Test
    void testParseRejectsSearchableFieldWithoutKind() {
        String yaml = """
                indexes:
                  - document: Product
                    fields:
                      - name: Title
                """;

        assertThatThrownBy(() -> loader.parse(stream(yaml)))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("Product.Title");
    }

    @Test
    void testLoadDefinitionsRegistersClasspathIndexes() {
        // Given: The test definition resource
        loader.setLocation("classpath:indexes.yml");

        // When: Loading definitions
        loader.loadDefinitions();

        // Then: Both declared document types are registered
        assertThat(registry.size()).isEqualTo(2);
        assertThat(registry.find("Person").get().getIndexName()).isEqualTo("person-idx");
        assertThat(registry.find("Order").get().getIndexName()).isEqualTo("order-idx");
    }

    @Test
    void testMissingResourceIsToleratedByDefault() {
        loader.setLocation("classpath:does-not-exist.yml");

        loader.loadDefinitions();

        assertThat(registry.size()).isZero();
    }

    @Test
    void testMissingResourceFailsWhenRequired() {
        loader.setLocation("classpath:does-not-exist.yml");
        loader.setFailOnMissing(true);

        assertThatThrownBy(() -> loader.loadDefinitions())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("does-not-exist.yml");
    }

    private static InputStream stream(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }
}
