package com.sift.index;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Loads index declarations from a YAML resource into the {@link IndexRegistry}.
 *
 * Example definition file:
 * <pre>
 * indexes:
 *   - document: Person
 *     index-name: person-idx
 *     fields:
 *       - name: Age
 *         kind: NUMERIC
 *       - name: Name
 *         kind: TEXT
 *       - name: Rank
 *         kind: INDEXED
 *         numeric: true
 *       - name: Notes
 *         searchable: false
 * </pre>
 */
@Component
public class IndexDefinitionLoader {

    private static final Logger log = LoggerFactory.getLogger(IndexDefinitionLoader.class);

    private final IndexRegistry registry;
    private final ResourceLoader resourceLoader;
    private final YAMLMapper yamlMapper;

    @Value("${sift.compiler.index-definitions:classpath:indexes.yml}")
    private String location;

    @Value("${sift.compiler.fail-on-missing-definitions:false}")
    private boolean failOnMissing;

    public IndexDefinitionLoader(IndexRegistry registry, ResourceLoader resourceLoader) {
        this.registry = registry;
        this.resourceLoader = resourceLoader;
        this.yamlMapper = new YAMLMapper();
    }

    /**
     * Reads the configured definition resource and registers every index it declares
     */
    @PostConstruct
    public void loadDefinitions() {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            if (failOnMissing) {
                throw new IllegalStateException("Index definition resource not found: " + location);
            }
            log.warn("Index definition resource {} not found, no indexes registered", location);
            return;
        }

        try (InputStream in = resource.getInputStream()) {
            List<DocumentIndex> indexes = parse(in);
            indexes.forEach(registry::register);
            log.info("Loaded {} index declarations from {}", indexes.size(), location);
        } catch (IOException e) {
            log.error("Failed to read index definitions from {}: {}", location, e.getMessage());
            throw new IllegalStateException("Invalid index definitions in " + location, e);
        }
    }

    /**
     * Parses index declarations from YAML
     *
     * @param in the YAML document
     * @return the declared indexes, in document order
     * @throws IOException if the YAML cannot be read or a declaration is incomplete
     */
    public List<DocumentIndex> parse(InputStream in) throws IOException {
        JsonNode root = yamlMapper.readTree(in);
        List<DocumentIndex> result = new ArrayList<>();
        if (root == null || !root.has("indexes")) {
            return result;
        }

        for (JsonNode indexNode : root.get("indexes")) {
            String document = indexNode.path("document").asText(null);
            if (document == null || document.isBlank()) {
                throw new IOException("Index declaration must name a document type");
            }

            List<FieldMetadata> fields = new ArrayList<>();
            for (JsonNode fieldNode : indexNode.path("fields")) {
                fields.add(parseField(document, fieldNode));
            }
            result.add(new DocumentIndex(document, indexNode.path("index-name").asText(null), fields));
        }
        return result;
    }

    private FieldMetadata parseField(String document, JsonNode fieldNode) throws IOException {
        String name = fieldNode.path("name").asText(null);
        if (name == null || name.isBlank()) {
            throw new IOException("Field declaration of " + document + " must have a name");
        }

        boolean searchable = fieldNode.path("searchable").asBoolean(true);
        if (!searchable) {
            return FieldMetadata.notSearchable(name);
        }

        String kindText = fieldNode.path("kind").asText(null);
        if (kindText == null) {
            throw new IOException("Searchable field " + document + "." + name + " must declare a kind");
        }

        FieldKind kind;
        try {
            kind = FieldKind.valueOf(kindText.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IOException("Unknown field kind '" + kindText + "' on " + document + "." + name, e);
        }

        boolean numeric = fieldNode.path("numeric").asBoolean(kind == FieldKind.NUMERIC);
        return new FieldMetadata(name, kind, numeric, true);
    }

    void setLocation(String location) {
        this.location = location;
    }

    void setFailOnMissing(boolean failOnMissing) {
        this.failOnMissing = failOnMissing;
    }
}
