package com.sift.index;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Index declaration of a document type: the index name plus the metadata of its fields
 */
public class DocumentIndex {
    private final String documentType;
    private final String indexName;
    private final Map<String, FieldMetadata> fields;

    public DocumentIndex(String documentType, String indexName, Collection<FieldMetadata> fields) {
        this.documentType = Objects.requireNonNull(documentType, "documentType");
        this.indexName = indexName == null || indexName.isBlank()
                ? defaultIndexName(documentType)
                : indexName;
        Map<String, FieldMetadata> byName = new LinkedHashMap<>();
        for (FieldMetadata field : fields) {
            byName.put(field.getName(), field);
        }
        this.fields = Collections.unmodifiableMap(byName);
    }

    /**
     * Default index name used when a declaration leaves it blank
     */
    public static String defaultIndexName(String documentType) {
        return documentType.toLowerCase(Locale.ROOT) + "-idx";
    }

    public String getDocumentType() {
        return documentType;
    }

    public String getIndexName() {
        return indexName;
    }

    public Map<String, FieldMetadata> getFields() {
        return fields;
    }

    public Optional<FieldMetadata> findField(String name) {
        return Optional.ofNullable(fields.get(name));
    }
}
