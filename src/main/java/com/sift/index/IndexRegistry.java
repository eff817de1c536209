package com.sift.index;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of index declarations by document type
 * Provides lookup of the index a query against a document type compiles for
 */
@Component
public class IndexRegistry {

    private static final Logger logger = LoggerFactory.getLogger(IndexRegistry.class);

    private final Map<String, DocumentIndex> indexes = new ConcurrentHashMap<>();

    /**
     * Registers (or replaces) the index declaration of a document type
     *
     * @param index the index declaration
     */
    public void register(DocumentIndex index) {
        DocumentIndex previous = indexes.put(index.getDocumentType(), index);
        if (previous != null) {
            logger.info("Replaced index declaration for document type {}", index.getDocumentType());
        } else {
            logger.debug("Registered index {} for document type {}", index.getIndexName(), index.getDocumentType());
        }
    }

    /**
     * Gets the index declaration of a document type
     *
     * @param documentType the document type name
     * @return the declaration, or empty if the type is not indexed
     */
    public Optional<DocumentIndex> find(String documentType) {
        return Optional.ofNullable(indexes.get(documentType));
    }

    public int size() {
        return indexes.size();
    }
}
