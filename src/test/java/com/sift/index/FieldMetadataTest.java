package com.sift.index;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for FieldMetadata and DocumentIndex
 */
class FieldMetadataTest {

    @Test
    void testIndexedNumericFieldResolvesToNumeric() {
        assertThat(FieldMetadata.indexed("Rank", true).getEffectiveKind()).isEqualTo(FieldKind.NUMERIC);
    }

    @Test
    void testIndexedNonNumericFieldResolvesToTag() {
        assertThat(FieldMetadata.indexed("Nickname", false).getEffectiveKind()).isEqualTo(FieldKind.TAG);
    }

    @Test
    void testDeclaredKindIsKept() {
        assertThat(FieldMetadata.of("Name", FieldKind.TEXT).getEffectiveKind()).isEqualTo(FieldKind.TEXT);
        assertThat(FieldMetadata.of("Home", FieldKind.GEO).getEffectiveKind()).isEqualTo(FieldKind.GEO);
    }

    @Test
    void testBlankIndexNameDefaultsFromDocumentType() {
        DocumentIndex index = new DocumentIndex("Customer", " ", List.of());

        assertThat(index.getIndexName()).isEqualTo("customer-idx");
    }

    @Test
    void testFindField() {
        DocumentIndex index = new DocumentIndex("Customer", "customers", List.of(
                FieldMetadata.of("Name", FieldKind.TEXT),
                FieldMetadata.notSearchable("Notes")));

        assertThat(index.findField("Name")).isPresent();
        assertThat(index.findField("Notes").get().isSearchable()).isFalse();
        assertThat(index.findField("Missing")).isEmpty();
    }
}
