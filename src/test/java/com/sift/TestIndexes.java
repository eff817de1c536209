package com.sift;

import com.sift.index.DocumentIndex;
import com.sift.index.FieldKind;
import com.sift.index.FieldMetadata;

import java.util.List;

/**
 * Index declarations shared by the compiler tests
 */
public final class TestIndexes {

    private TestIndexes() {
    }

    public static DocumentIndex person() {
        return new DocumentIndex("Person", "person-idx", List.of(
                FieldMetadata.of("Name", FieldKind.TEXT),
                FieldMetadata.of("Age", FieldKind.NUMERIC),
                FieldMetadata.of("City", FieldKind.TAG),
                FieldMetadata.of("Email", FieldKind.TAG),
                FieldMetadata.indexed("Rank", true),
                FieldMetadata.indexed("Nickname", false),
                FieldMetadata.of("Home", FieldKind.GEO),
                FieldMetadata.notSearchable("Notes")));
    }

    public static DocumentIndex order() {
        return new DocumentIndex("Order", null, List.of(
                FieldMetadata.of("Status", FieldKind.TAG),
                FieldMetadata.of("Total", FieldKind.NUMERIC)));
    }
}
