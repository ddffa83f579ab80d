package com.entity.consolidation.merge;

import com.entity.consolidation.store.SqlIdentifiers;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * The tables that hold references to entities, and how each one is repointed on merge.
 * Tables or columns missing from the connected database are skipped at execution time.
 */
public final class MergeSchema {

    /**
     * A column holding an entity (or person) id.
     *
     * @param uniqueKey the other half of a composite uniqueness, or {@code null} for a simple reference
     */
    public record Reference(String table, String column, String uniqueKey) {
        public Reference {
            SqlIdentifiers.requireValid(table);
            SqlIdentifiers.requireValid(column);
            if (uniqueKey != null) {
                SqlIdentifiers.requireValid(uniqueKey);
            }
        }

        public static Reference simple(String table, String column) {
            return new Reference(table, column, null);
        }

        public static Reference composite(String table, String column, String uniqueKey) {
            return new Reference(table, column, Objects.requireNonNull(uniqueKey, "uniqueKey"));
        }

        public boolean isComposite() {
            return uniqueKey != null;
        }
    }

    /**
     * A table linking two entities, such as a relationship edge.
     */
    public record PairReference(String table, String firstColumn, String secondColumn) {
        public PairReference {
            SqlIdentifiers.requireValid(table);
            SqlIdentifiers.requireValid(firstColumn);
            SqlIdentifiers.requireValid(secondColumn);
        }
    }

    /**
     * Optional one-to-one subtype table whose own id is referenced by further tables.
     */
    public record Subtype(String table, String idColumn, String entityColumn, List<Reference> references) {
        public Subtype {
            SqlIdentifiers.requireValid(table);
            SqlIdentifiers.requireValid(idColumn);
            SqlIdentifiers.requireValid(entityColumn);
            references = List.copyOf(references);
        }
    }

    private final String entityTable;
    private final List<Reference> entityReferences;
    private final List<Subtype> subtypes;
    private final List<PairReference> pairReferences;

    private MergeSchema(Builder builder) {
        this.entityTable = builder.entityTable;
        this.entityReferences = List.copyOf(builder.entityReferences);
        this.subtypes = List.copyOf(builder.subtypes);
        this.pairReferences = List.copyOf(builder.pairReferences);
    }

    /**
     * The archive's schema.
     */
    public static MergeSchema defaults() {
        return builder()
                .reference(Reference.composite("entity_mentions", "entity_id", "document_id"))
                .reference(Reference.simple("media_items", "entity_id"))
                .reference(Reference.simple("organizations", "entity_id"))
                .reference(Reference.composite("entity_evidence_types", "entity_id", "evidence_type_id"))
                .subtype(new Subtype("people", "id", "entity_id", List.of(
                        Reference.composite("entity_documents", "entity_id", "document_id"),
                        Reference.simple("black_book_entries", "person_id"))))
                .pairReference(new PairReference("entity_relationships", "source_entity_id", "target_entity_id"))
                .pairReference(new PairReference("entity_relationships", "source_id", "target_id"))
                .build();
    }

    public String getEntityTable() {
        return entityTable;
    }

    public List<Reference> getEntityReferences() {
        return entityReferences;
    }

    public List<Subtype> getSubtypes() {
        return subtypes;
    }

    public List<PairReference> getPairReferences() {
        return pairReferences;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String entityTable = "entities";
        private final List<Reference> entityReferences = new ArrayList<>();
        private final List<Subtype> subtypes = new ArrayList<>();
        private final List<PairReference> pairReferences = new ArrayList<>();

        public Builder entityTable(String entityTable) {
            this.entityTable = SqlIdentifiers.requireValid(entityTable);
            return this;
        }

        public Builder reference(Reference reference) {
            this.entityReferences.add(Objects.requireNonNull(reference));
            return this;
        }

        public Builder subtype(Subtype subtype) {
            this.subtypes.add(Objects.requireNonNull(subtype));
            return this;
        }

        public Builder pairReference(PairReference pairReference) {
            this.pairReferences.add(Objects.requireNonNull(pairReference));
            return this;
        }

        public MergeSchema build() {
            return new MergeSchema(this);
        }
    }
}
