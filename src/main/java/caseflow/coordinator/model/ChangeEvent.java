package caseflow.coordinator.model;

import caseflow.coordinator.error.PermanentValidationException;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Set;

/**
 * A row-level change notification: {@code {type, table, record, schema, old_record}}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ChangeEvent(
        @JsonProperty("type") String type,
        @JsonProperty("table") String table,
        @JsonProperty("record") JsonNode record,
        @JsonProperty("schema") String schema,
        @JsonProperty("old_record") JsonNode oldRecord) {

    public static final String CASES = "cases";
    public static final String CASE_DOCUMENTS = "case_documents";

    static final Set<String> TYPES = Set.of("INSERT", "UPDATE", "DELETE");
    static final Set<String> TABLES = Set.of(CASES, CASE_DOCUMENTS);

    /**
     * Minimal checks every event must pass.
     *
     * @throws PermanentValidationException if type, table or record is missing
     */
    public void validateBasics() {
        if (type == null || type.isBlank()) {
            throw new PermanentValidationException("type is required");
        }
        if (table == null || table.isBlank()) {
            throw new PermanentValidationException("table is required");
        }
        if (record == null || !record.isObject()) {
            throw new PermanentValidationException("record is required");
        }
    }

    /**
     * Full structural validation for events from outside the platform:
     * supported table and type, record id and owner reference present.
     */
    public void validateStructure() {
        validateBasics();
        if (!TYPES.contains(type)) {
            throw new PermanentValidationException("Unsupported event type: " + type);
        }
        if (!TABLES.contains(table)) {
            throw new PermanentValidationException("Unsupported table: " + table);
        }
        if (text("id") == null) {
            throw new PermanentValidationException("record.id is required");
        }
        String owner = isCaseTable() ? "user_id" : "case_id";
        if (text(owner) == null) {
            throw new PermanentValidationException("record." + owner + " is required");
        }
    }

    public boolean isCaseTable() {
        return CASES.equals(table);
    }

    public boolean isDocumentTable() {
        return CASE_DOCUMENTS.equals(table);
    }

    public boolean isUpsert() {
        return "INSERT".equals(type) || "UPDATE".equals(type);
    }

    public String recordId() {
        return text("id");
    }

    /**
     * Text field of the changed record, or null when absent or blank.
     */
    public String text(String field) {
        if (record == null) {
            return null;
        }
        JsonNode node = record.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        String value = node.asText();
        return value.isBlank() ? null : value;
    }
}
