package com.entity.consolidation.store;

import com.entity.consolidation.core.model.Entity;
import com.entity.consolidation.core.model.EntityType;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reads and updates rows of the {@code entities} table.
 * The {@code aliases} column is optional and holds a JSON array of strings.
 */
public class EntityRepository {
    private static final Logger log = LoggerFactory.getLogger(EntityRepository.class);

    static final String TABLE = "entities";
    static final String ALIASES_COLUMN = "aliases";

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};

    private final DatabaseConnection connection;
    private final ObjectMapper objectMapper;

    public EntityRepository(DatabaseConnection connection) {
        this(connection, new ObjectMapper());
    }

    public EntityRepository(DatabaseConnection connection, ObjectMapper objectMapper) {
        this.connection = connection;
        this.objectMapper = objectMapper;
    }

    /**
     * All entities of a type, ordered by id.
     * {@link EntityType#UNKNOWN} also covers rows with a null or unrecognized type.
     */
    public List<Entity> findByType(EntityType type) throws SQLException {
        String sql = "SELECT " + selectColumns() + " FROM " + TABLE + " WHERE " + typeFilter(type) + " ORDER BY id";
        List<Map<String, Object>> rows = type == EntityType.UNKNOWN
                ? connection.query(sql)
                : connection.query(sql, type.getLabel());
        List<Entity> entities = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            entities.add(mapRow(row));
        }
        log.debug("Loaded {} entities of type {}", entities.size(), type.getLabel());
        return entities;
    }

    public Optional<Entity> findById(long id) throws SQLException {
        List<Map<String, Object>> rows = connection.query(
                "SELECT " + selectColumns() + " FROM " + TABLE + " WHERE id = ?", id);
        if (rows.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(mapRow(rows.get(0)));
    }

    public int countByType(EntityType type) throws SQLException {
        String sql = "SELECT COUNT(*) AS cnt FROM " + TABLE + " WHERE " + typeFilter(type);
        List<Map<String, Object>> rows = type == EntityType.UNKNOWN
                ? connection.query(sql)
                : connection.query(sql, type.getLabel());
        return rows.isEmpty() ? 0 : ((Number) rows.get(0).get("cnt")).intValue();
    }

    public boolean supportsAliases() throws SQLException {
        return connection.columnExists(TABLE, ALIASES_COLUMN);
    }

    /**
     * Adds {@code delta} to the entity's mention counter.
     *
     * @return whether the row exists
     */
    public boolean addMentions(long id, int delta) throws SQLException {
        return connection.update(
                "UPDATE " + TABLE + " SET mentions = COALESCE(mentions, 0) + ? WHERE id = ?", delta, id) > 0;
    }

    public void updateAliases(long id, Collection<String> aliases) throws SQLException {
        connection.update("UPDATE " + TABLE + " SET " + ALIASES_COLUMN + " = ? WHERE id = ?",
                writeAliases(aliases), id);
    }

    public boolean delete(long id) throws SQLException {
        return connection.update("DELETE FROM " + TABLE + " WHERE id = ?", id) > 0;
    }

    private String selectColumns() throws SQLException {
        String columns = "id, full_name, entity_type, COALESCE(mentions, 0) AS mentions";
        return supportsAliases() ? columns + ", " + ALIASES_COLUMN : columns;
    }

    private static String typeFilter(EntityType type) {
        if (type == EntityType.UNKNOWN) {
            return "(entity_type IS NULL OR entity_type NOT IN ('"
                    + EntityType.PERSON.getLabel() + "', '" + EntityType.ORGANIZATION.getLabel() + "'))";
        }
        return "entity_type = ?";
    }

    private Entity mapRow(Map<String, Object> row) {
        Object fullName = row.get("full_name");
        return Entity.builder()
                .id(((Number) row.get("id")).longValue())
                .fullName(fullName != null ? fullName.toString() : "")
                .type(EntityType.fromLabel((String) row.get("entity_type")))
                .mentions(((Number) row.get("mentions")).intValue())
                .aliases(readAliases(row.get(ALIASES_COLUMN)))
                .build();
    }

    List<String> readAliases(Object value) {
        if (value == null) {
            return List.of();
        }
        String text = value.toString().trim();
        if (text.isEmpty()) {
            return List.of();
        }
        if (text.startsWith("[")) {
            try {
                return objectMapper.readValue(text, STRING_LIST);
            } catch (JsonProcessingException e) {
                log.warn("Unparseable aliases value, reading it as a comma-separated list: {}", e.getOriginalMessage());
            }
        }
        return Arrays.asList(text.split(","));
    }

    String writeAliases(Collection<String> aliases) {
        try {
            return objectMapper.writeValueAsString(List.copyOf(aliases));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize aliases", e);
        }
    }
}
