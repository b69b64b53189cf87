package com.example.LusLaboris.repository;

import com.example.LusLaboris.model.CollectionInfo;
import com.example.LusLaboris.model.RetrievedDocument;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pgvector.PGvector;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Law articles stored in pgvector. A collection is a logical partition of
 * {@code law_articles}, registered in {@code vector_collections}.
 */
@Repository
@RequiredArgsConstructor
public class LawArticleVectorRepository {

    private static final Logger log = LoggerFactory.getLogger(LawArticleVectorRepository.class);

    private static final TypeReference<Map<String, Object>> PAYLOAD_TYPE = new TypeReference<>() {
    };

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    /**
     * Cosine search with pgvector's {@code <=>} distance operator;
     * score = 1 - distance, best match first.
     */
    public List<RetrievedDocument> search(String collectionName, float[] embedding, int limit) {
        PGvector queryVector = new PGvector(embedding);

        String sql = """
                SELECT id,
                       payload,
                       1 - (embedding <=> ?) AS score
                FROM law_articles
                WHERE collection_name = ?
                ORDER BY embedding <=> ?
                LIMIT ?
                """;

        return jdbcTemplate.query(sql, ps -> {
            ps.setObject(1, queryVector);
            ps.setString(2, collectionName);
            ps.setObject(3, queryVector);
            ps.setInt(4, limit);
        }, new RetrievedDocumentRowMapper());
    }

    public boolean collectionExists(String name) {
        Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM vector_collections WHERE name = ?", Integer.class, name);
        return count != null && count > 0;
    }

    /**
     * Register a collection. With {@code replace} any existing rows are dropped
     * first; otherwise an existing collection is kept and appended to.
     */
    @Transactional
    public void createCollection(String name, int vectorSize, boolean replace) {
        if (replace) {
            deleteCollection(name);
        }
        if (collectionExists(name)) {
            log.info("Collection '{}' already exists, appending", name);
            return;
        }
        jdbcTemplate.update(
                "INSERT INTO vector_collections (name, vector_size, distance_metric) VALUES (?, ?, 'cosine')",
                name, vectorSize);
        log.info("Created collection '{}' with vector size {}", name, vectorSize);
    }

    @Transactional
    public boolean deleteCollection(String name) {
        int rows = jdbcTemplate.update("DELETE FROM law_articles WHERE collection_name = ?", name);
        int collections = jdbcTemplate.update("DELETE FROM vector_collections WHERE name = ?", name);
        if (collections > 0) {
            log.info("Deleted collection '{}' ({} rows)", name, rows);
        }
        return collections > 0;
    }

    public List<String> listCollections() {
        return jdbcTemplate.queryForList("SELECT name FROM vector_collections ORDER BY name", String.class);
    }

    public Optional<CollectionInfo> getCollectionInfo(String name) {
        String sql = """
                SELECT c.name,
                       c.vector_size,
                       c.distance_metric,
                       c.created_at,
                       (SELECT COUNT(*) FROM law_articles a WHERE a.collection_name = c.name) AS points_count
                FROM vector_collections c
                WHERE c.name = ?
                """;

        List<CollectionInfo> rows = jdbcTemplate.query(sql, (rs, rowNum) -> {
            Timestamp createdAt = rs.getTimestamp("created_at");
            return new CollectionInfo(
                    rs.getString("name"),
                    rs.getLong("points_count"),
                    rs.getInt("vector_size"),
                    rs.getString("distance_metric"),
                    createdAt == null ? null : createdAt.toInstant()
            );
        }, name);
        return rows.stream().findFirst();
    }

    /**
     * Insert articles with their embeddings in JDBC batches.
     *
     * @return number of inserted rows
     */
    public int insertDocuments(String collectionName, List<Map<String, Object>> payloads,
                               List<float[]> embeddings, int batchSize) {
        if (payloads.size() != embeddings.size()) {
            throw new IllegalArgumentException("Got " + payloads.size() + " payloads but "
                    + embeddings.size() + " embeddings");
        }

        List<Object[]> rows = new ArrayList<>(payloads.size());
        for (int i = 0; i < payloads.size(); i++) {
            rows.add(new Object[]{toJson(payloads.get(i)), embeddings.get(i)});
        }

        String sql = "INSERT INTO law_articles (collection_name, payload, embedding) VALUES (?, CAST(? AS jsonb), ?)";
        int[][] counts = jdbcTemplate.batchUpdate(sql, rows, Math.max(1, batchSize), (ps, row) -> {
            ps.setString(1, collectionName);
            ps.setString(2, (String) row[0]);
            ps.setObject(3, new PGvector((float[]) row[1]));
        });

        int inserted = 0;
        for (int[] batch : counts) {
            for (int count : batch) {
                // drivers may report SUCCESS_NO_INFO (-2) for batched statements
                inserted += count >= 0 ? count : 1;
            }
        }
        return inserted;
    }

    private String toJson(Map<String, Object> payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Payload is not serializable to JSON", e);
        }
    }

    private class RetrievedDocumentRowMapper implements RowMapper<RetrievedDocument> {
        @Override
        public RetrievedDocument mapRow(ResultSet rs, int rowNum) throws SQLException {
            long id = rs.getLong("id");
            Map<String, Object> payload = Map.of();

            String payloadJson = rs.getString("payload");
            if (payloadJson != null) {
                try {
                    payload = objectMapper.readValue(payloadJson, PAYLOAD_TYPE);
                } catch (JsonProcessingException e) {
                    log.warn("Unreadable payload for article {}, returning it without fields", id, e);
                }
            }

            return new RetrievedDocument(id, rs.getDouble("score"), null, payload);
        }
    }
}
