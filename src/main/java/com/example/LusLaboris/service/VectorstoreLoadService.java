package com.example.LusLaboris.service;

import com.example.LusLaboris.config.RagProperties;
import com.example.LusLaboris.exception.IngestionException;
import com.example.LusLaboris.model.CollectionInfo;
import com.example.LusLaboris.model.LoadResult;
import com.example.LusLaboris.model.LoadToVectorstoreRequest;
import com.example.LusLaboris.monitoring.MonitoringService;
import com.example.LusLaboris.repository.LawArticleVectorRepository;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Loads a processed labor-code JSON file into the vector store:
 *
 *   {"meta": {"numero_ley": "213"}, "articulos": [{...}, ...]}
 *
 * Each article is embedded as "capitulo_descripcion: articulo" and stored
 * with its structural fields as payload.
 */
@Service
public class VectorstoreLoadService {

    private static final Logger log = LoggerFactory.getLogger(VectorstoreLoadService.class);

    public static final String OPERATION = "load_to_vectorstore_local";

    private static final List<String> PAYLOAD_FIELDS = List.of(
            "libro", "libro_numero", "titulo", "capitulo", "capitulo_numero");

    private final EmbeddingService embeddingService;
    private final LawArticleVectorRepository vectorRepository;
    private final MonitoringService monitoringService;
    private final ObjectMapper objectMapper;
    private final RagProperties properties;

    public VectorstoreLoadService(EmbeddingService embeddingService,
                                  LawArticleVectorRepository vectorRepository,
                                  MonitoringService monitoringService,
                                  ObjectMapper objectMapper,
                                  RagProperties properties) {
        this.embeddingService = embeddingService;
        this.vectorRepository = vectorRepository;
        this.monitoringService = monitoringService;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    public String collectionName() {
        return properties.getRag().getCollectionName();
    }

    /**
     * @throws IngestionException when the file is missing, unreadable or has no articles
     */
    public LoadResult loadFromLocalFile(LoadToVectorstoreRequest request, String sessionId) {
        long start = System.nanoTime();
        String collectionName = collectionName();
        int batchSize = request.resolveBatchSize(properties.getEmbedding().getBatchSize());

        JsonNode data = readLocalFile(request);
        JsonNode articles = data.path("articulos");
        if (!articles.isArray() || articles.isEmpty()) {
            throw new IngestionException("No articles found in data");
        }

        String source = "codigo_trabajo_paraguay_ley" + data.path("meta").path("numero_ley").asText("unknown");
        List<Map<String, Object>> payloads = new ArrayList<>(articles.size());
        List<String> texts = new ArrayList<>(articles.size());
        for (JsonNode article : articles) {
            String chapter = article.path("capitulo_descripcion").asText("");
            String text = article.path("articulo").asText("");

            Map<String, Object> payload = new LinkedHashMap<>();
            for (String field : PAYLOAD_FIELDS) {
                payload.put(field, scalar(article.get(field)));
            }
            payload.put("capitulo_descripcion", chapter);
            payload.put("articulo", text);
            payload.put("articulo_numero", scalar(article.get("articulo_numero")));
            payload.put("articulo_len", text.length());
            payload.put("source", source);

            payloads.add(payload);
            texts.add(chapter + ": " + text);
        }
        log.info("Processing {} documents for embedding (source {})", payloads.size(), source);

        List<float[]> embeddings;
        try {
            embeddings = embeddingService.embedAll(texts, batchSize);
        } catch (RuntimeException e) {
            throw new IngestionException("Failed to generate embeddings: " + e.getMessage(), e);
        }
        if (embeddings.size() != payloads.size() || embeddings.isEmpty()) {
            throw new IngestionException("Embedding model returned " + embeddings.size()
                    + " vectors for " + payloads.size() + " articles");
        }
        int vectorSize = embeddings.get(0).length;

        vectorRepository.createCollection(collectionName, vectorSize, request.replaceCollection());
        int inserted = vectorRepository.insertDocuments(collectionName, payloads, embeddings, batchSize);

        double processingTime = (System.nanoTime() - start) / 1_000_000_000.0;
        LoadResult result = new LoadResult(
                collectionName,
                payloads.size(),
                inserted,
                processingTime,
                embeddingService.modelName(),
                vectorSize,
                batchSize
        );

        Map<String, Object> metadata = new LinkedHashMap<>(result.toMap());
        metadata.put("filename", request.filename());
        metadata.put("replace_collection", request.replaceCollection());
        monitoringService.trackVectorstoreOperation(sessionId, "load", collectionName, metadata);

        log.info("Loaded {} of {} articles into '{}' in {}s", inserted, payloads.size(), collectionName,
                String.format("%.2f", processingTime));
        return result;
    }

    public List<String> listCollections() {
        return vectorRepository.listCollections();
    }

    public Optional<CollectionInfo> getCollectionInfo(String name) {
        return vectorRepository.getCollectionInfo(name);
    }

    public boolean deleteCollection(String name, String sessionId) {
        boolean deleted = vectorRepository.deleteCollection(name);
        if (deleted) {
            monitoringService.trackVectorstoreOperation(sessionId, "delete", name, Map.of());
        }
        return deleted;
    }

    private JsonNode readLocalFile(LoadToVectorstoreRequest request) {
        String filename = request.filename();
        if (filename == null || filename.isBlank() || filename.contains("/") || filename.contains("\\")
                || filename.contains("..")) {
            throw new IngestionException("Invalid filename: " + filename);
        }

        Path file = Path.of(request.resolveLocalDataPath(properties.getIngestion().getLocalDataPath()))
                .resolve(filename);
        if (!Files.isRegularFile(file)) {
            throw new IngestionException("File not found: " + file);
        }

        log.info("Loading local data from: {}", file);
        try {
            return objectMapper.readTree(file.toFile());
        } catch (IOException e) {
            throw new IngestionException("Failed to read " + file + ": " + e.getMessage(), e);
        }
    }

    private static Object scalar(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isIntegralNumber()) {
            return node.asLong();
        }
        if (node.isNumber()) {
            return node.asDouble();
        }
        if (node.isBoolean()) {
            return node.asBoolean();
        }
        return node.asText();
    }
}
