package com.acmeCables.proposalEngine.repository;

import com.acmeCables.proposalEngine.resilience.exception.UpstreamUnavailableException;
import com.acmeCables.proposalEngine.util.JsonFileLoader;
import com.fasterxml.jackson.databind.JsonNode;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Document store over classpath JSON collections.
 *
 * <p>Seed collections are JSON arrays in {@code resources/data}, each object keyed by {@code _id}.
 * Saved documents live in a bounded Caffeine store and shadow seed documents with the same id.</p>
 */
@Slf4j
@Repository
public class DocumentRepository {

    public static final String RFPS = "rfps";
    public static final String CANDIDATES = "candidates";
    public static final String TEST_PRICING = "testPricing";
    public static final String PROPOSALS = "proposals";

    private static final String ID_FIELD = "_id";

    // Map collection names to JSON file paths in resources/data
    private static final Map<String, String> COLLECTION_TO_FILE_MAP = Map.of(
            RFPS, "data/rfps.json",
            CANDIDATES, "data/catalog.json",
            TEST_PRICING, "data/test-pricing.json"
    );

    private static final Duration SAVED_DOCUMENT_TTL = Duration.ofHours(24);

    /**
     * Key: collection + "/" + _id
     */
    private final Cache<String, Document> savedDocuments = Caffeine.newBuilder()
            .expireAfterWrite(SAVED_DOCUMENT_TTL)
            .maximumSize(10_000)
            .build();

    /**
     * Finds a document by its {@code _id}.
     *
     * @throws UpstreamUnavailableException if the collection file cannot be read
     */
    public Optional<Document> findById(String collection, String id) {
        Document saved = savedDocuments.getIfPresent(key(collection, id));
        if (saved != null) {
            return Optional.of(saved);
        }
        String filePath = COLLECTION_TO_FILE_MAP.get(collection);
        if (filePath == null) {
            log.debug("No seed file for collection: {}, id: {}", collection, id);
            return Optional.empty();
        }

        for (JsonNode jsonObject : loadArray(collection, filePath)) {
            JsonNode idNode = jsonObject.get(ID_FIELD);
            if (idNode != null && id.equals(idNode.asText())) {
                return Optional.of(Document.parse(jsonObject.toString()));
            }
        }
        log.debug("No document found with _id: {} in collection: {}", id, collection);
        return Optional.empty();
    }

    /**
     * All seed documents of a collection, in file order.
     *
     * @throws IllegalArgumentException for a collection without a seed file
     * @throws UpstreamUnavailableException if the collection file cannot be read
     */
    public List<Document> findAll(String collection) {
        String filePath = COLLECTION_TO_FILE_MAP.get(collection);
        if (filePath == null) {
            throw new IllegalArgumentException("Unknown collection: " + collection);
        }
        List<Document> documents = new ArrayList<>();
        for (JsonNode jsonObject : loadArray(collection, filePath)) {
            documents.add(Document.parse(jsonObject.toString()));
        }
        return documents;
    }

    /**
     * Upserts a document by id.
     */
    public void save(String collection, String id, Document document) {
        Document stored = new Document(document);
        stored.put(ID_FIELD, id);
        savedDocuments.put(key(collection, id), stored);
        log.debug("Saved document - collection: {}, _id: {}", collection, id);
    }

    private JsonNode loadArray(String collection, String filePath) {
        JsonNode jsonArray;
        try {
            jsonArray = JsonFileLoader.loadAsJsonNode(filePath);
        } catch (IOException e) {
            log.error("Failed to load JSON file: {}", filePath, e);
            throw new UpstreamUnavailableException("Collection " + collection + " could not be read", e);
        }
        if (!jsonArray.isArray()) {
            throw new IllegalStateException("JSON file " + filePath + " does not contain an array");
        }
        return jsonArray;
    }

    private static String key(String collection, String id) {
        return collection + "/" + id;
    }
}
