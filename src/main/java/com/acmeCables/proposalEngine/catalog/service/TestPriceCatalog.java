package com.acmeCables.proposalEngine.catalog.service;

import com.acmeCables.proposalEngine.catalog.model.TestPrice;
import com.acmeCables.proposalEngine.repository.DocumentRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Price table of acceptance and type tests, looked up by test name ignoring case.
 */
@Slf4j
@Service
public class TestPriceCatalog {

    private static final String INDEX_KEY = "all";
    private static final Duration INDEX_TTL = Duration.ofMinutes(30);

    private final DocumentRepository documentRepository;
    private final ObjectMapper objectMapper;
    private final LoadingCache<String, Map<String, TestPrice>> index;

    public TestPriceCatalog(DocumentRepository documentRepository, ObjectMapper objectMapper) {
        this.documentRepository = documentRepository;
        this.objectMapper = objectMapper;
        this.index = Caffeine.newBuilder()
                .expireAfterWrite(INDEX_TTL)
                .maximumSize(1)
                .build(key -> loadIndex());
    }

    public Optional<TestPrice> findPrice(String testName) {
        if (testName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(index.get(INDEX_KEY).get(normalize(testName)));
    }

    private Map<String, TestPrice> loadIndex() {
        Map<String, TestPrice> prices = new HashMap<>();
        for (Document document : documentRepository.findAll(DocumentRepository.TEST_PRICING)) {
            TestPrice price = toTestPrice(document);
            if (price.getTestName() == null || price.getPrice() == null) {
                log.warn("Skipping incomplete test price entry - _id: {}", document.get("_id"));
                continue;
            }
            prices.putIfAbsent(normalize(price.getTestName()), price);
        }
        log.info("Loaded {} test prices", prices.size());
        return Map.copyOf(prices);
    }

    private TestPrice toTestPrice(Document document) {
        try {
            return objectMapper.readValue(document.toJson(), TestPrice.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Test price entry " + document.get("_id") + " is malformed", e);
        }
    }

    private static String normalize(String testName) {
        return testName.trim().toLowerCase(Locale.ROOT);
    }
}
