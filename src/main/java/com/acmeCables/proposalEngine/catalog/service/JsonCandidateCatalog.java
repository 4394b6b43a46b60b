package com.acmeCables.proposalEngine.catalog.service;

import com.acmeCables.proposalEngine.catalog.model.Candidate;
import com.acmeCables.proposalEngine.repository.DocumentRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;

/**
 * Catalog backed by the {@code candidates} document collection, behind a Caffeine read-through cache.
 * Cached candidates are immutable and shared by concurrent item-matching tasks.
 */
@Slf4j
@Service
public class JsonCandidateCatalog implements CandidateCatalog {

    private static final Duration CANDIDATE_TTL = Duration.ofMinutes(30);

    private final DocumentRepository documentRepository;
    private final ObjectMapper objectMapper;
    private final LoadingCache<String, Optional<Candidate>> candidates;

    public JsonCandidateCatalog(DocumentRepository documentRepository, ObjectMapper objectMapper) {
        this.documentRepository = documentRepository;
        this.objectMapper = objectMapper;
        this.candidates = Caffeine.newBuilder()
                .expireAfterWrite(CANDIDATE_TTL)
                .maximumSize(50_000)
                .build(this::load);
    }

    @Override
    public Optional<Candidate> getCandidate(String candidateId) {
        if (candidateId == null || candidateId.isBlank()) {
            return Optional.empty();
        }
        return candidates.get(candidateId);
    }

    private Optional<Candidate> load(String candidateId) {
        return documentRepository.findById(DocumentRepository.CANDIDATES, candidateId)
                .map(this::toCandidate);
    }

    private Candidate toCandidate(Document document) {
        try {
            return objectMapper.readValue(document.toJson(), Candidate.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Catalog entry " + document.get("_id") + " is malformed", e);
        }
    }
}
