package com.acmeCables.proposalEngine.repository;

import com.acmeCables.proposalEngine.orchestrator.exception.RfpValidationException;
import com.acmeCables.proposalEngine.orchestrator.model.ProposalResult;
import com.acmeCables.proposalEngine.rfp.model.Rfp;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import org.springframework.stereotype.Repository;

import java.util.Map;
import java.util.Optional;

/**
 * RFP and proposal persistence on top of the {@link DocumentRepository}.
 * Seed RFPs are mapped through their JSON form. Proposal results are converted field by field
 * so monetary amounts stay {@link java.math.BigDecimal} with their scale.
 */
@Slf4j
@Repository
public class DocumentProposalRepository implements RfpRepository, ProposalResultRepository {

    private static final TypeReference<Map<String, Object>> FIELDS = new TypeReference<>() {
    };

    private final DocumentRepository documentRepository;
    private final ObjectMapper objectMapper;
    private final ObjectMapper proposalMapper;

    public DocumentProposalRepository(DocumentRepository documentRepository, ObjectMapper objectMapper) {
        this.documentRepository = documentRepository;
        this.objectMapper = objectMapper;
        this.proposalMapper = objectMapper.copy().enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);
    }

    @Override
    public Optional<Rfp> loadRfp(String rfpId) {
        return documentRepository.findById(DocumentRepository.RFPS, rfpId)
                .map(document -> {
                    try {
                        return objectMapper.readValue(document.toJson(), Rfp.class);
                    } catch (JsonProcessingException e) {
                        throw new RfpValidationException("RFP " + rfpId + " is malformed: " + e.getOriginalMessage());
                    }
                });
    }

    @Override
    public void store(ProposalResult result) {
        Document document;
        try {
            document = new Document(proposalMapper.convertValue(result, FIELDS));
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Proposal result for RFP " + result.getRfpId() + " is not serializable", e);
        }
        documentRepository.save(DocumentRepository.PROPOSALS, result.getRfpId(), document);
        log.info("Stored proposal result - correlationId: {}, rfpId: {}, state: {}",
                result.getCorrelationId(), result.getRfpId(), result.getState());
    }

    @Override
    public Optional<ProposalResult> findLatest(String rfpId) {
        return documentRepository.findById(DocumentRepository.PROPOSALS, rfpId)
                .map(document -> {
                    try {
                        return proposalMapper.convertValue(document, ProposalResult.class);
                    } catch (IllegalArgumentException e) {
                        throw new IllegalStateException("Stored proposal for RFP " + rfpId + " cannot be read", e);
                    }
                });
    }
}
