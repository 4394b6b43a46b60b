package com.acmeCables.proposalEngine.orchestrator.service;

import com.acmeCables.proposalEngine.orchestrator.exception.RfpValidationException;
import com.acmeCables.proposalEngine.rfp.model.RequestItem;
import com.acmeCables.proposalEngine.rfp.model.RequiredAttribute;
import com.acmeCables.proposalEngine.rfp.model.Rfp;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Structural checks on a loaded RFP. All violations are collected and reported together.
 */
@Component
public class RfpValidator {

    public void validate(Rfp rfp) {
        List<String> violations = new ArrayList<>();
        if (rfp.getRfpId() == null || rfp.getRfpId().isBlank()) {
            violations.add("rfpId is required");
        }
        if (rfp.getItems() == null || rfp.getItems().isEmpty()) {
            violations.add("RFP has no items");
        } else {
            Set<String> seenIds = new HashSet<>();
            for (int i = 0; i < rfp.getItems().size(); i++) {
                validateItem(i, rfp.getItems().get(i), seenIds, violations);
            }
        }
        if (rfp.getTestRequirements() != null) {
            for (int i = 0; i < rfp.getTestRequirements().size(); i++) {
                if (rfp.getTestRequirements().get(i) == null || rfp.getTestRequirements().get(i).getTestName() == null
                        || rfp.getTestRequirements().get(i).getTestName().isBlank()) {
                    violations.add("testRequirements[" + i + "]: testName is required");
                }
            }
        }

        if (!violations.isEmpty()) {
            throw new RfpValidationException(
                    "RFP " + rfp.getRfpId() + " is malformed: " + String.join("; ", violations), violations);
        }
    }

    private void validateItem(int index, RequestItem item, Set<String> seenIds, List<String> violations) {
        String label = "items[" + index + "]";
        if (item == null) {
            violations.add(label + ": item is null");
            return;
        }
        if (item.getItemId() == null || item.getItemId().isBlank()) {
            violations.add(label + ": itemId is required");
        } else {
            label = "item " + item.getItemId();
            if (!seenIds.add(item.getItemId())) {
                violations.add(label + ": duplicate itemId");
            }
        }
        if (item.getQuantity() == null || item.getQuantity().signum() <= 0) {
            violations.add(label + ": quantity must be greater than 0");
        }
        Map<String, RequiredAttribute> attributes = item.getRequiredAttributes();
        if (attributes != null) {
            for (Map.Entry<String, RequiredAttribute> attribute : attributes.entrySet()) {
                if (attribute.getValue() == null || attribute.getValue().getValue() == null
                        || attribute.getValue().getValue().isBlank()) {
                    violations.add(label + ": required attribute '" + attribute.getKey() + "' has no value");
                }
            }
        }
    }
}
