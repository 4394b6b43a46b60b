package com.acmeCables.proposalEngine.rfp.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Required value of a single attribute on a request item.
 */
@Value
@Builder
@Jacksonized
public class RequiredAttribute {

    String value;

    /**
     * Defaults to {@link ToleranceKind#NONE} when the RFP does not say.
     */
    @Builder.Default
    ToleranceKind tolerance = ToleranceKind.NONE;
}
