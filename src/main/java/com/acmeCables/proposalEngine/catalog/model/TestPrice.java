package com.acmeCables.proposalEngine.catalog.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class TestPrice {

    String testName;

    BigDecimal price;

    @Builder.Default
    String currency = "INR";
}
