package com.example.OfferScan.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Canonical, schema-normalized representation of one insurance offer.
 * <p>
 * Values that could not be determined are empty optionals and their dotted path is listed in
 * {@link #missingFields()}; zero is always a real value.
 */
@Builder
public record UnifiedOffer(
        @JsonProperty("offer_id") Optional<String> offerId,
        @JsonProperty("source_document") String sourceDocument,
        @JsonProperty("insured") List<InsuredPerson> insured,
        @JsonProperty("base_contracts") List<BaseContract> baseContracts,
        @JsonProperty("additional_contracts") List<AdditionalContract> additionalContracts,
        @JsonProperty("discounts") List<String> discounts,
        @JsonProperty("total_premium_before_discounts") OptionalDouble totalPremiumBeforeDiscounts,
        @JsonProperty("total_premium_after_discounts") OptionalDouble totalPremiumAfterDiscounts,
        @JsonProperty("assistance") List<Assistance> assistance,
        @JsonProperty("duration") OfferDuration duration,
        @JsonProperty("notes") List<String> notes,
        @JsonProperty("missing_fields") List<String> missingFields,
        @JsonProperty("extraction_confidence") ExtractionConfidence extractionConfidence
) {
    public UnifiedOffer {
        offerId = offerId == null ? Optional.empty() : offerId;
        insured = insured == null ? List.of() : List.copyOf(insured);
        baseContracts = baseContracts == null ? List.of() : List.copyOf(baseContracts);
        additionalContracts = additionalContracts == null ? List.of() : List.copyOf(additionalContracts);
        discounts = discounts == null ? List.of() : List.copyOf(discounts);
        totalPremiumBeforeDiscounts = totalPremiumBeforeDiscounts == null ? OptionalDouble.empty() : totalPremiumBeforeDiscounts;
        totalPremiumAfterDiscounts = totalPremiumAfterDiscounts == null ? OptionalDouble.empty() : totalPremiumAfterDiscounts;
        assistance = assistance == null ? List.of() : List.copyOf(assistance);
        notes = notes == null ? List.of() : List.copyOf(notes);
        missingFields = missingFields == null ? List.of() : List.copyOf(missingFields);
    }

    public record InsuredPerson(
            Optional<String> name,
            OptionalDouble age,
            String role,
            List<Plan> plans
    ) {
        public InsuredPerson {
            plans = plans == null ? List.of() : List.copyOf(plans);
        }
    }

    public record Plan(
            String type,
            OptionalDouble sum,
            OptionalDouble premium,
            String variant,
            Optional<String> duration
    ) {
    }

    public record BaseContract(
            String name,
            OptionalDouble sum,
            OptionalDouble premium,
            String variant
    ) {
    }

    public record AdditionalContract(
            String name,
            Optional<String> coverage,
            OptionalDouble premium
    ) {
    }

    public record Assistance(String name, String coverage, String limits) {
    }

    public record OfferDuration(
            Optional<String> start,
            Optional<String> end,
            String variant
    ) {
    }
}
