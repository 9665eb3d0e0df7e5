package com.example.OfferScan.service;

import com.example.OfferScan.model.ExtractionConfidence;
import com.example.OfferScan.model.OfferMetadata;
import com.example.OfferScan.model.ParsedSection;
import com.example.OfferScan.model.ProductTypeHeuristic;
import com.example.OfferScan.model.SectionSource;
import com.example.OfferScan.model.SectionType;
import com.example.OfferScan.model.SegmentationResult;
import com.example.OfferScan.model.UnifiedOffer;
import com.example.OfferScan.model.UnifiedOfferBuildResult;
import com.example.OfferScan.util.JsonValues;
import com.example.OfferScan.util.NumberValues;
import com.example.OfferScan.util.Texts;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Combines classified sections with the AI extraction into a {@link UnifiedOffer}.
 * <p>
 * AI values win; sections fill discounts, the final premium and the validity period when the AI
 * left them out. Every value that stays unknown is listed in {@code missing_fields}.
 */
@Component
public class UnifiedOfferBuilder {

    private static final Logger log = LoggerFactory.getLogger(UnifiedOfferBuilder.class);

    static final String DEFAULT_ROLE = "ubezpieczony";
    static final String DEFAULT_PLAN_TYPE = "Nieznany plan";
    static final String DEFAULT_VARIANT = "standard";
    static final String DEFAULT_DURATION_VARIANT = "standardowy";
    static final String DEFAULT_ASSISTANCE_COVERAGE = "24/7";
    static final String DEFAULT_ASSISTANCE_LIMITS = "standardowe";
    static final String DEFAULT_BASE_CONTRACT_NAME = "Umowa podstawowa";
    static final String DEFAULT_ADDITIONAL_CONTRACT_NAME = "Umowa dodatkowa";

    static final String FIELD_OFFER_ID = "offer_id";
    static final String FIELD_INSURED = "insured";
    static final String FIELD_PREMIUM_BEFORE = "total_premium_before_discounts";
    static final String FIELD_PREMIUM_AFTER = "total_premium_after_discounts";

    private static final Pattern DISCOUNT = Pattern.compile(
            "(?:zniżka|rabat|upust)[:\\s]+([^\\n]+)", Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    private static final Pattern PREMIUM_TOTAL = Pattern.compile(
            "(?:do zapłaty|składka\\s+(?:łączna|całkowita|razem)|razem)[^0-9\\n]{0,40}(\\d[\\d \\u00A0.,]*)",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    private static final String DATE = "(\\d{1,2}[./-]\\d{1,2}[./-]\\d{2,4}|\\d{4}-\\d{2}-\\d{2})";
    private static final Pattern PERIOD = Pattern.compile(
            "\\bod\\s+" + DATE + "\\s+do\\s+" + DATE, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);

    private static final Map<SectionType, String> FIELD_BY_SECTION = new EnumMap<>(Map.of(
            SectionType.INSURED, "insured",
            SectionType.BASE_CONTRACT, "base_contracts",
            SectionType.ADDITIONAL_CONTRACT, "additional_contracts",
            SectionType.ASSISTANCE, "assistance",
            SectionType.PREMIUM, "total_premium_after_discounts",
            SectionType.DISCOUNT, "discounts",
            SectionType.DURATION, "duration"));

    private final SectionClassifier classifier;

    public UnifiedOfferBuilder(SectionClassifier classifier) {
        this.classifier = classifier;
    }

    public UnifiedOfferBuildResult build(List<ParsedSection> sections, JsonNode aiExtraction, OfferMetadata metadata) {
        List<ParsedSection> secs = sections == null ? List.of() : sections;
        JsonNode ai = aiExtraction == null ? MissingNode.getInstance() : aiExtraction;
        OfferMetadata meta = metadata == null ? new OfferMetadata(null, null, null) : metadata;
        List<String> missing = new ArrayList<>();

        Optional<String> offerId = firstNonBlank(
                meta.calculationId(),
                JsonValues.firstText(ai, "calculation_id", "calculationId").orElse(null),
                meta.documentId());
        if (offerId.isEmpty()) missing.add(FIELD_OFFER_ID);

        List<UnifiedOffer.InsuredPerson> insured = buildInsured(ai, missing);
        List<UnifiedOffer.BaseContract> baseContracts = buildBaseContracts(ai, missing);
        List<UnifiedOffer.AdditionalContract> additionalContracts = buildAdditionalContracts(ai, missing);
        List<String> discounts = buildDiscounts(ai, secs);

        OptionalDouble before = NumberValues.parseOptional(
                firstPresent(ai, "total_premium_before_discounts", "totalPremiumBeforeDiscounts"));
        if (before.isEmpty()) missing.add(FIELD_PREMIUM_BEFORE);

        OptionalDouble after = NumberValues.parseOptional(
                firstPresent(ai, "total_premium_after_discounts", "totalPremiumAfterDiscounts", "premium.total"));
        if (after.isEmpty()) after = premiumFromSections(secs);
        if (after.isEmpty()) missing.add(FIELD_PREMIUM_AFTER);

        List<UnifiedOffer.Assistance> assistance = buildAssistance(ai);
        UnifiedOffer.OfferDuration duration = buildDuration(ai, secs, missing);
        List<String> notes = JsonValues.strings(ai.path("notes"));

        ExtractionConfidence confidence = grade(missing, SegmentationResult.identifiedRatio(secs));

        UnifiedOffer offer = UnifiedOffer.builder()
                .offerId(offerId)
                .sourceDocument(firstNonBlank(meta.fileName(), meta.documentId()).orElse("unknown"))
                .insured(insured)
                .baseContracts(baseContracts)
                .additionalContracts(additionalContracts)
                .discounts(discounts)
                .totalPremiumBeforeDiscounts(before)
                .totalPremiumAfterDiscounts(after)
                .assistance(assistance)
                .duration(duration)
                .notes(notes)
                .missingFields(missing)
                .extractionConfidence(confidence)
                .build();

        List<SectionSource> sources = secs.stream()
                .filter(ParsedSection::isIdentified)
                .map(s -> SectionSource.of(s, FIELD_BY_SECTION.get(s.type())))
                .toList();

        String allContent = secs.stream().map(ParsedSection::content).collect(Collectors.joining("\n"));
        ProductTypeHeuristic productType = classifier.inferProductType(allContent, ProductTypeHeuristic.Source.BUILDER);

        log.info("[UnifiedOfferBuilder] offerId={} confidence={} missing={} sections={}",
                offerId.orElse("-"), confidence, missing.size(), secs.size());
        return new UnifiedOfferBuildResult(offer, sources, productType);
    }

    private List<UnifiedOffer.InsuredPerson> buildInsured(JsonNode ai, List<String> missing) {
        JsonNode array = ai.path("insured");
        List<UnifiedOffer.InsuredPerson> out = new ArrayList<>();

        if (!array.isArray() || array.isEmpty()) {
            missing.add(FIELD_INSURED);
            out.add(new UnifiedOffer.InsuredPerson(Optional.empty(), OptionalDouble.empty(), DEFAULT_ROLE, List.of()));
            return out;
        }

        for (int i = 0; i < array.size(); i++) {
            JsonNode raw = array.get(i);
            String prefix = "insured[" + i + "]";

            Optional<String> name = JsonValues.firstText(raw, "name", "full_name", "fullName");
            if (name.isEmpty()) missing.add(prefix + ".name");

            OptionalDouble age = NumberValues.parseOptional(raw.path("age"));
            if (age.isEmpty()) missing.add(prefix + ".age");

            String role = JsonValues.firstText(raw, "role").orElse(DEFAULT_ROLE);

            List<UnifiedOffer.Plan> plans = new ArrayList<>();
            JsonNode rawPlans = raw.path("plans");
            if (rawPlans.isArray() && !rawPlans.isEmpty()) {
                for (int j = 0; j < rawPlans.size(); j++) {
                    plans.add(buildPlan(rawPlans.get(j), prefix + ".plans[" + j + "]", missing));
                }
            } else {
                missing.add(prefix + ".plans");
            }

            out.add(new UnifiedOffer.InsuredPerson(name, age, role, plans));
        }
        return out;
    }

    private static UnifiedOffer.Plan buildPlan(JsonNode raw, String prefix, List<String> missing) {
        OptionalDouble sum = NumberValues.parseOptional(firstPresent(raw, "sum", "sum_insured"));
        if (sum.isEmpty()) missing.add(prefix + ".sum");

        OptionalDouble premium = NumberValues.parseOptional(raw.path("premium"));
        if (premium.isEmpty()) missing.add(prefix + ".premium");

        Optional<String> duration = JsonValues.firstText(raw, "duration");
        if (duration.isEmpty()) missing.add(prefix + ".duration");

        return new UnifiedOffer.Plan(
                JsonValues.firstText(raw, "type", "name").orElse(DEFAULT_PLAN_TYPE),
                sum,
                premium,
                JsonValues.firstText(raw, "variant").orElse(DEFAULT_VARIANT),
                duration);
    }

    private static List<UnifiedOffer.BaseContract> buildBaseContracts(JsonNode ai, List<String> missing) {
        JsonNode array = JsonValues.firstArray(ai, "base_contracts", "baseContracts").orElse(MissingNode.getInstance());
        List<UnifiedOffer.BaseContract> out = new ArrayList<>();
        for (int i = 0; i < array.size(); i++) {
            JsonNode raw = array.get(i);
            if (!raw.isObject()) continue;
            String prefix = "base_contracts[" + i + "]";

            OptionalDouble sum = NumberValues.parseOptional(firstPresent(raw, "sum", "sum_insured"));
            if (sum.isEmpty()) missing.add(prefix + ".sum");
            OptionalDouble premium = NumberValues.parseOptional(raw.path("premium"));
            if (premium.isEmpty()) missing.add(prefix + ".premium");

            out.add(new UnifiedOffer.BaseContract(
                    JsonValues.firstText(raw, "name").orElse(DEFAULT_BASE_CONTRACT_NAME),
                    sum,
                    premium,
                    JsonValues.firstText(raw, "variant").orElse(DEFAULT_VARIANT)));
        }
        return out;
    }

    private static List<UnifiedOffer.AdditionalContract> buildAdditionalContracts(JsonNode ai, List<String> missing) {
        JsonNode array = JsonValues.firstArray(ai, "additional_contracts", "additionalContracts").orElse(MissingNode.getInstance());
        List<UnifiedOffer.AdditionalContract> out = new ArrayList<>();
        for (int i = 0; i < array.size(); i++) {
            JsonNode raw = array.get(i);
            if (!raw.isObject()) continue;
            String prefix = "additional_contracts[" + i + "]";

            Optional<String> coverage = JsonValues.firstText(raw, "coverage");
            if (coverage.isEmpty()) missing.add(prefix + ".coverage");
            OptionalDouble premium = NumberValues.parseOptional(raw.path("premium"));
            if (premium.isEmpty()) missing.add(prefix + ".premium");

            out.add(new UnifiedOffer.AdditionalContract(
                    JsonValues.firstText(raw, "name").orElse(DEFAULT_ADDITIONAL_CONTRACT_NAME),
                    coverage,
                    premium));
        }
        return out;
    }

    static List<String> buildDiscounts(JsonNode ai, List<ParsedSection> sections) {
        Set<String> out = new LinkedHashSet<>(JsonValues.strings(ai.path("discounts")));
        for (ParsedSection s : sections) {
            if (s.type() != SectionType.DISCOUNT) continue;
            Matcher m = DISCOUNT.matcher(s.content());
            while (m.find()) {
                String d = m.group(1).trim();
                if (!d.isEmpty()) out.add(d);
            }
        }
        return new ArrayList<>(out);
    }

    static OptionalDouble premiumFromSections(List<ParsedSection> sections) {
        for (ParsedSection s : sections) {
            if (s.type() != SectionType.PREMIUM) continue;
            Matcher m = PREMIUM_TOTAL.matcher(s.content());
            while (m.find()) {
                OptionalDouble v = NumberValues.parseOptional(m.group(1).trim());
                if (v.isPresent()) return v;
            }
        }
        return OptionalDouble.empty();
    }

    private static List<UnifiedOffer.Assistance> buildAssistance(JsonNode ai) {
        List<UnifiedOffer.Assistance> out = new ArrayList<>();
        for (JsonNode raw : ai.path("assistance")) {
            if (raw.isTextual() && !raw.asText().isBlank()) {
                out.add(new UnifiedOffer.Assistance(raw.asText().trim(), DEFAULT_ASSISTANCE_COVERAGE, DEFAULT_ASSISTANCE_LIMITS));
            } else if (raw.isObject()) {
                JsonValues.firstText(raw, "name").ifPresent(name -> out.add(new UnifiedOffer.Assistance(
                        name,
                        JsonValues.firstText(raw, "coverage").orElse(DEFAULT_ASSISTANCE_COVERAGE),
                        JsonValues.firstText(raw, "limits").orElse(DEFAULT_ASSISTANCE_LIMITS))));
            }
        }
        return out;
    }

    private static UnifiedOffer.OfferDuration buildDuration(JsonNode ai, List<ParsedSection> sections, List<String> missing) {
        Optional<String> start = JsonValues.firstText(ai, "valid_from", "validFrom", "duration.start");
        Optional<String> end = JsonValues.firstText(ai, "valid_to", "validTo", "duration.end");

        if (start.isEmpty() || end.isEmpty()) {
            for (ParsedSection s : sections) {
                if (s.type() != SectionType.DURATION) continue;
                Matcher m = PERIOD.matcher(s.content());
                if (m.find()) {
                    if (start.isEmpty()) start = Optional.of(m.group(1));
                    if (end.isEmpty()) end = Optional.of(m.group(2));
                    break;
                }
            }
        }

        if (start.isEmpty()) missing.add("duration.start");
        if (end.isEmpty()) missing.add("duration.end");
        String variant = JsonValues.firstText(ai, "duration.variant").orElse(DEFAULT_DURATION_VARIANT);
        return new UnifiedOffer.OfferDuration(start, end, variant);
    }

    static ExtractionConfidence grade(List<String> missing, double identifiedRatio) {
        if (missing.contains(FIELD_PREMIUM_AFTER) || missing.contains(FIELD_INSURED)) return ExtractionConfidence.LOW;
        if (missing.size() > 3) return ExtractionConfidence.MEDIUM;
        if (identifiedRatio > 0.7 && missing.isEmpty()) return ExtractionConfidence.HIGH;
        if (identifiedRatio > 0.5) return ExtractionConfidence.MEDIUM;
        return ExtractionConfidence.LOW;
    }

    private static JsonNode firstPresent(JsonNode root, String... paths) {
        for (String p : paths) {
            JsonNode n = JsonValues.at(root, p);
            if (JsonValues.isPresent(n)) return n;
        }
        return MissingNode.getInstance();
    }

    private static Optional<String> firstNonBlank(String... values) {
        for (String v : values) {
            String t = Texts.trimToNull(v);
            if (t != null) return Optional.of(t);
        }
        return Optional.empty();
    }
}
