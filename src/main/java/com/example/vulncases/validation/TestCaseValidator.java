package com.example.vulncases.validation;

import com.example.vulncases.models.Platform;
import com.example.vulncases.models.TestCase;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import org.springframework.stereotype.Component;

/**
 * Checks raw test-case payloads field by field and normalizes the accepted representations
 * ({@code platform} casing, yes/no for {@code Automated}, numeric strings for
 * {@code cvss_score}). Errors are accumulated so a caller sees every problem at once.
 *
 * <p>Unknown fields are rejected rather than dropped, including the store-assigned {@code _id}.
 */
@Component
public class TestCaseValidator {

    public static final String VULN_ID = "vuln_id";
    public static final String VULN_NAME = "vuln_name";
    public static final String PLATFORM = "platform";
    public static final String ANALYSIS_TYPE = "analysis_type";
    public static final String OWASP_REF = "owasp_ref";
    public static final String COMPLIANCE = "compliance";
    public static final String VULN_ABSTRACT = "vuln_abstract";
    public static final String DESCRIPTION = "description";
    public static final String RECOMMENDATION = "recommendation";
    public static final String EXAMPLE = "example";
    public static final String CVSS_SCORE = "cvss_score";
    public static final String AUTOMATED = "Automated";

    /** Pseudo-field used when the element itself has the wrong shape. */
    public static final String SCHEMA = "_schema";

    static final String MISSING = "Missing data for required field.";
    static final String NULL_VALUE = "Field may not be null.";
    static final String BLANK = "Field may not be blank.";
    static final String NOT_STRING = "Not a valid string.";
    static final String NOT_NUMBER = "Not a valid number.";
    static final String UNKNOWN = "Unknown field.";
    static final String INVALID_TYPE = "Invalid input type.";
    static final String CVSS_RANGE = "cvss_score must be between 0.0 and 10.0";
    static final String AUTOMATED_VALUES = "Automated must be boolean or 'yes'/'no'";

    static final double CVSS_MIN = 0.0;
    static final double CVSS_MAX = 10.0;

    private static final List<String> KNOWN_FIELDS = List.of(
            VULN_ID, VULN_NAME, PLATFORM, ANALYSIS_TYPE, OWASP_REF, COMPLIANCE, VULN_ABSTRACT,
            DESCRIPTION, RECOMMENDATION, EXAMPLE, CVSS_SCORE, AUTOMATED);

    /**
     * Validates a full record for insertion: {@code vuln_id}, {@code vuln_name} and
     * {@code platform} must all be present.
     */
    public ValidationResult validate(Map<String, ?> raw) {
        return check(raw, true);
    }

    /**
     * Validates a partial update. Only {@code vuln_id} is required; every other supplied field
     * is checked with the same rules as on insert.
     */
    public ValidationResult validatePatch(Map<String, ?> raw) {
        return check(raw, false);
    }

    /**
     * Validates one element of a batch, which may not even be a JSON object.
     */
    public ValidationResult validateElement(Object element, boolean patch) {
        if (!(element instanceof Map<?, ?> map)) {
            return ValidationResult.invalid(List.of(new FieldError(SCHEMA, INVALID_TYPE)));
        }
        Map<String, Object> raw = new LinkedHashMap<>();
        map.forEach((key, value) -> raw.put(String.valueOf(key), value));
        return patch ? validatePatch(raw) : validate(raw);
    }

    public static String platformError() {
        return "platform must be one of " + Platform.canonicalValues();
    }

    private ValidationResult check(Map<String, ?> raw, boolean fullRecord) {
        Objects.requireNonNull(raw, "raw");
        List<FieldError> errors = new ArrayList<>();
        TestCase.TestCaseBuilder builder = TestCase.builder();

        nonBlankString(raw, VULN_ID, true, errors).ifPresent(builder::vulnId);
        nonBlankString(raw, VULN_NAME, fullRecord, errors).ifPresent(builder::vulnName);
        platform(raw, fullRecord, errors).ifPresent(p -> builder.platform(p.value()));

        optionalString(raw, ANALYSIS_TYPE, errors, builder::analysisType);
        optionalString(raw, OWASP_REF, errors, builder::owaspRef);
        optionalString(raw, COMPLIANCE, errors, builder::compliance);
        optionalString(raw, VULN_ABSTRACT, errors, builder::vulnAbstract);
        optionalString(raw, DESCRIPTION, errors, builder::description);
        optionalString(raw, RECOMMENDATION, errors, builder::recommendation);
        optionalString(raw, EXAMPLE, errors, builder::example);

        cvssScore(raw, errors).ifPresent(builder::cvssScore);
        automated(raw, errors).ifPresent(builder::automated);

        for (String key : raw.keySet()) {
            if (!KNOWN_FIELDS.contains(key)) {
                errors.add(new FieldError(key, UNKNOWN));
            }
        }

        return errors.isEmpty()
                ? ValidationResult.valid(builder.build())
                : ValidationResult.invalid(errors);
    }

    // ----- per-field checks -----

    private static Optional<Object> present(Map<String, ?> raw, String field, boolean required,
                                            List<FieldError> errors) {
        if (!raw.containsKey(field)) {
            if (required) {
                errors.add(new FieldError(field, MISSING));
            }
            return Optional.empty();
        }
        Object value = raw.get(field);
        if (value == null && required) {
            errors.add(new FieldError(field, NULL_VALUE));
        }
        return Optional.ofNullable(value);
    }

    private static Optional<String> string(Map<String, ?> raw, String field, boolean required,
                                           List<FieldError> errors) {
        Optional<Object> value = present(raw, field, required, errors);
        if (value.isEmpty()) {
            return Optional.empty();
        }
        if (!(value.get() instanceof String s)) {
            errors.add(new FieldError(field, NOT_STRING));
            return Optional.empty();
        }
        return Optional.of(s);
    }

    private static Optional<String> nonBlankString(Map<String, ?> raw, String field, boolean required,
                                                   List<FieldError> errors) {
        Optional<String> value = string(raw, field, required, errors);
        if (value.isPresent() && value.get().isBlank()) {
            errors.add(new FieldError(field, BLANK));
            return Optional.empty();
        }
        return value;
    }

    private static void optionalString(Map<String, ?> raw, String field, List<FieldError> errors,
                                       Consumer<String> sink) {
        string(raw, field, false, errors).ifPresent(sink);
    }

    private static Optional<Platform> platform(Map<String, ?> raw, boolean required, List<FieldError> errors) {
        Optional<String> value = string(raw, PLATFORM, required, errors);
        if (value.isEmpty()) {
            return Optional.empty();
        }
        Optional<Platform> platform = Platform.fromInput(value.get());
        if (platform.isEmpty()) {
            errors.add(new FieldError(PLATFORM, platformError()));
        }
        return platform;
    }

    private static Optional<Double> cvssScore(Map<String, ?> raw, List<FieldError> errors) {
        Optional<Object> value = present(raw, CVSS_SCORE, false, errors);
        if (value.isEmpty()) {
            return Optional.empty();
        }
        Double score = toDouble(value.get());
        if (score == null) {
            errors.add(new FieldError(CVSS_SCORE, NOT_NUMBER));
            return Optional.empty();
        }
        if (!(score >= CVSS_MIN && score <= CVSS_MAX)) {
            errors.add(new FieldError(CVSS_SCORE, CVSS_RANGE));
            return Optional.empty();
        }
        return Optional.of(score);
    }

    private static Double toDouble(Object value) {
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        if (value instanceof String s) {
            try {
                return new BigDecimal(s.trim()).doubleValue();
            } catch (NumberFormatException ex) {
                return null;
            }
        }
        return null;
    }

    private static Optional<Boolean> automated(Map<String, ?> raw, List<FieldError> errors) {
        Optional<Object> value = present(raw, AUTOMATED, false, errors);
        if (value.isEmpty()) {
            return Optional.empty();
        }
        if (value.get() instanceof Boolean b) {
            return Optional.of(b);
        }
        if (value.get() instanceof String s) {
            switch (s.trim().toLowerCase(Locale.ROOT)) {
                case "yes" -> {
                    return Optional.of(Boolean.TRUE);
                }
                case "no" -> {
                    return Optional.of(Boolean.FALSE);
                }
                default -> { }
            }
        }
        errors.add(new FieldError(AUTOMATED, AUTOMATED_VALUES));
        return Optional.empty();
    }
}
