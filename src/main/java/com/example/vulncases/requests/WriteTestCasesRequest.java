package com.example.vulncases.requests;

import com.example.vulncases.service.TestCaseException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Service-layer command built from a POST or PUT body. Accepts a single object, an object
 * wrapping a {@code test_cases} array, or a bare array. Elements stay untyped here; the
 * validator decides whether each one is acceptable.
 */
public record WriteTestCasesRequest(List<Object> items, boolean batch) {

    public static final String TEST_CASES = "test_cases";

    public WriteTestCasesRequest {
        Objects.requireNonNull(items, "items");
        // JSON null elements are kept so the validator can report them by index
        items = Collections.unmodifiableList(new ArrayList<>(items));
    }

    /**
     * @param mapper converts each element into plain maps, lists and scalars for validation
     */
    public static WriteTestCasesRequest fromBody(JsonNode body, ObjectMapper mapper) {
        if (body == null || body.isNull() || body.isMissingNode()) {
            throw TestCaseException.invalidPayload("Invalid or missing JSON");
        }
        if (body.isObject() && body.path(TEST_CASES).isArray()) {
            return new WriteTestCasesRequest(elements(body.get(TEST_CASES), mapper), true);
        }
        if (body.isArray()) {
            return new WriteTestCasesRequest(elements(body, mapper), true);
        }
        if (body.isObject()) {
            return new WriteTestCasesRequest(List.of(toPlain(body, mapper)), false);
        }
        throw TestCaseException.invalidPayload("Payload must be an object or array");
    }

    private static List<Object> elements(JsonNode array, ObjectMapper mapper) {
        List<Object> items = new ArrayList<>(array.size());
        array.forEach(node -> items.add(toPlain(node, mapper)));
        return items;
    }

    private static Object toPlain(JsonNode node, ObjectMapper mapper) {
        return mapper.convertValue(node, Object.class);
    }
}
