package com.example.vulncases.requests;

import com.example.vulncases.service.TestCaseException;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Keys to delete, extracted from a DELETE body. Recognised shapes: {@code {"vuln_id": ...}},
 * {@code {"vuln_ids": [...]}}, {@code {"test_cases": [{"vuln_id": ...}]}} and a bare array of
 * ids or objects carrying {@code vuln_id}.
 */
public record DeleteTestCasesRequest(List<String> vulnIds) {

    private static final String VULN_ID = "vuln_id";
    private static final String VULN_IDS = "vuln_ids";

    public DeleteTestCasesRequest {
        Objects.requireNonNull(vulnIds, "vulnIds");
        if (vulnIds.isEmpty()) {
            throw TestCaseException.invalidPayload("No vuln_ids found to delete");
        }
        vulnIds = List.copyOf(vulnIds);
    }

    public static DeleteTestCasesRequest fromBody(JsonNode body) {
        if (body == null || body.isNull() || body.isMissingNode()) {
            throw TestCaseException.invalidPayload("Invalid or missing JSON");
        }
        List<String> ids = new ArrayList<>();
        if (body.isObject() && body.path(VULN_IDS).isArray()) {
            body.get(VULN_IDS).forEach(node -> ids.add(text(node)));
        } else if (body.isArray()) {
            body.forEach(node -> collect(node, ids));
        } else if (body.isObject() && body.path(WriteTestCasesRequest.TEST_CASES).isArray()) {
            body.get(WriteTestCasesRequest.TEST_CASES).forEach(node -> collect(node, ids));
        } else if (body.isObject() && body.has(VULN_ID)) {
            ids.add(text(body.get(VULN_ID)));
        } else {
            throw TestCaseException.invalidPayload("Provide vuln_ids list or test_cases array or vuln_id");
        }
        return new DeleteTestCasesRequest(ids);
    }

    private static void collect(JsonNode node, List<String> ids) {
        if (node.isTextual()) {
            ids.add(node.asText());
        } else if (node.isObject() && node.has(VULN_ID)) {
            ids.add(text(node.get(VULN_ID)));
        }
    }

    private static String text(JsonNode node) {
        if (!node.isTextual()) {
            throw TestCaseException.invalidPayload("vuln_id values must be strings");
        }
        return node.asText();
    }
}
