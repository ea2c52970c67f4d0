package com.example.vulncases.http;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

public record TestCaseListResponse(
        @JsonProperty("test_cases") List<TestCaseResponse> testCases
) {}
