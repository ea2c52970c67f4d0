package com.example.vulncases.http;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Result of a POST. {@code vuln_id} is only present when exactly one test case was inserted.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record InsertResponse(
        @JsonProperty("inserted") int inserted,
        @JsonProperty("vuln_id") String vulnId
) {}
