package com.example.vulncases.http;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record TestCaseResponse(
        @JsonProperty("_id") String documentId,
        @JsonProperty("vuln_id") String vulnId,
        @JsonProperty("vuln_name") String vulnName,
        @JsonProperty("platform") String platform,
        @JsonProperty("analysis_type") String analysisType,
        @JsonProperty("owasp_ref") String owaspRef,
        @JsonProperty("compliance") String compliance,
        @JsonProperty("vuln_abstract") String vulnAbstract,
        @JsonProperty("description") String description,
        @JsonProperty("recommendation") String recommendation,
        @JsonProperty("example") String example,
        @JsonProperty("cvss_score") Double cvssScore,
        @JsonProperty("Automated") Boolean automated
) {}
