package com.example.vulncases.http;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

public record UpdateResponse(
        @JsonProperty("updated") int updated,
        @JsonProperty("not_found") List<String> notFound
) {}
