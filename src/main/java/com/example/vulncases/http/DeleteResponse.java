package com.example.vulncases.http;

import com.fasterxml.jackson.annotation.JsonProperty;

public record DeleteResponse(
        @JsonProperty("deleted_count") int deletedCount
) {}
