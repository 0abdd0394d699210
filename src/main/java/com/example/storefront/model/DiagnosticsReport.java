package com.example.storefront.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

import java.util.List;

@Builder
public record DiagnosticsReport(
    String backend,
    String database,
    @JsonProperty("database_url") String databaseUrl,
    @JsonProperty("database_name") String databaseName,
    @JsonProperty("connection_status") String connectionStatus,
    List<String> collections
) {
}
