package com.pennywise_sync.backup.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

public record MetadataSnapshot(
        @JsonProperty("export_id") String exportId,
        @JsonProperty("app_version") String appVersion,
        @JsonProperty("database_version") Integer databaseVersion,
        @JsonProperty("device") String device,
        @JsonProperty("android_version") Integer androidVersion,
        @JsonProperty("statistics") JsonNode statistics
) {}
