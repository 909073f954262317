package com.pennywise_sync.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record UploadResponse(
        @JsonProperty("import_log_id") Long importLogId,
        @JsonProperty("filename") String filename,
        @JsonProperty("status") String status
) {}
