package com.pennywise_sync.backup.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Root of the JSON export written by the PennyWise app.
 */
public record PennyWiseBackup(
        @JsonProperty("_format") String format,
        @JsonProperty("_warning") String warning,
        @JsonProperty("_created") String created,
        MetadataSnapshot metadata,
        DatabaseSnapshot database,     // absent when the export carried no data
        PreferencesSnapshot preferences
) {}
