package com.pennywise_sync.backup.dto;

import com.fasterxml.jackson.databind.JsonNode;

// Carried for completeness; preferences are not persisted
public record PreferencesSnapshot(
        JsonNode theme,
        JsonNode sms,
        JsonNode developer,
        JsonNode app
) {}
