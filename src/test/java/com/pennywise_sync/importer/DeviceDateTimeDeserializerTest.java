package com.pennywise_sync.importer;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.module.SimpleModule;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;

class DeviceDateTimeDeserializerTest {

    private final ObjectMapper mapper = new ObjectMapper()
            .registerModule(new SimpleModule().addDeserializer(LocalDateTime.class, new DeviceDateTimeDeserializer()));

    private LocalDateTime read(String json) throws Exception {
        return mapper.readValue(json, LocalDateTime.class);
    }

    @Test
    @DisplayName("Accepts the formats the app writes")
    void deviceFormats() throws Exception {
        LocalDateTime expected = LocalDateTime.of(2024, 3, 1, 10, 15, 30);

        assertThat(read("\"2024-03-01T10:15:30\"")).isEqualTo(expected);
        assertThat(read("\"2024-03-01 10:15:30\"")).isEqualTo(expected);
        assertThat(read("\"2024-03-01\"")).isEqualTo(LocalDateTime.of(2024, 3, 1, 0, 0));
        assertThat(read("1709288130000")).isEqualTo(expected);
    }

    @Test
    @DisplayName("Offsets are normalised to UTC")
    void offsets() throws Exception {
        assertThat(read("\"2024-03-01T15:45:30+05:30\"")).isEqualTo(LocalDateTime.of(2024, 3, 1, 10, 15, 30));
        assertThat(read("\"2024-03-01T10:15:30Z\"")).isEqualTo(LocalDateTime.of(2024, 3, 1, 10, 15, 30));
    }

    @Test
    @DisplayName("Blank text means no value")
    void blank() throws Exception {
        assertThat(read("\"  \"")).isNull();
    }
}
