package com.pennywise_sync.controller;

import com.pennywise_sync.support.StoreCleaner;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.AutoConfigureWebTestClient;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.MediaType;
import org.springframework.http.client.MultipartBodyBuilder;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.reactive.server.WebTestClient;
import org.springframework.web.reactive.function.BodyInserters;

import java.nio.charset.StandardCharsets;

@SpringBootTest
@AutoConfigureWebTestClient
@ActiveProfiles("test")
@DisplayName("Backup upload HTTP surface")
class BackupControllerTest {

    private static final String BACKUP = """
            {
              "_format": "pennywise_backup_v1",
              "_created": "2024-03-02T09:00:00Z",
              "database": {
                "categories": [{"id": 1, "name": "Food"}],
                "transactions": [{"transaction_hash": "h1", "amount": 120.5, "category": "Food",
                                  "transaction_type": "EXPENSE", "date_time": "2024-03-01T10:00:00"}]
              },
              "preferences": {"currency": "INR"}
            }
            """;

    @Autowired
    private WebTestClient webTestClient;
    @Autowired
    private DatabaseClient databaseClient;

    @BeforeEach
    void setUp() {
        StoreCleaner.clean(databaseClient);
    }

    private WebTestClient.ResponseSpec upload(String filename, String content) {
        MultipartBodyBuilder builder = new MultipartBodyBuilder();
        builder.part("file", new ByteArrayResource(content.getBytes(StandardCharsets.UTF_8)))
                .filename(filename)
                .contentType(MediaType.APPLICATION_JSON);
        return webTestClient.post().uri("/api/v1/upload")
                .contentType(MediaType.MULTIPART_FORM_DATA)
                .body(BodyInserters.fromMultipartData(builder.build()))
                .exchange();
    }

    @Test
    @DisplayName("A valid backup is imported and its run is listed")
    void uploadBackup() {
        upload("pennywise-2024-03-02.json", BACKUP)
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.success").isEqualTo(true)
                .jsonPath("$.data.status").isEqualTo("COMPLETED")
                .jsonPath("$.data.filename").isEqualTo("pennywise-2024-03-02.json");

        webTestClient.get().uri("/api/v1/imports")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.data.length()").isEqualTo(1)
                .jsonPath("$.data[0].status").isEqualTo("COMPLETED");

        webTestClient.get().uri("/api/v1/budget/buckets")
                .exchange()
                .expectBody()
                .jsonPath("$.data[0].name").isEqualTo("Food")
                .jsonPath("$.data[0].balance").isEqualTo(-120.5);
    }

    @Test
    @DisplayName("Only .json files are accepted")
    void rejectsOtherExtensions() {
        upload("backup.txt", BACKUP)
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("Only .json backup files are accepted");
    }

    @Test
    @DisplayName("Malformed JSON is a 400 and no import is recorded")
    void rejectsInvalidJson() {
        upload("backup.json", "{\"database\": ")
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("Invalid JSON file");

        webTestClient.get().uri("/api/v1/imports")
                .exchange()
                .expectBody()
                .jsonPath("$.data.length()").isEqualTo(0);
    }

    @Test
    @DisplayName("Rows of an unknown import are a 404")
    void unknownImport() {
        webTestClient.get().uri("/api/v1/imports/{id}/rows", 999)
                .exchange()
                .expectStatus().isNotFound();
    }
}
