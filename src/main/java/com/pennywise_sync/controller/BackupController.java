package com.pennywise_sync.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pennywise_sync.backup.dto.PennyWiseBackup;
import com.pennywise_sync.dto.ApiResponse;
import com.pennywise_sync.dto.UploadResponse;
import com.pennywise_sync.exception.BadRequestException;
import com.pennywise_sync.model.ImportLog;
import com.pennywise_sync.model.ImportRowLog;
import com.pennywise_sync.service.AuditQueryService;
import com.pennywise_sync.service.BackupImportService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.multipart.FilePart;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.util.List;
import java.util.Locale;

@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1")
public class BackupController {

    private final BackupImportService backupImportService;

    private final AuditQueryService auditQueryService;

    private final ObjectMapper objectMapper;

    @PostMapping(value = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public Mono<ResponseEntity<ApiResponse<UploadResponse>>> upload(@RequestPart("file") FilePart file) {
        String filename = file.filename();
        if (filename == null || !filename.toLowerCase(Locale.ROOT).endsWith(".json")) {
            return Mono.error(new BadRequestException("Only .json backup files are accepted"));
        }
        return DataBufferUtils.join(file.content())
                .map(BackupController::drain)
                .switchIfEmpty(Mono.error(() -> new BadRequestException("Uploaded file is empty")))
                .map(this::parse)
                .flatMap(backup -> backupImportService.processBackup(backup, filename))
                .map(importLog -> ResponseEntity.ok(ApiResponse.ok(new UploadResponse(
                        importLog.getId(), importLog.getFilename(), importLog.getStatus().name()))));
    }

    @GetMapping("/imports")
    public Mono<ResponseEntity<ApiResponse<List<ImportLog>>>> imports(
            @RequestParam(name = "limit", required = false) Integer limit) {
        return auditQueryService.listImportLogs(limit)
                .collectList()
                .map(logs -> ResponseEntity.ok(ApiResponse.ok(logs)));
    }

    @GetMapping("/imports/{id}/rows")
    public Mono<ResponseEntity<ApiResponse<List<ImportRowLog>>>> importRows(@PathVariable("id") Long importLogId) {
        return auditQueryService.listImportRows(importLogId)
                .collectList()
                .map(rows -> ResponseEntity.ok(ApiResponse.ok(rows)));
    }

    private PennyWiseBackup parse(byte[] content) {
        try {
            PennyWiseBackup backup = objectMapper.readValue(content, PennyWiseBackup.class);
            if (backup == null) {
                throw new BadRequestException("Invalid JSON file: empty document");
            }
            return backup;
        } catch (IOException e) {
            log.warn("Rejected backup upload: {}", e.getMessage());
            throw new BadRequestException("Invalid JSON file", e);
        }
    }

    private static byte[] drain(DataBuffer buffer) {
        try {
            byte[] bytes = new byte[buffer.readableByteCount()];
            buffer.read(bytes);
            return bytes;
        } finally {
            DataBufferUtils.release(buffer);
        }
    }
}
