package com.intelhub.backend.transfer;

import com.intelhub.backend.db.entity.Partition;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Bulk export and import of the cached, archived and low_value collections.
 */
@Slf4j
@RestController
@RequestMapping("/api/maintenance")
@RequiredArgsConstructor
public class MaintenanceController {

    private final IntelligenceTransferService transferService;

    @GetMapping("/export")
    public void export(@RequestParam String collection,
                       @RequestParam(defaultValue = "jsonl") String format,
                       HttpServletResponse response) throws IOException {
        Partition partition = Partition.fromCollectionName(collection);
        TransferFormat transferFormat = TransferFormat.from(format);

        response.setContentType(transferFormat == TransferFormat.JSONL
                ? "application/x-ndjson"
                : MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding("UTF-8");
        response.setHeader(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\""
                + partition.getCollectionName() + (transferFormat == TransferFormat.JSONL ? ".jsonl" : ".json") + "\"");

        transferService.export(partition, transferFormat, response.getOutputStream());
    }

    @PostMapping("/import")
    public ResponseEntity<ImportResult> importDocuments(@RequestParam String collection,
                                                        @RequestParam(defaultValue = "jsonl") String format,
                                                        HttpServletRequest request) throws IOException {
        Partition partition = Partition.fromCollectionName(collection);
        TransferFormat transferFormat = TransferFormat.from(format);
        log.info("📥 Import requested into {} ({})", partition.getCollectionName(), transferFormat);
        return ResponseEntity.ok(transferService.importDocuments(partition, transferFormat, request.getInputStream()));
    }
}
