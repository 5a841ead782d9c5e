package com.intelhub.backend.query;

import com.intelhub.backend.model.dto.IntelligenceDocument;
import com.intelhub.backend.model.dto.IntelligenceQuery;
import com.intelhub.backend.model.dto.QueryResult;
import jakarta.validation.constraints.Min;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@Validated
@RestController
@RequestMapping("/api/intelligences")
@RequiredArgsConstructor
public class IntelligenceQueryController {

    private final IntelligenceQueryService queryService;

    /**
     * Query archived intelligence. List parameters match any value within a field and all fields
     * together.
     */
    @GetMapping("/query")
    public ResponseEntity<QueryResult> query(
            @RequestParam(name = "search_mode", defaultValue = "mongo") String searchMode,
            @RequestParam(defaultValue = "1") @Min(1) int page,
            @RequestParam(name = "per_page", defaultValue = "10") @Min(1) int perPage,
            @RequestParam(required = false) String keywords,
            @RequestParam(name = "start_time", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime startTime,
            @RequestParam(name = "end_time", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime endTime,
            @RequestParam(required = false) Double threshold,
            @RequestParam(required = false) List<String> peoples,
            @RequestParam(required = false) List<String> locations,
            @RequestParam(required = false) List<String> organizations,
            @RequestParam(name = "in_summary", defaultValue = "true") boolean inSummary,
            @RequestParam(name = "in_fulltext", defaultValue = "false") boolean inFulltext,
            @RequestParam(name = "score_threshold", defaultValue = "0.5") double scoreThreshold,
            @RequestParam(required = false) UUID reference) {

        IntelligenceQuery query = IntelligenceQuery.builder()
                .searchMode(IntelligenceQuery.SearchMode.from(searchMode))
                .page(page)
                .perPage(perPage)
                .keywords(keywords)
                .startTime(startTime)
                .endTime(endTime)
                .threshold(threshold)
                .peoples(peoples != null ? peoples : List.of())
                .locations(locations != null ? locations : List.of())
                .organizations(organizations != null ? organizations : List.of())
                .inSummary(inSummary)
                .inFulltext(inFulltext)
                .scoreThreshold(scoreThreshold)
                .reference(reference)
                .build();
        return ResponseEntity.ok(queryService.query(query));
    }

    @PostMapping("/query")
    public ResponseEntity<QueryResult> queryByBody(@RequestBody IntelligenceQuery query) {
        return ResponseEntity.ok(queryService.query(query));
    }

    @GetMapping("/{uuid}")
    public ResponseEntity<IntelligenceDocument> get(@PathVariable UUID uuid) {
        return ResponseEntity.ok(queryService.get(uuid));
    }
}
