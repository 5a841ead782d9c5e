package com.intelhub.backend.rating;

import com.intelhub.backend.model.dto.ManualRatingRequest;
import jakarta.validation.Valid;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@RestController
@RequestMapping("/api/intelligences")
@RequiredArgsConstructor
public class ManualRatingController {

    private final ManualRatingService manualRatingService;

    /**
     * Submit human ratings for an archived item
     */
    @PostMapping("/manual-rate")
    public ResponseEntity<Map<String, Object>> manualRate(@Valid @RequestBody ManualRatingRequest request) {
        Map<String, Double> ratings = manualRatingService.submit(request);
        return ResponseEntity.ok(Map.of(
                "success", true,
                "uuid", request.getUuid(),
                "manual_rating", ratings
        ));
    }
}
