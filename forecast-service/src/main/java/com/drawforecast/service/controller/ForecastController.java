package com.drawforecast.service.controller;

import com.drawforecast.service.dto.ForecastStatsDTO;
import com.drawforecast.service.dto.NotReadyDTO;
import com.drawforecast.service.ledger.TrackedPrediction;
import com.drawforecast.service.service.ForecastService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.List;

@RestController
@RequestMapping("/api/v1/forecast")
public class ForecastController {

    static final int MAX_HISTORY = 500;

    private final ForecastService forecastService;

    public ForecastController(ForecastService forecastService) {
        this.forecastService = forecastService;
    }

    /** Decision for the next period, or 503 while the buffer is below the minimum. */
    @GetMapping("/next")
    public Mono<ResponseEntity<Object>> next() {
        return forecastService.next().map(result -> result.isReady()
            ? ResponseEntity.<Object>ok(result.decision())
            : ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .<Object>body(NotReadyDTO.of(result.bufferedRecords(), result.requiredRecords())));
    }

    @GetMapping("/stats")
    public ResponseEntity<ForecastStatsDTO> stats() {
        return ResponseEntity.ok(forecastService.stats());
    }

    @GetMapping("/history")
    public ResponseEntity<List<TrackedPrediction>> history(@RequestParam(defaultValue = "50") int limit) {
        return ResponseEntity.ok(forecastService.history(Math.min(limit, MAX_HISTORY)));
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }
}
