package com.platform.drengine.api;

import com.platform.drengine.history.DrHistoryService;
import com.platform.drengine.history.HistorySummary;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;
import java.time.Instant;

/**
 * Read-only history for compliance reporting.
 */
@RestController
@RequestMapping("/api/history")
@RequiredArgsConstructor
@CrossOrigin(origins = "${drengine.api.allowed-origins:*}")
public class HistoryController {
    
    private final DrHistoryService historyService;
    
    /**
     * Summary over {@code [from, to)}; defaults to the last 30 days across all scopes.
     */
    @GetMapping
    public HistorySummary summary(
            @RequestParam(required = false) String scope,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to) {
        Instant end = to != null ? to : Instant.now();
        Instant start = from != null ? from : end.minus(Duration.ofDays(30));
        return historyService.summary(scope, start, end);
    }
}
