package com.platform.drengine.api;

import com.platform.drengine.recoverytest.RecoveryTest;
import com.platform.drengine.recoverytest.RecoveryTestRunner;
import com.platform.drengine.recoverytest.ScheduleTestRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * REST API for recovery tests.
 */
@Slf4j
@RestController
@RequestMapping("/api/recovery-tests")
@RequiredArgsConstructor
@CrossOrigin(origins = "${drengine.api.allowed-origins:*}")
public class RecoveryTestController {
    
    private final RecoveryTestRunner runner;
    
    @PostMapping
    public ResponseEntity<Map<String, UUID>> schedule(@Valid @RequestBody ScheduleTestRequest request) {
        log.info("API: Schedule {} recovery test in {}", request.scenario(), request.environment());
        UUID testId = runner.scheduleTest(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of("testId", testId));
    }
    
    /**
     * Run a scheduled test synchronously and return its final state.
     */
    @PostMapping("/{testId}/run")
    public RecoveryTest run(@PathVariable UUID testId) {
        log.info("API: Run recovery test {}", testId);
        return runner.runTest(testId);
    }
    
    @GetMapping("/{testId}")
    public RecoveryTest getTest(@PathVariable UUID testId) {
        return runner.test(testId);
    }
    
    @GetMapping
    public List<RecoveryTest> listTests(@RequestParam(required = false) String scope) {
        return runner.listTests(scope);
    }
}
