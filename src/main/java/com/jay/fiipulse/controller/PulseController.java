package com.jay.fiipulse.controller;

import com.jay.fiipulse.layer1_data.TradingCalendar;
import com.jay.fiipulse.layer3_signal.PulsePipelineService;
import com.jay.fiipulse.model.DealFetchResult;
import com.jay.fiipulse.model.PulseReport;
import com.jay.fiipulse.model.TradingWindow;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API — read-only view of the pulse run.
 *
 * Endpoints:
 *   GET /api/pulse/report   — latest report; runs the pipeline first if none exists or refresh=true
 *   GET /api/pulse/window   — current bulk/block disclosure window
 *   GET /api/pulse/deals    — raw deals and source label behind the latest report
 */
@RestController
@RequestMapping("/api/pulse")
@RequiredArgsConstructor
public class PulseController {

    private final PulsePipelineService pipeline;
    private final TradingCalendar calendar;

    // ── GET /api/pulse/report ──────────────────────────────────────────────────

    @GetMapping("/report")
    public ResponseEntity<PulseReport> report(@RequestParam(defaultValue = "false") boolean refresh) {
        PulseReport report = refresh
            ? pipeline.run()
            : pipeline.latest().orElseGet(pipeline::run);
        return ResponseEntity.ok(report);
    }

    // ── GET /api/pulse/window ──────────────────────────────────────────────────

    @GetMapping("/window")
    public ResponseEntity<TradingWindow> window() {
        return ResponseEntity.of(calendar.currentWindow());
    }

    // ── GET /api/pulse/deals ───────────────────────────────────────────────────

    @GetMapping("/deals")
    public ResponseEntity<DealFetchResult> deals() {
        return ResponseEntity.of(pipeline.latestDeals());
    }
}
