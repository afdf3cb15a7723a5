package com.chicu.candlecollector.web.controller.api;

import com.chicu.candlecollector.engine.JobStatus;
import com.chicu.candlecollector.engine.TriggerResult;
import com.chicu.candlecollector.market.store.CollectionStats;
import com.chicu.candlecollector.service.DataCollectionService;
import com.chicu.candlecollector.web.dto.ApiResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * HTTP-обёртка над DataCollectionService. Логики здесь нет.
 */
@Slf4j
@RestController
@RequestMapping(value = "/api/collection", produces = MediaType.APPLICATION_JSON_VALUE)
@RequiredArgsConstructor
public class DataCollectionApiController {

    private final DataCollectionService service;

    // =====================================================================
    // РУЧНОЙ ЗАПУСК
    // =====================================================================

    @PostMapping("/current")
    public ResponseEntity<ApiResponse> triggerCurrent() {
        return toResponse(service.triggerCurrentCollection(), "Current candles collection");
    }

    @PostMapping("/historical")
    public ResponseEntity<ApiResponse> triggerHistorical() {
        return toResponse(service.triggerHistoricalCollection(), "Historical candles collection");
    }

    private static ResponseEntity<ApiResponse> toResponse(TriggerResult result, String what) {
        if (result == TriggerResult.ACCEPTED) {
            return ResponseEntity.status(HttpStatus.ACCEPTED).body(ApiResponse.accepted(what + " triggered"));
        }
        return ResponseEntity.status(HttpStatus.CONFLICT).body(ApiResponse.rejected(what + " is already running"));
    }

    // =====================================================================
    // СТАТУС
    // =====================================================================

    @GetMapping("/status")
    public Map<String, Object> status() {
        DataCollectionService.SchedulerStatus st = service.getJobStatus();

        List<Map<String, Object>> jobs = new ArrayList<>();
        for (JobStatus j : st.jobs()) {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("name", j.name());
            m.put("state", j.state().name());
            m.put("next_run", j.nextRunAt());
            m.put("last_run", j.lastRunAt());
            m.put("last_error", j.lastError());
            m.put("last_summary", j.lastSummary());
            jobs.add(m);
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", st.running() ? "running" : "stopped");
        body.put("jobs", jobs);
        return body;
    }

    @GetMapping("/stats")
    public Map<String, Object> stats() {
        CollectionStats s = service.getCollectionStats();

        List<Map<String, Object>> latest = new ArrayList<>();
        s.latestUpdatePerExchange().forEach((exchange, at) -> {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("exchange", exchange);
            m.put("last_update", at);
            latest.add(m);
        });

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("total_candles", s.totalCandles());
        body.put("total_exchanges", s.totalExchanges());
        body.put("total_currency_pairs", s.totalPairs());
        body.put("total_time_periods", s.totalPeriods());
        body.put("latest_updates", latest);
        return body;
    }

    @GetMapping("/db-status")
    public ResponseEntity<Map<String, Object>> dbStatus() {
        DataCollectionService.DatabaseStatus db = service.checkDatabase();

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("database", db.connected() ? "connected" : "disconnected");
        body.put("status", db.connected() ? "healthy" : "error");
        if (!db.connected()) {
            body.put("error", db.error());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body);
        }
        return ResponseEntity.ok(body);
    }

    @GetMapping("/logs")
    public Map<String, Object> logs() {
        List<DataCollectionService.LogFileInfo> files = service.getLogFiles();

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "success");
        body.put("logs", files);
        body.put("total_files", files.size());
        return body;
    }
}
