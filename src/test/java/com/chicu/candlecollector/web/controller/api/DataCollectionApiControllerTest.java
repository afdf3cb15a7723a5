package com.chicu.candlecollector.web.controller.api;

import com.chicu.candlecollector.engine.JobState;
import com.chicu.candlecollector.engine.JobStatus;
import com.chicu.candlecollector.engine.TriggerResult;
import com.chicu.candlecollector.market.store.CollectionStats;
import com.chicu.candlecollector.service.DataCollectionService;
import com.chicu.candlecollector.web.dto.ApiResponse;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.ResponseEntity;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DataCollectionApiControllerTest {

    private static final Instant T = Instant.parse("2024-01-01T00:00:00Z");

    @Mock
    private DataCollectionService service;

    @InjectMocks
    private DataCollectionApiController controller;

    @Test
    void triggerCurrent_accepted_shouldAnswer202() {
        when(service.triggerCurrentCollection()).thenReturn(TriggerResult.ACCEPTED);

        ResponseEntity<ApiResponse> resp = controller.triggerCurrent();

        assertEquals(202, resp.getStatusCode().value());
        assertEquals("accepted", resp.getBody().getStatus());
    }

    @Test
    void triggerHistorical_running_shouldAnswer409() {
        when(service.triggerHistoricalCollection()).thenReturn(TriggerResult.REJECTED_ALREADY_RUNNING);

        ResponseEntity<ApiResponse> resp = controller.triggerHistorical();

        assertEquals(409, resp.getStatusCode().value());
        assertEquals("rejected", resp.getBody().getStatus());
        assertTrue(resp.getBody().getMessage().contains("already running"));
    }

    @Test
    void status_shouldRenderJobs() {
        JobStatus current = new JobStatus("current", JobState.RUNNING, T, null, T.plusSeconds(15), null, null);
        JobStatus historical = new JobStatus("historical", JobState.IDLE, null, T, T.plusSeconds(86400), "boom", "HISTORICAL: units=0");
        when(service.getJobStatus()).thenReturn(new DataCollectionService.SchedulerStatus(true, List.of(current, historical)));

        Map<String, Object> body = controller.status();

        assertEquals("running", body.get("status"));
        List<?> jobs = (List<?>) body.get("jobs");
        Map<?, ?> h = (Map<?, ?>) jobs.get(1);
        assertEquals("historical", h.get("name"));
        assertEquals("IDLE", h.get("state"));
        assertEquals("boom", h.get("last_error"));
        assertEquals(T.plusSeconds(86400), h.get("next_run"));
    }

    @Test
    void stats_shouldUseWireNames() {
        Map<String, Instant> latest = new LinkedHashMap<>();
        latest.put("Binance", T);
        when(service.getCollectionStats()).thenReturn(new CollectionStats(42, 4, 7, 3, latest));

        Map<String, Object> body = controller.stats();

        assertEquals(42L, body.get("total_candles"));
        assertEquals(4L, body.get("total_exchanges"));
        assertEquals(7L, body.get("total_currency_pairs"));
        assertEquals(3L, body.get("total_time_periods"));
        List<?> updates = (List<?>) body.get("latest_updates");
        assertEquals(Map.of("exchange", "Binance", "last_update", T), updates.get(0));
    }

    @Test
    void dbStatus_down_shouldAnswer503() {
        when(service.checkDatabase()).thenReturn(new DataCollectionService.DatabaseStatus(false, "Connection refused"));

        ResponseEntity<Map<String, Object>> resp = controller.dbStatus();

        assertEquals(503, resp.getStatusCode().value());
        assertEquals("disconnected", resp.getBody().get("database"));
        assertEquals("Connection refused", resp.getBody().get("error"));
    }

    @Test
    void dbStatus_up_shouldAnswer200() {
        when(service.checkDatabase()).thenReturn(new DataCollectionService.DatabaseStatus(true, null));

        ResponseEntity<Map<String, Object>> resp = controller.dbStatus();

        assertEquals(200, resp.getStatusCode().value());
        assertEquals("healthy", resp.getBody().get("status"));
        assertFalse(resp.getBody().containsKey("error"));
    }

    @Test
    void logs_shouldCountFiles() {
        when(service.getLogFiles()).thenReturn(List.of(
                new DataCollectionService.LogFileInfo("candle_collector.log", 120, T)));

        Map<String, Object> body = controller.logs();

        assertEquals("success", body.get("status"));
        assertEquals(1, body.get("total_files"));
        verify(service, times(1)).getLogFiles();
    }
}
