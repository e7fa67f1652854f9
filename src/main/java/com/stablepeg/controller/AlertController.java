package com.stablepeg.controller;

import com.stablepeg.model.domain.AlertPayload;
import com.stablepeg.model.domain.TickReport;
import com.stablepeg.service.alert.AlertHistory;
import com.stablepeg.service.monitor.MonitorScheduler;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/alerts")
@RequiredArgsConstructor
public class AlertController {

    private final AlertHistory alertHistory;
    private final MonitorScheduler monitorScheduler;

    @GetMapping("/recent")
    public List<AlertPayload> getRecent(@RequestParam(defaultValue = "50") int limit) {
        return alertHistory.getRecent(Math.max(0, limit));
    }

    @GetMapping("/last-tick")
    public ResponseEntity<TickReport> getLastTick() {
        return monitorScheduler.getLastReport()
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }
}
