package com.everrich.reconciliation.controller;

import java.time.LocalDate;
import java.util.List;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.everrich.reconciliation.entities.AnalyticsSnapshot;
import com.everrich.reconciliation.entities.PeriodType;
import com.everrich.reconciliation.service.AnalyticsAggregatorService;

@RestController
@RequestMapping("/api/analytics")
public class AnalyticsController {

    @Autowired
    private AnalyticsAggregatorService analyticsService;

    @PostMapping("/snapshots")
    public AnalyticsSnapshot compute(@RequestParam String companyId,
                                     @RequestParam(defaultValue = "DAILY") PeriodType periodType,
                                     @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate start) {
        return analyticsService.computeSnapshot(companyId, periodType, start);
    }

    @GetMapping("/snapshots")
    public List<AnalyticsSnapshot> list(@RequestParam String companyId,
                                        @RequestParam(defaultValue = "DAILY") PeriodType periodType) {
        return analyticsService.listSnapshots(companyId, periodType);
    }
}
