package com.xbleey.grafanareporter.controller;

import com.xbleey.grafanareporter.service.GrafanaDashboardClient;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/dashboards")
public class DashboardController {

    private final GrafanaDashboardClient dashboardClient;

    public DashboardController(GrafanaDashboardClient dashboardClient) {
        this.dashboardClient = dashboardClient;
    }

    // Grafana's search response is relayed as-is
    @GetMapping
    public ResponseEntity<String> listDashboards() {
        return ResponseEntity.ok()
                .contentType(MediaType.APPLICATION_JSON)
                .body(dashboardClient.listDashboards());
    }
}
