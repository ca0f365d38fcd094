package com.xbleey.grafanareporter.controller;

import com.xbleey.grafanareporter.exception.ReportValidationException;
import com.xbleey.grafanareporter.model.ReporterConfig;
import com.xbleey.grafanareporter.service.ReporterConfigStore;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/config")
public class ReporterConfigController {

    private final ReporterConfigStore configStore;

    public ReporterConfigController(ReporterConfigStore configStore) {
        this.configStore = configStore;
    }

    @GetMapping
    public ReporterConfig getConfig() {
        return configStore.read();
    }

    @PostMapping
    public Map<String, Object> saveConfig(@RequestBody(required = false) ReporterConfig config) {
        if (config == null) {
            throw new ReportValidationException("config body is required");
        }
        configStore.update(config);
        return Map.of("message", "Configuration saved successfully");
    }
}
