package com.chronicle.api;

import com.chronicle.generation.ExtractionMetricsService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/v1/metrics")
public class ExtractionMetricsController {

    private final ExtractionMetricsService metrics;

    public ExtractionMetricsController(ExtractionMetricsService metrics) {
        this.metrics = metrics;
    }

    @GetMapping("/extraction")
    public Map<String, Object> extraction() {
        return metrics.snapshot();
    }
}
