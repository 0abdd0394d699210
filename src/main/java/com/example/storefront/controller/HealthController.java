package com.example.storefront.controller;

import com.example.storefront.model.DiagnosticsReport;
import com.example.storefront.service.DiagnosticsService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequiredArgsConstructor
public class HealthController {

    static final String LIVENESS_MESSAGE = "eCommerce Backend Running";

    private final DiagnosticsService diagnosticsService;

    @GetMapping("/")
    public Map<String, String> root() {
        return Map.of("message", LIVENESS_MESSAGE);
    }

    @GetMapping("/test")
    public DiagnosticsReport test() {
        return diagnosticsService.report();
    }
}
