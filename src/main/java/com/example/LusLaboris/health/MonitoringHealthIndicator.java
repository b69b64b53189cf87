package com.example.LusLaboris.health;

import com.example.LusLaboris.monitoring.MonitoringService;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

// Tracing is best effort, so this never reports down.
@Component
@RequiredArgsConstructor
public class MonitoringHealthIndicator implements HealthIndicator {

    private final MonitoringService monitoringService;

    @Override
    public Health health() {
        return Health.up().withDetails(monitoringService.health()).build();
    }
}
