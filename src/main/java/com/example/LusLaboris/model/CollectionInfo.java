package com.example.LusLaboris.model;

import java.time.Instant;

public record CollectionInfo(
        String name,
        long pointsCount,
        int vectorSize,
        String distanceMetric,
        Instant createdAt
) {
}
