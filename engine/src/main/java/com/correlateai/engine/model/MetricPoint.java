package com.correlateai.engine.model;

import java.time.LocalDateTime;

public record MetricPoint(LocalDateTime timestamp, double value) {}
