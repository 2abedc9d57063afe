package com.correlateai.engine.model;

import java.util.List;

public record EngineReport(
        CorrelationAnalysisReport correlations,
        List<SeriesPattern> patterns,
        AnalysisSummary summary
) {}
