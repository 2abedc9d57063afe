package com.correlateai.engine.service.stats;

import com.correlateai.engine.model.ConfidenceLevel;
import com.correlateai.engine.model.RelationshipType;
import org.springframework.stereotype.Component;

import java.util.Map;

@Component
public class RelationshipClassifier {

    public RelationshipType classify(double pearson, double spearman, Map<Integer, Double> lags, double mutualInformation) {
        double linear = Math.abs(pearson);
        if (LagCorrelationService.strongest(lags) > linear + 0.1) {
            return RelationshipType.LAGGED;
        }
        if (Math.abs(spearman) > linear + 0.2) {
            return RelationshipType.NON_LINEAR;
        }
        if (mutualInformation > 0.3 && linear < 0.3) {
            return RelationshipType.NON_LINEAR;
        }
        if (linear > 0.3) {
            return RelationshipType.LINEAR;
        }
        return RelationshipType.WEAK;
    }

    public ConfidenceLevel confidence(double pearson, double pValue) {
        double strength = Math.abs(pearson);
        if (strength > 0.8 && pValue < 0.01) {
            return ConfidenceLevel.VERY_HIGH;
        }
        if (strength > 0.6 && pValue < 0.05) {
            return ConfidenceLevel.HIGH;
        }
        if (strength > 0.4 && pValue < 0.1) {
            return ConfidenceLevel.MEDIUM;
        }
        return ConfidenceLevel.LOW;
    }
}
