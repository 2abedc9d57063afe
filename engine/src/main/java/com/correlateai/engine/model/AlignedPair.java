package com.correlateai.engine.model;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Two metrics restricted to the timestamps both of them observed.
 */
public record AlignedPair(
        String firstName,
        String secondName,
        List<LocalDateTime> timestamps,
        double[] first,
        double[] second
) {
    public int size() {
        return timestamps.size();
    }
}
