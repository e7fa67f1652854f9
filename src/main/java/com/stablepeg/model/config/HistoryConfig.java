package com.stablepeg.model.config;

import lombok.Data;

import java.time.Duration;

@Data
public class HistoryConfig {
    /** JSON file backing the sample windows. Blank keeps history in memory only. */
    private String file;
    private int maxSamples = 240;
    private Duration maxAge = Duration.ofHours(24);
}
