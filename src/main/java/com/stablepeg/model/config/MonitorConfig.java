package com.stablepeg.model.config;

import lombok.Data;

import java.time.Duration;

@Data
public class MonitorConfig {
    private boolean enabled = true;
    private Duration pollInterval = Duration.ofSeconds(60);
    private Duration initialDelay = Duration.ofSeconds(5);
    private Duration tickTimeout = Duration.ofMinutes(2);
    private int workerThreads = 4;
}
