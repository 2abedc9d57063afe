package com.correlateai.engine.config;

import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Configuration
@ConfigurationProperties(prefix = "analysis.executor")
@Data
@Validated
public class ExecutorProperties {

    @Min(1)
    private int queueCapacity = 500;

    @Min(0)
    private int awaitTerminationSeconds = 30;
}
