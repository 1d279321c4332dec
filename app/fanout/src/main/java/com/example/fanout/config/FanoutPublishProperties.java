package com.example.fanout.config;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "fanout.publish")
@Validated
public record FanoutPublishProperties(
    @NotNull @Positive Integer poolSize, @NotNull @Positive Integer queueCapacity) {}
