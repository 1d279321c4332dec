package com.example.fanout.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/** 既に指定のフラグが立っていた場合 {@code modified} は false。 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record MarkResponse(String notificationId, boolean modified) {}
