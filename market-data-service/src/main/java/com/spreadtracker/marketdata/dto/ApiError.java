package com.spreadtracker.marketdata.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ApiError(
    @JsonProperty("message") String message
) {}
