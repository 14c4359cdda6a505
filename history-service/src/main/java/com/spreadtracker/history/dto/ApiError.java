package com.spreadtracker.history.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ApiError(@JsonProperty("message") String message) {}
