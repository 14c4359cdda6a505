package com.spreadtracker.marketdata.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Profit calculator input. Fee fields are optional; {@code null} means "use the
 * exchange's published fee".
 */
public record CalculatorRequest(
    @JsonProperty("amount")        double amount,
    @JsonProperty("buyExchange")   String buyExchange,
    @JsonProperty("sellExchange")  String sellExchange,
    @JsonProperty("customBuyFee")  Double customBuyFee,
    @JsonProperty("customSellFee") Double customSellFee,
    @JsonProperty("transferFee")   Double transferFee
) {}
