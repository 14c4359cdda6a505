package com.spreadtracker.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Fee-adjusted outcome of moving {@code investmentAmount} ZAR through one opportunity.
 */
public record ProfitCalculation(
    @JsonProperty("buyExchange")           String  buyExchange,
    @JsonProperty("sellExchange")          String  sellExchange,
    @JsonProperty("investmentAmount")      double  investmentAmount,
    @JsonProperty("buyPrice")              double  buyPrice,
    @JsonProperty("sellPrice")             double  sellPrice,
    @JsonProperty("buyFeePercentage")      double  buyFeePercentage,
    @JsonProperty("sellFeePercentage")     double  sellFeePercentage,
    @JsonProperty("transferFee")           double  transferFee,
    @JsonProperty("buyFeeAmount")          double  buyFeeAmount,
    @JsonProperty("sellFeeAmount")         double  sellFeeAmount,
    @JsonProperty("totalFees")             double  totalFees,
    @JsonProperty("grossProfit")           double  grossProfit,
    @JsonProperty("netProfit")             double  netProfit,
    @JsonProperty("netProfitPercentage")   double  netProfitPercentage,
    @JsonProperty("isProfit")              boolean isProfit
) {}
