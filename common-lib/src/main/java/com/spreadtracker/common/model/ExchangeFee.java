package com.spreadtracker.common.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Published fee card for one exchange. International venues charge withdrawals in USD,
 * local venues in ZAR; the other field is {@code null}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExchangeFee(
    @JsonProperty("name")                 String name,
    @JsonProperty("tradingFeePercentage") double tradingFeePercentage,
    @JsonProperty("withdrawalFeeUSD")     Double withdrawalFeeUSD,
    @JsonProperty("withdrawalFeeZAR")     Double withdrawalFeeZAR
) {

    public static ExchangeFee usd(String name, double tradingFeePercentage, double withdrawalFeeUSD) {
        return new ExchangeFee(name, tradingFeePercentage, withdrawalFeeUSD, null);
    }

    public static ExchangeFee zar(String name, double tradingFeePercentage, double withdrawalFeeZAR) {
        return new ExchangeFee(name, tradingFeePercentage, null, withdrawalFeeZAR);
    }
}
