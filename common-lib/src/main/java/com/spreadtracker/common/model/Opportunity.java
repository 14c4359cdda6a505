package com.spreadtracker.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One buy/sell exchange pairing with its ZAR-normalised spread.
 *
 * <p>Both prices are in ZAR. {@code spread = sellPriceInZAR - buyPriceInZAR} and
 * {@code spreadPercentage = spread / buyPriceInZAR * 100}.
 */
public record Opportunity(
    @JsonProperty("buyExchange")      String buyExchange,
    @JsonProperty("sellExchange")     String sellExchange,
    @JsonProperty("route")            String route,
    @JsonProperty("buyPriceInZAR")    double buyPriceInZAR,
    @JsonProperty("sellPriceInZAR")   double sellPriceInZAR,
    @JsonProperty("spread")           double spread,
    @JsonProperty("spreadPercentage") double spreadPercentage
) {

    public static final String ROUTE_SEPARATOR = " → ";

    public static Opportunity of(String buyExchange, String sellExchange,
                                 double buyPriceInZAR, double sellPriceInZAR) {
        double spread = sellPriceInZAR - buyPriceInZAR;
        return new Opportunity(buyExchange, sellExchange, routeOf(buyExchange, sellExchange),
            buyPriceInZAR, sellPriceInZAR, spread, spread / buyPriceInZAR * 100.0);
    }

    /** Display label shared by opportunities and stored spread rows, e.g. {@code "Binance → VALR"}. */
    public static String routeOf(String buyExchange, String sellExchange) {
        return buyExchange + ROUTE_SEPARATOR + sellExchange;
    }
}
