package com.spreadtracker.marketdata.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.spreadtracker.common.exception.InvalidQuoteException;

/**
 * Response shape of each upstream ticker. Every constant knows where the price lives in
 * its payload (as a JSON pointer) and parses it into a positive price or fails with
 * {@link InvalidQuoteException}; a missing node is never read as zero.
 */
public enum ExchangeResponseFormat {

    /** {@code {"last": "60123.00", ...}} */
    BITSTAMP("/last"),
    /** {@code [BID, BID_SIZE, ASK, ASK_SIZE, DAILY_CHANGE, DAILY_CHANGE_REL, LAST_PRICE, ...]} */
    BITFINEX("/6"),
    /** {@code {"symbol": "BTCUSD", "price": "60123.45"}} */
    BINANCE("/price"),
    /** {@code {"result": {"XXBTZUSD": {"c": ["60123.4", "0.01"]}}}} */
    KRAKEN("/result/XXBTZUSD/c/0"),
    /** {@code {"data": {"last": "60123.4"}}} */
    KUCOIN("/data/last"),
    /** {@code {"last_trade": "1150000.00"}} */
    LUNO("/last_trade"),
    /** {@code {"lastTradedPrice": "1150000"}} */
    VALR("/lastTradedPrice"),
    /** {@code {"BTC": {"Price": "1150000"}}} */
    ALTCOIN_TRADER("/BTC/Price"),
    /** {@code {"rates": {"ZAR": 18.9}}} */
    EXCHANGE_RATE_API("/rates/ZAR");

    private final String pricePointer;

    ExchangeResponseFormat(String pricePointer) {
        this.pricePointer = pricePointer;
    }

    /**
     * Extracts the price from {@code body}.
     *
     * @param sourceName used for error attribution only
     * @return a finite, strictly positive price
     * @throws InvalidQuoteException when the node is missing, non-numeric or not positive
     */
    public double parsePrice(String sourceName, JsonNode body) {
        if (body == null || body.isMissingNode() || body.isNull()) {
            throw new InvalidQuoteException(sourceName, "empty response body");
        }
        JsonNode node = body.at(pricePointer);
        if (node.isMissingNode() || node.isNull()) {
            throw new InvalidQuoteException(sourceName, "missing price at " + pricePointer);
        }

        double price;
        if (node.isNumber()) {
            price = node.doubleValue();
        } else if (node.isTextual()) {
            try {
                price = Double.parseDouble(node.textValue().trim());
            } catch (NumberFormatException e) {
                throw new InvalidQuoteException(sourceName,
                    "non-numeric price '" + node.textValue() + "' at " + pricePointer, e);
            }
        } else {
            throw new InvalidQuoteException(sourceName,
                "unexpected " + node.getNodeType() + " at " + pricePointer);
        }

        if (!Double.isFinite(price) || price <= 0) {
            throw new InvalidQuoteException(sourceName, "non-positive price " + price);
        }
        return price;
    }
}
