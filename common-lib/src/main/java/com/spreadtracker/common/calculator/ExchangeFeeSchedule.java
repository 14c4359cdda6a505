package com.spreadtracker.common.calculator;

import com.spreadtracker.common.model.ExchangeFee;

import java.util.List;
import java.util.Optional;

/**
 * Static fee card for every exchange the tracker knows about, quoted or not.
 */
public final class ExchangeFeeSchedule {

    private static final List<ExchangeFee> FEES = List.of(
        ExchangeFee.usd("Binance",       0.10, 20),
        ExchangeFee.usd("Bitfinex",      0.20, 25),
        ExchangeFee.usd("Bitstamp",      0.25, 22),
        ExchangeFee.usd("Kraken",        0.16, 21),
        ExchangeFee.usd("KuCoin",        0.10, 20),
        ExchangeFee.zar("ChainEX",       0.15, 300),
        ExchangeFee.zar("AltcoinTrader", 0.20, 350),
        ExchangeFee.zar("Ovex",          0.15, 300),
        ExchangeFee.zar("VALR",          0.10, 250),
        ExchangeFee.zar("LUNO",          0.25, 400)
    );

    private ExchangeFeeSchedule() {}

    public static List<ExchangeFee> all() {
        return FEES;
    }

    public static Optional<ExchangeFee> find(String exchangeName) {
        return FEES.stream()
            .filter(fee -> fee.name().equals(exchangeName))
            .findFirst();
    }
}
