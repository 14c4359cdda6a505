package com.spreadtracker.common.calculator;

import com.spreadtracker.common.model.Opportunity;
import com.spreadtracker.common.model.Quote;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Pure cross-join of international (USD) and local (ZAR) quotes.
 *
 * <p>Every international quote is converted to ZAR through the FX rate and paired with
 * every local quote, producing {@code |international| x |local|} opportunities. The
 * result is ordered by {@code spreadPercentage} descending; {@link List#sort} is stable,
 * so equal spreads keep their encounter order (international-major, local-minor).
 *
 * <p>The FX rate is trusted: validating it is the FX source's job.
 *
 * <p>No reactive types. No logging. No side-effects.
 */
public final class ArbitrageCalculator {

    private static final Comparator<Opportunity> BY_SPREAD_DESC =
        Comparator.comparingDouble(Opportunity::spreadPercentage).reversed();

    private ArbitrageCalculator() {}

    public static List<Opportunity> compute(List<Quote> international, List<Quote> local, double fxRate) {
        if (international == null || local == null || international.isEmpty() || local.isEmpty()) {
            return List.of();
        }

        List<Opportunity> opportunities = new ArrayList<>(international.size() * local.size());
        for (Quote buy : international) {
            double buyPriceInZar = buy.price() * fxRate;
            for (Quote sell : local) {
                opportunities.add(Opportunity.of(buy.exchangeName(), sell.exchangeName(),
                    buyPriceInZar, sell.price()));
            }
        }
        opportunities.sort(BY_SPREAD_DESC);
        return opportunities;
    }
}
