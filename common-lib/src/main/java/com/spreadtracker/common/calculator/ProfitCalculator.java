package com.spreadtracker.common.calculator;

import com.spreadtracker.common.exception.UnknownRouteException;
import com.spreadtracker.common.model.ExchangeFee;
import com.spreadtracker.common.model.Opportunity;
import com.spreadtracker.common.model.ProfitCalculation;

/**
 * Walks an investment through one opportunity: buy fee, BTC bought, gross sale,
 * sell fee, flat transfer fee.
 *
 * <p>Custom fee percentages override the {@link ExchangeFeeSchedule} entries when
 * non-null. All amounts are ZAR.
 */
public final class ProfitCalculator {

    private ProfitCalculator() {}

    public static ProfitCalculation calculate(Opportunity opportunity, double investmentAmount,
                                              Double customBuyFee, Double customSellFee,
                                              Double transferFee) {
        ExchangeFee buyFeeCard = ExchangeFeeSchedule.find(opportunity.buyExchange())
            .orElseThrow(() -> new UnknownRouteException(
                "No fee data for exchange " + opportunity.buyExchange()));
        ExchangeFee sellFeeCard = ExchangeFeeSchedule.find(opportunity.sellExchange())
            .orElseThrow(() -> new UnknownRouteException(
                "No fee data for exchange " + opportunity.sellExchange()));

        double buyFeePct  = customBuyFee  != null ? customBuyFee  : buyFeeCard.tradingFeePercentage();
        double sellFeePct = customSellFee != null ? customSellFee : sellFeeCard.tradingFeePercentage();
        double transfer   = transferFee   != null ? transferFee   : 0.0;

        double buyPrice  = opportunity.buyPriceInZAR();
        double sellPrice = opportunity.sellPriceInZAR();

        double buyFeeAmount     = investmentAmount * buyFeePct / 100.0;
        double btcAmount        = (investmentAmount - buyFeeAmount) / buyPrice;
        double grossProceeds    = btcAmount * sellPrice;
        double sellFeeAmount    = grossProceeds * sellFeePct / 100.0;
        double netProceeds      = grossProceeds - sellFeeAmount - transfer;

        double grossProfit = grossProceeds - investmentAmount;
        double netProfit   = netProceeds - investmentAmount;

        return new ProfitCalculation(
            opportunity.buyExchange(), opportunity.sellExchange(),
            investmentAmount, buyPrice, sellPrice,
            buyFeePct, sellFeePct, transfer,
            buyFeeAmount, sellFeeAmount, buyFeeAmount + sellFeeAmount + transfer,
            grossProfit, netProfit, netProfit / investmentAmount * 100.0,
            netProfit > 0);
    }
}
