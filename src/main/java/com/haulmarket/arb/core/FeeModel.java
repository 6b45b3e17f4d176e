package com.haulmarket.arb.core;

import com.haulmarket.arb.domain.FeeConfig;
import com.haulmarket.arb.domain.ProfitResult;

import java.math.BigDecimal;
import java.math.MathContext;

/**
 * Profit of buying one unit in one market and selling it in another.
 *
 * <pre>
 * effective_cost    = buy_price  * (1 + broker_fee_buy)
 * effective_revenue = sell_price * (1 - broker_fee_sell - sales_tax)
 * transport         = transport_cost_per_bulk_unit * bulk
 * net_profit        = effective_revenue - effective_cost - transport
 * margin_pct        = net_profit / effective_cost * 100, or 0 when effective_cost is 0
 * </pre>
 */
public final class FeeModel {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private FeeModel() {
    }

    public static ProfitResult profit(BigDecimal buyPrice, BigDecimal sellPrice, BigDecimal bulk, FeeConfig fees) {
        BigDecimal effectiveCost = buyPrice.multiply(BigDecimal.ONE.add(fees.getBrokerFeeBuy()));
        BigDecimal effectiveRevenue = sellPrice.multiply(
                BigDecimal.ONE.subtract(fees.getBrokerFeeSell()).subtract(fees.getSalesTax()));
        BigDecimal transport = fees.getTransportCostPerBulkUnit().multiply(bulk);

        BigDecimal netProfit = effectiveRevenue.subtract(effectiveCost).subtract(transport);
        BigDecimal marginPct = effectiveCost.signum() == 0
                ? BigDecimal.ZERO
                : netProfit.divide(effectiveCost, MathContext.DECIMAL64).multiply(HUNDRED);
        return new ProfitResult(netProfit, marginPct);
    }

    public static boolean isProfitable(BigDecimal netProfit, BigDecimal marginPct,
                                       BigDecimal minMarginPct, BigDecimal minNetProfit) {
        return netProfit.compareTo(minNetProfit) >= 0 && marginPct.compareTo(minMarginPct) >= 0;
    }
}
