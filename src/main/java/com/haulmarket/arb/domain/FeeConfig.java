package com.haulmarket.arb.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Transaction cost model for one scan. Rates are fractions, transport is per unit of bulk.
 */
@Value
@Builder
public class FeeConfig {
    BigDecimal brokerFeeBuy;
    BigDecimal brokerFeeSell;
    BigDecimal salesTax;
    BigDecimal transportCostPerBulkUnit;
}
