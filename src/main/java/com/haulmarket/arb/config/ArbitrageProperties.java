package com.haulmarket.arb.config;

import com.haulmarket.arb.domain.FeeConfig;
import com.haulmarket.arb.domain.Market;
import com.haulmarket.arb.domain.ScanFilters;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Data
@ConfigurationProperties(prefix = "arbitrage")
public class ArbitrageProperties {

    private Api api = new Api();
    private Cache cache = new Cache();
    private Fees fees = new Fees();
    private Filters filters = new Filters();
    private List<MarketEntry> markets = new ArrayList<>();
    private Scan scan = new Scan();

    @Data
    public static class Api {
        private String baseUrl = "https://esi.evetech.net/latest";
        private String datasource = "tranquility";
        private String userAgent = "haulmarket-arb/1.0";
        private Duration requestTimeout = Duration.ofSeconds(15);
        private int maxAttempts = 3;
        private int errorLimitThreshold = 20;
        private Duration errorLimitCooldown = Duration.ofSeconds(2);
        private String errorLimitHeader = "X-ESI-Error-Limit-Remain";
        private String pagesHeader = "X-Pages";
        private double requestsPerSecond = 20.0; // 0 disables client-side pacing
    }

    @Data
    public static class Cache {
        private String dbPath = "data/haulmarket-arb.db";
        private Duration orderTtl = Duration.ofMinutes(5);
        private Duration itemTtl = Duration.ofHours(24);
        private Duration placeholderItemTtl = Duration.ofMinutes(10);
    }

    @Data
    public static class Fees {
        private BigDecimal brokerFeeBuy = new BigDecimal("0.03");
        private BigDecimal brokerFeeSell = new BigDecimal("0.03");
        private BigDecimal salesTax = new BigDecimal("0.08");
        private BigDecimal transportCostPerBulkUnit = new BigDecimal("800");
    }

    @Data
    public static class Filters {
        private BigDecimal minProfitMarginPct = new BigDecimal("10");
        private BigDecimal minNetProfit = new BigDecimal("1000000");
        private BigDecimal maxInvestmentPerItem = BigDecimal.ZERO;
        private long minVolumeAvailable = 1;
    }

    @Data
    public static class MarketEntry {
        private String name;
        private long id;
    }

    @Data
    public static class Scan {
        private List<List<String>> pairs = new ArrayList<>();
        private int maxWorkers = 4;
        private Duration deadline; // null = no deadline
        private Scheduled scheduled = new Scheduled();
    }

    @Data
    public static class Scheduled {
        private boolean enabled = false;
        private long intervalMs = 900_000;
        private long initialDelayMs = 10_000;
    }

    public FeeConfig toFeeConfig() {
        return FeeConfig.builder()
                .brokerFeeBuy(fees.getBrokerFeeBuy())
                .brokerFeeSell(fees.getBrokerFeeSell())
                .salesTax(fees.getSalesTax())
                .transportCostPerBulkUnit(fees.getTransportCostPerBulkUnit())
                .build();
    }

    public ScanFilters toScanFilters() {
        return ScanFilters.builder()
                .minProfitMarginPct(filters.getMinProfitMarginPct())
                .minNetProfit(filters.getMinNetProfit())
                .maxInvestmentPerItem(filters.getMaxInvestmentPerItem())
                .minVolumeAvailable(filters.getMinVolumeAvailable())
                .build();
    }

    public Map<String, Market> marketsByName() {
        Map<String, Market> byName = new LinkedHashMap<>();
        for (MarketEntry entry : markets) {
            if (entry != null && entry.getName() != null && !entry.getName().isBlank()) {
                byName.putIfAbsent(entry.getName(), new Market(entry.getName(), entry.getId()));
            }
        }
        return byName;
    }

    /**
     * Checks fee, filter and pair settings. An empty list means the configuration is usable.
     */
    public List<String> validate() {
        List<String> errors = new ArrayList<>();

        checkRate(errors, "fees.broker-fee-buy", fees.getBrokerFeeBuy());
        checkRate(errors, "fees.broker-fee-sell", fees.getBrokerFeeSell());
        checkRate(errors, "fees.sales-tax", fees.getSalesTax());
        checkNonNegative(errors, "fees.transport-cost-per-bulk-unit", fees.getTransportCostPerBulkUnit());

        checkNonNegative(errors, "filters.min-profit-margin-pct", filters.getMinProfitMarginPct());
        checkNonNegative(errors, "filters.min-net-profit", filters.getMinNetProfit());
        checkNonNegative(errors, "filters.max-investment-per-item", filters.getMaxInvestmentPerItem());
        if (filters.getMinVolumeAvailable() < 1) {
            errors.add("filters.min-volume-available must be >= 1");
        }

        Set<String> names = new HashSet<>();
        for (int i = 0; i < markets.size(); i++) {
            MarketEntry entry = markets.get(i);
            if (entry == null || entry.getName() == null || entry.getName().isBlank()) {
                errors.add("markets[" + i + "].name must not be blank");
                continue;
            }
            if (entry.getId() <= 0) {
                errors.add("markets[" + i + "].id must be > 0 for " + entry.getName());
            }
            if (!names.add(entry.getName())) {
                errors.add("markets[" + i + "].name is a duplicate: " + entry.getName());
            }
        }

        for (List<String> pair : scan.getPairs()) {
            if (!isWellFormedPair(pair)) {
                errors.add("scan.pairs entries must name exactly two markets: " + pair);
            }
        }
        return errors;
    }

    public static boolean isWellFormedPair(List<String> pair) {
        return pair != null && pair.size() == 2
                && pair.stream().allMatch(name -> name != null && !name.isBlank());
    }

    private static void checkRate(List<String> errors, String name, BigDecimal value) {
        if (value == null || value.signum() < 0 || value.compareTo(BigDecimal.ONE) > 0) {
            errors.add(name + " must be between 0 and 1");
        }
    }

    private static void checkNonNegative(List<String> errors, String name, BigDecimal value) {
        if (value == null || value.signum() < 0) {
            errors.add(name + " must be >= 0");
        }
    }
}
