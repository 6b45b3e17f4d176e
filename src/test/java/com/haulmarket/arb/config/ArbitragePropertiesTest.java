package com.haulmarket.arb.config;

import com.haulmarket.arb.core.ScanSnapshot;
import com.haulmarket.arb.domain.Route;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ArbitragePropertiesTest {

    @Test
    void defaultsAreValid() {
        assertThat(new ArbitrageProperties().validate()).isEmpty();
    }

    @Test
    void outOfRangeSettingsAreReported() {
        ArbitrageProperties properties = new ArbitrageProperties();
        properties.getFees().setBrokerFeeBuy(new BigDecimal("-0.01"));
        properties.getFees().setSalesTax(new BigDecimal("1.01"));
        properties.getFees().setTransportCostPerBulkUnit(new BigDecimal("-1"));
        properties.getFilters().setMinVolumeAvailable(0);
        properties.getScan().getPairs().add(List.of("The Forge"));

        assertThat(properties.validate())
                .hasSize(5)
                .anySatisfy(e -> assertThat(e).startsWith("fees.broker-fee-buy"))
                .anySatisfy(e -> assertThat(e).startsWith("fees.sales-tax"))
                .anySatisfy(e -> assertThat(e).startsWith("fees.transport-cost-per-bulk-unit"))
                .anySatisfy(e -> assertThat(e).startsWith("filters.min-volume-available"))
                .anySatisfy(e -> assertThat(e).startsWith("scan.pairs"));
    }

    @Test
    void malformedMarketEntriesAreReported() {
        ArbitrageProperties properties = new ArbitrageProperties();
        properties.getMarkets().add(market("The Forge", 10000002L));
        properties.getMarkets().add(market(null, 2L));
        properties.getMarkets().add(market("Domain", 0L));
        properties.getMarkets().add(market("The Forge", 10000043L));

        assertThat(properties.validate())
                .containsExactly(
                        "markets[1].name must not be blank",
                        "markets[2].id must be > 0 for Domain",
                        "markets[3].name is a duplicate: The Forge");
        assertThat(properties.marketsByName()).containsOnlyKeys("The Forge", "Domain");
        assertThat(properties.marketsByName().get("The Forge").getId()).isEqualTo(10000002L);
    }

    @Test
    void namelessMarketDoesNotBreakSnapshot() {
        ArbitrageProperties properties = new ArbitrageProperties();
        properties.getMarkets().add(market("The Forge", 10000002L));
        properties.getMarkets().add(market(null, 2L));

        ScanSnapshot snapshot = ScanSnapshot.from(properties);

        assertThat(snapshot.isValid()).isFalse();
        assertThat(snapshot.getMarkets()).containsOnlyKeys("The Forge");
    }

    @Test
    void pairWithMissingOrBlankNameIsReportedAndNotExpanded() {
        ArbitrageProperties properties = new ArbitrageProperties();
        properties.getScan().getPairs().add(Arrays.asList("The Forge", null));
        properties.getScan().getPairs().add(List.of("Domain", " "));
        properties.getScan().getPairs().add(null);
        properties.getScan().getPairs().add(List.of("The Forge", "Domain"));

        assertThat(properties.validate()).hasSize(3)
                .allSatisfy(e -> assertThat(e).startsWith("scan.pairs"));

        ScanSnapshot snapshot = ScanSnapshot.from(properties);
        assertThat(snapshot.getConfiguredRoutes()).containsExactly(
                new Route("The Forge", "Domain"),
                new Route("Domain", "The Forge"));
        assertThat(snapshot.knows(new Route("The Forge", null))).isFalse();
    }

    @Test
    void boundaryRatesAreAccepted() {
        ArbitrageProperties properties = new ArbitrageProperties();
        properties.getFees().setBrokerFeeBuy(BigDecimal.ZERO);
        properties.getFees().setSalesTax(BigDecimal.ONE);

        assertThat(properties.validate()).isEmpty();
    }

    @Test
    void snapshotExpandsPairsInBothDirectionsWithoutDuplicates() {
        ArbitrageProperties properties = new ArbitrageProperties();
        properties.getScan().getPairs().add(List.of("The Forge", "Domain"));
        properties.getScan().getPairs().add(List.of("Domain", "The Forge"));
        properties.getScan().getPairs().add(List.of("The Forge", "Heimatar"));

        ScanSnapshot snapshot = ScanSnapshot.from(properties);

        assertThat(snapshot.getConfiguredRoutes()).containsExactly(
                new Route("The Forge", "Domain"),
                new Route("Domain", "The Forge"),
                new Route("The Forge", "Heimatar"),
                new Route("Heimatar", "The Forge"));
    }

    @Test
    void snapshotIsDetachedFromLaterEdits() {
        ArbitrageProperties properties = new ArbitrageProperties();
        properties.getMarkets().add(market("The Forge", 10000002L));

        ScanSnapshot snapshot = ScanSnapshot.from(properties);
        properties.getFees().setSalesTax(new BigDecimal("0.5"));
        properties.getMarkets().clear();

        assertThat(snapshot.getFeeConfig().getSalesTax()).isEqualByComparingTo("0.08");
        assertThat(snapshot.market("The Forge").getId()).isEqualTo(10000002L);
        assertThatThrownBy(() -> snapshot.market("Domain")).isInstanceOf(IllegalArgumentException.class);
    }

    private static ArbitrageProperties.MarketEntry market(String name, long id) {
        ArbitrageProperties.MarketEntry entry = new ArbitrageProperties.MarketEntry();
        entry.setName(name);
        entry.setId(id);
        return entry;
    }
}
