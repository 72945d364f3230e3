package com.catalog.harvester.sync;

import com.catalog.harvester.config.CatalogProperties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.math.BigDecimal;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class PricingPolicyTest {

    private static PricingPolicy enabled() {
        CatalogProperties.Pricing cfg = new CatalogProperties.Pricing();
        cfg.setEnabled(true);
        return new PricingPolicy(cfg);
    }

    @Test
    void disabledPolicyPassesThePriceThrough() {
        PricingPolicy policy = new PricingPolicy(new CatalogProperties.Pricing());

        assertThat(policy.format(new BigDecimal("59.9"), Map.of("discount", "30"))).isEqualTo("59.90");
        assertThat(policy.apply(null, Map.of())).isNull();
    }

    @ParameterizedTest
    @CsvSource({
            "30, 134",
            "30%, 134",
            "45, 140",
            "150, 213",
            "0, 134",
            "-5, 134",
            "n/a, 113"
    })
    void profitTierFollowsTheDiscount(final String discount, final String expected) {
        assertThat(enabled().format(new BigDecimal("100"), Map.of("discount", discount))).isEqualTo(expected);
    }

    @Test
    void missingDiscountEarnsNoProfitAndResultIsRounded() {
        assertThat(enabled().apply(new BigDecimal("59.99"), Map.of())).isEqualByComparingTo("68");
        assertThat(enabled().apply(new BigDecimal("59.99"), Map.of("discount", "25.32"))).isEqualByComparingTo("80");
    }

    @Test
    void discountIsClampedIntoTheTierRange() {
        PricingPolicy policy = enabled();

        assertThat(policy.format(new BigDecimal("100"), Map.of("discount", "0")))
                .isEqualTo(policy.format(new BigDecimal("100"), Map.of("discount", "1")));
        assertThat(policy.format(new BigDecimal("100"), Map.of("discount", "150")))
                .isEqualTo(policy.format(new BigDecimal("100"), Map.of("discount", "99")));
    }

    @Test
    void multiplierScalesTheWholeSum() {
        CatalogProperties.Pricing cfg = new CatalogProperties.Pricing();
        cfg.setEnabled(true);
        cfg.setMultiplier(new BigDecimal("2"));

        assertThat(new PricingPolicy(cfg).format(new BigDecimal("100"), Map.of())).isEqualTo("226");
    }
}
