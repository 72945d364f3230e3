package com.catalog.harvester.sync;

import com.catalog.harvester.config.CatalogProperties;
import com.catalog.harvester.parser.PriceParser;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.math.NumberUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Map;

/**
 * Turns a source price into the price published on the remote catalog.
 * <p>
 * When pricing is enabled the result is {@code (price + profit + tax) * multiplier}, rounded
 * to a whole number, where the profit rate comes from the tier matching the product's
 * {@code discount} meta value (clamped to 1..99, so {@code 0} falls in the first tier) and
 * tax is a fixed share of the source price. A product whose discount is absent or not a
 * number earns no profit. When disabled the source
 * price is passed through with two decimals.
 * </p>
 */
@Component
public class PricingPolicy {

    private final CatalogProperties.Pricing cfg;

    @Autowired
    public PricingPolicy(final CatalogProperties props) {
        this(props.getPricing());
    }

    public PricingPolicy(final CatalogProperties.Pricing cfg) {
        this.cfg = cfg;
    }

    public BigDecimal apply(final BigDecimal price, final Map<String, String> meta) {
        if (price == null) {
            return null;
        }
        if (!cfg.isEnabled()) {
            return price.setScale(2, RoundingMode.HALF_UP);
        }
        Integer discount = discountOf(meta);
        BigDecimal profit = BigDecimal.ZERO;
        if (discount != null) {
            profit = cfg.getTiers().stream()
                    .filter(t -> discount >= t.getMinDiscount() && discount <= t.getMaxDiscount())
                    .findFirst()
                    .map(t -> price.multiply(t.getProfitRate()))
                    .orElse(BigDecimal.ZERO);
        }
        BigDecimal tax = price.multiply(cfg.getTaxRate());
        return price.add(profit).add(tax)
                .multiply(cfg.getMultiplier())
                .setScale(0, RoundingMode.HALF_UP);
    }

    /** Price as the remote catalog expects it: a plain decimal string. */
    public String format(final BigDecimal price, final Map<String, String> meta) {
        BigDecimal value = apply(price, meta);
        return value == null ? null : value.toPlainString();
    }

    private static Integer discountOf(final Map<String, String> meta) {
        if (meta == null) {
            return null;
        }
        String text = StringUtils.remove(StringUtils.trimToEmpty(meta.get("discount")), '%').trim();
        BigDecimal raw = NumberUtils.isParsable(text) ? new BigDecimal(text) : PriceParser.parsePercent(text);
        if (raw == null) {
            return null;
        }
        int value = raw.setScale(0, RoundingMode.DOWN).intValue();
        return Math.max(1, Math.min(99, value));
    }
}
