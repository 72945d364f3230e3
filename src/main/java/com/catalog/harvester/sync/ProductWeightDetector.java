package com.catalog.harvester.sync;

import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Estimates the shipping weight (kg) of a product from keywords in its title.
 * The first matching keyword wins; the estimate is the middle of its range.
 */
@Component
public class ProductWeightDetector {

    static final BigDecimal DEFAULT_WEIGHT = new BigDecimal("0.3");

    private static final Map<String, double[]> RANGES = new LinkedHashMap<>();

    static {
        // clothing
        RANGES.put("blazers", new double[] {0.9, 1.2});
        RANGES.put("suits", new double[] {0.9, 1.2});
        RANGES.put("cardigans", new double[] {0.4, 0.7});
        RANGES.put("jumpers", new double[] {0.4, 0.7});
        RANGES.put("hoodies", new double[] {0.5, 0.8});
        RANGES.put("sweatshirts", new double[] {0.5, 0.8});
        RANGES.put("jackets", new double[] {1.0, 2.0});
        RANGES.put("coats", new double[] {1.0, 2.0});
        RANGES.put("jeans", new double[] {0.5, 0.7});
        RANGES.put("pants", new double[] {0.4, 0.6});
        RANGES.put("shirts", new double[] {0.2, 0.4});
        RANGES.put("shoes", new double[] {0.5, 1.0});
        RANGES.put("shorts", new double[] {0.2, 0.3});
        RANGES.put("sleepwear", new double[] {0.2, 0.5});
        RANGES.put("loungewear", new double[] {0.2, 0.5});
        RANGES.put("socks", new double[] {0.05, 0.1});
        RANGES.put("sportswear", new double[] {0.2, 0.5});
        RANGES.put("swimwear", new double[] {0.1, 0.3});
        RANGES.put("tshirts", new double[] {0.15, 0.3});
        RANGES.put("t shirts", new double[] {0.15, 0.3});
        RANGES.put("underwear", new double[] {0.1, 0.3});
        // beauty
        RANGES.put("foundation", new double[] {0.05, 0.15});
        RANGES.put("lipstick", new double[] {0.02, 0.05});
        RANGES.put("eye shadow", new double[] {0.005, 0.05});
        RANGES.put("eyeshadow", new double[] {0.005, 0.05});
        RANGES.put("mascara", new double[] {0.02, 0.04});
        RANGES.put("creams", new double[] {0.05, 0.25});
        RANGES.put("moisturizers", new double[] {0.05, 0.25});
        RANGES.put("moisturiser", new double[] {0.05, 0.25});
        RANGES.put("cleansers", new double[] {0.05, 0.2});
        RANGES.put("face masks", new double[] {0.03, 0.1});
        RANGES.put("shampoo", new double[] {0.1, 0.5});
        RANGES.put("conditioner", new double[] {0.1, 0.5});
        RANGES.put("hair spray", new double[] {0.1, 0.3});
        RANGES.put("gel", new double[] {0.1, 0.3});
        RANGES.put("perfume", new double[] {0.05, 0.3});
        RANGES.put("cologne", new double[] {0.05, 0.3});
        RANGES.put("brushes", new double[] {0.005, 0.1});
        RANGES.put("sponges", new double[] {0.005, 0.1});
        RANGES.put("trimmers", new double[] {0.1, 0.5});
        RANGES.put("epilators", new double[] {0.1, 0.5});
    }

    private static final Map<Pattern, BigDecimal> PATTERNS = new LinkedHashMap<>();

    static {
        RANGES.forEach((keyword, range) -> {
            // plural keywords also match their singular form ("jacket", "brush")
            List<String> forms = new ArrayList<>(List.of(keyword));
            if (keyword.endsWith("s")) {
                forms.add(StringUtils.removeEnd(keyword, "s"));
            }
            if (keyword.endsWith("hes")) {
                forms.add(StringUtils.removeEnd(keyword, "es"));
            }
            String regex = forms.stream().map(Pattern::quote).collect(Collectors.joining("|", "\\b(?:", ")\\b"));
            BigDecimal mid = BigDecimal.valueOf((range[0] + range[1]) / 2).setScale(3, RoundingMode.HALF_UP);
            PATTERNS.put(Pattern.compile(regex), mid);
        });
    }

    /**
     * @param title product title, may be blank
     * @return estimated weight in kg, {@link #DEFAULT_WEIGHT} when nothing matches
     */
    public BigDecimal detect(final String title) {
        if (StringUtils.isBlank(title)) {
            return DEFAULT_WEIGHT;
        }
        String normalised = title.trim().toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9\\s]", " ")
                .replaceAll("\\s+", " ");
        return PATTERNS.entrySet().stream()
                .filter(e -> e.getKey().matcher(normalised).find())
                .map(Map.Entry::getValue)
                .findFirst()
                .orElse(DEFAULT_WEIGHT);
    }
}
