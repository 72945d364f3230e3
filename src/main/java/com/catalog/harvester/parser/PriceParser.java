package com.catalog.harvester.parser;

import org.apache.commons.lang3.StringUtils;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses retailer price strings ("CA$1,234.50", "79,95 €", "-30%").
 *
 * <p>Decimal separator rules: when both {@code ,} and {@code .} occur, the last one is the
 * decimal separator; a lone separator followed by exactly three digits is a thousands
 * separator; otherwise it is the decimal separator.</p>
 */
public final class PriceParser {

    /** Lowest price accepted by {@link #parsePlausible(String)}. */
    public static final BigDecimal MIN_PLAUSIBLE = BigDecimal.TEN;

    /** Highest price accepted by {@link #parsePlausible(String)}. */
    public static final BigDecimal MAX_PLAUSIBLE = new BigDecimal("10000");

    /** Grouped amount ("1 299,00", "1.234.567,89") or a plain one ("48.00"); never spans two prices. */
    private static final Pattern NUMBER =
            Pattern.compile("\\d{1,3}(?:[.,\\s\\u00A0]\\d{3})+(?:[.,]\\d{1,2})?(?!\\d)|\\d+(?:[.,]\\d+)?");

    private static final Pattern PERCENT = Pattern.compile("(\\d{1,2}(?:[.,]\\d+)?)\\s*%");

    private static final BigDecimal HUNDRED = new BigDecimal("100");

    private PriceParser() {
    }

    /**
     * @param text free text containing a price
     * @return the first amount found, {@code null} when there is none
     */
    public static BigDecimal parse(final String text) {
        if (StringUtils.isBlank(text)) {
            return null;
        }
        Matcher m = NUMBER.matcher(text);
        if (!m.find()) {
            return null;
        }
        String raw = m.group().replaceAll("[\\s ]", "");
        try {
            return new BigDecimal(normaliseSeparators(raw));
        } catch (NumberFormatException ex) {
            return null;
        }
    }

    /**
     * Like {@link #parse(String)} but rejects amounts outside
     * [{@link #MIN_PLAUSIBLE}, {@link #MAX_PLAUSIBLE}], which filters out sizes, counts
     * and ratings that happen to sit in a price-like element.
     */
    public static BigDecimal parsePlausible(final String text) {
        BigDecimal value = parse(text);
        if (value == null || value.compareTo(MIN_PLAUSIBLE) < 0 || value.compareTo(MAX_PLAUSIBLE) > 0) {
            return null;
        }
        return value;
    }

    /** "-30%", "30 % off" &rarr; 30. */
    public static BigDecimal parsePercent(final String text) {
        if (StringUtils.isBlank(text)) {
            return null;
        }
        Matcher m = PERCENT.matcher(text);
        return m.find() ? new BigDecimal(m.group(1).replace(',', '.')) : null;
    }

    /**
     * {@code round(100 * (1 - sale / original), 2)}.
     *
     * @return the percentage, {@code null} unless both prices are known and the sale price is lower
     */
    public static BigDecimal discountPercent(final BigDecimal sale, final BigDecimal original) {
        if (sale == null || original == null || original.signum() <= 0 || sale.compareTo(original) >= 0) {
            return null;
        }
        BigDecimal ratio = sale.divide(original, 10, RoundingMode.HALF_UP);
        return BigDecimal.ONE.subtract(ratio).multiply(HUNDRED).setScale(2, RoundingMode.HALF_UP);
    }

    /**
     * @return ISO code guessed from the currency symbol or code in {@code text},
     * {@code fallback} for "$" and when nothing is found
     */
    public static String detectCurrency(final String text, final String fallback) {
        if (StringUtils.isBlank(text)) {
            return fallback;
        }
        String upper = text.toUpperCase();
        if (upper.contains("€") || upper.contains("EUR")) {
            return "EUR";
        }
        if (upper.contains("£") || upper.contains("GBP")) {
            return "GBP";
        }
        if (upper.contains("CA$") || upper.contains("CAD")) {
            return "CAD";
        }
        if (upper.contains("AU$") || upper.contains("AUD")) {
            return "AUD";
        }
        if (upper.contains("USD") || upper.contains("US$")) {
            return "USD";
        }
        return fallback;
    }

    static String normaliseSeparators(final String raw) {
        int lastComma = raw.lastIndexOf(',');
        int lastDot = raw.lastIndexOf('.');
        if (lastComma >= 0 && lastDot >= 0) {
            char decimal = lastComma > lastDot ? ',' : '.';
            char thousands = decimal == ',' ? '.' : ',';
            return raw.replace(String.valueOf(thousands), "").replace(decimal, '.');
        }
        int sep = Math.max(lastComma, lastDot);
        if (sep < 0) {
            return raw;
        }
        char c = raw.charAt(sep);
        boolean repeated = raw.indexOf(c) != sep;
        int decimals = raw.length() - sep - 1;
        if (repeated || decimals == 3) {
            return raw.replace(String.valueOf(c), "");
        }
        return raw.replace(c, '.');
    }
}
