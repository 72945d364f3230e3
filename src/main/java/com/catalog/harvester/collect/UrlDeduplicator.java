package com.catalog.harvester.collect;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Two-stage URL de-duplication.
 * <ol>
 *   <li>exact string match;</li>
 *   <li>base product: the URL up to and including its last {@code /} (query and fragment ignored);
 *       only the first URL seen per base survives, which folds the per-colour URLs of one
 *       product into a single representative.</li>
 * </ol>
 * Both stages keep first-seen order and are idempotent.
 * <p>
 * The base is purely textual, so two shapes need {@code dedupe-by-base-product: false}:
 * a URL ending in {@code /} is its own base and never folds with its siblings, and products
 * keyed only by the query ({@code /product?id=1}, {@code /product?id=2}) share one base and
 * collapse into the first.
 * </p>
 */
public final class UrlDeduplicator {

    private UrlDeduplicator() {
    }

    public static Set<String> dedupe(final Collection<String> urls, final boolean byBaseProduct) {
        Set<String> exact = exact(urls);
        return byBaseProduct ? byBaseProduct(exact) : exact;
    }

    public static Set<String> exact(final Collection<String> urls) {
        return new LinkedHashSet<>(urls);
    }

    public static Set<String> byBaseProduct(final Collection<String> urls) {
        Map<String, String> firstPerBase = new LinkedHashMap<>();
        for (String url : urls) {
            firstPerBase.putIfAbsent(basePath(url), url);
        }
        return new LinkedHashSet<>(firstPerBase.values());
    }

    static String basePath(final String url) {
        String path = url;
        int cut = indexOfAny(path, '?', '#');
        if (cut >= 0) {
            path = path.substring(0, cut);
        }
        int slash = path.lastIndexOf('/');
        return slash < 0 ? path : path.substring(0, slash + 1);
    }

    private static int indexOfAny(final String s, final char a, final char b) {
        int ia = s.indexOf(a);
        int ib = s.indexOf(b);
        if (ia < 0) {
            return ib;
        }
        return ib < 0 ? ia : Math.min(ia, ib);
    }
}
