package com.catalog.harvester.model;

/**
 * One product or colourway image.
 *
 * @param url       absolute source URL, the identity used for de-duplication
 * @param altText   alternative text, may be {@code null}
 * @param localPath blob-store path, {@code null} until downloaded
 * @param primary   whether this is the product's lead image
 */
public record ProductImage(String url, String altText, String localPath, boolean primary) {

    public static ProductImage of(final String url, final String altText) {
        return new ProductImage(url, altText, null, false);
    }

    public ProductImage withLocalPath(final String path) {
        return new ProductImage(url, altText, path, primary);
    }

    public ProductImage withPrimary(final boolean flag) {
        return new ProductImage(url, altText, localPath, flag);
    }
}
