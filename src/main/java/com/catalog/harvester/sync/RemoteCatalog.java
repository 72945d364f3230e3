package com.catalog.harvester.sync;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Port to the remote commerce catalog (WooCommerce REST semantics).
 * <p>
 * Every method throws {@link com.catalog.harvester.exception.RemoteCatalogException}
 * on a non-successful answer or a transport failure. List methods return every page.
 * </p>
 */
public interface RemoteCatalog {

    List<JsonNode> listAttributes();

    JsonNode createAttribute(String name, String slug);

    List<JsonNode> listTerms(long attributeId);

    JsonNode createTerm(long attributeId, String name, String slug);

    List<JsonNode> listCategories();

    JsonNode createCategory(String name, String slug);

    JsonNode createProduct(JsonNode payload);

    JsonNode updateProduct(long productId, JsonNode payload);

    List<JsonNode> listVariations(long productId);

    JsonNode createVariation(long productId, JsonNode payload);

    JsonNode updateVariation(long productId, long variationId, JsonNode payload);

    /**
     * Uploads one file to the media library.
     *
     * @return the remote media id
     */
    long uploadMedia(byte[] bytes, String filename, String mimeType, String altText);
}
