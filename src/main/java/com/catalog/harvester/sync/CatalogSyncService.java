package com.catalog.harvester.sync;

import com.catalog.harvester.config.SiteCfg;
import com.catalog.harvester.config.SiteProperties;
import com.catalog.harvester.exception.HarvestException;
import com.catalog.harvester.exception.RemoteCatalogException;
import com.catalog.harvester.media.BlobStore;
import com.catalog.harvester.model.CanonicalProduct;
import com.catalog.harvester.model.ColorwayVariant;
import com.catalog.harvester.model.ProductImage;
import com.catalog.harvester.model.ProductKey;
import com.catalog.harvester.model.SizeVariant;
import com.catalog.harvester.model.SyncMapping;
import com.catalog.harvester.model.SyncStatus;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.http.MediaTypeFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * <h2>Catalog sync</h2>
 *
 * <p>Publishes one canonical product to the remote catalog and records the outcome in a
 * {@link SyncMapping}. A product without a remote id is created, otherwise updated; the remote
 * id is saved as soon as a create succeeds so that a failure further on turns the next run
 * into an update instead of a duplicate.</p>
 *
 * <p>Variations are reconciled by their {@code colour|size} key: known ones are updated, new
 * ones created, remote ones without a local counterpart are left alone. A failed variation is
 * logged and counted but does not fail the product. Any other remote error does, and the
 * mapping then carries the error payload.</p>
 */
@Slf4j
@Service
public class CatalogSyncService {

    enum SyncState { NEW, EXISTING, CREATING, UPDATING, SYNCED, FAILED }

    private final RemoteCatalog catalog;

    private final AttributeTermResolver attributes;

    private final CategoryResolver categories;

    private final ProductPayloadBuilder payloads;

    private final BlobStore blobs;

    private final SyncMappingStore mappings;

    private final SiteProperties sites;

    private final ObjectMapper mapper;

    /** Remote media ids by blob key, for the lifetime of the process. */
    private final Map<String, Long> uploaded = new ConcurrentHashMap<>();

    public CatalogSyncService(final RemoteCatalog catalog,
                              final AttributeTermResolver attributes,
                              final CategoryResolver categories,
                              final ProductPayloadBuilder payloads,
                              final BlobStore blobs,
                              final SyncMappingStore mappings,
                              final SiteProperties sites,
                              @Qualifier("harvesterObjectMapper") final ObjectMapper mapper) {
        this.catalog = catalog;
        this.attributes = attributes;
        this.categories = categories;
        this.payloads = payloads;
        this.blobs = blobs;
        this.mappings = mappings;
        this.sites = sites;
        this.mapper = mapper;
    }

    /**
     * Creates or updates the product remotely.
     *
     * @return the stored mapping; {@link SyncStatus#FAILED} when a remote call or a stored image read aborted the sync
     */
    public SyncMapping sync(final CanonicalProduct product) {
        ProductKey key = product.key();
        Long remoteId = mappings.find(key).map(SyncMapping::getRemoteProductId).orElse(null);
        SyncState state = remoteId == null ? SyncState.NEW : SyncState.EXISTING;
        SyncState action = state == SyncState.NEW ? SyncState.CREATING : SyncState.UPDATING;
        log.info("Sync {}:{} {} -> {}", key.siteId(), key.externalId(), state, action);

        try {
            AttributeTermResolver.ProductAttributes attrs =
                    product.isVariable() ? attributes.prepare(product.getVariantMatrix()) : null;
            ObjectNode payload = payloads.product(product, productImages(product),
                    categories.resolve(displayName(product.getSiteId())), attrs);

            JsonNode response = action == SyncState.CREATING
                    ? catalog.createProduct(payload)
                    : catalog.updateProduct(remoteId, payload);
            long id = response.path("id").asLong(0);
            if (id == 0) {
                throw new RemoteCatalogException("Product response without id", 0, response.toString());
            }
            if (action == SyncState.CREATING) {
                mappings.save(mapping(product, id, null, payload, 0));
            }

            int failedVariations = attrs == null ? 0 : reconcileVariations(id, product, attrs,
                    action == SyncState.CREATING);
            SyncMapping done = mapping(product, id, SyncStatus.SUCCESS, payload, failedVariations);
            mappings.save(done);
            log.info("Sync {}:{} {} as #{} ({} failed variations)", key.siteId(), key.externalId(),
                    SyncState.SYNCED, id, failedVariations);
            return done;
        } catch (HarvestException ex) {
            Long known = mappings.find(key).map(SyncMapping::getRemoteProductId).orElse(remoteId);
            SyncMapping failed = mapping(product, known, SyncStatus.FAILED, errorPayload(ex), 0);
            mappings.save(failed);
            log.warn("Sync {}:{} {}: {}", key.siteId(), key.externalId(), SyncState.FAILED, ex.getMessage());
            return failed;
        }
    }

    /* ---- variations --------------------------------------------------- */

    private int reconcileVariations(final long productId,
                                    final CanonicalProduct product,
                                    final AttributeTermResolver.ProductAttributes attrs,
                                    final boolean fresh) {
        Map<String, Long> existing = fresh ? Map.of() : indexVariations(catalog.listVariations(productId), attrs);
        ColourMediaCache colourMedia = new ColourMediaCache();
        int failed = 0;
        int created = 0;
        int updated = 0;

        for (ColorwayVariant cw : product.getVariantMatrix().colourways()) {
            Long mediaId = colourMedia.resolve(cw.getColourLabel(), () -> uploadFirst(cw.getImages()));
            for (SizeVariant size : cw.getSizeVariants()) {
                ObjectNode payload = payloads.variation(product, cw, size, attrs, mediaId);
                Long variationId = existing.get(AttributeTermResolver.variationKey(cw.getColourLabel(), size.size()));
                try {
                    if (variationId != null) {
                        catalog.updateVariation(productId, variationId, payload);
                        updated++;
                    } else {
                        catalog.createVariation(productId, payload);
                        created++;
                    }
                } catch (RemoteCatalogException ex) {
                    failed++;
                    log.warn("Variation {}/{} of #{} failed: {}", cw.getColourLabel(), size.size(),
                            productId, ex.getMessage());
                }
            }
        }
        log.debug("Variations of #{}: {} created, {} updated, {} failed", productId, created, updated, failed);
        return failed;
    }

    private static Map<String, Long> indexVariations(final List<JsonNode> remote,
                                                     final AttributeTermResolver.ProductAttributes attrs) {
        Map<String, Long> index = new HashMap<>();
        for (JsonNode v : remote) {
            String colour = null;
            String size = null;
            for (JsonNode a : v.path("attributes")) {
                long id = a.path("id").asLong(0);
                String name = a.path("name").asText("").toLowerCase(Locale.ROOT);
                if (id == attrs.colourAttributeId() || "color".equals(name) || "colour".equals(name)) {
                    colour = a.path("option").asText(null);
                } else if (id == attrs.sizeAttributeId() || "size".equals(name)) {
                    size = a.path("option").asText(null);
                }
            }
            if (colour != null && size != null) {
                index.putIfAbsent(AttributeTermResolver.variationKey(colour, size), v.path("id").asLong());
            }
        }
        return index;
    }

    /* ---- media -------------------------------------------------------- */

    /**
     * Stored images become uploaded media ({@code {id}}). When none of them could be uploaded
     * the remote URLs are sent instead ({@code {src}}).
     */
    private List<ObjectNode> productImages(final CanonicalProduct product) {
        List<ObjectNode> byId = new ArrayList<>();
        for (ProductImage image : product.getImages()) {
            Long id = upload(image);
            if (id != null) {
                byId.add(mapper.createObjectNode().put("id", id));
            }
        }
        if (!byId.isEmpty() || product.getImages().isEmpty()) {
            return byId;
        }
        log.warn("No image of {}:{} could be uploaded, sending source URLs", product.getSiteId(),
                product.getExternalId());
        List<ObjectNode> bySrc = new ArrayList<>();
        product.getImages().forEach(img -> bySrc.add(mapper.createObjectNode().put("src", img.url())));
        return bySrc;
    }

    private Long uploadFirst(final List<ProductImage> images) {
        for (ProductImage image : images) {
            Long id = upload(image);
            if (id != null) {
                return id;
            }
        }
        return null;
    }

    private Long upload(final ProductImage image) {
        String key = image.localPath();
        if (StringUtils.isBlank(key)) {
            return null;
        }
        Long known = uploaded.get(key);
        if (known != null) {
            return known;
        }
        Optional<byte[]> bytes = blobs.get(key);
        if (bytes.isEmpty()) {
            log.warn("Stored image {} is missing", key);
            return null;
        }
        String filename = StringUtils.substringAfterLast("/" + key, "/");
        String mime = MediaTypeFactory.getMediaType(filename).orElse(MediaType.IMAGE_JPEG).toString();
        try {
            long id = catalog.uploadMedia(bytes.get(), filename, mime, image.altText());
            uploaded.putIfAbsent(key, id);
            return uploaded.get(key);
        } catch (RemoteCatalogException ex) {
            log.warn("Upload of {} failed: {}", key, ex.getMessage());
            return null;
        }
    }

    /**
     * Media id per colour for one product. Checked before and after an upload, so two sizes
     * of one colour share a single upload; a failed upload is not retried for that colour.
     */
    static final class ColourMediaCache {

        private final Map<String, Long> ids = new ConcurrentHashMap<>();

        private final Map<String, Boolean> attempted = new ConcurrentHashMap<>();

        Long resolve(final String colour, final Supplier<Long> upload) {
            String key = colour.trim().toLowerCase(Locale.ROOT);
            Long id = ids.get(key);
            if (id != null || attempted.putIfAbsent(key, Boolean.TRUE) != null) {
                return id != null ? id : ids.get(key);
            }
            Long fresh = upload.get();
            if (fresh != null) {
                ids.putIfAbsent(key, fresh);
            }
            return ids.get(key);
        }
    }

    /* ---- mapping ------------------------------------------------------ */

    private SyncMapping mapping(final CanonicalProduct product,
                                final Long remoteId,
                                final SyncStatus status,
                                final JsonNode payload,
                                final int failedVariations) {
        return SyncMapping.builder()
                .siteId(product.getSiteId())
                .canonicalProductExternalId(product.getExternalId())
                .remoteProductId(remoteId)
                .lastSyncStatus(status)
                .lastSyncedAt(Instant.now())
                .lastPayloadSnapshot(payload == null ? null : payload.toString())
                .failedVariations(failedVariations)
                .build();
    }

    private ObjectNode errorPayload(final HarvestException ex) {
        ObjectNode error = mapper.createObjectNode();
        error.put("error", ex.getMessage());
        if (!(ex instanceof RemoteCatalogException)) {
            error.put("status", 0);
            return error;
        }
        RemoteCatalogException remote = (RemoteCatalogException) ex;
        error.put("status", remote.getStatus());
        if (StringUtils.isNotBlank(remote.getResponseBody())) {
            try {
                error.set("response", mapper.readTree(remote.getResponseBody()));
            } catch (JsonProcessingException parse) {
                error.put("response", remote.getResponseBody());
            }
        }
        return error;
    }

    private String displayName(final String siteId) {
        SiteCfg cfg = sites.forName(siteId);
        return cfg != null && StringUtils.isNotBlank(cfg.getDisplayName()) ? cfg.getDisplayName() : siteId;
    }
}
