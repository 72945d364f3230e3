package com.catalog.harvester.sync;

import com.catalog.harvester.config.CatalogProperties;
import com.catalog.harvester.config.SiteCfg;
import com.catalog.harvester.config.SiteProperties;
import com.catalog.harvester.exception.HarvestException;
import com.catalog.harvester.exception.RemoteCatalogException;
import com.catalog.harvester.media.BlobStore;
import com.catalog.harvester.media.FileSystemBlobStore;
import com.catalog.harvester.model.CanonicalProduct;
import com.catalog.harvester.model.ColorwayVariant;
import com.catalog.harvester.model.ProductImage;
import com.catalog.harvester.model.ProductStatus;
import com.catalog.harvester.model.SizeVariant;
import com.catalog.harvester.model.SyncMapping;
import com.catalog.harvester.model.SyncStatus;
import com.catalog.harvester.model.VariantMatrix;
import com.catalog.harvester.support.TestConfigs;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class CatalogSyncServiceTest {

    @TempDir
    Path storage;

    private final ObjectMapper mapper = TestConfigs.mapper();

    private final FakeRemoteCatalog catalog = new FakeRemoteCatalog();

    private final InMemorySyncMappingStore mappings = new InMemorySyncMappingStore();

    private CatalogSyncService service;

    private FileSystemBlobStore blobs;

    private SiteProperties sites;

    @BeforeEach
    void setUp() {
        FileSystemBlobStore blobs = new FileSystemBlobStore(storage);
        for (String name : List.of("main", "black", "white")) {
            blobs.put(key(name), name.getBytes(StandardCharsets.UTF_8));
        }
        SiteCfg site = new SiteCfg();
        site.setDisplayName("Lululemon");
        SiteProperties sites = new SiteProperties();
        sites.getConfigs().put("lululemon", site);

        this.blobs = blobs;
        this.sites = sites;
        service = serviceWith(blobs);
    }

    private CatalogSyncService serviceWith(final BlobStore store) {
        CatalogProperties props = new CatalogProperties();
        return new CatalogSyncService(catalog,
                new AttributeTermResolver(catalog, props, mapper),
                new CategoryResolver(catalog, props),
                new ProductPayloadBuilder(new PricingPolicy(props), new ProductWeightDetector(), mapper),
                store, mappings, sites, mapper);
    }

    private static String key(final String name) {
        return "images/lululemon/lw1/" + name + ".jpg";
    }

    private static ProductImage stored(final String name) {
        return new ProductImage("https://img.test/" + name + ".jpg", name, key(name), false);
    }

    private static CanonicalProduct variableProduct() {
        return CanonicalProduct.builder()
                .siteId("lululemon")
                .externalId("LW1")
                .title("Align Tank")
                .description("Buttery soft.")
                .slug("align-tank")
                .price(new BigDecimal("48"))
                .currency("CAD")
                .status(ProductStatus.PUBLISHED)
                .images(List.of(stored("main").withPrimary(true)))
                .variantMatrix(VariantMatrix.of(List.of(
                        ColorwayVariant.builder().colourLabel("Black").images(List.of(stored("black")))
                                .sizeVariants(List.of(new SizeVariant("S", "sku-s", true, null),
                                        new SizeVariant("M", null, false, null)))
                                .build(),
                        ColorwayVariant.builder().colourLabel("White").images(List.of(stored("white")))
                                .basePrice(new BigDecimal("39"))
                                .sizeVariants(List.of(SizeVariant.of("L", true)))
                                .build())))
                .meta(Map.of("brand", "lululemon"))
                .sourceUrl("https://shop.test/p/align-tank/LW1")
                .build();
    }

    @Test
    void firstSyncCreatesAndSecondUpdates() {
        SyncMapping first = service.sync(variableProduct());
        long id = first.getRemoteProductId();

        SyncMapping second = service.sync(variableProduct());

        assertThat(first.getLastSyncStatus()).isEqualTo(SyncStatus.SUCCESS);
        assertThat(second.getLastSyncStatus()).isEqualTo(SyncStatus.SUCCESS);
        assertThat(second.getRemoteProductId()).isEqualTo(id);
        assertThat(catalog.productCreates).hasValue(1);
        assertThat(catalog.productUpdates).hasValue(1);
        assertThat(catalog.variationsOf(id)).hasSize(3);
        assertThat(catalog.variationUpdates).hasValue(3);
        assertThat(catalog.categories).hasSize(1);
        assertThat(mappings.all()).hasSize(1);
    }

    @Test
    void productPayloadCarriesVariableShape() {
        long id = service.sync(variableProduct()).getRemoteProductId();

        ObjectNode remote = catalog.products.get(id);
        assertThat(remote.path("type").asText()).isEqualTo("variable");
        assertThat(remote.path("status").asText()).isEqualTo("publish");
        assertThat(remote.path("sku").asText()).isEqualTo("LW1");
        assertThat(remote.path("attributes")).hasSize(2);
        assertThat(remote.path("categories").get(0).path("id").asLong())
                .isEqualTo(catalog.categories.get(0).path("id").asLong());
        assertThat(remote.path("meta_data").findValuesAsText("key")).contains("brand", "weblink");
        assertThat(remote.path("images").get(0).has("id")).isTrue();

        List<ObjectNode> variations = catalog.variationsOf(id);
        assertThat(variations).extracting(v -> v.path("sku").asText())
                .containsExactly("sku-s", "LW1-BLA-M", "LW1-WHI-L");
        assertThat(variations).extracting(v -> v.path("regular_price").asText())
                .containsExactly("48.00", "48.00", "39.00");
        assertThat(variations).extracting(v -> v.path("stock_quantity").asInt())
                .containsExactly(1, 0, 1);
    }

    @Test
    void eachColourImageIsUploadedOnce() {
        long id = service.sync(variableProduct()).getRemoteProductId();
        service.sync(variableProduct());

        assertThat(catalog.uploads).containsExactly("main.jpg", "black.jpg", "white.jpg");
        List<ObjectNode> variations = catalog.variationsOf(id);
        JsonNode blackS = variations.get(0).path("image").path("id");
        JsonNode blackM = variations.get(1).path("image").path("id");
        JsonNode whiteL = variations.get(2).path("image").path("id");
        assertThat(blackS.asLong()).isPositive().isEqualTo(blackM.asLong());
        assertThat(whiteL.asLong()).isNotEqualTo(blackS.asLong());
    }

    @Test
    void failedVariationIsCountedButDoesNotFailTheProduct() {
        catalog.rejectVariation = v -> "M".equals(v.path("attributes").get(1).path("option").asText());

        SyncMapping mapping = service.sync(variableProduct());

        assertThat(mapping.getLastSyncStatus()).isEqualTo(SyncStatus.SUCCESS);
        assertThat(mapping.getFailedVariations()).isEqualTo(1);
        assertThat(catalog.variationsOf(mapping.getRemoteProductId())).hasSize(2);
    }

    @Test
    void remoteErrorIsRecordedAndKeepsTheKnownId() {
        long id = service.sync(variableProduct()).getRemoteProductId();
        catalog.productFailure = new RemoteCatalogException("Internal error", 500, "{\"code\":\"internal\"}");

        SyncMapping failed = service.sync(variableProduct());

        assertThat(failed.getLastSyncStatus()).isEqualTo(SyncStatus.FAILED);
        assertThat(failed.getRemoteProductId()).isEqualTo(id);
        assertThat(failed.getLastPayloadSnapshot())
                .contains("\"error\":\"Internal error\"", "\"status\":500", "\"code\":\"internal\"");
        assertThat(mappings.find(variableProduct().key())).contains(failed);
    }

    @Test
    void failedCreateLeavesNoIdAndTheNextRunCreates() {
        catalog.productFailure = new RemoteCatalogException("timeout", new RuntimeException("read timed out"));
        SyncMapping failed = service.sync(variableProduct());
        catalog.productFailure = null;

        SyncMapping retried = service.sync(variableProduct());

        assertThat(failed.getRemoteProductId()).isNull();
        assertThat(failed.getLastSyncStatus()).isEqualTo(SyncStatus.FAILED);
        assertThat(retried.getLastSyncStatus()).isEqualTo(SyncStatus.SUCCESS);
        assertThat(catalog.productCreates).hasValue(1);
    }

    @Test
    void simpleProductWithUnstoredImagesSendsSourceUrls() {
        CanonicalProduct simple = variableProduct().toBuilder()
                .variantMatrix(null)
                .status(ProductStatus.OUT_OF_STOCK)
                .images(List.of(ProductImage.of("https://img.test/remote.jpg", null)))
                .build();

        long id = service.sync(simple).getRemoteProductId();

        ObjectNode remote = catalog.products.get(id);
        assertThat(remote.path("type").asText()).isEqualTo("simple");
        assertThat(remote.path("status").asText()).isEqualTo("draft");
        assertThat(remote.path("stock_status").asText()).isEqualTo("outofstock");
        assertThat(remote.path("regular_price").asText()).isEqualTo("48.00");
        assertThat(remote.path("images").get(0).path("src").asText()).isEqualTo("https://img.test/remote.jpg");
        assertThat(catalog.variationsOf(id)).isEmpty();
        assertThat(catalog.uploads).isEmpty();
    }

    @Test
    void unreadableColourImageFailsTheSyncAndKeepsTheCreatedId() {
        BlobStore broken = new BlobStore() {
            @Override
            public String put(final String key, final byte[] bytes) {
                return blobs.put(key, bytes);
            }

            @Override
            public Optional<byte[]> get(final String key) {
                if (key.endsWith("black.jpg")) {
                    throw new HarvestException("Cannot read blob " + key + ": disk error");
                }
                return blobs.get(key);
            }

            @Override
            public boolean exists(final String key) {
                return blobs.exists(key);
            }
        };

        SyncMapping failed = serviceWith(broken).sync(variableProduct());

        assertThat(failed.getLastSyncStatus()).isEqualTo(SyncStatus.FAILED);
        assertThat(failed.getRemoteProductId()).isNotNull();
        assertThat(catalog.products).containsKey(failed.getRemoteProductId());
        assertThat(failed.getLastPayloadSnapshot()).contains("disk error", "\"status\":0");
        assertThat(mappings.find(variableProduct().key())).contains(failed);

        SyncMapping retried = service.sync(variableProduct());

        assertThat(retried.getLastSyncStatus()).isEqualTo(SyncStatus.SUCCESS);
        assertThat(catalog.productCreates).hasValue(1);
        assertThat(catalog.productUpdates).hasValue(1);
    }
}
