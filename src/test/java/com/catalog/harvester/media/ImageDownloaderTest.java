package com.catalog.harvester.media;

import com.catalog.harvester.model.CanonicalProduct;
import com.catalog.harvester.model.ColorwayVariant;
import com.catalog.harvester.model.ProductImage;
import com.catalog.harvester.model.ProductStatus;
import com.catalog.harvester.model.SizeVariant;
import com.catalog.harvester.model.VariantMatrix;
import com.catalog.harvester.support.StubExchange;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ImageDownloaderTest {

    @TempDir
    Path root;

    private final StubExchange cdn = StubExchange.of(req -> switch (req.url().getPath()) {
        case "/a.png", "/moved.webp" -> StubExchange.html(200, "bytes of " + req.url().getPath());
        case "/old.webp" -> StubExchange.redirect(301, "/moved.webp");
        default -> StubExchange.html(404, "");
    });

    private CanonicalProduct product() {
        ProductImage shared = ProductImage.of("https://cdn.test/a.png", "front");
        return CanonicalProduct.builder()
                .siteId("Shop One")
                .externalId("SKU 1")
                .title("Tee")
                .status(ProductStatus.PUBLISHED)
                .images(List.of(shared.withPrimary(true), ProductImage.of("https://cdn.test/missing.jpg", null)))
                .variantMatrix(VariantMatrix.of(List.of(ColorwayVariant.builder()
                        .colourLabel("Black")
                        .images(List.of(shared, ProductImage.of("https://cdn.test/old.webp?w=800", null)))
                        .sizeVariants(List.of(SizeVariant.of("M", true)))
                        .build())))
                .build();
    }

    @Test
    void storesEachUrlOnceAndFollowsRedirects() {
        FileSystemBlobStore blobs = new FileSystemBlobStore(root);
        ImageDownloader downloader = new ImageDownloader(cdn.webClient(), blobs, Duration.ofSeconds(5));

        CanonicalProduct localised = downloader.localise(product());

        ProductImage front = localised.getImages().get(0);
        assertThat(front.localPath()).startsWith("images/shop-one/sku-1/").endsWith(".png");
        assertThat(front.primary()).isTrue();
        assertThat(localised.getImages().get(1).localPath()).isNull();

        List<ProductImage> colour = localised.getVariantMatrix().colourways().get(0).getImages();
        assertThat(colour.get(0).localPath()).isEqualTo(front.localPath());
        assertThat(colour.get(1).localPath()).endsWith(".webp");
        assertThat(blobs.get(colour.get(1).localPath()))
                .hasValueSatisfying(b -> assertThat(new String(b, StandardCharsets.UTF_8)).isEqualTo("bytes of /moved.webp"));

        assertThat(cdn.requests()).extracting(r -> r.url().getPath())
                .containsExactly("/a.png", "/missing.jpg", "/old.webp", "/moved.webp");
    }

    @Test
    void alreadyStoredImagesAreNotDownloadedAgain() {
        FileSystemBlobStore blobs = new FileSystemBlobStore(root);
        new ImageDownloader(cdn.webClient(), blobs, Duration.ofSeconds(5)).localise(product());
        int first = cdn.requests().size();

        new ImageDownloader(cdn.webClient(), blobs, Duration.ofSeconds(5)).localise(product());

        assertThat(cdn.requests().size() - first).isEqualTo(1);
        assertThat(cdn.requests().get(cdn.requests().size() - 1).url().getPath()).isEqualTo("/missing.jpg");
    }

    @Test
    void extensionComesFromThePathOnly() {
        assertThat(ImageDownloader.extensionOf("https://cdn.test/x/photo.JPEG?fmt=png")).isEqualTo(".jpeg");
        assertThat(ImageDownloader.extensionOf("https://cdn.test/x/photo.avif#frag")).isEqualTo(".avif");
        assertThat(ImageDownloader.extensionOf("https://cdn.test/is/image/ABC_123")).isEqualTo(".jpg");
        assertThat(ImageDownloader.extensionOf("https://cdn.test/x.v2/photo")).isEqualTo(".jpg");
    }
}
