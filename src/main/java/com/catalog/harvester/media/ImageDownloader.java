package com.catalog.harvester.media;

import com.catalog.harvester.config.HarvestProperties;
import com.catalog.harvester.fetch.BrowserHeaderPool;
import com.catalog.harvester.model.CanonicalProduct;
import com.catalog.harvester.model.ColorwayVariant;
import com.catalog.harvester.model.ProductImage;
import com.catalog.harvester.model.Slugs;
import com.catalog.harvester.model.VariantMatrix;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.util.DigestUtils;
import org.springframework.web.reactive.function.client.WebClient;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Downloads product and colourway images into the {@link BlobStore} and records the
 * stored key as {@link ProductImage#localPath()}.
 * <p>
 * A failed download leaves the image with its remote URL only. Keys are derived from
 * the image URL, so an image that is already stored is not downloaded again.
 * </p>
 */
@Slf4j
@Component
public class ImageDownloader {

    private static final int MAX_REDIRECTS = 3;

    private final WebClient webClient;

    private final BlobStore blobs;

    private final Duration timeout;

    private final BrowserHeaderPool headers = new BrowserHeaderPool();

    @Autowired
    public ImageDownloader(@Qualifier("fetchWebClient") final WebClient webClient,
                           final BlobStore blobs,
                           final HarvestProperties props) {
        this(webClient, blobs, props.getFetch().getRequestTimeout());
    }

    public ImageDownloader(final WebClient webClient, final BlobStore blobs, final Duration timeout) {
        this.webClient = webClient;
        this.blobs = blobs;
        this.timeout = timeout;
    }

    /**
     * Returns a copy of the product whose images (gallery and colourways) point at local copies.
     */
    public CanonicalProduct localise(final CanonicalProduct product) {
        Map<String, String> stored = new HashMap<>();
        String folder = "images/" + Slugs.slugify(product.getSiteId()) + "/" + Slugs.slugify(product.getExternalId());

        List<ProductImage> gallery = localise(product.getImages(), folder, stored);
        VariantMatrix matrix = product.getVariantMatrix();
        if (matrix != null) {
            List<ColorwayVariant> colourways = matrix.colourways().stream()
                    .map(cw -> cw.toBuilder().images(localise(cw.getImages(), folder, stored)).build())
                    .toList();
            matrix = VariantMatrix.of(colourways);
        }
        long ok = stored.values().stream().filter(StringUtils::isNotEmpty).count();
        log.info("Images for {}:{} stored {}/{}", product.getSiteId(), product.getExternalId(), ok, stored.size());
        return product.toBuilder().images(gallery).variantMatrix(matrix).build();
    }

    private List<ProductImage> localise(final List<ProductImage> images,
                                        final String folder,
                                        final Map<String, String> stored) {
        return images.stream()
                .map(img -> {
                    if (StringUtils.isNotBlank(img.localPath())) {
                        return img;
                    }
                    String key = stored.computeIfAbsent(img.url(), url -> store(url, folder));
                    return key.isEmpty() ? img : img.withLocalPath(key);
                })
                .toList();
    }

    /** Downloads one image; an empty string marks a failure so the URL is not tried twice. */
    private String store(final String url, final String folder) {
        String key = folder + "/" + DigestUtils.md5DigestAsHex(url.getBytes(StandardCharsets.UTF_8))
                + extensionOf(url);
        if (blobs.exists(key)) {
            return key;
        }
        try {
            byte[] bytes = download(url);
            if (bytes == null || bytes.length == 0) {
                return "";
            }
            return blobs.put(key, bytes);
        } catch (RuntimeException ex) {
            log.warn("Image {} not stored: {}", url, ex.getMessage());
            return "";
        }
    }

    private byte[] download(final String url) {
        String current = url;
        for (int hop = 0; hop <= MAX_REDIRECTS; hop++) {
            final String target = current;
            ResponseEntity<byte[]> response = webClient.get()
                    .uri(URI.create(target))
                    .headers(h -> headers.apply(h, target, false))
                    .exchangeToMono(resp -> resp.toEntity(byte[].class))
                    .timeout(timeout)
                    .block();
            if (response == null) {
                return null;
            }
            int status = response.getStatusCode().value();
            URI location = response.getHeaders().getLocation();
            if (status >= 300 && status < 400 && location != null) {
                current = URI.create(target).resolve(location).toString();
                continue;
            }
            if (status != 200) {
                log.warn("Image {} answered HTTP {}", target, status);
                return null;
            }
            return response.getBody();
        }
        log.warn("Image {} redirected more than {} times", url, MAX_REDIRECTS);
        return null;
    }

    static String extensionOf(final String url) {
        String path = StringUtils.substringBefore(StringUtils.substringBefore(url, "?"), "#");
        String ext = StringUtils.substringAfterLast(StringUtils.substringAfterLast(path, "/"), ".")
                .toLowerCase(Locale.ROOT);
        return switch (ext) {
            case "jpg", "jpeg", "png", "webp", "gif", "avif" -> "." + ext;
            default -> ".jpg";
        };
    }
}
