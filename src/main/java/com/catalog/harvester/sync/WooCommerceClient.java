package com.catalog.harvester.sync;

import com.catalog.harvester.config.CatalogProperties;
import com.catalog.harvester.exception.ConfigurationException;
import com.catalog.harvester.exception.RemoteCatalogException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.client.MultipartBodyBuilder;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * <h2>WooCommerce REST client</h2>
 *
 * <p>Talks to {@code {base-url}/wp-json/{api-version}} with the consumer key/secret as
 * HTTP Basic credentials. Media goes to {@code {base-url}/wp-json/wp/v2/media} with the
 * WordPress application password when one is configured.</p>
 *
 * <p>List endpoints are read with {@code page}/{@code per_page} until a short page comes
 * back, capped at {@code catalog.max-pages} pages.</p>
 */
@Slf4j
@Component
public class WooCommerceClient implements RemoteCatalog {

    private static final String MEDIA_PATH = "/wp-json/wp/v2/media";

    private final CatalogProperties cfg;

    private final WebClient webClient;

    private final ObjectMapper mapper;

    @Autowired
    public WooCommerceClient(final CatalogProperties cfg,
                             final WebClient.Builder builder,
                             @Qualifier("harvesterObjectMapper") final ObjectMapper mapper) {
        this(cfg, builder.clone().build(), mapper);
    }

    WooCommerceClient(final CatalogProperties cfg, final WebClient webClient, final ObjectMapper mapper) {
        this.cfg = cfg;
        this.webClient = webClient;
        this.mapper = mapper;
    }

    /* ---- taxonomy ----------------------------------------------------- */

    @Override
    public List<JsonNode> listAttributes() {
        return listAll("/products/attributes");
    }

    @Override
    public JsonNode createAttribute(final String name, final String slug) {
        return send(HttpMethod.POST, api("/products/attributes", Map.of()), Map.of(
                "name", name,
                "slug", slug,
                "type", "select",
                "order_by", "menu_order",
                "has_archives", false));
    }

    @Override
    public List<JsonNode> listTerms(final long attributeId) {
        return listAll("/products/attributes/" + attributeId + "/terms");
    }

    @Override
    public JsonNode createTerm(final long attributeId, final String name, final String slug) {
        return send(HttpMethod.POST, api("/products/attributes/" + attributeId + "/terms", Map.of()),
                Map.of("name", name, "slug", slug));
    }

    @Override
    public List<JsonNode> listCategories() {
        return listAll("/products/categories");
    }

    @Override
    public JsonNode createCategory(final String name, final String slug) {
        return send(HttpMethod.POST, api("/products/categories", Map.of()), Map.of("name", name, "slug", slug));
    }

    /* ---- products ----------------------------------------------------- */

    @Override
    public JsonNode createProduct(final JsonNode payload) {
        return send(HttpMethod.POST, api("/products", Map.of()), payload);
    }

    @Override
    public JsonNode updateProduct(final long productId, final JsonNode payload) {
        return send(HttpMethod.PUT, api("/products/" + productId, Map.of()), payload);
    }

    @Override
    public List<JsonNode> listVariations(final long productId) {
        return listAll("/products/" + productId + "/variations");
    }

    @Override
    public JsonNode createVariation(final long productId, final JsonNode payload) {
        return send(HttpMethod.POST, api("/products/" + productId + "/variations", Map.of()), payload);
    }

    @Override
    public JsonNode updateVariation(final long productId, final long variationId, final JsonNode payload) {
        return send(HttpMethod.PUT, api("/products/" + productId + "/variations/" + variationId, Map.of()), payload);
    }

    /* ---- media -------------------------------------------------------- */

    @Override
    public long uploadMedia(final byte[] bytes, final String filename, final String mimeType, final String altText) {
        MultipartBodyBuilder parts = new MultipartBodyBuilder();
        parts.part("file", new ByteArrayResource(bytes) {
            @Override
            public String getFilename() {
                return filename;
            }
        }).contentType(MediaType.parseMediaType(mimeType));
        if (StringUtils.isNotBlank(altText)) {
            parts.part("alt_text", altText);
        }

        URI uri = URI.create(root() + MEDIA_PATH);
        JsonNode response = exchange(HttpMethod.POST, uri, spec -> spec
                .headers(this::mediaAuth)
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + filename + "\"")
                .body(BodyInserters.fromMultipartData(parts.build())));
        long id = response.path("id").asLong(0);
        if (id == 0) {
            throw new RemoteCatalogException("Media upload of " + filename + " returned no id", 200, response.toString());
        }
        log.debug("Uploaded media {} as #{}", filename, id);
        return id;
    }

    /* ---- HTTP helpers ------------------------------------------------- */

    private List<JsonNode> listAll(final String path) {
        List<JsonNode> all = new ArrayList<>();
        for (int page = 1; page <= cfg.getMaxPages(); page++) {
            JsonNode batch = send(HttpMethod.GET,
                    api(path, Map.of("page", page, "per_page", cfg.getPerPage())), null);
            if (!batch.isArray()) {
                break;
            }
            batch.forEach(all::add);
            if (batch.size() < cfg.getPerPage()) {
                break;
            }
            if (page == cfg.getMaxPages()) {
                log.warn("Stopped paging {} after {} pages", path, page);
            }
        }
        return all;
    }

    private JsonNode send(final HttpMethod method, final URI uri, final Object body) {
        return exchange(method, uri, spec -> {
            WebClient.RequestBodySpec authed = spec.headers(h -> h.setBasicAuth(cfg.getConsumerKey(), cfg.getConsumerSecret()));
            return body == null
                    ? authed
                    : authed.contentType(MediaType.APPLICATION_JSON).bodyValue(body);
        });
    }

    private record Raw(int status, String body) {
    }

    private JsonNode exchange(final HttpMethod method, final URI uri,
                              final Function<WebClient.RequestBodySpec, WebClient.RequestHeadersSpec<?>> customizer) {
        final Raw raw;
        try {
            raw = customizer.apply(webClient.method(method).uri(uri))
                    .accept(MediaType.APPLICATION_JSON)
                    .exchangeToMono(resp -> resp.bodyToMono(String.class)
                            .defaultIfEmpty("")
                            .map(b -> new Raw(resp.statusCode().value(), b)))
                    .timeout(cfg.getTimeout())
                    .block();
        } catch (RuntimeException ex) {
            throw new RemoteCatalogException(method + " " + uri.getPath() + " failed: " + ex.getMessage(), ex);
        }
        if (raw == null) {
            throw new RemoteCatalogException(method + " " + uri.getPath() + " returned nothing", 0, "");
        }
        if (raw.status() < 200 || raw.status() >= 300) {
            log.warn("{} {} -> HTTP {}: {}", method, uri.getPath(), raw.status(), StringUtils.abbreviate(raw.body(), 300));
            throw new RemoteCatalogException(method + " " + uri.getPath() + " -> HTTP " + raw.status(),
                    raw.status(), raw.body());
        }
        if (StringUtils.isBlank(raw.body())) {
            return MissingNode.getInstance();
        }
        try {
            return mapper.readTree(raw.body());
        } catch (JsonProcessingException ex) {
            throw new RemoteCatalogException(method + " " + uri.getPath() + " returned invalid JSON",
                    raw.status(), raw.body());
        }
    }

    private URI api(final String path, final Map<String, Object> query) {
        UriComponentsBuilder b = UriComponentsBuilder.fromHttpUrl(root())
                .path("/wp-json/")
                .path(StringUtils.strip(cfg.getApiVersion(), "/"))
                .path(path);
        query.forEach(b::queryParam);
        return b.build().encode().toUri();
    }

    private String root() {
        if (StringUtils.isBlank(cfg.getBaseUrl())) {
            throw new ConfigurationException("catalog.base-url is not set");
        }
        return StringUtils.removeEnd(cfg.getBaseUrl().trim(), "/");
    }

    private void mediaAuth(final HttpHeaders headers) {
        if (StringUtils.isNotBlank(cfg.getWpUsername()) && StringUtils.isNotBlank(cfg.getWpAppPassword())) {
            headers.setBasicAuth(cfg.getWpUsername(), cfg.getWpAppPassword());
        } else {
            headers.setBasicAuth(cfg.getConsumerKey(), cfg.getConsumerSecret());
        }
    }
}
