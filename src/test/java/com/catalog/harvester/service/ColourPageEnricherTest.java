package com.catalog.harvester.service;

import com.catalog.harvester.config.SiteCfg;
import com.catalog.harvester.fetch.BrowserHeaderPool;
import com.catalog.harvester.fetch.FetchEngine;
import com.catalog.harvester.model.CanonicalProduct;
import com.catalog.harvester.model.ProductImage;
import com.catalog.harvester.model.ProductStatus;
import com.catalog.harvester.model.SizeVariant;
import com.catalog.harvester.parser.ExtractionContext;
import com.catalog.harvester.parser.ProductExtractor;
import com.catalog.harvester.support.StubExchange;
import com.catalog.harvester.support.TestConfigs;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ColourPageEnricherTest {

    private static final String DETAIL = "https://shop.test/p/tee/T1?color=black";

    private static final String DETAIL_HTML = """
            <html><body>
            <h1>Everyday Tee</h1>
            <span class="colour-name">Black</span>
            <img class="gallery" src="/img/black.jpg">
            <button class="size">S</button><button class="size" disabled>M</button>
            <a class="swatch" href="/p/tee/T1?color=black">Black</a>
            <a class="swatch" href="/p/tee/T1?color=red">Red</a>
            <a class="swatch" href="/p/tee/T1?color=blue">Blue</a>
            <a class="swatch" href="/p/tee/T1?color=green">Green</a>
            </body></html>
            """;

    private final StubExchange stub = StubExchange.of(req -> {
        String colour = req.url().getQuery();
        return switch (colour) {
            case "color=red" -> StubExchange.html(200, """
                    <html><body><span class="colour-name">Red</span>
                    <img class="gallery" src="/img/red.jpg">
                    <button class="size">L</button></body></html>
                    """);
            case "color=blue" -> StubExchange.html(200, """
                    <html><body><span class="colour-name">Blue</span>
                    <img class="gallery" src="/img/blue.jpg"></body></html>
                    """);
            default -> StubExchange.html(500, "down");
        };
    });

    private final ProductExtractor extractor = new ProductExtractor(TestConfigs.mapper());

    private final ColourPageEnricher enricher = new ColourPageEnricher(
            new FetchEngine(stub.webClient(), TestConfigs.fastFetch(1), new BrowserHeaderPool()), extractor);

    private static SiteCfg site() {
        SiteCfg site = new SiteCfg();
        site.setBaseUrl("https://shop.test");
        site.getSelectors().setColourLabel(List.of("span.colour-name"));
        site.getSelectors().setSizes(List.of("button.size"));
        site.getSelectors().setImages(List.of("img.gallery"));
        site.getSelectors().setColourLinks(List.of("a.swatch"));
        return site;
    }

    @Test
    void otherColourPagesAddColourwaysAndImages() {
        SiteCfg site = site();
        Document detail = Jsoup.parse(DETAIL_HTML, DETAIL);
        CanonicalProduct product = extractor.extract(DETAIL_HTML, ExtractionContext.of("shop", site, DETAIL));
        assertThat(product.getVariantMatrix().colourLabels()).containsExactly("Black");

        CanonicalProduct enriched = enricher.enrich(product, detail, site);

        assertThat(enriched.getVariantMatrix().colourLabels()).containsExactly("Black", "Red");
        assertThat(enriched.getVariantMatrix().colourways().get(1).getSizeVariants())
                .extracting(SizeVariant::size)
                .containsExactly("L");
        assertThat(enriched.getImages())
                .extracting(ProductImage::url)
                .contains("https://shop.test/img/black.jpg",
                        "https://shop.test/img/red.jpg",
                        "https://shop.test/img/blue.jpg");
        assertThat(enriched.getStatus()).isEqualTo(ProductStatus.PUBLISHED);
        assertThat(enriched.getMeta()).containsEntry("available_colours", "[\"Black\",\"Red\"]");
        assertThat(enriched.getMeta()).containsEntry("available_sizes_by_colour", "{\"Black\":[\"S\"],\"Red\":[\"L\"]}");
        assertThat(stub.requests())
                .extracting(r -> r.url().getQuery())
                .containsExactlyInAnyOrder("color=red", "color=blue", "color=green");
    }

    @Test
    void nothingToVisitLeavesTheProductAlone() {
        SiteCfg site = site();
        site.getSelectors().setColourLinks(List.of());
        CanonicalProduct product = extractor.extract(DETAIL_HTML, ExtractionContext.of("shop", site, DETAIL));

        CanonicalProduct enriched = enricher.enrich(product, Jsoup.parse(DETAIL_HTML, DETAIL), site);

        assertThat(enriched).isSameAs(product);
        assertThat(stub.requests()).isEmpty();
    }
}
