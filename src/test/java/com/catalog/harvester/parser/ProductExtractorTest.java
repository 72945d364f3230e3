package com.catalog.harvester.parser;

import com.catalog.harvester.config.SiteCfg;
import com.catalog.harvester.exception.MalformedSourceException;
import com.catalog.harvester.model.CanonicalProduct;
import com.catalog.harvester.model.ColorwayVariant;
import com.catalog.harvester.model.ProductStatus;
import com.catalog.harvester.model.SizeVariant;
import com.catalog.harvester.support.TestConfigs;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProductExtractorTest {

    private static final String URL = "https://shop.test/p/align-tank/LW1234.html";

    private final ObjectMapper mapper = TestConfigs.mapper();

    private final ProductExtractor extractor = new ProductExtractor(mapper);

    private static String nextDataPage(final String blackStock, final String whiteStock) {
        return """
                <html><head><title>Ignored title</title></head><body>
                <h1>Align Tank Top</h1>
                <script id="__NEXT_DATA__" type="application/json">
                {"props":{"pageProps":{"product":{
                  "productId":"LW1234","name":"Align Tank","description":"Buttery soft.",
                  "price":{"price":48,"currency":"CAD"},
                  "colourways":[
                    {"id":"c1","colour":"Black","images":["//img.test/black-1.jpg","//img.test/black-2.jpg"],
                     "variants":[{"size":"S","id":"sku-s","stockAvailability":"%s"},
                                 {"size":"M","id":"sku-m","stockAvailability":"OUT_OF_STOCK"}]},
                    {"id":"c2","colour":"White","images":["//img.test/white-1.jpg"],
                     "variants":[{"size":"L","id":"sku-l","stockAvailability":"%s"}]}
                  ]}}}}
                </script></body></html>
                """.formatted(blackStock, whiteStock);
    }

    private static SiteCfg site() {
        SiteCfg site = new SiteCfg();
        site.setBaseUrl("https://shop.test");
        site.setDisplayName("Shop");
        return site;
    }

    @Test
    void embeddedColourwaysBecomeTheVariantMatrix() {
        CanonicalProduct p = extractor.extract(nextDataPage("IN_STOCK", "IN_STOCK"),
                ExtractionContext.of("shop", site(), URL));

        assertThat(p.getExternalId()).isEqualTo("LW1234");
        assertThat(p.getTitle()).isEqualTo("Align Tank");
        assertThat(p.getSlug()).isEqualTo("align-tank");
        assertThat(p.getPrice()).isEqualByComparingTo("48");
        assertThat(p.getCurrency()).isEqualTo("CAD");
        assertThat(p.getStatus()).isEqualTo(ProductStatus.PUBLISHED);
        assertThat(p.isVariable()).isTrue();
        assertThat(p.getVariantMatrix().colourLabels()).containsExactly("Black", "White");
        assertThat(p.getVariantMatrix().sizeVariantCount()).isEqualTo(3);
        assertThat(p.getVariantMatrix().colourways().get(0).getSizeVariants())
                .extracting(SizeVariant::sku)
                .containsExactly("sku-s", "sku-m");
        assertThat(p.getImages()).hasSize(3);
        assertThat(p.getImages().get(0).url()).isEqualTo("https://img.test/black-1.jpg");
        assertThat(p.getImages().get(0).primary()).isTrue();
        assertThat(p.getImages().subList(1, 3)).noneMatch(i -> i.primary());
        assertThat(p.getMeta()).containsEntry("available_colours", "[\"Black\",\"White\"]");
        assertThat(p.getMeta()).containsEntry("available_sizes_by_colour", "{\"Black\":[\"S\"],\"White\":[\"L\"]}");
        assertThat(p.getSourceUrl()).isEqualTo(URL);
    }

    @Test
    void outOfStockOnlyWhenNoSizeIsAvailable() {
        CanonicalProduct oneLeft = extractor.extract(nextDataPage("OUT_OF_STOCK", "IN_STOCK"),
                ExtractionContext.of("shop", site(), URL));
        CanonicalProduct none = extractor.extract(nextDataPage("OUT_OF_STOCK", "OUT_OF_STOCK"),
                ExtractionContext.of("shop", site(), URL));

        assertThat(oneLeft.getStatus()).isEqualTo(ProductStatus.PUBLISHED);
        assertThat(none.getStatus()).isEqualTo(ProductStatus.OUT_OF_STOCK);
        assertThat(none.getVariantMatrix().sizeVariantCount()).isEqualTo(3);
    }

    @Test
    void sideChannelColourIsMergedWithTheSameEmbeddedColour() throws Exception {
        JsonNode side = mapper.readTree("""
                {"black":{"images":["https://img.test/side-black.jpg"],
                          "sizes":{"available":["XS"],"unavailable":["S"]},
                          "price":"$48.00","discount_price":"$39.00"}}
                """);
        CanonicalProduct p = extractor.extract(nextDataPage("IN_STOCK", "IN_STOCK"),
                new ExtractionContext("shop", site(), URL, URL, side));

        assertThat(p.getVariantMatrix().colourLabels()).containsExactly("black", "White");
        ColorwayVariant black = p.getVariantMatrix().colourways().get(0);
        assertThat(black.getSizeVariants()).extracting(SizeVariant::size).containsExactly("XS", "S", "M");
        assertThat(black.getSizeVariants().get(1).stockAvailable()).isFalse();
        assertThat(black.resolvePrice(black.getSizeVariants().get(0))).isEqualByComparingTo("39.00");
        assertThat(black.getImages()).extracting(i -> i.url())
                .containsExactly("https://img.test/side-black.jpg", "https://img.test/black-1.jpg",
                        "https://img.test/black-2.jpg");
    }

    @Test
    void domSelectorsServeTemplatesWithoutEmbeddedState() {
        SiteCfg site = site();
        site.getSelectors().setSizes(List.of(".sizes button"));
        site.getSelectors().setColourLabel(List.of(".colour-name"));
        site.getSelectors().setPrice(List.of(".price-now"));
        site.getSelectors().setImages(List.of(".gallery img"));
        String html = """
                <html><body>
                <h1>Classic Tee</h1>
                <span class="price-now">$59.00</span><s>$79.00</s>
                <span class="colour-name">Navy</span>
                <div class="gallery"><img src="/img/tee-1.jpg" alt="front"><img src="/img/tee-2.jpg"></div>
                <div class="sizes"><button>S</button><button disabled>M</button><button>L</button></div>
                </body></html>
                """;

        CanonicalProduct p = extractor.extract(html, ExtractionContext.of("shop", site, "https://shop.test/p/tee/prod123.html"));

        assertThat(p.getExternalId()).isEqualTo("prod123");
        assertThat(p.getTitle()).isEqualTo("Classic Tee");
        assertThat(p.getPrice()).isEqualByComparingTo("59.00");
        assertThat(p.getCurrency()).isEqualTo("USD");
        assertThat(p.getMeta()).containsEntry("original_price", "79.00").containsEntry("discount", "25.32");
        assertThat(p.getVariantMatrix().colourLabels()).containsExactly("Navy");
        assertThat(p.getVariantMatrix().colourways().get(0).getSizeVariants())
                .extracting(SizeVariant::stockAvailable)
                .containsExactly(true, false, true);
        assertThat(p.getImages()).extracting(i -> i.url())
                .containsExactly("https://shop.test/img/tee-1.jpg", "https://shop.test/img/tee-2.jpg");
    }

    @Test
    void flatVariantDocumentFallsBackToVariantPrice() {
        String json = """
                {"id":"X1","name":"Trail Sock","variants":[
                  {"color":"Red","size":"M","available":true,"price":"29.99"},
                  {"color":"Red","size":"L","available":false,"price":"29.99"},
                  {"color":"Blue","size":"M","available":true,"price":"31.50"}]}
                """;

        CanonicalProduct p = extractor.extract(json, ExtractionContext.of("shop", site(), "https://api.shop.test/products/X1"));

        assertThat(p.getExternalId()).isEqualTo("X1");
        assertThat(p.getPrice()).isEqualByComparingTo(new BigDecimal("29.99"));
        assertThat(p.getVariantMatrix().colourLabels()).containsExactly("Red", "Blue");
        assertThat(p.getVariantMatrix().sizeVariantCount()).isEqualTo(3);
    }

    @Test
    void singleSkuProductUsesTheOutOfStockMarker() {
        SiteCfg site = site();
        site.getSelectors().setOutOfStock(".sold-out");
        String html = "<html><body><h1>Gift Card</h1><span class=\"price\">$25</span>"
                + "<div class=\"sold-out\">Sold out</div></body></html>";

        CanonicalProduct p = extractor.extract(html, ExtractionContext.of("shop", site, "https://shop.test/p/gift/GC25"));

        assertThat(p.isVariable()).isFalse();
        assertThat(p.getVariantMatrix()).isNull();
        assertThat(p.getStatus()).isEqualTo(ProductStatus.OUT_OF_STOCK);
    }

    @Test
    void pageWithoutAnyIdIsMalformed() {
        assertThatThrownBy(() -> extractor.extract("<html><body><p>Hello</p></body></html>",
                ExtractionContext.of("shop", site(), "https://shop.test/")))
                .isInstanceOf(MalformedSourceException.class);
        assertThatThrownBy(() -> extractor.extract("  ", ExtractionContext.of("shop", site(), URL)))
                .isInstanceOf(MalformedSourceException.class);
    }
}
