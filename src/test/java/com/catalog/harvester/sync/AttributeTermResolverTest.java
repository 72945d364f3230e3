package com.catalog.harvester.sync;

import com.catalog.harvester.config.CatalogProperties;
import com.catalog.harvester.exception.RemoteCatalogException;
import com.catalog.harvester.model.ColorwayVariant;
import com.catalog.harvester.model.SizeVariant;
import com.catalog.harvester.model.VariantMatrix;
import com.catalog.harvester.support.TestConfigs;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AttributeTermResolverTest {

    private final FakeRemoteCatalog catalog = new FakeRemoteCatalog();

    private AttributeTermResolver resolver() {
        return new AttributeTermResolver(catalog, new CatalogProperties(), TestConfigs.mapper());
    }

    private static VariantMatrix matrix() {
        return VariantMatrix.of(List.of(
                ColorwayVariant.builder().colourLabel("Black")
                        .sizeVariants(List.of(SizeVariant.of("S", true), SizeVariant.of("M", false))).build(),
                ColorwayVariant.builder().colourLabel("Sea Salt")
                        .sizeVariants(List.of(SizeVariant.of("M", true))).build()));
    }

    @Test
    void prepareCreatesAttributesAndTermsOnce() {
        AttributeTermResolver resolver = resolver();

        AttributeTermResolver.ProductAttributes attrs = resolver.prepare(matrix());
        resolver.prepare(matrix());

        assertThat(catalog.attributeCreates).hasValue(2);
        assertThat(catalog.termCreates).hasValue(4);
        assertThat(catalog.listTerms(attrs.colourAttributeId()))
                .extracting(t -> t.path("slug").asText())
                .containsExactly("black", "sea-salt");
        JsonNode colour = attrs.payload().get(0);
        assertThat(colour.path("id").asLong()).isEqualTo(attrs.colourAttributeId());
        assertThat(colour.path("variation").asBoolean()).isTrue();
        assertThat(colour.path("options")).extracting(JsonNode::asText).containsExactly("Black", "Sea Salt");
        assertThat(attrs.payload().get(1).path("options")).extracting(JsonNode::asText).containsExactly("S", "M");
    }

    @Test
    void secondResolverReusesWhatTheFirstCreated() {
        resolver().prepare(matrix());

        resolver().prepare(matrix());

        assertThat(catalog.attributeCreates).hasValue(2);
        assertThat(catalog.termCreates).hasValue(4);
    }

    @Test
    void existingTermIsMatchedByNameWhenSlugsDiffer() {
        long colourId = resolver().resolveAttribute("Color");
        long legacy = catalog.createTerm(colourId, "Sea Salt", "seasalt-legacy").path("id").asLong();
        catalog.termCreates.set(0);

        assertThat(resolver().resolveTerm(colourId, "sea salt")).isEqualTo(legacy);
        assertThat(catalog.termCreates).hasValue(0);
    }

    @Test
    void failedCreateFallsBackToTheTermThatNowExists() {
        AttributeTermResolver resolver = resolver();
        long sizeId = resolver.resolveAttribute("Size");
        catalog.racingTerms.add("xl");

        long id = resolver.resolveTerm(sizeId, "XL");

        assertThat(catalog.listTerms(sizeId)).hasSize(1);
        assertThat(id).isEqualTo(catalog.listTerms(sizeId).get(0).path("id").asLong());
    }

    @Test
    void failedCreateWithoutTheTermIsRethrown() {
        RemoteCatalog broken = new FakeRemoteCatalog() {
            @Override
            public JsonNode createAttribute(final String name, final String slug) {
                throw new RemoteCatalogException("forbidden", 403, "{}");
            }
        };
        AttributeTermResolver resolver = new AttributeTermResolver(broken, new CatalogProperties(), TestConfigs.mapper());

        assertThatThrownBy(() -> resolver.resolveAttribute("Color"))
                .isInstanceOf(RemoteCatalogException.class)
                .hasMessage("forbidden");
    }

    @Test
    void concurrentResolutionOfOneNameYieldsOneId() throws Exception {
        AttributeTermResolver resolver = resolver();
        long colourId = resolver.resolveAttribute("Color");
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<CompletableFuture<Long>> futures = IntStream.range(0, 8)
                    .mapToObj(i -> CompletableFuture.supplyAsync(() -> resolver.resolveTerm(colourId, "Black"), pool))
                    .toList();

            List<Long> resolved = futures.stream().map(CompletableFuture::join).distinct().toList();

            assertThat(resolved).hasSize(1);
            assertThat(catalog.termCreates).hasValue(1);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void variationKeyIgnoresCaseAndPadding() {
        assertThat(AttributeTermResolver.variationKey(" Black ", "m")).isEqualTo(AttributeTermResolver.variationKey("black", "M"));
        assertThat(AttributeTermResolver.normaliseSlug("pa_Color")).isEqualTo("color");
    }
}
