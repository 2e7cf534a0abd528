package com.sky.association.catalog;

import com.sky.association.core.model.CatalogSource;
import com.sky.association.testsupport.SkyFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class CatalogSourceCacheTest {

    private final CatalogRegistry registry = CatalogRegistry.of("nvss", "first");
    private final AtomicInteger loads = new AtomicInteger();
    private CatalogSourceCache cache;

    @BeforeEach
    void setUp() {
        cache = new CatalogSourceCache(registry, name -> {
            loads.incrementAndGet();
            return List.of(
                    SkyFixtures.catalogSource(1, 0, 150.0, 30.0),
                    SkyFixtures.catalogSource(2, 0, 150.0, 30.1),
                    SkyFixtures.catalogSource(3, 0, 200.0, -10.0));
        });
    }

    @Test
    void parsesEachCatalogOnce() {
        cache.findWithinCone("nvss", 150.0, 30.0, 0.2);
        cache.findWithinCone("NVSS", 150.0, 30.0, 0.2);
        cache.size("nvss");

        assertEquals(1, loads.get());
        assertEquals(1, cache.loadCount());
        assertEquals(2, cache.hitCount());
    }

    @Test
    void assignsTheRegisteredCatalogId() {
        List<CatalogSource> found = cache.findWithinCone("first", 150.0, 30.0, 0.01);

        assertEquals(1, found.size());
        assertEquals(registry.idOf("first"), found.get(0).catalogId());
    }

    @Test
    void conesReturnNearestFirst() {
        List<CatalogSource> found = cache.findWithinCone("nvss", 150.0, 30.09, 0.2);

        assertEquals(List.of(2L, 1L), found.stream().map(CatalogSource::id).toList());
    }

    @Test
    void invalidateForcesReload() {
        cache.size("nvss");
        cache.invalidate("nvss");
        cache.size("nvss");

        assertEquals(2, loads.get());
    }

    @Test
    void unknownCatalogIsRejected() {
        assertThrows(UnknownCatalogException.class, () -> cache.size("vlssr"));
        assertEquals(0, loads.get());
    }

    @Test
    void configIsValidated() {
        assertThrows(IllegalArgumentException.class, () -> new CatalogCacheConfig(0, 10));
        assertThrows(IllegalArgumentException.class, () -> new CatalogCacheConfig(4, 0));
    }
}
