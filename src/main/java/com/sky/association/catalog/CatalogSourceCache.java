package com.sky.association.catalog;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import com.sky.association.core.model.CatalogSource;
import com.sky.association.core.sky.SkyIndex;
import com.sky.association.core.sky.SkyPosition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;

/**
 * Caffeine-backed cache of parsed, spatially indexed catalogs.
 * Each catalog is parsed once through the loader and kept until evicted.
 */
public class CatalogSourceCache implements CatalogSourceRepository {
    private static final Logger log = LoggerFactory.getLogger(CatalogSourceCache.class);

    private final CatalogRegistry registry;
    private final LoadingCache<String, SkyIndex<Long, CatalogSource>> cache;

    public CatalogSourceCache(CatalogRegistry registry, CatalogSourceLoader loader) {
        this(registry, loader, CatalogCacheConfig.defaults());
    }

    public CatalogSourceCache(CatalogRegistry registry, CatalogSourceLoader loader, CatalogCacheConfig config) {
        this.registry = registry;
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxCatalogs())
                .expireAfterAccess(Duration.ofSeconds(config.expireAfterAccessSeconds()))
                .recordStats()
                .build(name -> index(name, loader.load(name)));
        log.info("CatalogSourceCache initialized: maxCatalogs={}, idle={}s",
                config.maxCatalogs(), config.expireAfterAccessSeconds());
    }

    @Override
    public List<CatalogSource> findWithinCone(String catalogName, double ra, double dec, double radius) {
        return cache.get(canonical(catalogName)).within(ra, dec, radius);
    }

    @Override
    public int size(String catalogName) {
        return cache.get(canonical(catalogName)).size();
    }

    public void invalidate(String catalogName) {
        cache.invalidate(canonical(catalogName));
    }

    public void invalidateAll() {
        cache.invalidateAll();
    }

    public long hitCount() {
        return cache.stats().hitCount();
    }

    public long loadCount() {
        return cache.stats().loadCount();
    }

    private String canonical(String catalogName) {
        return registry.nameOf(registry.idOf(catalogName));
    }

    private SkyIndex<Long, CatalogSource> index(String name, List<CatalogSource> sources) {
        int catalogId = registry.idOf(name);
        SkyIndex<Long, CatalogSource> index =
                new SkyIndex<>(0.25, CatalogSource::id, s -> new SkyPosition(s.ra(), s.dec()));
        for (CatalogSource source : sources) {
            index.put(source.catalogId() == catalogId ? source : source.withCatalogId(catalogId));
        }
        log.info("catalog.indexed catalog={} sources={}", name, index.size());
        return index;
    }
}
