package com.sky.association.crossmatch;

import com.sky.association.association.ConsistencyMaintainer;
import com.sky.association.catalog.CatalogRegistry;
import com.sky.association.catalog.CatalogSourceRepository;
import com.sky.association.core.model.AssociatedSource;
import com.sky.association.core.model.CatalogMatch;
import com.sky.association.core.model.CatalogSource;
import com.sky.association.core.model.Image;
import com.sky.association.core.model.UniqueSource;
import com.sky.association.core.sky.SkyMath;
import com.sky.association.store.SkyStore;
import com.sky.association.store.StageTransaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Cross-identifies associated sources against external reference catalogs.
 *
 * <p>For every source of an image and every requested catalog the image has not been
 * checked against yet, the catalog entries inside the search cone are ranked by de Ruiter
 * radius. The best one is recorded as a match when its radius is below the threshold.
 * The checked catalogs are then added to the image's {@code catalogsChecked}, so running
 * again with the same catalogs does nothing.</p>
 */
public class CatalogCrossMatcher {
    private static final Logger log = LoggerFactory.getLogger(CatalogCrossMatcher.class);

    public static final double DEFAULT_DE_RUITER_THRESHOLD = 5.68;
    public static final double DEFAULT_SEARCH_RADIUS_ARCSEC = 60.0;

    private final SkyStore store;
    private final CatalogSourceRepository catalogSources;
    private final CatalogRegistry registry;
    private final ConsistencyMaintainer maintainer;
    private final UniquenessRegistry uniqueness;
    private final double deRuiterThreshold;
    private final double searchRadius;

    public CatalogCrossMatcher(SkyStore store, CatalogSourceRepository catalogSources, CatalogRegistry registry,
                               ConsistencyMaintainer maintainer, UniquenessRegistry uniqueness) {
        this(store, catalogSources, registry, maintainer, uniqueness,
                DEFAULT_DE_RUITER_THRESHOLD, DEFAULT_SEARCH_RADIUS_ARCSEC);
    }

    public CatalogCrossMatcher(SkyStore store, CatalogSourceRepository catalogSources, CatalogRegistry registry,
                               ConsistencyMaintainer maintainer, UniquenessRegistry uniqueness,
                               double deRuiterThreshold, double searchRadiusArcsec) {
        if (deRuiterThreshold <= 0) {
            throw new IllegalArgumentException("deRuiterThreshold must be > 0");
        }
        if (searchRadiusArcsec <= 0) {
            throw new IllegalArgumentException("searchRadiusArcsec must be > 0");
        }
        this.store = store;
        this.catalogSources = catalogSources;
        this.registry = registry;
        this.maintainer = maintainer;
        this.uniqueness = uniqueness;
        this.deRuiterThreshold = deRuiterThreshold;
        this.searchRadius = SkyMath.arcsecToDegrees(searchRadiusArcsec);
    }

    /**
     * Matches the image's sources against the requested catalogs it has not been checked against.
     * The image's {@code catalogsChecked} is updated in place; saving the image is up to the caller.
     */
    public CrossMatchResult matchImage(Image image, Collection<Long> sourceIds, Collection<String> catalogs,
                                       StageTransaction tx) {
        List<String> toCheck = new ArrayList<>();
        for (String name : registry.validate(catalogs)) {
            if (!image.getCatalogsChecked().contains(name)) {
                toCheck.add(name);
            }
        }

        List<AssociatedSource> sources = load(sourceIds);
        Map<String, Integer> perCatalog = new LinkedHashMap<>();
        int recorded = 0;
        for (String catalog : toCheck) {
            int catalogId = registry.idOf(catalog);
            int count = 0;
            for (AssociatedSource source : sources) {
                if (matchSource(source, catalog, catalogId, tx)) {
                    count++;
                }
            }
            perCatalog.put(catalog, count);
            recorded += count;
        }

        int unique = uniqueness.recordUnmatched(image.getId(), sources, tx);
        image.addCatalogsChecked(new HashSet<>(toCheck));

        log.info("crossmatch.completed imageId={} catalogs={} matches={} unique={}",
                image.getId(), toCheck, recorded, unique);
        return new CrossMatchResult(toCheck, recorded, unique, perCatalog);
    }

    /**
     * Drops every match of the image's sources and the image's uniqueness records, then matches
     * again against the full set of catalogs. Sources left without a match get a uniqueness record
     * in every image where they are detected.
     */
    public CrossMatchResult redo(Image image, Collection<Long> sourceIds, Collection<String> catalogs,
                                 StageTransaction tx) {
        for (AssociatedSource source : load(sourceIds)) {
            long assocId = source.getId();
            List<CatalogMatch> removed = new ArrayList<>();
            tx.execute("drop matches of source " + assocId,
                    () -> removed.addAll(store.catalogMatches().deleteByAssociatedSource(assocId)),
                    () -> removed.forEach(store.catalogMatches()::add));
            if (source.getNmatches() != 0) {
                AssociatedSource before = source.copy();
                source.setNmatches(0);
                tx.execute("reset match count of source " + assocId,
                        () -> store.associatedSources().save(source),
                        () -> store.associatedSources().save(before));
            }
        }
        int imageId = image.getId();
        List<UniqueSource> dropped = new ArrayList<>();
        tx.execute("drop uniqueness records of image " + imageId,
                () -> dropped.addAll(store.uniqueSources().deleteByImage(imageId)),
                () -> dropped.forEach(store.uniqueSources()::upsert));
        image.clearCatalogsChecked();
        log.info("crossmatch.redo imageId={} sources={}", imageId, sourceIds.size());

        CrossMatchResult result = matchImage(image, sourceIds, catalogs, tx);
        int materialized = uniqueness.materialize(maintainer.onMatchesDropped(sourceIds), tx);
        return new CrossMatchResult(result.newlyChecked(), result.matchesRecorded(),
                result.uniqueRecorded() + materialized, result.matchesPerCatalog());
    }

    /**
     * Deletes every match against the named catalogs and removes them from each image's
     * {@code catalogsChecked}. Every name is validated before anything is written.
     *
     * @param materializeUnique whether sources left without any match get uniqueness records
     * @throws com.sky.association.catalog.UnknownCatalogException if any name is not registered
     */
    public CatalogRemovalResult removeCatalogs(Collection<String> names, boolean materializeUnique,
                                               StageTransaction tx) {
        List<String> catalogs = registry.validate(names);

        Map<Long, Integer> lostPerSource = new TreeMap<>();
        int matchesRemoved = 0;
        for (String catalog : catalogs) {
            int catalogId = registry.idOf(catalog);
            List<CatalogMatch> removed = new ArrayList<>();
            tx.execute("drop matches of catalog " + catalog,
                    () -> removed.addAll(store.catalogMatches().deleteByCatalog(catalogId)),
                    () -> removed.forEach(store.catalogMatches()::add));
            for (CatalogMatch match : removed) {
                lostPerSource.merge(match.associatedSourceId(), 1, Integer::sum);
            }
            matchesRemoved += removed.size();
        }

        int sourcesUpdated = 0;
        for (Map.Entry<Long, Integer> entry : lostPerSource.entrySet()) {
            Optional<AssociatedSource> found = store.associatedSources().findById(entry.getKey());
            if (found.isEmpty()) {
                continue;
            }
            AssociatedSource source = found.get();
            AssociatedSource before = source.copy();
            source.setNmatches(Math.max(0, source.getNmatches() - entry.getValue()));
            tx.execute("decrement match count of source " + source.getId(),
                    () -> store.associatedSources().save(source),
                    () -> store.associatedSources().save(before));
            sourcesUpdated++;
        }

        int imagesUpdated = 0;
        for (Image image : store.images().findAll()) {
            Image before = image.copy();
            boolean changed = false;
            for (String catalog : catalogs) {
                changed |= image.removeCatalogChecked(catalog);
            }
            if (changed) {
                tx.execute("uncheck catalogs on image " + image.getId(),
                        () -> store.images().save(image),
                        () -> store.images().save(before));
                imagesUpdated++;
            }
        }

        Map<Long, Set<Integer>> unmatched = maintainer.onMatchesDropped(lostPerSource.keySet());
        int uniqueRecorded = materializeUnique ? uniqueness.materialize(unmatched, tx) : 0;

        log.info("crossmatch.catalogs.removed catalogs={} matches={} sources={} images={} nowUnmatched={}",
                catalogs, matchesRemoved, sourcesUpdated, imagesUpdated, unmatched.size());
        return new CatalogRemovalResult(catalogs, matchesRemoved, sourcesUpdated, imagesUpdated,
                new ArrayList<>(unmatched.keySet()), uniqueRecorded);
    }

    private boolean matchSource(AssociatedSource source, String catalog, int catalogId, StageTransaction tx) {
        long assocId = source.getId();
        if (store.catalogMatches().existsFor(catalogId, assocId)) {
            return false;
        }
        CatalogSource best = null;
        double bestR = Double.POSITIVE_INFINITY;
        for (CatalogSource candidate : catalogSources.findWithinCone(catalog, source.getRa(), source.getDec(), searchRadius)) {
            double r = SkyMath.deRuiterRadius(
                    source.getRa(), source.getERa(), source.getDec(), source.getEDec(),
                    candidate.ra(), candidate.eRa(), candidate.dec(), candidate.eDec());
            if (r < bestR) {
                bestR = r;
                best = candidate;
            }
        }
        if (best == null || !(bestR < deRuiterThreshold)) {
            return false;
        }

        CatalogMatch match = new CatalogMatch(catalogId, best.id(), assocId, bestR);
        boolean[] added = new boolean[1];
        tx.execute("record match " + match.key(),
                () -> added[0] = store.catalogMatches().add(match),
                () -> {
                    if (added[0]) {
                        store.catalogMatches().remove(match.key());
                    }
                });
        if (!added[0]) {
            return false;
        }

        AssociatedSource before = source.copy();
        source.setNmatches(source.getNmatches() + 1);
        tx.execute("increment match count of source " + assocId,
                () -> store.associatedSources().save(source),
                () -> store.associatedSources().save(before));
        if (before.getNmatches() == 0) {
            maintainer.onFirstMatch(assocId, tx);
        }
        return true;
    }

    private List<AssociatedSource> load(Collection<Long> sourceIds) {
        List<AssociatedSource> sources = new ArrayList<>();
        for (Long id : sourceIds) {
            store.associatedSources().findById(id).ifPresentOrElse(sources::add,
                    () -> log.warn("Associated source {} not found; skipping", id));
        }
        return sources;
    }
}
