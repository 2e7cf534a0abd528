package com.sky.association.crossmatch;

import com.sky.association.core.model.AssociatedSource;
import com.sky.association.core.model.UniqueSource;
import com.sky.association.store.StageTransaction;
import com.sky.association.store.UniqueSourceRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Tracks associated sources detected in an image but matched to no external catalog.
 * Records are upserted, so repeated matching runs never duplicate them.
 */
public class UniquenessRegistry {
    private static final Logger log = LoggerFactory.getLogger(UniquenessRegistry.class);

    private final UniqueSourceRepository repository;

    public UniquenessRegistry(UniqueSourceRepository repository) {
        this.repository = repository;
    }

    /**
     * Inserts the record, or updates its detected flag if present.
     */
    public void upsert(UniqueSource record, StageTransaction tx) {
        Optional<UniqueSource> previous = repository.find(record.imageId(), record.associatedSourceId());
        tx.execute("upsert uniqueness record " + record.imageId() + "/" + record.associatedSourceId(),
                () -> repository.upsert(record),
                () -> previous.ifPresentOrElse(repository::upsert,
                        () -> repository.delete(record.imageId(), record.associatedSourceId())));
    }

    /**
     * Records every source of the image that has no catalog match.
     *
     * @return number of records written
     */
    public int recordUnmatched(int imageId, Collection<AssociatedSource> sources, StageTransaction tx) {
        int count = 0;
        for (AssociatedSource source : sources) {
            if (source.isSurveyUnique()) {
                upsert(new UniqueSource(imageId, source.getId(), true), tx);
                count++;
            }
        }
        log.debug("Image {}: {} survey-unique sources recorded", imageId, count);
        return count;
    }

    /**
     * Writes a record for every (source, image) pair of the candidates.
     *
     * @param candidates source id to the ids of the images in which it is detected
     * @return number of records written
     */
    public int materialize(Map<Long, Set<Integer>> candidates, StageTransaction tx) {
        int count = 0;
        for (Map.Entry<Long, Set<Integer>> entry : candidates.entrySet()) {
            for (Integer imageId : entry.getValue()) {
                upsert(new UniqueSource(imageId, entry.getKey(), true), tx);
                count++;
            }
        }
        if (count > 0) {
            log.info("uniqueness.materialized sources={} records={}", candidates.size(), count);
        }
        return count;
    }
}
