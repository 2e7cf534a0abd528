package com.sky.association.store;

import com.sky.association.core.model.UniqueSource;

import java.util.List;
import java.util.Optional;

/**
 * Persistence of survey-unique records keyed by (image, associated source).
 */
public interface UniqueSourceRepository {

    /**
     * Inserts the record or updates its detected flag if present.
     */
    void upsert(UniqueSource record);

    Optional<UniqueSource> find(int imageId, long assocId);

    List<UniqueSource> findByImage(int imageId);

    List<UniqueSource> findByAssociatedSource(long assocId);

    boolean delete(int imageId, long assocId);

    List<UniqueSource> deleteByAssociatedSource(long assocId);

    List<UniqueSource> deleteByImage(int imageId);

    void deleteAll();
}
