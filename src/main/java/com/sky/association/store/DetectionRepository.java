package com.sky.association.store;

import com.sky.association.core.model.Detection;
import com.sky.association.core.model.DetectionKey;
import com.sky.association.core.model.Island;

import java.util.List;
import java.util.Optional;

/**
 * Persistence of per-image detections and the islands grouping them.
 */
public interface DetectionRepository {

    /**
     * Inserts an island unless one with the same (image, island id) exists.
     *
     * @return false when the island was already present
     */
    boolean saveIsland(Island island);

    List<Island> findIslandsByImage(int imageId);

    int deleteIslandsByImage(int imageId);

    /**
     * Inserts or replaces a detection keyed by (source id, image id).
     */
    void save(Detection detection);

    Optional<Detection> findByKey(DetectionKey key);

    List<Detection> findByImage(int imageId);

    List<Detection> findByAssociatedSource(long assocId);

    boolean delete(DetectionKey key);

    void deleteAll();
}
