package com.sky.association.store;

import com.sky.association.core.model.Detection;
import com.sky.association.core.model.DetectionKey;
import com.sky.association.core.model.Island;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory detection and island store.
 */
public class InMemoryDetectionRepository implements DetectionRepository {

    private final Map<DetectionKey, Detection> detections = new ConcurrentHashMap<>();
    private final Map<IslandKey, Island> islands = new ConcurrentHashMap<>();

    @Override
    public boolean saveIsland(Island island) {
        return islands.putIfAbsent(new IslandKey(island.islandId(), island.imageId()), island) == null;
    }

    @Override
    public List<Island> findIslandsByImage(int imageId) {
        return islands.values().stream()
                .filter(i -> i.imageId() == imageId)
                .sorted(Comparator.comparingInt(Island::islandId))
                .toList();
    }

    @Override
    public int deleteIslandsByImage(int imageId) {
        List<IslandKey> keys = islands.keySet().stream().filter(k -> k.imageId() == imageId).toList();
        keys.forEach(islands::remove);
        return keys.size();
    }

    @Override
    public void save(Detection detection) {
        detections.put(detection.getKey(), detection.copy());
    }

    @Override
    public Optional<Detection> findByKey(DetectionKey key) {
        return Optional.ofNullable(detections.get(key)).map(Detection::copy);
    }

    @Override
    public List<Detection> findByImage(int imageId) {
        return detections.values().stream()
                .filter(d -> d.getImageId() == imageId)
                .sorted(Comparator.comparingInt(Detection::getSourceId))
                .map(Detection::copy)
                .toList();
    }

    @Override
    public List<Detection> findByAssociatedSource(long assocId) {
        return detections.values().stream()
                .filter(d -> d.isAssociatedTo(assocId))
                .sorted(Comparator.comparingInt(Detection::getImageId).thenComparingInt(Detection::getSourceId))
                .map(Detection::copy)
                .toList();
    }

    @Override
    public boolean delete(DetectionKey key) {
        return detections.remove(key) != null;
    }

    @Override
    public void deleteAll() {
        detections.clear();
        islands.clear();
    }

    private record IslandKey(int islandId, int imageId) {}
}
