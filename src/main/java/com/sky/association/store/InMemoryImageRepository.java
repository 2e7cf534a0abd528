package com.sky.association.store;

import com.sky.association.core.model.Image;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory image store. Images are copied on the way in and out so callers
 * only change stored state through {@link #save(Image)}.
 */
public class InMemoryImageRepository implements ImageRepository {

    private final Map<Integer, Image> images = new ConcurrentHashMap<>();
    private final AtomicInteger sequence = new AtomicInteger();

    @Override
    public synchronized Image save(Image image) {
        if (image.getId() == null) {
            Optional<Image> existing = findByFilename(image.getFilename());
            image.assignId(existing.map(Image::getId).orElseGet(sequence::incrementAndGet));
        } else {
            sequence.accumulateAndGet(image.getId(), Math::max);
        }
        images.put(image.getId(), image.copy());
        return image;
    }

    @Override
    public Optional<Image> findById(int id) {
        return Optional.ofNullable(images.get(id)).map(Image::copy);
    }

    @Override
    public Optional<Image> findByFilename(String filename) {
        return images.values().stream()
                .filter(i -> i.getFilename().equals(filename))
                .findFirst()
                .map(Image::copy);
    }

    @Override
    public List<Image> findAll() {
        return images.values().stream()
                .sorted(Comparator.comparing(Image::getId))
                .map(Image::copy)
                .toList();
    }

    @Override
    public boolean delete(int id) {
        return images.remove(id) != null;
    }

    @Override
    public synchronized void deleteAll() {
        images.clear();
        sequence.set(0);
    }
}
