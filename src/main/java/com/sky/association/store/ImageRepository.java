package com.sky.association.store;

import com.sky.association.core.model.Image;

import java.util.List;
import java.util.Optional;

/**
 * Persistence of image records.
 */
public interface ImageRepository {

    /**
     * Inserts or replaces an image. An image without an id is assigned the next one.
     */
    Image save(Image image);

    Optional<Image> findById(int id);

    Optional<Image> findByFilename(String filename);

    List<Image> findAll();

    boolean delete(int id);

    void deleteAll();
}
