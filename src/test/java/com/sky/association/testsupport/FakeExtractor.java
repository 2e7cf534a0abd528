package com.sky.association.testsupport;

import com.sky.association.core.model.Detection;
import com.sky.association.core.model.Image;
import com.sky.association.core.model.ImageHeader;
import com.sky.association.core.model.Island;
import com.sky.association.core.sky.SkyMath;
import com.sky.association.extraction.ExtractionException;
import com.sky.association.extraction.ExtractionParameters;
import com.sky.association.extraction.ExtractionResult;
import com.sky.association.extraction.SourceExtractor;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Extractor reporting the planted sources that fall within the image's field radius.
 * Detections are numbered from 1 in planting order; every call returns fresh objects.
 */
public class FakeExtractor implements SourceExtractor {

    private final Map<String, List<PlantedSource>> planted = new HashMap<>();
    private final Set<String> failing = new HashSet<>();
    private final AtomicInteger calls = new AtomicInteger();

    public FakeExtractor plant(String filename, List<PlantedSource> sources) {
        planted.put(filename, List.copyOf(sources));
        return this;
    }

    public FakeExtractor failOn(String filename) {
        failing.add(filename);
        return this;
    }

    @Override
    public ExtractionResult extract(Image image, ExtractionParameters parameters) {
        calls.incrementAndGet();
        if (failing.contains(image.getFilename())) {
            throw new ExtractionException("extractor crashed on " + image.getFilename());
        }
        ImageHeader header = image.getHeader();
        double radius = image.getRadius() != null ? image.getRadius() : Double.MAX_VALUE;

        List<Detection> detections = new ArrayList<>();
        Map<Integer, Island> islands = new LinkedHashMap<>();
        int sourceId = 1;
        for (PlantedSource source : planted.getOrDefault(image.getFilename(), List.of())) {
            if (SkyMath.separation(header.obsRa(), header.obsDec(), source.ra(), source.dec()) > radius) {
                continue;
            }
            detections.add(SkyFixtures.detection(sourceId++, source.islandId(), source.ra(), source.dec()));
            islands.computeIfAbsent(source.islandId(), id -> new Island(id, 0, 10.0, 1.0, 0.5, 0.01, 0.4, 0.0));
        }
        return new ExtractionResult(new ArrayList<>(islands.values()), detections, "(60, 20)");
    }

    public int calls() {
        return calls.get();
    }
}
