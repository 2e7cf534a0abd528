package com.sky.association.core.model;

import com.sky.association.testsupport.SkyFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ImageTest {

    @Test
    @DisplayName("Radius is half the image height times the scale, in degrees to 0.01")
    void radiusFromScale() {
        Image image = Image.builder().filename("a.fits").header(SkyFixtures.header()).build();

        image.applyRadiusScale(0.5);
        assertEquals(0.57, image.getRadius());

        image.applyRadiusScale(0.3);
        assertEquals(0.34, image.getRadius());
    }

    @Test
    @DisplayName("Radius is unknown without a pixel grid")
    void radiusWithoutHeader() {
        Image image = Image.builder().filename("a.fits").radius(1.0).build();

        image.applyRadiusScale(0.5);

        assertNull(image.getRadius());
    }

    @Test
    void newImageStartsAtRead() {
        Image image = Image.builder().filename("a.fits").build();

        assertEquals(ProcessingStage.READ, image.getStage());
        assertNull(image.getId());
        assertTrue(image.getHeader().missingRequiredFields().contains("pointing"));
    }

    @Test
    void copyIsIndependent() {
        Image image = Image.builder().filename("a.fits").catalogsChecked(Set.of("nvss")).build();
        Image copy = image.copy();

        copy.addCatalogsChecked(Set.of("first"));
        copy.setStage(ProcessingStage.ASSOCIATED);

        assertEquals(Set.of("nvss"), image.getCatalogsChecked());
        assertEquals(ProcessingStage.READ, image.getStage());
        assertEquals(image, copy);
    }

    @Test
    void catalogsCheckedAreSortedAndReadOnly() {
        Image image = Image.builder().filename("a.fits").build();
        image.addCatalogsChecked(Set.of("sumss", "first", "nvss"));

        assertEquals("[first, nvss, sumss]", image.getCatalogsChecked().toString());
        assertTrue(image.removeCatalogChecked("nvss"));
        assertFalse(image.removeCatalogChecked("nvss"));
        assertThrows(UnsupportedOperationException.class, () -> image.getCatalogsChecked().add("x"));
    }

    @Test
    void onlyFatalErrorsAbort() {
        Image image = Image.builder().filename("a.fits").build();

        image.setError(ImageError.BRIGHT_SOURCE_IN_FIELD);
        assertFalse(image.isAborted());

        image.setError(ImageError.LOW_VISIBILITY_COUNT);
        assertTrue(image.isAborted());
    }

    @Test
    void idIsAssignedOnce() {
        Image image = Image.builder().filename("a.fits").build();
        image.assignId(4);

        assertThrows(IllegalStateException.class, () -> image.assignId(5));
    }
}
