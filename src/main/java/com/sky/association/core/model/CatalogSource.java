package com.sky.association.core.model;

/**
 * Normalized entry of an external reference catalog.
 * Positions and errors in degrees, fluxes in mJy, axes in arcsec.
 * Unknown numeric values are {@link Double#NaN}.
 */
public record CatalogSource(
        long id,
        int catalogId,
        String name,
        double ra,
        double eRa,
        double dec,
        double eDec,
        double totalFlux,
        double eTotalFlux,
        double peakFlux,
        double ePeakFlux,
        double maj,
        double min,
        double pa,
        double rms
) {
    public CatalogSource withCatalogId(int newCatalogId) {
        return new CatalogSource(id, newCatalogId, name, ra, eRa, dec, eDec, totalFlux, eTotalFlux,
                peakFlux, ePeakFlux, maj, min, pa, rms);
    }
}
