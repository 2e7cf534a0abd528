package com.sky.association.core.model;

/**
 * Primary-beam corrected photometry of one detection.
 *
 * @param beamPower       primary beam power at the detection's distance from the pointing centre
 * @param totalFlux       corrected integrated flux (mJy)
 * @param eTotalFlux      integrated flux error including the systematic term (mJy)
 * @param peakFlux        corrected peak flux (mJy/beam)
 * @param ePeakFlux       peak flux error including the systematic term (mJy/beam)
 * @param islandTotalFlux corrected island flux (mJy)
 * @param eIslandTotalFlux island flux error including the systematic term (mJy)
 * @param islandRms       corrected island background rms (mJy/beam)
 * @param islandMean      corrected island background mean (mJy/beam)
 * @param snr             (peak - island mean) / island rms
 */
public record CorrectedFlux(
        double beamPower,
        double totalFlux,
        double eTotalFlux,
        double peakFlux,
        double ePeakFlux,
        double islandTotalFlux,
        double eIslandTotalFlux,
        double islandRms,
        double islandMean,
        double snr
) {
}
