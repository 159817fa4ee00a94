package com.updownbot.hft.controller.signal;

/**
 * Output of {@link SignalModel#estimate}.
 *
 * @param probability   calibrated probability that the window settles Up
 * @param z             clamped z-score fed to the sigmoid
 * @param rawZ          z-score before clamping
 * @param effectiveVol  volatility actually used as the denominator
 */
public record SignalEstimate(
        double probability,
        double z,
        double rawZ,
        double effectiveVol,
        boolean volFloorHit,
        boolean zClamped,
        boolean probabilityClamped
) {
}
