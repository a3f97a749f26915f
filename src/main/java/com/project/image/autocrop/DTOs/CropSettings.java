package com.project.image.autocrop.DTOs;

import com.project.image.autocrop.model.CropMode;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Everything a single crop run needs besides the images themselves.
 *
 * @param leniencyPercent tolerance in percent, {@code 0 <= leniencyPercent < 100}
 * @param backgroundName naming of the background output (index 0)
 * @param imageName naming of every other output
 */
public record CropSettings(
        double leniencyPercent,
        CropMode mode,
        boolean resizeOutput,
        Path outputDir,
        NamingSpec backgroundName,
        NamingSpec imageName
) {
    public CropSettings {
        if (Double.isNaN(leniencyPercent) || leniencyPercent < 0 || leniencyPercent >= 100) {
            throw new IllegalArgumentException("Leniency must be in [0, 100): " + leniencyPercent);
        }
        Objects.requireNonNull(mode, "mode");
        Objects.requireNonNull(outputDir, "outputDir");
        Objects.requireNonNull(backgroundName, "backgroundName");
        Objects.requireNonNull(imageName, "imageName");
    }

    /** Leniency normalized to the [0, 1] scale of {@code PixelDistance}. */
    public double threshold() {
        return leniencyPercent / 100.0;
    }
}
