package com.project.image.autocrop.DTOs;

import com.project.image.autocrop.model.PixelPos;
import com.project.image.autocrop.model.RectangleRange;

import java.util.List;

/**
 * Output of the difference scan.
 *
 * @param boundingBox range enclosing every differing coordinate, possibly empty
 * @param differingPixels one list per comparison image (background excluded), empty when the
 *                        exact pass did not run
 */
public record ScanResult(RectangleRange boundingBox, List<List<PixelPos>> differingPixels) {

    public ScanResult {
        differingPixels = List.copyOf(differingPixels);
    }

    /** Whether the exact pass ran; it always yields one list per comparison image. */
    public boolean hasPixelSets() {
        return !differingPixels.isEmpty();
    }

    /**
     * @param imageIndex position of the image in the input list, 1 for the first comparison image
     */
    public List<PixelPos> differingPixels(int imageIndex) {
        if (imageIndex < 1 || imageIndex > differingPixels.size()) {
            return List.of();
        }
        return differingPixels.get(imageIndex - 1);
    }
}
