package com.project.image.autocrop.DTOs;

import java.util.List;

public record CropResponse(
        String batchId,           // name of the output folder holding this request's files
        int width,
        int height,
        String mode,
        CropResult.BoundingBox boundingBox,
        List<OutputFile> outputs
) {
    public record OutputFile(int index, String filename, String webPath, int width, int height) {}
}
