package com.project.image.autocrop.DTOs;

import java.nio.file.Path;
import java.util.List;

/**
 * Uploads of one request, stored on disk until they have been decoded.
 *
 * @param id unique name of the batch, also used for the request's output folder
 * @param files stored files in upload order
 */
public record StagedBatch(String id, Path dir, List<Path> files) {
    public StagedBatch {
        files = List.copyOf(files);
    }
}
