package com.project.image.autocrop.service;

import com.project.image.autocrop.DTOs.CropSettings;
import com.project.image.autocrop.DTOs.NamingSpec;
import com.project.image.autocrop.exceptions.OutputNamingException;
import org.springframework.stereotype.Service;

import java.nio.file.Path;

/**
 * Decides where each output image is written. Names are not sanitized here; custom names are
 * checked with {@link FilenameValidator} before a crop starts.
 */
@Service
public class OutputNamer {
    static final String EXTENSION = ".png";

    /**
     * File name without extension for the image at {@code index}.
     *
     * @param sourcePath file the image was loaded from, used for original naming
     */
    public String stem(int index, Path sourcePath, CropSettings settings) {
        NamingSpec spec = index == 0 ? settings.backgroundName() : settings.imageName();
        return switch (spec.type()) {
            case ORIGINAL -> originalStem(sourcePath);
            case CUSTOM -> index == 0 ? spec.customName() : spec.customName() + index;
        };
    }

    public Path resolve(int index, Path sourcePath, CropSettings settings) {
        return settings.outputDir().resolve(stem(index, sourcePath, settings) + EXTENSION);
    }

    static String originalStem(Path sourcePath) {
        Path fileName = sourcePath == null ? null : sourcePath.getFileName();
        if (fileName == null || fileName.toString().isEmpty()) {
            throw new OutputNamingException("Could not retrieve original file name from: " + sourcePath);
        }
        String name = fileName.toString();
        int dot = name.lastIndexOf('.');
        // ".hidden" has no extension, keep the whole name
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
