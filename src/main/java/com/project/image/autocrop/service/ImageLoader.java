package com.project.image.autocrop.service;

import com.project.image.autocrop.DTOs.SourceImage;
import com.project.image.autocrop.exceptions.CropInputException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Decodes the input files and checks that they can be cropped together.
 */
@Service
public class ImageLoader {
    private static final Logger log = LoggerFactory.getLogger(ImageLoader.class);

    static final int MIN_IMAGES = 2;
    static final int MAX_IMAGES = 10_000;

    /**
     * @param paths background first, then the comparison images
     * @throws CropInputException if there are too few or too many files, a file is not a readable
     *                            image, or the images do not all share the first one's dimensions
     */
    public List<SourceImage> load(List<Path> paths) {
        if (paths == null || paths.size() < MIN_IMAGES) {
            throw new CropInputException("At minimum two images must be selected.");
        }
        if (paths.size() > MAX_IMAGES) {
            throw new CropInputException("You cannot select more than " + MAX_IMAGES + " images.");
        }

        List<SourceImage> images = new ArrayList<>(paths.size());
        int width = -1, height = -1;
        for (Path path : paths) {
            BufferedImage image = read(path);
            if (width < 0) {
                width = image.getWidth();
                height = image.getHeight();
            } else if (image.getWidth() != width || image.getHeight() != height) {
                log.warn("{} is {}x{}, expected {}x{}", path, image.getWidth(), image.getHeight(), width, height);
                throw new CropInputException("Images must be the same resolution.");
            }
            images.add(new SourceImage(path, image));
        }

        log.debug("Loaded {} images of {}x{}", images.size(), width, height);
        return images;
    }

    private static BufferedImage read(Path path) {
        BufferedImage image;
        try {
            image = ImageIO.read(path.toFile());
        } catch (IOException e) {
            throw new CropInputException("Could not read image " + path.getFileName(), e);
        }
        if (image == null) {
            throw new CropInputException("File is not a valid image or is corrupted: " + path.getFileName());
        }
        return image;
    }
}
