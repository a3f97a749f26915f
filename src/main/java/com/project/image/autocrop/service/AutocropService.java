package com.project.image.autocrop.service;

import com.project.image.autocrop.DTOs.CropResult;
import com.project.image.autocrop.DTOs.CropSettings;
import com.project.image.autocrop.DTOs.ScanResult;
import com.project.image.autocrop.DTOs.SourceImage;
import com.project.image.autocrop.exceptions.CropInputException;
import com.project.image.autocrop.exceptions.ImageWriteException;
import com.project.image.autocrop.model.CropMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs a whole crop: scan for differences, crop every image, write one PNG per image.
 *
 * <p>Images are written in input order and the run stops at the first failure. Files written
 * before the failure stay on disk.</p>
 */
@Service
public class AutocropService {
    private static final Logger log = LoggerFactory.getLogger(AutocropService.class);

    private final DifferenceScanner scanner;
    private final CropStrategy cropStrategy;
    private final OutputNamer namer;
    private final PngEncoder encoder;

    public AutocropService(DifferenceScanner scanner, CropStrategy cropStrategy, OutputNamer namer, PngEncoder encoder) {
        this.scanner = scanner;
        this.cropStrategy = cropStrategy;
        this.namer = namer;
        this.encoder = encoder;
    }

    public CropResult crop(List<SourceImage> images, CropSettings settings) {
        if (images == null || images.size() < 2) {
            throw new CropInputException("At minimum two images are required to crop.");
        }

        BufferedImage background = images.get(0).image();
        log.info("Starting crop of {} images ({}x{}), mode={}, leniency={}%, resize={}",
                images.size(), background.getWidth(), background.getHeight(),
                settings.mode(), settings.leniencyPercent(), settings.resizeOutput());

        createOutputDir(settings.outputDir());

        List<BufferedImage> rasters = images.stream().map(SourceImage::image).toList();
        ScanResult scan = scanner.scan(rasters, settings.threshold(), settings.mode() == CropMode.EXACT);
        log.info("Difference range: {}", scan.boundingBox());

        List<CropResult.WrittenImage> written = new ArrayList<>(images.size());
        // a cancellation check belongs here, between whole images, never inside the pixel loops
        for (int i = 0; i < images.size(); i++) {
            SourceImage source = images.get(i);
            if (i == 0) {
                log.info("Cropping background image");
            } else {
                log.info("Cropping image {}...", i);
            }
            BufferedImage out = cropStrategy.apply(settings.mode(), source.image(), i, scan, settings);

            Path target = namer.resolve(i, source.path(), settings);
            log.info("Saving image {} to {}", i, target.getFileName());
            encoder.write(out, target);
            written.add(new CropResult.WrittenImage(i, target, out.getWidth(), out.getHeight()));
        }

        log.info("Crop finished, {} files written to {}", written.size(), settings.outputDir());
        return new CropResult(background.getWidth(), background.getHeight(), settings.mode(),
                CropResult.BoundingBox.of(scan.boundingBox()), written);
    }

    private static void createOutputDir(Path dir) {
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new ImageWriteException("Cannot create output directory: " + dir, e);
        }
    }
}
