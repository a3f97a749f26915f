package com.project.image.autocrop.controller;

import com.project.image.autocrop.DTOs.CropResponse;
import com.project.image.autocrop.DTOs.CropResult;
import com.project.image.autocrop.DTOs.CropSettings;
import com.project.image.autocrop.DTOs.NamingSpec;
import com.project.image.autocrop.DTOs.SourceImage;
import com.project.image.autocrop.DTOs.StagedBatch;
import com.project.image.autocrop.model.CropMode;
import com.project.image.autocrop.model.NameType;
import com.project.image.autocrop.service.AutocropService;
import com.project.image.autocrop.service.FilenameValidator;
import com.project.image.autocrop.service.ImageLoader;
import com.project.image.autocrop.service.StorageService;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;

@RestController
@Validated
@RequestMapping("/api")
public class CropController {
    private static final Logger log = LoggerFactory.getLogger(CropController.class);

    private final AutocropService autocropService;
    private final ImageLoader imageLoader;
    private final StorageService storageService;
    private final Path outputDir;

    @Value("${app.crop.default-leniency:0}")
    private double defaultLeniency;

    public CropController(AutocropService autocropService, ImageLoader imageLoader, StorageService storageService,
                          @Value("${app.output.dir:outputs}") String outputDir) {
        this.autocropService = autocropService;
        this.imageLoader = imageLoader;
        this.storageService = storageService;
        this.outputDir = Paths.get(outputDir).toAbsolutePath().normalize();
    }

    /**
     * Crops the uploaded images against the first one and writes a PNG per image into a folder of
     * the output directory that belongs to this request alone.
     */
    @PostMapping(value = "/crop", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public CropResponse crop(
            @RequestParam("files") List<MultipartFile> files,
            @RequestParam(name = "leniency", required = false)
            @DecimalMin(value = "0", message = "Leniency cannot be negative")
            @DecimalMax(value = "100", inclusive = false, message = "Leniency must be below 100")
            Double leniency,
            @RequestParam(name = "mode", defaultValue = "EXACT") CropMode mode,
            @RequestParam(name = "resizeOutput", defaultValue = "false") boolean resizeOutput,
            @RequestParam(name = "backgroundNameType", defaultValue = "ORIGINAL") NameType backgroundNameType,
            @RequestParam(name = "backgroundName", defaultValue = "name") String backgroundName,
            @RequestParam(name = "imageNameType", defaultValue = "ORIGINAL") NameType imageNameType,
            @RequestParam(name = "imageName", defaultValue = "name") String imageName
    ) {
        NamingSpec bgSpec = new NamingSpec(backgroundNameType, backgroundName);
        NamingSpec imageSpec = new NamingSpec(imageNameType, imageName);
        if (bgSpec.isIllegal()) {
            throw new IllegalArgumentException("Illegal background file name: " + backgroundName);
        }
        if (imageSpec.isIllegal()) {
            throw new IllegalArgumentException("Illegal image file name: " + imageName);
        }

        double lenient = leniency == null ? defaultLeniency : leniency;

        log.info("Processing crop request with {} files", files.size());
        StagedBatch batch = storageService.stageBatch(files);
        try {
            CropSettings settings = new CropSettings(lenient, mode, resizeOutput,
                    outputDir.resolve(batch.id()), bgSpec, imageSpec);
            List<SourceImage> images = imageLoader.load(batch.files());
            CropResult result = autocropService.crop(images, settings);
            return toResponse(batch.id(), result);
        } finally {
            storageService.discard(batch);
        }
    }

    /** Lets a client check a custom name before submitting a crop. */
    @GetMapping("/filenames/check")
    public Map<String, Object> checkFilename(@RequestParam(name = "name", defaultValue = "") String name) {
        return Map.of("name", name, "illegal", FilenameValidator.isIllegal(name));
    }

    private CropResponse toResponse(String batchId, CropResult result) {
        List<CropResponse.OutputFile> outputs = result.images().stream()
                .map(img -> {
                    String filename = img.path().getFileName().toString();
                    return new CropResponse.OutputFile(img.index(), filename, "/outputs/" + batchId + "/" + filename,
                            img.width(), img.height());
                })
                .toList();
        return new CropResponse(batchId, result.width(), result.height(), result.mode().name(),
                result.boundingBox(), outputs);
    }
}
