package com.project.image.autocrop.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.CacheControl;
import org.springframework.web.servlet.config.annotation.ResourceHandlerRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;

/**
 * Serves cropped images as /outputs/{batch}/{file}.png straight from the output directory.
 * Every request writes into a fresh batch folder, so a served file never changes and can be cached.
 */
@Configuration
public class StaticResourceConfig implements WebMvcConfigurer {

    private final Path outputDir;
    private final Duration cacheFor;

    public StaticResourceConfig(@Value("${app.output.dir:outputs}") String outputDir,
                                @Value("${app.output.cache-seconds:3600}") long cacheSeconds) {
        this.outputDir = Paths.get(outputDir).toAbsolutePath().normalize();
        this.cacheFor = Duration.ofSeconds(cacheSeconds);
    }

    @Override
    public void addResourceHandlers(ResourceHandlerRegistry registry) {
        // trailing slash marks the location as a directory
        String location = outputDir.toUri().toString();
        registry.addResourceHandler("/outputs/**")
                .addResourceLocations(location.endsWith("/") ? location : location + "/")
                .setCacheControl(CacheControl.maxAge(cacheFor).cachePublic());
    }
}
