package com.project.image.autocrop;

import com.jayway.jsonpath.JsonPath;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import static com.project.image.autocrop.TestImages.BLACK;
import static com.project.image.autocrop.TestImages.TRANSPARENT;
import static com.project.image.autocrop.TestImages.WHITE;
import static com.project.image.autocrop.TestImages.filled;
import static com.project.image.autocrop.TestImages.png;
import static com.project.image.autocrop.TestImages.withPixel;
import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
class CropControllerTest {

    private static Path outputDir;
    private static Path uploadDir;

    @Autowired MockMvc mvc;

    @DynamicPropertySource
    static void directories(DynamicPropertyRegistry registry) throws IOException {
        Path root = Files.createTempDirectory("autocrop-web");
        outputDir = root.resolve("outputs");
        uploadDir = root.resolve("uploads");
        registry.add("app.upload.dir", () -> uploadDir.toString());
        registry.add("app.output.dir", () -> outputDir.toString());
    }

    private static MockMultipartFile image(String name, BufferedImage img) throws IOException {
        return new MockMultipartFile("files", name, "image/png", png(img));
    }

    @Test
    void crop_flow_writesOutputsAndReportsBox() throws Exception {
        BufferedImage bg = filled(4, 4, BLACK);

        MvcResult res = mvc.perform(multipart("/api/crop")
                        .file(image("bg.png", bg))
                        .file(image("shot.png", withPixel(bg, 2, 1, WHITE)))
                        .param("mode", "EXACT")
                        .param("leniency", "0")
                        .param("backgroundNameType", "CUSTOM")
                        .param("backgroundName", "web-bg")
                        .param("imageNameType", "CUSTOM")
                        .param("imageName", "web-shot"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.width").value(4))
                .andExpect(jsonPath("$.mode").value("EXACT"))
                .andExpect(jsonPath("$.boundingBox.minX").value(2))
                .andExpect(jsonPath("$.boundingBox.minY").value(1))
                .andExpect(jsonPath("$.boundingBox.width").value(0))
                .andExpect(jsonPath("$.outputs.length()").value(2))
                .andExpect(jsonPath("$.outputs[0].filename").value("web-bg.png"))
                .andExpect(jsonPath("$.outputs[1].filename").value("web-shot1.png"))
                .andReturn();

        String batchId = batchId(res);
        assertThat(JsonPath.<String>read(res.getResponse().getContentAsString(), "$.outputs[1].webPath"))
                .isEqualTo("/outputs/" + batchId + "/web-shot1.png");
        assertThat(outputDir.resolve(batchId).resolve("web-bg.png")).exists();
        assertThat(outputDir.resolve(batchId).resolve("web-shot1.png")).exists();
    }

    @Test
    void crop_twoRequestsWithSameNames_keepTheirOwnOutputs() throws Exception {
        BufferedImage bg = filled(4, 4, BLACK);

        String first = batchId(mvc.perform(multipart("/api/crop")
                        .file(image("bg.png", bg))
                        .file(image("shot.png", withPixel(bg, 2, 1, WHITE))))
                .andExpect(status().isOk())
                .andReturn());
        String second = batchId(mvc.perform(multipart("/api/crop")
                        .file(image("bg.png", bg))
                        .file(image("shot.png", withPixel(bg, 0, 3, WHITE))))
                .andExpect(status().isOk())
                .andReturn());

        assertThat(first).isNotEqualTo(second);
        BufferedImage firstShot = ImageIO.read(outputDir.resolve(first).resolve("shot.png").toFile());
        BufferedImage secondShot = ImageIO.read(outputDir.resolve(second).resolve("shot.png").toFile());
        assertThat(firstShot.getRGB(2, 1)).isEqualTo(WHITE);
        assertThat(firstShot.getRGB(0, 3)).isEqualTo(TRANSPARENT);
        assertThat(secondShot.getRGB(0, 3)).isEqualTo(WHITE);
        assertThat(secondShot.getRGB(2, 1)).isEqualTo(TRANSPARENT);
    }

    @Test
    void crop_leavesNoStagedUploadsBehind() throws Exception {
        BufferedImage bg = filled(2, 2, BLACK);

        mvc.perform(multipart("/api/crop")
                        .file(image("a.png", bg))
                        .file(image("b.png", withPixel(bg, 1, 1, WHITE))))
                .andExpect(status().isOk());
        mvc.perform(multipart("/api/crop")
                        .file(image("a.png", bg))
                        .file(image("b.png", filled(3, 3, BLACK))))
                .andExpect(status().isBadRequest());

        try (Stream<Path> left = Files.list(uploadDir)) {
            assertThat(left).isEmpty();
        }
    }

    @Test
    void webPath_servesTheWrittenPng() throws Exception {
        BufferedImage bg = filled(3, 3, BLACK);

        MvcResult res = mvc.perform(multipart("/api/crop")
                        .file(image("bg.png", bg))
                        .file(image("shot.png", withPixel(bg, 1, 1, WHITE))))
                .andExpect(status().isOk())
                .andReturn();
        String webPath = JsonPath.read(res.getResponse().getContentAsString(), "$.outputs[1].webPath");

        byte[] served = mvc.perform(get(webPath))
                .andExpect(status().isOk())
                .andExpect(content().contentType("image/png"))
                .andExpect(header().string("Cache-Control", containsString("max-age=3600")))
                .andReturn().getResponse().getContentAsByteArray();
        BufferedImage decoded = ImageIO.read(new ByteArrayInputStream(served));
        assertThat(decoded.getRGB(1, 1)).isEqualTo(WHITE);
        assertThat(decoded.getRGB(0, 0)).isEqualTo(TRANSPARENT);
    }

    private static String batchId(MvcResult res) throws Exception {
        return JsonPath.read(res.getResponse().getContentAsString(), "$.batchId");
    }

    @Test
    void crop_originalNames_comeFromUploadedFileNames() throws Exception {
        BufferedImage bg = filled(3, 3, WHITE);

        mvc.perform(multipart("/api/crop")
                        .file(image("plain.png", bg))
                        .file(image("marked.png", withPixel(bg, 0, 0, BLACK)))
                        .param("mode", "RECTANGLE")
                        .param("resizeOutput", "true"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.outputs[0].filename").value("plain.png"))
                .andExpect(jsonPath("$.outputs[0].width").value(3))
                .andExpect(jsonPath("$.outputs[1].filename").value("marked.png"))
                .andExpect(jsonPath("$.outputs[1].width").value(1));
    }

    @Test
    void crop_singleImage_isBadRequest() throws Exception {
        mvc.perform(multipart("/api/crop").file(image("bg.png", filled(2, 2, BLACK))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("At minimum two images must be selected."));
    }

    @Test
    void crop_differentResolutions_isBadRequest() throws Exception {
        mvc.perform(multipart("/api/crop")
                        .file(image("a.png", filled(2, 2, BLACK)))
                        .file(image("b.png", filled(3, 2, BLACK))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Images must be the same resolution."));
    }

    @Test
    void crop_illegalCustomName_isRejectedBeforeWork() throws Exception {
        BufferedImage bg = filled(2, 2, BLACK);

        mvc.perform(multipart("/api/crop")
                        .file(image("a.png", bg))
                        .file(image("b.png", bg))
                        .param("imageNameType", "CUSTOM")
                        .param("imageName", "shot*"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Illegal image file name: shot*"));
    }

    @Test
    void crop_leniencyOutOfRange_isBadRequest() throws Exception {
        BufferedImage bg = filled(2, 2, BLACK);

        mvc.perform(multipart("/api/crop")
                        .file(image("a.png", bg))
                        .file(image("b.png", bg))
                        .param("leniency", "100"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void crop_unknownMode_isBadRequest() throws Exception {
        BufferedImage bg = filled(2, 2, BLACK);

        mvc.perform(multipart("/api/crop")
                        .file(image("a.png", bg))
                        .file(image("b.png", bg))
                        .param("mode", "ELLIPSE"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void checkFilename_reportsIllegalNames() throws Exception {
        mvc.perform(get("/api/filenames/check").param("name", "nul"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.illegal").value(true));
        mvc.perform(get("/api/filenames/check").param("name", "shot 1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.illegal").value(false));
    }
}
