package com.blockmorph.web;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.blockmorph.morph.MorphSettings;
import com.blockmorph.morph.TestImages;
import com.blockmorph.render.FrameExporter;
import com.blockmorph.render.ImageSurfaces;
import com.blockmorph.render.OutputFormat;
import com.blockmorph.service.ExportJob;
import com.blockmorph.service.MorphService;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

class MorphControllerTest {

    @TempDir
    Path tempDir;

    private MorphService service;
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        service = new MorphService(tempDir, MorphSettings.builder().build(), Runnable::run, new FrameExporter());
        mvc = MockMvcBuilders.standaloneSetup(new MorphController(service)).build();
    }

    private static MockMultipartFile png(String name, int width, int height, int seed) {
        return new MockMultipartFile(name, name + ".png", "image/png",
                ImageSurfaces.encodePng(TestImages.pattern(width, height, seed)));
    }

    private void morph() throws Exception {
        mvc.perform(multipart("/morph")
                        .file(png("source", 64, 64, 1))
                        .file(png("target", 64, 64, 2))
                        .param("cellSize", "16"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.cellCount").value(16))
                .andExpect(jsonPath("$.frameCount").value(61))
                .andExpect(jsonPath("$.summary").value("16_0.7_2000_30"));
    }

    @Test
    void morphThenScrubAndExport() throws Exception {
        morph();

        mvc.perform(get("/frames/60"))
                .andExpect(status().isOk())
                .andExpect(content().contentType("image/png"));
        mvc.perform(get("/frames/61")).andExpect(status().isNotFound());

        mvc.perform(post("/export").param("format", "gif").param("durationMs", "1500"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.framesEncoded").value(61))
                .andExpect(jsonPath("$.frameDelayMs").value(24))
                .andExpect(jsonPath("$.fileName").value("morph_16px_w70_61f.gif"));

        mvc.perform(get("/last.gif"))
                .andExpect(status().isOk())
                .andExpect(content().contentType("image/gif"));
    }

    @Test
    void rejectsBadRequests() throws Exception {
        mvc.perform(multipart("/morph")
                        .file(png("source", 64, 64, 1))
                        .file(png("target", 64, 64, 2))
                        .param("gradientWeight", "2.0"))
                .andExpect(status().isBadRequest());
        mvc.perform(multipart("/morph")
                        .file(png("source", 10, 10, 1))
                        .file(png("target", 64, 64, 2)))
                .andExpect(status().isBadRequest());
        mvc.perform(multipart("/morph")
                        .file(new MockMultipartFile("source", "a.txt", "text/plain", new byte[]{1, 2, 3}))
                        .file(png("target", 64, 64, 2)))
                .andExpect(status().isBadRequest());

        mvc.perform(post("/export")).andExpect(status().isNotFound());
        mvc.perform(get("/frames/0")).andExpect(status().isNotFound());
        mvc.perform(get("/last.mp4")).andExpect(status().isNotFound());

        morph();
        mvc.perform(post("/export").param("format", "webm")).andExpect(status().isBadRequest());
        mvc.perform(post("/export").param("durationMs", "0")).andExpect(status().isBadRequest());
    }

    @Test
    void asyncExportLifecycle() throws Exception {
        morph();

        mvc.perform(post("/exports").param("format", "gif"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.state").value("COMPLETED"));

        ExportJob job = service.startExport(OutputFormat.GIF, 1500);
        mvc.perform(get("/exports/" + job.id()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.progress").value(1.0));
        mvc.perform(get("/exports/" + job.id() + "/media"))
                .andExpect(status().isOk())
                .andExpect(content().contentType("image/gif"));
        mvc.perform(delete("/exports/" + job.id()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.state").value("COMPLETED"));
        mvc.perform(get("/exports/missing")).andExpect(status().isNotFound());
    }
}
