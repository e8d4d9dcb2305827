package com.mindmarker.API;

import com.mindmarker.compiler.CompileOptions;
import com.mindmarker.compiler.CompileResult;
import com.mindmarker.compiler.MarkerCompiler;
import com.mindmarker.error.DecodeException;
import com.mindmarker.error.DimensionException;
import com.mindmarker.error.InternalException;
import com.mindmarker.error.QualityException;
import com.mindmarker.fallback.FallbackOutcome;
import com.mindmarker.fallback.FeatureSource;
import com.mindmarker.fallback.SyntheticGrid;
import com.mindmarker.feature.FeatureSet;
import com.mindmarker.markerFile.MarkerFile;
import com.mindmarker.markerFile.MarkerTarget;
import com.mindmarker.quality.QualityReport;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.HttpHeaders;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.hasItem;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * MarkerControllerTest
 * -----------------------------------------------------------------------------
 * HTTP contract of the /api endpoints with the pipeline replaced by a mock:
 * upload checks, response headers and the mapping of error kinds to statuses.
 */
@SpringBootTest
@AutoConfigureMockMvc
final class MarkerControllerTest {
    private static final byte[] PHOTO = {(byte) 0xFF, (byte) 0xD8, (byte) 0xFF, 1, 2, 3};

    @Autowired
    private MockMvc mvc;

    @MockBean
    private MarkerCompiler compiler;

    private static MockMultipartFile photo(String name) {
        return new MockMultipartFile("image", name, "image/jpeg", PHOTO);
    }

    private static CompileResult gridResult() {
        FeatureSet grid = SyntheticGrid.generate(10);
        MarkerTarget target = new MarkerTarget(3, 1f, 1f, new byte[]{9, 9}, grid);
        QualityReport report = new QualityReport(0, 0.0, 300, 300,
                List.of("Not enough trackable features (0 found, need 50+)"), true);
        FallbackOutcome outcome = FallbackOutcome.marginal(FeatureSource.SYNTHETIC_GRID, grid, "grid");
        return new CompileResult(new byte[]{1, 2, 3, 4}, MarkerFile.single(target), report, outcome);
    }

    @Test
    void compileReturnsMarkerAttachment() throws Exception {
        when(compiler.compile(any(byte[].class), any(CompileOptions.class))).thenReturn(gridResult());

        mvc.perform(multipart("/api/compile").file(photo("my photo.jpg"))
                        .param("targetId", "3").param("width", "2.5"))
                .andExpect(status().isOk())
                .andExpect(header().string(HttpHeaders.CONTENT_TYPE, "application/octet-stream"))
                .andExpect(header().string(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"my_photo.mind\""))
                .andExpect(header().string(MarkerController.HEADER_FEATURE_SOURCE, "SYNTHETIC_GRID"))
                .andExpect(header().string(MarkerController.HEADER_FEATURE_COUNT, "100"))
                .andExpect(header().string(MarkerController.HEADER_DEGRADED, "true"))
                .andExpect(content().bytes(new byte[]{1, 2, 3, 4}));

        ArgumentCaptor<CompileOptions> options = ArgumentCaptor.forClass(CompileOptions.class);
        verify(compiler).compile(any(byte[].class), options.capture());
        assertEquals(3, options.getValue().getTargetId());
        assertEquals(2.5f, options.getValue().getPhysicalWidth());
        assertEquals(1.0f, options.getValue().getPhysicalHeight());
    }

    @Test
    void missingImageIsBadRequest() throws Exception {
        mvc.perform(multipart("/api/compile"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("No image data provided"));
        verify(compiler, never()).compile(any(byte[].class), any(CompileOptions.class));
    }

    @Test
    void nonImageUploadIsBadRequest() throws Exception {
        MockMultipartFile text = new MockMultipartFile("image", "notes.txt", "text/plain", PHOTO);
        mvc.perform(multipart("/api/validate").file(text))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Invalid file: notes.txt"));
    }

    @Test
    void nonPositiveSizeIsBadRequest() throws Exception {
        mvc.perform(multipart("/api/compile").file(photo("a.jpg")).param("height", "0"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void nonFiniteSizeIsBadRequest() throws Exception {
        mvc.perform(multipart("/api/compile").file(photo("a.jpg")).param("width", "Infinity"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("width and height must be finite and positive"));
        mvc.perform(multipart("/api/compile").file(photo("a.jpg")).param("height", "NaN"))
                .andExpect(status().isBadRequest());
        verify(compiler, never()).compile(any(byte[].class), any(CompileOptions.class));
    }

    @Test
    void targetIdCoversUnsignedRange() throws Exception {
        when(compiler.compile(any(byte[].class), any(CompileOptions.class))).thenReturn(gridResult());

        mvc.perform(multipart("/api/compile").file(photo("a.jpg")).param("targetId", "4294967295"))
                .andExpect(status().isOk());

        ArgumentCaptor<CompileOptions> options = ArgumentCaptor.forClass(CompileOptions.class);
        verify(compiler).compile(any(byte[].class), options.capture());
        assertEquals(4294967295L, Integer.toUnsignedLong(options.getValue().getTargetId()));
    }

    @Test
    void targetIdOutsideUnsignedRangeIsBadRequest() throws Exception {
        mvc.perform(multipart("/api/compile").file(photo("a.jpg")).param("targetId", "-1"))
                .andExpect(status().isBadRequest());
        mvc.perform(multipart("/api/compile").file(photo("a.jpg")).param("targetId", "4294967296"))
                .andExpect(status().isBadRequest());
        verify(compiler, never()).compile(any(byte[].class), any(CompileOptions.class));
    }

    @Test
    void validateReturnsReport() throws Exception {
        QualityReport report = new QualityReport(12, 40.5, 512, 384,
                List.of("Not enough trackable features (12 found, need 50+)", "Image too blurry (sharpness: 40.5)"), true);
        when(compiler.validate(any(byte[].class))).thenReturn(report);

        mvc.perform(multipart("/api/validate").file(photo("a.png")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.valid").value(false))
                .andExpect(jsonPath("$.featureCount").value(12))
                .andExpect(jsonPath("$.sharpness").value(40.5))
                .andExpect(jsonPath("$.dimensions", contains(512, 384)))
                .andExpect(jsonPath("$.issues", hasItem("Image too blurry (sharpness: 40.5)")))
                .andExpect(jsonPath("$.recommendation").value(QualityReport.IMPROVE));
    }

    @Test
    void decodeFailureIsBadRequest() throws Exception {
        when(compiler.compile(any(byte[].class), any(CompileOptions.class)))
                .thenThrow(new DecodeException("Invalid image format"));

        mvc.perform(multipart("/api/compile").file(photo("a.jpg")))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.kind").value("DECODE"));
    }

    @Test
    void smallImageIsBadRequest() throws Exception {
        when(compiler.compile(any(byte[].class), any(CompileOptions.class)))
                .thenThrow(new DimensionException(100, 100, 200));

        mvc.perform(multipart("/api/compile").file(photo("a.jpg")))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.kind").value("DIMENSION"))
                .andExpect(jsonPath("$.error").value("Image too small (100x100, need 200x200+)"));
    }

    @Test
    void qualityRejectionIsUnprocessable() throws Exception {
        QualityReport report = new QualityReport(3, 10.0, 300, 300, List.of("Image too blurry (sharpness: 10.0)"), true);
        when(compiler.compile(any(byte[].class), any(CompileOptions.class)))
                .thenThrow(new QualityException("Image too blurry (sharpness: 10.0)", report));

        mvc.perform(multipart("/api/compile").file(photo("a.jpg")))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.kind").value("QUALITY"))
                .andExpect(jsonPath("$.issues[0]").value("Image too blurry (sharpness: 10.0)"));
    }

    @Test
    void internalFailureIsServerError() throws Exception {
        when(compiler.compile(any(byte[].class), any(CompileOptions.class)))
                .thenThrow(new InternalException("encoder failed"));

        mvc.perform(multipart("/api/compile").file(photo("a.jpg")))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.kind").value("INTERNAL"));
    }

    @Test
    void healthReportsFormatVersion() throws Exception {
        mvc.perform(get("/api/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("healthy"))
                .andExpect(jsonPath("$.service").value(MarkerController.SERVICE_NAME))
                .andExpect(jsonPath("$.formatVersion").value(1));
    }
}
