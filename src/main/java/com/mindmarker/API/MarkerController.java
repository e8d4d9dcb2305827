package com.mindmarker.API;

import com.mindmarker.compiler.CompileResult;
import com.mindmarker.error.CompileException;
import com.mindmarker.markerFile.MarkerFormat;
import com.mindmarker.quality.QualityReport;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api")
@CrossOrigin(origins = "*")
public class MarkerController {
    public static final String SERVICE_NAME = "marker-compiler";
    public static final String SERVICE_VERSION = "1.0.0";

    public static final String HEADER_FEATURE_SOURCE = "X-Marker-Feature-Source";
    public static final String HEADER_FEATURE_COUNT = "X-Marker-Feature-Count";
    public static final String HEADER_DEGRADED = "X-Marker-Degraded";

    static final long MAX_TARGET_ID = 0xFFFFFFFFL;

    @Autowired
    private MarkerCompileService compileService;

    @PostMapping(value = "/compile", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<?> compile(
            @RequestParam(value = "image", required = false) MultipartFile image,
            @RequestParam(value = "targetId", required = false) Long targetId,
            @RequestParam(value = "width", required = false) Float width,
            @RequestParam(value = "height", required = false) Float height) throws CompileException, IOException {
        ResponseEntity<?> rejected = checkUpload(image);
        if (rejected != null) return rejected;
        if (!isPhysicalSize(width) || !isPhysicalSize(height)) {
            return badRequest("width and height must be finite and positive");
        }
        if (targetId != null && (targetId < 0 || targetId > MAX_TARGET_ID)) {
            return badRequest("targetId must be between 0 and " + MAX_TARGET_ID);
        }

        // uint32 on the wire, so ids above Integer.MAX_VALUE travel as negative ints
        Integer wireId = targetId == null ? null : (int) targetId.longValue();
        CompileResult result = compileService.compile(image, wireId, width, height);

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_OCTET_STREAM);
        headers.setContentDisposition(ContentDisposition.attachment()
                .filename(MarkerCompileService.markerFilename(image.getOriginalFilename()))
                .build());
        headers.set(HEADER_FEATURE_SOURCE, result.getFeatureSource().name());
        headers.set(HEADER_FEATURE_COUNT, String.valueOf(result.getFeatureCount()));
        headers.set(HEADER_DEGRADED, String.valueOf(result.isDegraded()));
        return ResponseEntity.ok().headers(headers).body(result.getBytes());
    }

    @PostMapping(value = "/validate", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<?> validate(@RequestParam(value = "image", required = false) MultipartFile image)
            throws CompileException, IOException {
        ResponseEntity<?> rejected = checkUpload(image);
        if (rejected != null) return rejected;

        QualityReport report = compileService.validate(image);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("valid", report.isValid());
        body.put("featureCount", report.getFeatureCount());
        body.put("sharpness", report.getSharpness());
        body.put("dimensions", List.of(report.getWidth(), report.getHeight()));
        body.put("issues", report.getIssues());
        body.put("recommendation", report.recommendation());
        return ResponseEntity.ok(body);
    }

    @GetMapping("/health")
    public Map<String, Object> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "healthy");
        body.put("service", SERVICE_NAME);
        body.put("version", SERVICE_VERSION);
        body.put("formatVersion", MarkerFormat.VERSION);
        return body;
    }

    private ResponseEntity<?> checkUpload(MultipartFile image) {
        if (image == null || image.isEmpty()) {
            return badRequest("No image data provided");
        }
        if (!compileService.isValidImageFile(image)) {
            return badRequest("Invalid file: " + image.getOriginalFilename());
        }
        return null;
    }

    // absent means "use the configured default"
    private static boolean isPhysicalSize(Float value) {
        return value == null || (Float.isFinite(value) && value > 0f);
    }

    private static ResponseEntity<Map<String, String>> badRequest(String message) {
        Map<String, String> error = new HashMap<>();
        error.put("error", message);
        return ResponseEntity.badRequest().body(error);
    }
}
