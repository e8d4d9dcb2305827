package com.mindmarker.API;

import com.mindmarker.compiler.CompileOptions;
import com.mindmarker.compiler.CompileResult;
import com.mindmarker.compiler.MarkerCompiler;
import com.mindmarker.config.CompilerProperties;
import com.mindmarker.error.CompileException;
import com.mindmarker.quality.QualityReport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;

@Slf4j
@Service
public class MarkerCompileService {
    private static final String DEFAULT_NAME = "marker";

    private final MarkerCompiler compiler;
    private final CompilerProperties properties;

    public MarkerCompileService(MarkerCompiler compiler, CompilerProperties properties) {
        this.compiler = compiler;
        this.properties = properties;
    }

    public CompileResult compile(MultipartFile image, Integer targetId, Float width, Float height)
            throws CompileException, IOException {
        CompilerProperties.Target defaults = properties.getTarget();
        CompileOptions options = new CompileOptions(
                targetId == null ? 0 : targetId,
                width == null ? defaults.getDefaultWidth() : width,
                height == null ? defaults.getDefaultHeight() : height);
        log.info("Processing image: {}, size: {} bytes", image.getOriginalFilename(), image.getSize());
        return compiler.compile(image.getBytes(), options);
    }

    public QualityReport validate(MultipartFile image) throws CompileException, IOException {
        return compiler.validate(image.getBytes());
    }

    /**
     * Only image uploads with a known image extension are accepted.
     */
    public boolean isValidImageFile(MultipartFile file) {
        if (file == null || file.isEmpty()) return false;

        String contentType = file.getContentType();
        if (contentType == null || !contentType.startsWith("image/")) {
            return false;
        }

        String originalFilename = file.getOriginalFilename();
        return originalFilename != null &&
                originalFilename.matches("(?i).+\\.(jpg|jpeg|png|bmp|webp)$");
    }

    /**
     * photo.jpg -> photo.mind
     */
    public static String markerFilename(String originalFilename) {
        if (originalFilename == null || originalFilename.isBlank()) return DEFAULT_NAME + ".mind";
        String name = originalFilename.replace('\\', '/');
        name = name.substring(name.lastIndexOf('/') + 1);
        int dot = name.lastIndexOf('.');
        if (dot > 0) name = name.substring(0, dot);
        name = name.replaceAll("[^A-Za-z0-9._-]", "_");
        return (name.isEmpty() ? DEFAULT_NAME : name) + ".mind";
    }
}
