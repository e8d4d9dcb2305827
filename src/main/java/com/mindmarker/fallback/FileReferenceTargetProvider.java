package com.mindmarker.fallback;

import com.mindmarker.error.FormatException;
import com.mindmarker.error.InternalException;
import com.mindmarker.markerFile.MarkerDecoder;
import com.mindmarker.markerFile.MarkerTarget;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Reads a marker file from local disk once and keeps its first target in memory.
 */
@Slf4j
public class FileReferenceTargetProvider implements ReferenceTargetProvider {
    private final Path path;
    private final MarkerDecoder decoder;
    private volatile MarkerTarget cached;

    public FileReferenceTargetProvider(Path path, MarkerDecoder decoder) {
        this.path = path;
        this.decoder = decoder;
    }

    @Override
    public Optional<MarkerTarget> load() throws InternalException {
        MarkerTarget target = cached;
        if (target != null) return Optional.of(target);
        synchronized (this) {
            if (cached == null) {
                cached = read();
                log.info("Loaded reference target from {}: {}", path, cached);
            }
            return Optional.of(cached);
        }
    }

    private MarkerTarget read() throws InternalException {
        try {
            return decoder.decode(Files.readAllBytes(path)).firstTarget();
        } catch (IOException e) {
            throw new InternalException("Cannot read reference target " + path + ": " + e.getMessage(), e);
        } catch (FormatException e) {
            throw new InternalException("Reference target " + path + " is not a valid marker file: " + e.getMessage(), e);
        }
    }
}
