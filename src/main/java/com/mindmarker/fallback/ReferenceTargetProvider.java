package com.mindmarker.fallback;

import com.mindmarker.error.InternalException;
import com.mindmarker.markerFile.MarkerTarget;

import java.util.Optional;

/**
 * Source of a previously compiled target that can stand in when a photo cannot be compiled.
 */
public interface ReferenceTargetProvider {
    ReferenceTargetProvider NONE = Optional::empty;

    Optional<MarkerTarget> load() throws InternalException;
}
