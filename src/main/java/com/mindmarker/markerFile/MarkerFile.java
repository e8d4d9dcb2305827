package com.mindmarker.markerFile;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

@Getter
@ToString
@EqualsAndHashCode
public class MarkerFile {
    private final int version;
    private final List<MarkerTarget> targets;

    public MarkerFile(int version, List<MarkerTarget> targets) {
        if (targets == null || targets.isEmpty()) {
            throw new IllegalArgumentException("A marker file holds at least one target");
        }
        this.version = version;
        this.targets = List.copyOf(targets);
    }

    public static MarkerFile single(MarkerTarget target) {
        return new MarkerFile(MarkerFormat.VERSION, List.of(target));
    }

    public MarkerTarget firstTarget() {
        return targets.get(0);
    }

    public int targetCount() {
        return targets.size();
    }
}
