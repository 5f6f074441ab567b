package io.parley.core.detect;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Identifier-to-detector mapping. Lookup ignores case and treats {@code -} like {@code _}.
 */
public final class DetectorRegistry {
    private final Map<String, Detector> detectors = new LinkedHashMap<>();
    private final Map<String, String> aliases = new LinkedHashMap<>();

    public DetectorRegistry register(Detector detector) {
        detectors.put(normalize(detector.id()), detector);
        return this;
    }

    public DetectorRegistry alias(String alias, String detectorId) {
        aliases.put(normalize(alias), normalize(detectorId));
        return this;
    }

    public Optional<Detector> find(String name) {
        String key = normalize(name);
        Detector detector = detectors.get(key);
        if (detector == null && aliases.containsKey(key)) {
            detector = detectors.get(aliases.get(key));
        }
        return Optional.ofNullable(detector);
    }

    public Collection<Detector> all() {
        return Collections.unmodifiableCollection(detectors.values());
    }

    private String normalize(String name) {
        return name == null ? "" : name.trim().toLowerCase(Locale.ROOT).replace('-', '_');
    }
}
