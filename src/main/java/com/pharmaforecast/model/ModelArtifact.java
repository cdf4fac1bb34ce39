package com.pharmaforecast.model;

import org.springframework.core.io.Resource;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A named, serialized model. Names follow {@code model_<drugId>_<slug>.json},
 * the convention the trainer writes.
 */
public record ModelArtifact(String name, Resource resource) {

    private static final Pattern NAME_PATTERN = Pattern.compile("^model_(\\d+)(?:_.*)?\\.json$");

    public Optional<Long> drugId() {
        if (name == null) {
            return Optional.empty();
        }
        Matcher m = NAME_PATTERN.matcher(name);
        if (!m.matches()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Long.parseLong(m.group(1)));
        } catch (NumberFormatException ex) {
            return Optional.empty();
        }
    }
}
