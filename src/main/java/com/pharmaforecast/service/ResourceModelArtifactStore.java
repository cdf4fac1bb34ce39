package com.pharmaforecast.service;

import com.pharmaforecast.exception.ModelLoadException;
import com.pharmaforecast.model.ModelArtifact;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.core.io.support.ResourcePatternResolver;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/** Artifacts are the {@code *.json} files under a Spring resource location ({@code file:} or {@code classpath:}). */
@Slf4j
@Component
public class ResourceModelArtifactStore implements ModelArtifactStore {

    private final String location;
    private final ResourcePatternResolver resolver;

    @Autowired
    public ResourceModelArtifactStore(@Value("${forecast.models.location:file:models/trained}") String location) {
        this(location, new PathMatchingResourcePatternResolver());
    }

    ResourceModelArtifactStore(String location, ResourcePatternResolver resolver) {
        this.location = location.endsWith("/") ? location.substring(0, location.length() - 1) : location;
        this.resolver = resolver;
    }

    @Override
    public List<ModelArtifact> list() {
        Resource[] resources;
        try {
            resources = resolver.getResources(location + "/*.json");
        } catch (IOException ex) {
            throw new ModelLoadException(location, "artifact location cannot be listed", ex);
        }
        List<ModelArtifact> artifacts = Arrays.stream(resources)
            .filter(Resource::isReadable)
            .filter(r -> r.getFilename() != null)
            .map(r -> new ModelArtifact(Objects.requireNonNull(r.getFilename()), r))
            .sorted(Comparator.comparing(ModelArtifact::name))
            .toList();
        log.debug("Artifact scan | location={} | found={}", location, artifacts.size());
        return artifacts;
    }

    @Override
    public String location() {
        return location;
    }
}
