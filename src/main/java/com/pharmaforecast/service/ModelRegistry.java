package com.pharmaforecast.service;

import com.pharmaforecast.exception.ModelLoadException;
import com.pharmaforecast.exception.ModelNotFoundException;
import com.pharmaforecast.model.DemandModel;
import com.pharmaforecast.model.DrugInfo;
import com.pharmaforecast.model.ModelArtifact;
import com.pharmaforecast.model.ModelArtifactReader;
import com.pharmaforecast.repository.DrugRepository;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Holds one trained model per drug together with the drug catalog.
 *
 * <p>Both are published as a single immutable {@link Snapshot}. A reload builds
 * the next snapshot off to the side and installs it with one reference write,
 * so readers never block and never see models from two generations at once.
 * Reloads themselves are serialized.
 */
@Slf4j
@Service
public class ModelRegistry {

    private final ModelArtifactStore artifactStore;
    private final ModelArtifactReader artifactReader;
    private final DrugRepository drugRepository;
    private final Clock clock;

    private final AtomicReference<Snapshot> current = new AtomicReference<>(Snapshot.EMPTY);
    private final ReentrantLock reloadLock = new ReentrantLock();

    public ModelRegistry(ModelArtifactStore artifactStore, ModelArtifactReader artifactReader,
                         DrugRepository drugRepository, Clock clock) {
        this.artifactStore = artifactStore;
        this.artifactReader = artifactReader;
        this.drugRepository = drugRepository;
        this.clock = clock;
    }

    @PostConstruct
    void load() {
        try {
            reload();
        } catch (ModelLoadException ex) {
            log.error("Initial model load failed, serving with no models | location={} | cause={}",
                artifactStore.location(), ex.getMessage());
        }
    }

    /**
     * Re-reads every artifact and the catalog and swaps them in atomically.
     *
     * @return number of models in the new generation
     * @throws ModelLoadException when the artifact store cannot be listed; the previous generation stays live
     */
    public int reload() {
        reloadLock.lock();
        try {
            Snapshot previous = current.get();
            Map<Long, DemandModel> models = loadModels();
            Map<Long, DrugInfo> catalog = loadCatalog(previous.catalog());
            Snapshot next = new Snapshot(previous.generation() + 1, clock.instant(), Map.copyOf(models), Map.copyOf(catalog));
            current.set(next);
            log.info("Models loaded | generation={} | models={} | catalog={} | location={}",
                next.generation(), models.size(), catalog.size(), artifactStore.location());
            return models.size();
        } finally {
            reloadLock.unlock();
        }
    }

    @PreDestroy
    void dispose() {
        current.set(Snapshot.EMPTY);
        log.info("Model registry disposed");
    }

    public Snapshot snapshot() {
        return current.get();
    }

    private Map<Long, DemandModel> loadModels() {
        List<ModelArtifact> artifacts = artifactStore.list();
        Map<Long, DemandModel> models = new HashMap<>();
        for (ModelArtifact artifact : artifacts) {
            Optional<Long> drugId = artifact.drugId();
            if (drugId.isEmpty()) {
                log.warn("Skipping artifact with unrecognised name | artifact={}", artifact.name());
                continue;
            }
            try {
                DemandModel model = artifactReader.read(artifact);
                DemandModel replaced = models.put(drugId.get(), model);
                if (replaced != null) {
                    log.warn("Duplicate artifact for drug, keeping the later one | drugId={} | artifact={}",
                        drugId.get(), artifact.name());
                }
                log.debug("Model loaded | drugId={} | artifact={} | model={}", drugId.get(), artifact.name(), model.describe());
            } catch (ModelLoadException ex) {
                log.warn("Skipping model artifact | artifact={} | reason={}", artifact.name(), ex.getMessage());
            }
        }
        return models;
    }

    private Map<Long, DrugInfo> loadCatalog(Map<Long, DrugInfo> previous) {
        try {
            Map<Long, DrugInfo> catalog = new HashMap<>();
            drugRepository.findAllByOrderByIdAsc().forEach(d -> catalog.put(d.getId().longValue(), DrugInfo.from(d)));
            return catalog;
        } catch (DataAccessException ex) {
            log.warn("Catalog load failed, keeping previous catalog | entries={} | cause={}",
                previous.size(), ex.getMessage());
            return previous;
        }
    }

    public record Snapshot(long generation, Instant loadedAt, Map<Long, DemandModel> models, Map<Long, DrugInfo> catalog) {

        static final Snapshot EMPTY = new Snapshot(0, Instant.EPOCH, Map.of(), Map.of());

        public SortedSet<Long> drugIds() {
            return new TreeSet<>(models.keySet());
        }

        public DemandModel requireModel(long drugId) {
            DemandModel model = models.get(drugId);
            if (model == null) {
                throw new ModelNotFoundException(drugId);
            }
            return model;
        }

        public Optional<DrugInfo> drugInfo(long drugId) {
            return Optional.ofNullable(catalog.get(drugId));
        }
    }
}
