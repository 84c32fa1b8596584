package com.seismicrisk.retrofit.domain.repository;

import com.seismicrisk.retrofit.domain.model.VulnerabilityModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory registry of vulnerability models, keyed by reference.
 *
 * Models are immutable values, so a registered model can be handed to any number of
 * concurrent analyses. Re-registering a reference replaces the previous model for
 * analyses started afterwards.
 */
@Repository
@Slf4j
public class VulnerabilityModelRegistry {

    private final Map<String, VulnerabilityModel> models = new ConcurrentHashMap<>();

    public VulnerabilityModel register(VulnerabilityModel model) {
        VulnerabilityModel previous = models.put(model.reference(), model);
        if (previous != null) {
            log.info("Replaced vulnerability model {} ({} taxonomies)", model.reference(), model.functions().size());
        } else {
            log.info("Registered vulnerability model {} ({} taxonomies)", model.reference(), model.functions().size());
        }
        return model;
    }

    public Optional<VulnerabilityModel> findByReference(String reference) {
        return Optional.ofNullable(models.get(reference));
    }

    public Collection<VulnerabilityModel> findAll() {
        return List.copyOf(models.values());
    }

    public boolean isEmpty() {
        return models.isEmpty();
    }
}
