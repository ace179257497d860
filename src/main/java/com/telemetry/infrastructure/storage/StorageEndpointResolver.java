package com.telemetry.infrastructure.storage;

import com.telemetry.domain.exception.StorageConfigurationException;
import com.telemetry.domain.model.StorageEndpoint;
import com.telemetry.infrastructure.persistence.entity.StorageEndpointEntity;
import com.telemetry.infrastructure.persistence.repository.StorageEndpointRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.DoubleSupplier;
import java.util.stream.Collectors;

/**
 * Picks the storage endpoint for a project.
 *
 * Resolution order:
 * 1. Active non-shadow endpoints of the project, highest priority first
 * 2. Active non-shadow global endpoints
 * 3. In self-hosted mode, the configured fallback endpoint
 *
 * Several candidates are load balanced with weight {@code priority + 1}.
 * Uploads go to the selected endpoint and the chosen id is stored with the
 * artifact, so reads never depend on this choice.
 */
@Slf4j
@Component
public class StorageEndpointResolver {

    private final StorageEndpointRepository repository;
    private final StorageProperties properties;
    private final DoubleSupplier random;

    public StorageEndpointResolver(StorageEndpointRepository repository,
                                   StorageProperties properties,
                                   DoubleSupplier random) {
        this.repository = repository;
        this.properties = properties;
        this.random = random;
    }

    @Transactional(readOnly = true)
    public StorageEndpoint resolveForProject(UUID projectId) {
        List<StorageEndpointEntity> candidates = projectId == null
                ? List.of()
                : repository.findByProjectIdAndActiveTrueAndShadowFalseOrderByPriorityDesc(projectId);

        if (candidates.isEmpty()) {
            candidates = repository.findByProjectIdIsNullAndActiveTrueAndShadowFalseOrderByPriorityDesc();
        }

        if (candidates.isEmpty()) {
            return envFallback().orElseThrow(() -> new StorageConfigurationException(
                    "No storage endpoint configured for project " + projectId));
        }

        List<StorageEndpoint> endpoints = candidates.stream()
                .map(StorageEndpointResolver::toModel)
                .collect(Collectors.toList());

        if (endpoints.size() == 1) {
            return endpoints.get(0);
        }
        return selectWeighted(endpoints, random.getAsDouble());
    }

    /**
     * Endpoint by id, including the virtual fallback. Empty when unknown.
     */
    @Transactional(readOnly = true)
    public Optional<StorageEndpoint> findById(String endpointId) {
        if (endpointId == null || endpointId.isBlank()) {
            return Optional.empty();
        }
        if (StorageEndpoint.ENV_FALLBACK_ID.equals(endpointId)) {
            return envFallback();
        }

        UUID id;
        try {
            id = UUID.fromString(endpointId);
        } catch (IllegalArgumentException e) {
            log.warn("Ignoring malformed endpoint id: {}", endpointId);
            return Optional.empty();
        }
        return repository.findById(id).map(StorageEndpointResolver::toModel);
    }

    /**
     * Active shadow endpoints, project-specific ones first, then global ones.
     */
    @Transactional(readOnly = true)
    public List<StorageEndpoint> shadowsFor(UUID projectId) {
        List<StorageEndpoint> shadows = new ArrayList<>();
        if (projectId != null) {
            repository.findByProjectIdAndActiveTrueAndShadowTrue(projectId).stream()
                    .map(StorageEndpointResolver::toModel)
                    .forEach(shadows::add);
        }
        repository.findByProjectIdIsNullAndActiveTrueAndShadowTrue().stream()
                .map(StorageEndpointResolver::toModel)
                .forEach(shadows::add);
        return shadows;
    }

    /**
     * Every active endpoint that may hold objects of the project: its own
     * primaries and shadows, then the global ones. Falls back to the
     * configured endpoint in self-hosted mode.
     */
    @Transactional(readOnly = true)
    public List<StorageEndpoint> allFor(UUID projectId) {
        Map<String, StorageEndpoint> endpoints = new LinkedHashMap<>();
        if (projectId != null) {
            repository.findByProjectIdAndActiveTrue(projectId).stream()
                    .map(StorageEndpointResolver::toModel)
                    .forEach(e -> endpoints.putIfAbsent(e.getId(), e));
        }
        repository.findByProjectIdIsNullAndActiveTrue().stream()
                .map(StorageEndpointResolver::toModel)
                .forEach(e -> endpoints.putIfAbsent(e.getId(), e));
        envFallback().ifPresent(e -> endpoints.putIfAbsent(e.getId(), e));

        if (endpoints.isEmpty()) {
            throw new StorageConfigurationException("No storage endpoint configured for project " + projectId);
        }
        return new ArrayList<>(endpoints.values());
    }

    /**
     * Weighted pick: draw {@code r} in {@code [0, sum of weights)} and walk
     * the list subtracting weights until {@code r <= 0}.
     *
     * @param draw uniform value in {@code [0, 1)}
     */
    static StorageEndpoint selectWeighted(List<StorageEndpoint> endpoints, double draw) {
        int totalWeight = endpoints.stream().mapToInt(StorageEndpoint::weight).sum();
        double remaining = draw * totalWeight;

        for (StorageEndpoint endpoint : endpoints) {
            remaining -= endpoint.weight();
            if (remaining <= 0) {
                return endpoint;
            }
        }
        return endpoints.get(0);
    }

    private Optional<StorageEndpoint> envFallback() {
        StorageProperties.Fallback fallback = properties.getFallback();
        if (!properties.isSelfHosted() || !fallback.isConfigured()) {
            return Optional.empty();
        }
        return Optional.of(StorageEndpoint.builder()
                .id(StorageEndpoint.ENV_FALLBACK_ID)
                .endpointUrl(fallback.getEndpoint())
                .bucket(fallback.getBucket())
                .region(fallback.getRegion())
                .accessKeyId(fallback.getAccessKeyId())
                .keyRef(fallback.getSecretAccessKey())
                .priority(100)
                .shadow(false)
                .build());
    }

    static StorageEndpoint toModel(StorageEndpointEntity entity) {
        return StorageEndpoint.builder()
                .id(entity.getId().toString())
                .projectId(entity.getProjectId())
                .endpointUrl(entity.getEndpointUrl())
                .bucket(entity.getBucket())
                .region(entity.getRegion())
                .accessKeyId(entity.getAccessKeyId())
                .keyRef(entity.getKeyRef())
                .priority(entity.getPriority())
                .shadow(entity.isShadow())
                .build();
    }
}
