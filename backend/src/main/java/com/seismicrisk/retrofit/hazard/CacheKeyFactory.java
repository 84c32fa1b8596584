package com.seismicrisk.retrofit.hazard;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.seismicrisk.retrofit.domain.model.Site;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Derives the {@link CacheKey} of a job from its hazard-affecting parameters.
 *
 * CANONICAL FORM:
 * - Only HAZARD-scoped {@link JobParameter}s are included, under their external keys
 * - Object properties and map entries are written in sorted order
 * - Sites are sorted by id; the computed curves do not depend on list order
 * - The key-schema version is included as "key_schema_version"
 *
 * The same configuration always yields the same key, in any JVM.
 */
@Component
@Slf4j
public class CacheKeyFactory {

    static final String SCHEMA_VERSION_KEY = "key_schema_version";

    private static final ObjectMapper CANONICAL_MAPPER = JsonMapper.builder()
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .build();

    private final HazardCacheProperties properties;

    public CacheKeyFactory(HazardCacheProperties properties) {
        this.properties = properties;
    }

    public CacheKey keyFor(JobConfiguration configuration) {
        String canonical = canonicalJson(configuration);
        CacheKey key = CacheKey.of(sha256Hex(canonical));
        log.debug("Cache key {} for canonical parameters {}", key.shortForm(), canonical);
        return key;
    }

    String canonicalJson(JobConfiguration configuration) {
        Map<String, Object> parameters = new TreeMap<>();
        for (JobParameter parameter : JobParameter.hazardParameters()) {
            parameters.put(parameter.key(), normalize(parameter.extract(configuration)));
        }
        parameters.put(SCHEMA_VERSION_KEY, properties.getKeySchemaVersion());
        try {
            return CANONICAL_MAPPER.writeValueAsString(parameters);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Job configuration cannot be fingerprinted", e);
        }
    }

    private Object normalize(Object value) {
        if (value instanceof List<?> list && !list.isEmpty() && list.get(0) instanceof Site) {
            return list.stream()
                    .map(Site.class::cast)
                    .sorted(Comparator.comparing(Site::id))
                    .toList();
        }
        if (value instanceof Map<?, ?> map) {
            return new TreeMap<>(map);
        }
        return value;
    }

    private static String sha256Hex(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
