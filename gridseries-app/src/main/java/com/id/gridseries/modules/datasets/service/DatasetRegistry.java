package com.id.gridseries.modules.datasets.service;

import com.id.gridseries.config.AppConfig;
import com.id.gridseries.modules.datasets.model.DatasetDefinition;
import com.id.gridseries.modules.query.exception.DatasetNotFoundException;
import com.id.gridseries.modules.query.model.Resolution;
import com.id.gridseries.modules.store.SqlIdentifiers;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Whitelist of datasets, read from {@code gridseries.datasets} as {@code name:resolution[,name:resolution...]}.
 */
@Service
@Slf4j
public class DatasetRegistry {

    private final Map<String, DatasetDefinition> datasets;

    public DatasetRegistry(AppConfig appConfig) {
        this.datasets = Collections.unmodifiableMap(parse(appConfig.getDatasets()));
        log.info("Registered datasets: {}", datasets.values());
    }

    static Map<String, DatasetDefinition> parse(String raw) {
        Map<String, DatasetDefinition> out = new LinkedHashMap<>();
        if (raw == null || raw.isBlank()) {
            return out;
        }
        for (String entry : raw.split(",")) {
            String trimmed = entry.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            int sep = trimmed.indexOf(':');
            if (sep <= 0 || sep == trimmed.length() - 1) {
                throw new IllegalArgumentException("Invalid dataset entry '%s', expected name:resolution".formatted(trimmed));
            }
            String name = SqlIdentifiers.requireValid(trimmed.substring(0, sep).trim());
            Resolution resolution = Resolution.parse(trimmed.substring(sep + 1));
            if (out.putIfAbsent(name, new DatasetDefinition(name, resolution)) != null) {
                throw new IllegalArgumentException("Dataset '%s' declared twice".formatted(name));
            }
        }
        return out;
    }

    public Optional<DatasetDefinition> find(String name) {
        return Optional.ofNullable(name).map(datasets::get);
    }

    public DatasetDefinition require(String name) {
        return find(name).orElseThrow(() -> new DatasetNotFoundException(name));
    }

    public Collection<DatasetDefinition> all() {
        return datasets.values();
    }
}
