package com.id.gridseries.modules.datasets.model;

import com.id.gridseries.modules.query.model.Resolution;

/**
 * A known table and the cadence its samples were recorded at.
 */
public record DatasetDefinition(String name, Resolution nativeResolution) {
}
