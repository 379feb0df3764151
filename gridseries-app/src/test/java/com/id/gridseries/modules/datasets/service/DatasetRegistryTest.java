package com.id.gridseries.modules.datasets.service;

import com.id.gridseries.config.TestAppConfigs;
import com.id.gridseries.modules.datasets.model.DatasetDefinition;
import com.id.gridseries.modules.query.exception.DatasetNotFoundException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DatasetRegistryTest {

    @Test
    void parsesEntriesInDeclarationOrder() {
        Map<String, DatasetDefinition> parsed = DatasetRegistry.parse(" b_data:1s , a_data:30s,,");
        assertEquals(List.of("b_data", "a_data"), List.copyOf(parsed.keySet()));
        assertEquals(Duration.ofSeconds(30), parsed.get("a_data").nativeResolution().step());
        assertTrue(DatasetRegistry.parse("").isEmpty());
        assertTrue(DatasetRegistry.parse(null).isEmpty());
    }

    @Test
    void rejectsBadEntries() {
        assertThrows(IllegalArgumentException.class, () -> DatasetRegistry.parse("no_resolution"));
        assertThrows(IllegalArgumentException.class, () -> DatasetRegistry.parse("trailing:"));
        assertThrows(IllegalArgumentException.class, () -> DatasetRegistry.parse(":30s"));
        assertThrows(IllegalArgumentException.class, () -> DatasetRegistry.parse("Bad-Name:30s"));
        assertThrows(IllegalArgumentException.class, () -> DatasetRegistry.parse("a:30s,a:1s"));
        assertThrows(IllegalArgumentException.class, () -> DatasetRegistry.parse("a:soon"));
    }

    @Test
    void findAndRequire() {
        DatasetRegistry registry = new DatasetRegistry(TestAppConfigs.defaults());

        assertEquals(3, registry.all().size());
        assertEquals(Duration.ofSeconds(30),
                registry.require("swissgrid_frequency_data").nativeResolution().step());
        assertTrue(registry.find("volume_frequency_data").isPresent());
        assertTrue(registry.find(null).isEmpty());
        DatasetNotFoundException e = assertThrows(DatasetNotFoundException.class, () -> registry.require("nope"));
        assertEquals("nope", e.getDatasetName());
    }
}
