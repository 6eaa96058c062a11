package com.ttennebkram.imagelab.config;

import com.ttennebkram.imagelab.ValidationException;
import com.ttennebkram.imagelab.processing.EqualizationMode;
import org.junit.jupiter.api.Test;

import java.io.StringReader;

import static org.junit.jupiter.api.Assertions.*;

class EngineConfigTest {

    @Test
    void defaultsAreUnboundedPerChannelUnseeded() {
        EngineConfig config = EngineConfig.defaults();
        assertEquals(0, config.getHistoryLimit());
        assertEquals(EqualizationMode.PER_CHANNEL, config.getEqualizationMode());
        assertFalse(config.hasRandomSeed());
    }

    @Test
    void bundledResourceLoads() {
        EngineConfig config = EngineConfig.load();
        assertEquals(0, config.getHistoryLimit());
        assertEquals(EqualizationMode.PER_CHANNEL, config.getEqualizationMode());
    }

    @Test
    void readsUnderscoreFieldNames() {
        EngineConfig config = EngineConfig.fromJson(new StringReader(
                "{\"history_limit\": 20, \"equalization_mode\": \"luma\", \"random_seed\": 99}"));
        assertEquals(20, config.getHistoryLimit());
        assertEquals(EqualizationMode.LUMA, config.getEqualizationMode());
        assertTrue(config.hasRandomSeed());
        assertEquals(config.newRandom().nextLong(), config.newRandom().nextLong());
    }

    @Test
    void missingFieldsKeepDefaults() {
        EngineConfig config = EngineConfig.fromJson(new StringReader("{\"random_seed\": 5}"));
        assertEquals(0, config.getHistoryLimit());
        assertEquals(EqualizationMode.PER_CHANNEL, config.getEqualizationMode());
    }

    @Test
    void invalidValuesRejected() {
        assertThrows(ValidationException.class,
                () -> EngineConfig.fromJson(new StringReader("{\"history_limit\": -1}")));
        assertThrows(ValidationException.class,
                () -> EngineConfig.fromJson(new StringReader("{\"equalization_mode\": \"hsv\"}")));
        assertThrows(ValidationException.class,
                () -> EngineConfig.fromJson(new StringReader("{\"history_limit\": \"many\"}")));
    }

    @Test
    void withMethodsCopy() {
        EngineConfig base = EngineConfig.defaults();
        EngineConfig changed = base.withHistoryLimit(3).withEqualizationMode(EqualizationMode.LUMA);
        assertEquals(0, base.getHistoryLimit());
        assertEquals(3, changed.getHistoryLimit());
        assertEquals(EqualizationMode.LUMA, changed.getEqualizationMode());
    }
}
