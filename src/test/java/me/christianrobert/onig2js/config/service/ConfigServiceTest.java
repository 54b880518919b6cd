package me.christianrobert.onig2js.config.service;

import me.christianrobert.onig2js.transformer.context.ConversionOptions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConfigServiceTest {

    private ConfigService configService;

    @BeforeEach
    void setUp() {
        configService = new ConfigService();
    }

    @Test
    void defaultsMatchConversionOptions() {
        ConversionOptions options = configService.getConversionOptions();

        assertTrue(options.isAddGlobalFlag());
        assertEquals(256, options.getMaxNestingDepth());
        assertFalse(options.isIncludeNodeTree());
        assertEquals(3, configService.getAllConfiguration().size());
    }

    @Test
    void stringValuesAreParsed() {
        configService.updateConfiguration(Map.of(
                ConfigService.ADD_GLOBAL_FLAG, "false",
                ConfigService.MAX_NESTING_DEPTH, " 32 ",
                ConfigService.INCLUDE_NODE_TREE, "TRUE"));

        ConversionOptions options = configService.getConversionOptions();

        assertFalse(options.isAddGlobalFlag());
        assertEquals(32, options.getMaxNestingDepth());
        assertTrue(options.isIncludeNodeTree());
    }

    @Test
    void invalidDepthFallsBackToDefault() {
        configService.setConfigValue(ConfigService.MAX_NESTING_DEPTH, "deep");
        assertEquals(ConversionOptions.DEFAULT_MAX_NESTING_DEPTH, configService.getConversionOptions().getMaxNestingDepth());

        configService.setConfigValue(ConfigService.MAX_NESTING_DEPTH, 0);
        assertEquals(ConversionOptions.DEFAULT_MAX_NESTING_DEPTH, configService.getConversionOptions().getMaxNestingDepth());
    }

    @Test
    void typedGetters() {
        configService.setConfigValue("custom.number", 12L);

        assertEquals(Integer.valueOf(12), configService.getConfigValueAsInteger("custom.number"));
        assertEquals("12", configService.getConfigValueAsString("custom.number"));
        assertNull(configService.getConfigValueAsBoolean("custom.number"));
        assertNull(configService.getConfigValueAsString("missing"));
        assertTrue(configService.hasConfigKey("custom.number"));
    }

    @Test
    void resetRestoresDefaults() {
        configService.setConfigValue(ConfigService.ADD_GLOBAL_FLAG, false);
        configService.setConfigValue("custom.key", "x");

        configService.resetToDefaults();

        assertEquals(Boolean.TRUE, configService.getConfigValueAsBoolean(ConfigService.ADD_GLOBAL_FLAG));
        assertFalse(configService.hasConfigKey("custom.key"));
    }
}
