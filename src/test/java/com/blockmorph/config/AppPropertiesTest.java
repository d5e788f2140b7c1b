package com.blockmorph.config;

import static org.junit.jupiter.api.Assertions.*;

import com.blockmorph.morph.MorphSettings;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.springframework.mock.env.MockEnvironment;

class AppPropertiesTest {

    @Test
    void defaultsWhenNothingConfigured() {
        AppProperties properties = new AppProperties(new MockEnvironment());
        assertEquals("0.0.0.0", properties.getBindHost());
        assertEquals(3000, properties.getBindPort());
        assertEquals(MorphSettings.builder().build(), properties.getDefaultSettings());
        assertEquals(Path.of(""), properties.getOutputDirectory());
        assertNull(properties.getDefaultSettings().progressLogPercentStep());
    }

    @Test
    void progressLogStepIsConfigurable() {
        AppProperties fromProperty = new AppProperties(
                new MockEnvironment().withProperty("app.morph.progress-log-step", "10"));
        assertEquals(10, fromProperty.getDefaultSettings().progressLogPercentStep());

        AppProperties fromEnvironment = new AppProperties(
                new MockEnvironment().withProperty("MORPH_PROGRESS_LOG_STEP", "50"));
        assertEquals(50, fromEnvironment.getDefaultSettings().progressLogPercentStep());

        assertThrows(IllegalStateException.class,
                () -> new AppProperties(new MockEnvironment().withProperty("MORPH_PROGRESS_LOG_STEP", "0")));
    }

    @Test
    void propertiesTakePrecedenceOverEnvironmentKeys() {
        MockEnvironment environment = new MockEnvironment()
                .withProperty("app.morph.cell-size", "16")
                .withProperty("MORPH_CELL_SIZE", "64")
                .withProperty("MORPH_GRADIENT_WEIGHT", "0.25")
                .withProperty("MORPH_OUTPUT_DIR", "/tmp/morph")
                .withProperty("APP_BIND_ADDR", "127.0.0.1:8081");
        AppProperties properties = new AppProperties(environment);

        assertEquals(16, properties.getDefaultSettings().cellSize());
        assertEquals(0.25, properties.getDefaultSettings().gradientWeight());
        assertEquals(Path.of("/tmp/morph"), properties.getOutputDirectory());
        assertEquals("127.0.0.1", properties.getBindHost());
        assertEquals(8081, properties.getBindPort());
    }

    @Test
    void invalidValuesFailStartup() {
        assertThrows(IllegalStateException.class,
                () -> new AppProperties(new MockEnvironment().withProperty("MORPH_CELL_SIZE", "abc")));
        assertThrows(IllegalStateException.class,
                () -> new AppProperties(new MockEnvironment().withProperty("MORPH_GRADIENT_WEIGHT", "1.5")));
        assertThrows(IllegalStateException.class,
                () -> new AppProperties(new MockEnvironment().withProperty("APP_BIND_ADDR", "localhost")));
        assertThrows(IllegalStateException.class,
                () -> new AppProperties(new MockEnvironment().withProperty("PORT", "70000")));
    }
}
