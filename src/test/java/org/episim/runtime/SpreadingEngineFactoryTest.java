package org.episim.runtime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.episim.api.exceptions.SpreadingEngineException;
import org.episim.runtime.impl.StationarySpreadingEngine;
import org.episim.runtime.spi.ISpreadingEngine;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import com.typesafe.config.ConfigFactory;

@Tag("unit")
@DisplayName("SpreadingEngineFactory Unit Tests")
class SpreadingEngineFactoryTest {

    @Test
    void createsConfiguredEngine() throws Exception {
        ISpreadingEngine engine = SpreadingEngineFactory.create(ConfigFactory.parseString(
                "className = \"org.episim.runtime.impl.StationarySpreadingEngine\"\n"
                        + "options { validate-mass = true }"));

        assertThat(engine).isInstanceOf(StationarySpreadingEngine.class);
    }

    @Test
    void engineFromReferenceSettings() throws Exception {
        ISpreadingEngine engine = SpreadingEngineFactory.create(
                ConfigFactory.defaultReference().getConfig("episim.spreading-engine"));

        assertThat(engine).isInstanceOf(StationarySpreadingEngine.class);
    }

    @Test
    void missingClassName() {
        assertThatThrownBy(() -> SpreadingEngineFactory.create(ConfigFactory.empty()))
                .isInstanceOf(SpreadingEngineException.class)
                .hasMessageContaining("className");
    }

    @Test
    void unknownClass() {
        assertThatThrownBy(() -> SpreadingEngineFactory.create(
                ConfigFactory.parseString("className = \"org.episim.runtime.impl.Missing\"")))
                .isInstanceOf(SpreadingEngineException.class)
                .hasMessageContaining("org.episim.runtime.impl.Missing")
                .hasCauseInstanceOf(ClassNotFoundException.class);
    }

    @Test
    void classMustImplementEngineInterface() {
        assertThatThrownBy(() -> SpreadingEngineFactory.create(
                ConfigFactory.parseString("className = \"java.lang.String\"")))
                .isInstanceOf(SpreadingEngineException.class)
                .hasMessageContaining("does not implement");
    }
}
