package com.rosarchitect.core.nodemodel;

import org.junit.jupiter.api.Test;

import java.util.List;

import static com.rosarchitect.core.TestFixtures.model;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for the {@link NodeModelRegistry} implementations.
 */
class NodeModelRegistryTest {

    @Test
    void mapRegistry_looksUpByPackageAndExecutable() {
        NodeModel driver = model("laser", "driver", context -> { });
        MapNodeModelRegistry registry = MapNodeModelRegistry.builder().register(driver).build();

        assertThat(registry.lookup("laser", "driver")).containsSame(driver);
        assertThat(registry.lookup("laser", "other")).isEmpty();
        assertThat(MapNodeModelRegistry.empty().models()).isEmpty();
    }

    @Test
    void mapRegistry_rejectsDuplicates() {
        MapNodeModelRegistry.Builder builder = MapNodeModelRegistry.builder()
            .register(model("laser", "driver", context -> { }));

        assertThatThrownBy(() -> builder.register(model("laser", "driver", context -> { })))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("laser/driver");
    }

    @Test
    void compositeRegistry_firstDelegateWins() {
        NodeModel custom = model("laser", "driver", context -> { });
        NodeModel builtIn = model("laser", "driver", context -> { });
        NodeModel other = model("camera", "driver", context -> { });
        CompositeNodeModelRegistry registry = new CompositeNodeModelRegistry(List.of(
            MapNodeModelRegistry.builder().register(custom).build(),
            MapNodeModelRegistry.builder().register(builtIn).register(other).build()));

        assertThat(registry.lookup("laser", "driver")).containsSame(custom);
        assertThat(registry.lookup("camera", "driver")).containsSame(other);
        assertThat(registry.models()).containsExactly(other, custom);
    }

    @Test
    void serviceLoaderRegistry_discoversStandardModels() {
        ServiceLoaderNodeModelRegistry registry = new ServiceLoaderNodeModelRegistry();

        assertThat(registry.lookup("image_transport", "republish")).isPresent();
        assertThat(registry.lookup("robot_state_publisher", "robot_state_publisher")).isPresent();
        assertThat(registry.models())
            .extracting(model -> NodeModel.key(model.getPackageName(), model.getExecutable()))
            .isSorted()
            .contains("joint_state_publisher/joint_state_publisher");
    }
}
