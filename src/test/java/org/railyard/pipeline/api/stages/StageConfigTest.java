package org.railyard.pipeline.api.stages;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class StageConfigTest {

    private static final StageParameter<Long> CHUNK = StageParameter.optional("chunkSize", Long.class, 100L, "rows per chunk");
    private static final StageParameter<Double> ZMAX = StageParameter.optional("zMax", Double.class, 3.0, "upper edge");
    private static final StageParameter<String> COLUMN = StageParameter.required("column", String.class, "column to use");
    private static final StageParameter<List<?>> NAMES = StageParameter.list("names", List.of("a"), "names");

    private static StageParameters declared() {
        return StageParameters.builder().add(CHUNK).add(ZMAX).add(COLUMN).add(NAMES).build();
    }

    @Test
    void appliesDefaultsForUnsuppliedParameters() {
        StageConfig config = new StageConfig("s", declared(), Map.of("column", "z"));

        assertThat(config.getLong("chunkSize")).isEqualTo(100L);
        assertThat(config.getDouble("zMax")).isEqualTo(3.0);
        assertThat(config.getString("column")).isEqualTo("z");
        assertThat(config.getStringList("names")).containsExactly("a");
    }

    @Test
    void widensIntegralValues() {
        StageConfig config = new StageConfig("s", declared(), Map.of("column", "z", "chunkSize", 7, "zMax", 2));

        assertThat(config.getLong("chunkSize")).isEqualTo(7L);
        assertThat(config.getInt("chunkSize")).isEqualTo(7);
        assertThat(config.getDouble("zMax")).isEqualTo(2.0);
    }

    @Test
    void rejectsUnknownKeys() {
        assertThatThrownBy(() -> new StageConfig("s", declared(), Map.of("column", "z", "chunksize", 5L)))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("unknown parameters [chunksize]");
    }

    @Test
    void rejectsMissingRequired() {
        assertThatThrownBy(() -> new StageConfig("s", declared(), Map.of()))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("missing required parameters [column]");
    }

    @Test
    void rejectsWrongTypes() {
        assertThatThrownBy(() -> new StageConfig("s", declared(), Map.of("column", "z", "chunkSize", 2.5)))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("chunkSize");
        assertThatThrownBy(() -> new StageConfig("s", declared(), Map.of("column", 3L)))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("expects String");
    }

    @Test
    @SuppressWarnings("unchecked")
    void rejectsDefaultOfWrongType() {
        Class<Object> token = (Class<Object>) (Class<?>) Long.class;
        assertThatThrownBy(() -> StageParameter.optional("n", token, "ten", "bad default"))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("default ten");
    }

    @Test
    void collectionParametersAreTyped() {
        StageParameter<Map<String, ?>> columns = StageParameter.requiredMap("columns", "renames");
        StageParameters params = StageParameters.builder().add(columns).add(NAMES).build();

        StageConfig config = new StageConfig("s", params, Map.of("columns", Map.of("a", "b"), "names", List.of(1L, "x")));

        assertThat(columns.getType()).isEqualTo(Map.class);
        assertThat(columns.isRequired()).isTrue();
        assertThat(config.getMap("columns")).containsEntry("a", "b");
        assertThat(config.getStringList("names")).containsExactly("1", "x");
        assertThatThrownBy(() -> new StageConfig("s", params, Map.of("columns", List.of("a"))))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("expects Map");
        assertThatThrownBy(() -> new StageConfig("s", params, Map.of()))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("missing required parameters [columns]");
    }

    @Test
    void rejectsUnsupportedTypes() {
        assertThatThrownBy(() -> StageParameter.optional("n", Integer.class, 1, "ints are not supported"))
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void getChecksDeclarationAndType() {
        StageConfig config = new StageConfig("s", declared(), Map.of("column", "z"));

        assertThatThrownBy(() -> config.get("other", String.class)).isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> config.get("chunkSize", String.class)).isInstanceOf(ConfigurationException.class);
    }

    @Test
    void laterDeclarationOverridesDefault() {
        StageParameters params = StageParameters.builder().add(CHUNK).add(CHUNK.withDefault(5L)).build();

        assertThat(new StageConfig("s", params, Map.of()).getLong("chunkSize")).isEqualTo(5L);
        assertThat(params.all()).hasSize(1);
    }
}
