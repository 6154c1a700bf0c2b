package org.railyard.pipeline.utils;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Map;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class PathExpansionTest {

    private final Map<String, String> env = Map.of("DATA", "/srv/data", "RUN", "r7");

    @Test
    void expandsBothSyntaxes() {
        assertThat(PathExpansion.expandPath("$DATA/${RUN}/out.rtab", env)).isEqualTo("/srv/data/r7/out.rtab");
    }

    @Test
    void leavesUnknownVariablesUntouched() {
        assertThat(PathExpansion.expandPath("${MISSING}/x/$ALSO_MISSING", env)).isEqualTo("${MISSING}/x/$ALSO_MISSING");
    }

    @Test
    void passesThroughPlainPathsAndNull() {
        assertThat(PathExpansion.expandPath("plain/path.rtab", env)).isEqualTo("plain/path.rtab");
        assertThat(PathExpansion.expandPath(null, env)).isNull();
    }

    @Test
    void replacementsAreTakenLiterally() {
        assertThat(PathExpansion.expandPath("$X/y", Map.of("X", "a$b\\c"))).isEqualTo("a$b\\c/y");
    }
}
