package org.railyard.pipeline.stages.tools;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Path;
import java.util.Map;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.railyard.junit.extensions.logging.ExpectLog;
import org.railyard.junit.extensions.logging.LogLevel;
import org.railyard.junit.extensions.logging.LogWatchExtension;
import org.railyard.pipeline.api.data.Table;
import org.railyard.pipeline.api.stages.ConfigurationException;
import org.railyard.pipeline.stages.StageContext;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class RowSelectorTest {

    @TempDir
    Path tempDir;

    @Test
    void keepsRequestedRows() throws Exception {
        RowSelector selector = new RowSelector("select", Map.of("start", 1L, "stop", 3L, "outputMode", "return"),
                StageContext.local(tempDir));
        selector.setData(RowSelector.INPUT, Table.of("a", 10, 11, 12, 13));

        selector.execute();

        assertThat(selector.getData(RowSelector.OUTPUT, Table.class)).isEqualTo(Table.of("a", 11, 12));
    }

    @Test
    void negativeStopMeansEnd() throws Exception {
        RowSelector selector = new RowSelector("select", Map.of("start", 2L), StageContext.local(tempDir));
        selector.setData(RowSelector.INPUT, Table.of("a", 10, 11, 12, 13));

        selector.execute();

        assertThat(tempDir.resolve("output.rtab")).exists();
        assertThat(selector.getData(RowSelector.OUTPUT, Table.class)).isEqualTo(Table.of("a", 12, 13));
    }

    @Test
    @ExpectLog(level = LogLevel.ERROR, messagePattern = "Stage 'select' failed while RUNNING: .*cannot select rows.*")
    void rejectsInvertedRange() throws Exception {
        RowSelector selector = new RowSelector("select", Map.of("start", 3L, "stop", 1L), StageContext.local(tempDir));
        selector.setData(RowSelector.INPUT, Table.of("a", 10, 11, 12, 13));

        assertThatThrownBy(selector::execute).isInstanceOf(ConfigurationException.class);
    }
}
