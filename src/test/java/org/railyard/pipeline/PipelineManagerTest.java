package org.railyard.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.FileNotFoundException;
import java.nio.file.Path;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.railyard.junit.extensions.logging.ExpectLog;
import org.railyard.junit.extensions.logging.LogLevel;
import org.railyard.junit.extensions.logging.LogWatchExtension;
import org.railyard.pipeline.api.data.DataLookupException;
import org.railyard.pipeline.api.data.Table;
import org.railyard.pipeline.api.stages.ConfigurationException;
import org.railyard.pipeline.api.stages.StageState;
import org.railyard.pipeline.config.ConfigLoader;
import org.railyard.pipeline.data.TableHandle;
import org.railyard.pipeline.stages.AbstractStage;
import org.railyard.pipeline.stages.evaluation.PointToPointEvaluator;
import org.railyard.pipeline.stages.tools.RowSelector;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class PipelineManagerTest {

    @TempDir
    Path tempDir;

    private Path training;
    private Path catalog;

    @BeforeEach
    void writeInputs() throws Exception {
        training = tempDir.resolve("training.rtab");
        TableHandle trainingHandle = new TableHandle("training", training.toString(), "test");
        trainingHandle.setData(Table.of("redshift", 0.3, 0.3, 0.3, 0.7, 1.1), false);
        trainingHandle.write();

        catalog = tempDir.resolve("catalog.rtab");
        TableHandle catalogHandle = new TableHandle("catalog", catalog.toString(), "test");
        catalogHandle.setData(Table.builder("id", "mag", "redshift")
                .addRow(1, 21.0, 0.3)
                .addRow(2, 22.0, 0.4)
                .addRow(3, 23.0, 0.2)
                .addRow(4, 24.0, 1.5)
                .addRow(5, 25.0, 0.3)
                .build(), false);
        catalogHandle.write();
    }

    private Config config(String pipelineBody) {
        return ConfigLoader.loadFromString(String.format("pipeline { outputDirectory = \"%s\"\n%s\n}",
                tempDir.resolve("out"), pipelineBody));
    }

    @Test
    void runsInformEstimateEvaluateChain() throws Exception {
        Config config = config(String.format("""
                data { training { type = "rtab", path = "%s" } }
                stages {
                  inform {
                    type = "trainZInformer"
                    options { zMin = 0.0, zMax = 2.0, nzBins = 21 }
                    aliases { input = "training" }
                  }
                  estimate {
                    type = "trainZEstimator"
                    options { idCol = "id", chunkSize = 2, calculatedPointEstimates = ["mode"] }
                    connections { model = "inform.model" }
                    inputs { input = "%s" }
                  }
                  evaluate {
                    type = "pointToPointEvaluator"
                    options { metrics = ["delta_z", "mean_bias", "outlier_rate"], chunkSize = 2 }
                    connections { input = "estimate.output" }
                    inputs { truth = "%s" }
                  }
                }
                stageSequence = ["inform", "estimate", "evaluate"]
                """, training, catalog, catalog));

        Map<String, AbstractStage> stages = new PipelineManager(config).run();

        Path out = tempDir.resolve("out");
        assertThat(stages).containsOnlyKeys("inform", "estimate", "evaluate");
        assertThat(stages.values()).extracting(AbstractStage::getCurrentState).containsOnly(StageState.DONE);
        assertThat(out.resolve("inform_model.ser.zst")).exists();
        assertThat(out.resolve("estimate_output.rens")).exists();
        assertThat(out.resolve("evaluate_output.rtab")).exists();
        assertThat(out.resolve("evaluate_summary.json")).exists();

        Table summary = stages.get("evaluate").getData(PointToPointEvaluator.SUMMARY, Table.class);
        assertThat(summary.columnNames()).containsExactly("mean_bias", "outlier_rate");
        // every object gets the training mode 0.3; only the z = 1.5 object is an outlier
        assertThat(summary.get("outlier_rate", 0)).isEqualTo(0.2);
        Table deltaZ = new TableHandle("dz", out.resolve("evaluate_output.rtab").toString(), "test").read();
        assertThat(deltaZ.numRows()).isEqualTo(5);
    }

    @Test
    void outputsWithoutAliasAreNamedAfterTheStage() throws Exception {
        Config config = config(String.format("""
                stages {
                  first { type = "rowSelector", options { stop = 3 }, inputs { input = "%s" } }
                  second { type = "rowSelector", options { start = 1 }, connections { input = "first.output" } }
                  third { type = "rowSelector", aliases { output = "selected" }, connections { input = "second.output" } }
                }
                stageSequence = ["first", "second", "third"]
                """, catalog));
        PipelineManager manager = new PipelineManager(config);

        Map<String, AbstractStage> stages = manager.run(manager.newContext());

        assertThat(stages.get("first").resolveAlias(RowSelector.OUTPUT)).isEqualTo("first_output");
        assertThat(stages.get("second").resolveAlias(RowSelector.INPUT)).isEqualTo("first_output");
        assertThat(stages.get("third").getData(RowSelector.OUTPUT, Table.class).column("id")).containsExactly(2, 3);
        assertThat(tempDir.resolve("out").resolve("selected.rtab")).exists();
    }

    @Test
    void instantiatesStagesByClassName() throws Exception {
        Config config = config(String.format("""
                stages {
                  select { className = "%s", options { start = 4 }, inputs { input = "%s" } }
                }
                stageSequence = ["select"]
                """, RowSelector.class.getName(), catalog));
        PipelineManager manager = new PipelineManager(config);

        Map<String, AbstractStage> stages = manager.build(manager.newContext());

        assertThat(stages.get("select")).isInstanceOf(RowSelector.class);
        assertThat(stages.get("select").getConfig().getLong("start")).isEqualTo(4L);
    }

    @Test
    void rejectsClassesThatAreNotStages() {
        Config config = config("""
                stages { odd { className = "java.lang.String" } }
                stageSequence = ["odd"]
                """);
        PipelineManager manager = new PipelineManager(config);

        assertThatThrownBy(() -> manager.build(manager.newContext()))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("java.lang.String");
    }

    @Test
    void rejectsConnectionsToLaterOrUnknownStages() {
        Config config = config("""
                stages {
                  second { type = "rowSelector", connections { input = "first.output" } }
                  first { type = "rowSelector" }
                }
                stageSequence = ["second", "first"]
                """);
        PipelineManager manager = new PipelineManager(config);

        assertThatThrownBy(() -> manager.build(manager.newContext()))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("does not run before it");
    }

    @Test
    void rejectsMalformedConnections() {
        Config config = config("""
                stages {
                  first { type = "rowSelector" }
                  second { type = "rowSelector", connections { input = "first" } }
                }
                stageSequence = ["first", "second"]
                """);
        PipelineManager manager = new PipelineManager(config);

        assertThatThrownBy(() -> manager.build(manager.newContext()))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("stageName.outputTag");
    }

    @Test
    void rejectsUnknownStageTypes() {
        Config config = config("""
                stages { odd { type = "noSuchStage" } }
                stageSequence = ["odd"]
                """);
        PipelineManager manager = new PipelineManager(config);

        assertThatThrownBy(() -> manager.build(manager.newContext())).isInstanceOf(DataLookupException.class);
    }

    @Test
    void missingInputFileFailsTheBuild() {
        Config config = config(String.format("""
                stages { select { type = "rowSelector", inputs { input = "%s" } } }
                stageSequence = ["select"]
                """, tempDir.resolve("missing.rtab")));
        PipelineManager manager = new PipelineManager(config);

        assertThatThrownBy(() -> manager.build(manager.newContext())).isInstanceOf(FileNotFoundException.class);
    }

    @Test
    void rejectsUndefinedStagesInSequence() {
        assertThatThrownBy(() -> new PipelineManager(config("stageSequence = [\"ghost\"]")))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("ghost");
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Stage 'idle' is defined but not part of stageSequence and will not run")
    void warnsAboutStagesOutsideTheSequence() {
        PipelineManager manager = new PipelineManager(config("stages { idle { type = \"rowSelector\" } }"));

        assertThat(manager.getStageSequence()).isEmpty();
    }

    @Test
    void requiresPipelineSection() {
        assertThatThrownBy(() -> new PipelineManager(ConfigFactory.parseString("other = 1")))
                .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> new PipelineManager(config("workers = 0")))
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void workersShareTheChunksOfEveryStage() throws Exception {
        Config config = config(String.format("""
                workers = 2
                stages {
                  mapper {
                    type = "columnMapper"
                    options { columns { mag = "r" }, chunkSize = 2 }
                    inputs { input = "%s" }
                  }
                }
                stageSequence = ["mapper"]
                """, catalog));
        PipelineManager manager = new PipelineManager(config);

        Map<String, AbstractStage> stages = manager.run();

        assertThat(manager.getWorkers()).isEqualTo(2);
        assertThat(stages.get("mapper").getCurrentState()).isEqualTo(StageState.DONE);
        Table mapped = new TableHandle("check", tempDir.resolve("out").resolve("mapper_output.rtab").toString(), "test").read();
        assertThat(mapped.columnNames()).containsExactly("id", "r", "redshift");
        assertThat(mapped.column("r")).containsExactly(21, 22, 23, 24, 25);
    }
}
