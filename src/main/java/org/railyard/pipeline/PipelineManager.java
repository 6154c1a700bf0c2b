package org.railyard.pipeline;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.railyard.pipeline.api.comm.CommunicationException;
import org.railyard.pipeline.api.stages.ConfigurationException;
import org.railyard.pipeline.comm.LocalCommunicatorGroup;
import org.railyard.pipeline.data.DataStore;
import org.railyard.pipeline.data.HandleRegistry;
import org.railyard.pipeline.stages.AbstractStage;
import org.railyard.pipeline.stages.StageContext;
import org.railyard.pipeline.stages.StagePort;
import org.railyard.pipeline.stages.StageRegistry;
import org.railyard.pipeline.utils.PathExpansion;
import org.railyard.pipeline.utils.compression.CompressionCodecFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Builds the stages of a pipeline from the {@code pipeline} section of a configuration and
 * runs them in {@code stageSequence} order.
 * <p>
 * Configuration layout:
 * <pre>
 * pipeline {
 *   outputDirectory = "output"
 *   allowOverwrite = false
 *   workers = 1
 *   models { compression { codec = "zstd", level = 3 } }
 *   data {
 *     catalog { type = "rtab", path = "${HOME}/catalog.rtab" }
 *   }
 *   stages {
 *     inform {
 *       type = "trainZInformer"            # or className = "com.example.MyStage"
 *       options { zMax = 2.0 }
 *       aliases { input = "catalog" }
 *       inputs { truth = "truth.rtab" }    # files attached to input tags
 *     }
 *     estimate {
 *       type = "trainZEstimator"
 *       connections { model = "inform.model" }
 *     }
 *   }
 *   stageSequence = ["inform", "estimate"]
 * }
 * </pre>
 * Outputs without an explicit alias are stored under {@code <stageName>_<tag>}, so two
 * instances of one stage class never collide in the store.
 */
public class PipelineManager {

    private static final Logger log = LoggerFactory.getLogger(PipelineManager.class);

    static final String CREATOR = "pipeline";

    private final Config pipelineConfig;
    private final StageRegistry stageRegistry;
    private final HandleRegistry handleRegistry;
    private final List<String> stageSequence;
    private final Path outputDirectory;
    private final boolean allowOverwrite;
    private final int workers;

    public PipelineManager(Config rootConfig) {
        this(rootConfig, StageRegistry.withDefaults(), null);
    }

    /**
     * @param handleRegistry handle types of the run, or {@code null} to build the defaults
     *                       with the configured model compression
     */
    public PipelineManager(Config rootConfig, StageRegistry stageRegistry, HandleRegistry handleRegistry) {
        if (!rootConfig.hasPath("pipeline")) {
            throw new ConfigurationException("Configuration must contain a 'pipeline' section");
        }
        this.pipelineConfig = rootConfig.getConfig("pipeline");
        this.stageRegistry = stageRegistry;
        this.handleRegistry = handleRegistry != null ? handleRegistry : HandleRegistry.withDefaults(
                CompressionCodecFactory.create(pipelineConfig.hasPath("models")
                        ? pipelineConfig.getConfig("models") : ConfigFactory.empty()));
        this.stageSequence = pipelineConfig.hasPath("stageSequence")
                ? pipelineConfig.getStringList("stageSequence")
                : Collections.emptyList();
        this.outputDirectory = Paths.get(PathExpansion.expandPath(pipelineConfig.hasPath("outputDirectory")
                ? pipelineConfig.getString("outputDirectory") : ".")).toAbsolutePath();
        this.allowOverwrite = pipelineConfig.hasPath("allowOverwrite") && pipelineConfig.getBoolean("allowOverwrite");
        this.workers = pipelineConfig.hasPath("workers") ? pipelineConfig.getInt("workers") : 1;
        if (workers < 1) {
            throw new ConfigurationException("pipeline.workers must be at least 1, got " + workers);
        }
        checkSequence();
        log.info("Pipeline with {} stages, {} worker(s), output directory {}", stageSequence.size(), workers, outputDirectory);
    }

    public List<String> getStageSequence() {
        return stageSequence;
    }

    public Path getOutputDirectory() {
        return outputDirectory;
    }

    public int getWorkers() {
        return workers;
    }

    public HandleRegistry getHandleRegistry() {
        return handleRegistry;
    }

    /**
     * Creates a fresh single-worker context for this pipeline.
     */
    public StageContext newContext() {
        return new StageContext(new DataStore(allowOverwrite), handleRegistry, null, outputDirectory);
    }

    /**
     * Runs the pipeline with the configured number of workers.
     *
     * @return the stages of rank 0, by name, after execution
     */
    public Map<String, AbstractStage> run() throws IOException {
        Files.createDirectories(outputDirectory);
        if (workers == 1) {
            return run(newContext());
        }
        StageContext template = newContext();
        try {
            List<Map<String, AbstractStage>> perRank = new LocalCommunicatorGroup(workers)
                    .runWorkers(comm -> run(template.forWorker(new DataStore(allowOverwrite), comm)));
            return perRank.get(0);
        } catch (UncheckedIOException e) {
            throw e.getCause();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CommunicationException("Interrupted while waiting for pipeline workers", e);
        }
    }

    /**
     * Builds and executes every stage of the sequence in one worker's context.
     *
     * @return the executed stages, by name
     */
    public Map<String, AbstractStage> run(StageContext context) throws IOException {
        Map<String, AbstractStage> stages = build(context);
        for (AbstractStage stage : stages.values()) {
            stage.execute();
        }
        log.debug("Pipeline finished on rank {}", context.rank());
        return stages;
    }

    /**
     * Creates the pre-registered data handles and the stages of the sequence, wired together
     * but not executed.
     *
     * @return the stages, by name, in sequence order
     * @throws ConfigurationException if a stage definition is invalid
     * @throws IOException            if an input file does not exist
     */
    public Map<String, AbstractStage> build(StageContext context) throws IOException {
        registerData(context.getDataStore());
        Config stagesConfig = pipelineConfig.hasPath("stages") ? pipelineConfig.getConfig("stages") : ConfigFactory.empty();
        Map<String, AbstractStage> stages = new LinkedHashMap<>();
        for (String name : stageSequence) {
            Config definition = stagesConfig.getConfig(name);
            AbstractStage stage = instantiate(name, definition, context);
            autoAliasOutputs(stage);
            connect(stage, definition, stages);
            attachInputs(stage, definition);
            stages.put(name, stage);
        }
        return stages;
    }

    private void registerData(DataStore store) {
        if (!pipelineConfig.hasPath("data")) {
            return;
        }
        Config dataConfig = pipelineConfig.getConfig("data");
        for (String tag : dataConfig.root().keySet()) {
            Config definition = dataConfig.getConfig(tag);
            String path = definition.hasPath("path") ? definition.getString("path") : null;
            store.addHandle(tag, handleRegistry.get(definition.getString("type")), path, CREATOR);
            log.debug("Registered data '{}' at {}", tag, path);
        }
    }

    private AbstractStage instantiate(String name, Config definition, StageContext context) {
        Map<String, Object> options = definition.hasPath("options")
                ? new LinkedHashMap<>(definition.getConfig("options").root().unwrapped())
                : new LinkedHashMap<>();
        if (definition.hasPath("aliases")) {
            options.put(AbstractStage.ALIASES_OPTION, definition.getConfig("aliases").root().unwrapped());
        }
        if (definition.hasPath("type")) {
            return stageRegistry.get(definition.getString("type")).create(name, options, context);
        }
        if (!definition.hasPath("className")) {
            throw new ConfigurationException(String.format("Stage '%s' needs either 'type' or 'className'", name));
        }
        String className = definition.getString("className");
        try {
            Constructor<? extends AbstractStage> constructor = Class.forName(className)
                    .asSubclass(AbstractStage.class)
                    .getConstructor(String.class, Map.class, StageContext.class);
            return constructor.newInstance(name, options, context);
        } catch (InvocationTargetException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new ConfigurationException(String.format("Failed to create stage '%s' of class %s", name, className), e.getCause());
        } catch (ReflectiveOperationException | ClassCastException e) {
            throw new ConfigurationException(String.format(
                    "Cannot create stage '%s': %s must be a stage with a (String, Map, StageContext) constructor", name, className), e);
        }
    }

    private static void autoAliasOutputs(AbstractStage stage) {
        for (StagePort port : stage.getOutputs()) {
            if (!stage.getAliases().containsKey(port.tag())) {
                stage.setAlias(port.tag(), stage.getInstanceName() + "_" + port.tag());
            }
        }
    }

    private static void connect(AbstractStage stage, Config definition, Map<String, AbstractStage> built) {
        if (!definition.hasPath("connections")) {
            return;
        }
        Config connections = definition.getConfig("connections");
        for (String inputTag : connections.root().keySet()) {
            String source = connections.getString(inputTag);
            int dot = source.lastIndexOf('.');
            if (dot <= 0 || dot == source.length() - 1) {
                throw new ConfigurationException(String.format(
                        "Stage '%s': connection '%s = %s' must have the form stageName.outputTag",
                        stage.getInstanceName(), inputTag, source));
            }
            AbstractStage upstream = built.get(source.substring(0, dot));
            if (upstream == null) {
                throw new ConfigurationException(String.format(
                        "Stage '%s': input '%s' refers to stage '%s', which does not run before it",
                        stage.getInstanceName(), inputTag, source.substring(0, dot)));
            }
            stage.connectInput(upstream, inputTag, source.substring(dot + 1));
        }
    }

    private static void attachInputs(AbstractStage stage, Config definition) throws IOException {
        if (!definition.hasPath("inputs")) {
            return;
        }
        Config inputs = definition.getConfig("inputs");
        for (String inputTag : inputs.root().keySet()) {
            stage.setData(inputTag, inputs.getString(inputTag), false);
        }
    }

    private void checkSequence() {
        Set<String> defined = pipelineConfig.hasPath("stages")
                ? pipelineConfig.getConfig("stages").root().keySet()
                : Set.of();
        List<String> unknown = new ArrayList<>();
        for (String name : stageSequence) {
            if (!defined.contains(name)) {
                unknown.add(name);
            }
        }
        if (!unknown.isEmpty()) {
            throw new ConfigurationException("stageSequence names undefined stages: " + unknown);
        }
        for (String name : defined) {
            if (!stageSequence.contains(name)) {
                log.warn("Stage '{}' is defined but not part of stageSequence and will not run", name);
            }
        }
    }
}
