package org.railyard.pipeline.stages.evaluation;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.railyard.pipeline.api.comm.ICommunicator;
import org.railyard.pipeline.api.data.Chunk;
import org.railyard.pipeline.api.data.Table;
import org.railyard.pipeline.api.evaluation.IAccumulatingMetric;
import org.railyard.pipeline.api.evaluation.IMetric;
import org.railyard.pipeline.api.evaluation.MetricOutputType;
import org.railyard.pipeline.api.evaluation.MetricResult;
import org.railyard.pipeline.api.stages.ConfigurationException;
import org.railyard.pipeline.api.stages.StageParameter;
import org.railyard.pipeline.api.stages.StageParameters;
import org.railyard.pipeline.data.JsonTableHandle;
import org.railyard.pipeline.data.TableHandle;
import org.railyard.pipeline.stages.AbstractStage;
import org.railyard.pipeline.stages.SharedParameters;
import org.railyard.pipeline.stages.StageContext;
import org.railyard.pipeline.stages.StagePort;

/**
 * Base class of stages that compare estimates against reference data and report metrics.
 * <p>
 * The primary input {@value #INPUT} is iterated in chunks. Each selected metric is handled
 * according to its {@link MetricOutputType}:
 * <ul>
 *   <li>per-object metrics are evaluated on every chunk and streamed to {@value #OUTPUT},
 *       one column per metric;</li>
 *   <li>aggregate metrics implementing {@link IAccumulatingMetric} turn every chunk into a
 *       partial statistic. Once all chunk loops are done the partials of every worker are
 *       gathered to rank 0, which finalizes them into {@value #SUMMARY} (one row of single
 *       values) and {@value #DISTRIBUTION} (columns prefixed with the metric name);</li>
 *   <li>aggregate metrics that cannot accumulate are skipped with a warning.</li>
 * </ul>
 * With {@code forceExact} rank 0 instead reads the whole input and evaluates every metric
 * directly, including those that cannot accumulate.
 * <p>
 * Metric selection: {@code metrics} lists metric names or {@value #ALL_METRICS};
 * {@code excludeMetrics} removes names from that selection. {@code metricConfig} holds
 * options passed to {@link IMetric#configure(Map)}: the entry {@value #GENERAL_CONFIG} goes to
 * every metric, an entry named after a metric overrides it for that metric.
 *
 * @param <E> evaluation data type built from one chunk
 */
public abstract class AbstractEvaluator<E> extends AbstractStage {

    public static final String INPUT = "input";
    public static final String OUTPUT = "output";
    public static final String SUMMARY = "summary";
    public static final String DISTRIBUTION = "distribution";

    public static final String ALL_METRICS = "all";
    public static final String GENERAL_CONFIG = "general";

    public static final StageParameter<List<?>> METRICS =
            StageParameter.list("metrics", List.of(ALL_METRICS), "Names of the metrics to compute, or 'all'");

    public static final StageParameter<List<?>> EXCLUDE_METRICS =
            StageParameter.list("excludeMetrics", List.of(), "Metrics removed from the selection");

    public static final StageParameter<Map<String, ?>> METRIC_CONFIG =
            StageParameter.map("metricConfig", Map.of(), "Metric options: 'general' plus per-metric overrides");

    public static final StageParameter<Boolean> FORCE_EXACT =
            StageParameter.optional("forceExact", Boolean.class, false, "Evaluate all data at once on a single worker");

    private static final StageParameters BASE_PARAMETERS = StageParameters.builder()
            .add(SharedParameters.CHUNK_SIZE)
            .add(METRICS)
            .add(EXCLUDE_METRICS)
            .add(METRIC_CONFIG)
            .add(FORCE_EXACT)
            .build();

    private static final List<StagePort> OUTPUTS = List.of(
            new StagePort(OUTPUT, TableHandle.TYPE),
            new StagePort(SUMMARY, JsonTableHandle.TYPE),
            new StagePort(DISTRIBUTION, JsonTableHandle.TYPE));

    private final Map<String, IMetric<E>> metrics;

    protected AbstractEvaluator(String name, StageParameters parameters, Map<String, Object> options,
                                StageContext context, MetricRegistry<E> registry) {
        super(name, StageParameters.builder().addAll(BASE_PARAMETERS).addAll(parameters).build(), options, context);
        this.metrics = selectMetrics(registry);
    }

    @Override
    public List<StagePort> getOutputs() {
        return OUTPUTS;
    }

    /**
     * @return the selected and configured metrics, in selection order
     */
    public Map<String, IMetric<E>> getMetrics() {
        return metrics;
    }

    /**
     * Turns one chunk of the primary input into evaluation data, reading matching rows of
     * any secondary inputs.
     */
    protected abstract E prepareChunk(Object chunkData, long start, long end) throws IOException;

    /**
     * Reads every input completely. Used with {@code forceExact}.
     */
    protected abstract E readAll() throws IOException;

    @Override
    protected void run() throws IOException {
        if (config.getBoolean(FORCE_EXACT.getName())) {
            runExact();
        } else {
            runChunked();
        }
    }

    private void runExact() throws IOException {
        if (!context.isCoordinator()) {
            log.debug("Stage '{}': exact evaluation runs on rank 0 only", instanceName);
            return;
        }
        E data = readAll();
        Map<String, MetricResult> results = new LinkedHashMap<>();
        for (IMetric<E> metric : metrics.values()) {
            results.put(metric.getName(), metric.evaluate(data));
        }
        Map<String, double[]> perObject = new LinkedHashMap<>();
        results.forEach((metricName, result) -> {
            if (result.getType() == MetricOutputType.ONE_VALUE_PER_DISTRIBUTION) {
                perObject.put(metricName, result.getPerObject());
            }
        });
        if (!perObject.isEmpty()) {
            addData(OUTPUT, Table.of(perObject));
        }
        publishAggregates(results);
    }

    private void runChunked() throws IOException {
        List<IMetric<E>> perObject = new ArrayList<>();
        List<IAccumulatingMetric<E, ?>> accumulating = new ArrayList<>();
        for (IMetric<E> metric : metrics.values()) {
            if (metric.getOutputType() == MetricOutputType.ONE_VALUE_PER_DISTRIBUTION) {
                perObject.add(metric);
            } else if (metric instanceof IAccumulatingMetric<E, ?> acc) {
                accumulating.add(acc);
            } else {
                log.warn("Stage '{}': metric '{}' cannot be accumulated over chunks and is skipped; set forceExact to compute it",
                        instanceName, metric.getName());
            }
        }

        if (!perObject.isEmpty()) {
            List<String> columns = perObject.stream().map(IMetric::getName).toList();
            initializeOutput(OUTPUT, Table.empty(columns), getHandle(INPUT).size());
        }

        LinkedHashMap<String, ArrayList<Object>> partials = new LinkedHashMap<>();
        accumulating.forEach(m -> partials.put(m.getName(), new ArrayList<>()));
        int chunks = 0;
        for (Chunk<Object> chunk : inputIterator(INPUT, Object.class)) {
            E data = prepareChunk(chunk.data(), chunk.start(), chunk.end());
            if (!perObject.isEmpty()) {
                Map<String, double[]> columns = new LinkedHashMap<>();
                for (IMetric<E> metric : perObject) {
                    columns.put(metric.getName(), metric.evaluate(data).getPerObject());
                }
                writeOutputChunk(OUTPUT, Table.of(columns), chunk.start(), chunk.end());
            }
            for (IAccumulatingMetric<E, ?> metric : accumulating) {
                partials.get(metric.getName()).add(metric.accumulate(data));
            }
            chunks++;
        }
        log.debug("Stage '{}': evaluated {} chunks on rank {}", instanceName, chunks, rank());

        if (accumulating.isEmpty()) {
            return;
        }
        Map<String, List<Object>> collected = collectPartials(partials);
        if (collected == null) {
            return;
        }
        Map<String, MetricResult> results = new LinkedHashMap<>();
        for (IAccumulatingMetric<E, ?> metric : accumulating) {
            results.put(metric.getName(), finalizeMetric(metric, collected.get(metric.getName())));
        }
        publishAggregates(results);
    }

    /**
     * Gathers the partials of every worker to rank 0. Collective.
     *
     * @return all partials per metric on rank 0, {@code null} on other ranks
     */
    private Map<String, List<Object>> collectPartials(LinkedHashMap<String, ArrayList<Object>> local) {
        ICommunicator comm = context.getComm();
        if (comm == null || comm.size() == 1) {
            return new LinkedHashMap<>(local);
        }
        List<LinkedHashMap<String, ArrayList<Object>>> all = comm.gather(local, 0);
        if (all == null) {
            return null;
        }
        Map<String, List<Object>> merged = new LinkedHashMap<>();
        for (LinkedHashMap<String, ArrayList<Object>> part : all) {
            part.forEach((metricName, values) -> merged.computeIfAbsent(metricName, k -> new ArrayList<>()).addAll(values));
        }
        log.debug("Stage '{}': gathered partials from {} workers", instanceName, all.size());
        return merged;
    }

    @SuppressWarnings("unchecked")
    private static <S> MetricResult finalizeMetric(IAccumulatingMetric<?, S> metric, List<Object> partials) {
        return metric.finalizeResult((List<S>) partials);
    }

    private void publishAggregates(Map<String, MetricResult> results) {
        Map<String, double[]> summary = new LinkedHashMap<>();
        Map<String, double[]> distributions = new LinkedHashMap<>();
        results.forEach((metricName, result) -> {
            switch (result.getType()) {
                case SINGLE_VALUE -> summary.put(metricName, new double[] {result.getValue()});
                case SINGLE_DISTRIBUTION -> {
                    Table table = result.getDistribution();
                    for (String column : table.columnNames()) {
                        distributions.put(metricName + "_" + column, table.column(column));
                    }
                }
                case ONE_VALUE_PER_DISTRIBUTION -> {
                }
            }
        });
        if (!summary.isEmpty()) {
            addData(SUMMARY, Table.of(summary));
            log.info("Stage '{}': computed {}", instanceName, summary.keySet());
        }
        if (!distributions.isEmpty()) {
            addData(DISTRIBUTION, Table.of(padColumns(distributions)));
        }
    }

    /**
     * Pads columns with NaN to the longest column, since distributions of different metrics
     * may have different lengths.
     */
    private static Map<String, double[]> padColumns(Map<String, double[]> columns) {
        int rows = columns.values().stream().mapToInt(c -> c.length).max().orElse(0);
        Map<String, double[]> padded = new LinkedHashMap<>();
        columns.forEach((name, values) -> {
            double[] column = Arrays.copyOf(values, rows);
            Arrays.fill(column, values.length, rows, Double.NaN);
            padded.put(name, column);
        });
        return padded;
    }

    private Map<String, IMetric<E>> selectMetrics(MetricRegistry<E> registry) {
        List<String> requested = config.getStringList(METRICS.getName());
        Set<String> excluded = new HashSet<>(config.getStringList(EXCLUDE_METRICS.getName()));
        Collection<String> names = requested.contains(ALL_METRICS) ? registry.names() : requested;
        Map<String, Object> metricConfig = config.getMap(METRIC_CONFIG.getName());
        Map<String, Object> general = configSection(metricConfig, GENERAL_CONFIG);

        Map<String, IMetric<E>> selected = new LinkedHashMap<>();
        for (String metricName : names) {
            if (excluded.contains(metricName) || selected.containsKey(metricName)) {
                continue;
            }
            if (!registry.contains(metricName)) {
                log.warn("Stage '{}': unknown metric '{}' is ignored. Known metrics: {}",
                        instanceName, metricName, registry.names());
                continue;
            }
            Map<String, Object> metricOptions = new LinkedHashMap<>(general);
            metricOptions.putAll(configSection(metricConfig, metricName));
            IMetric<E> metric = registry.create(metricName);
            metric.configure(metricOptions);
            selected.put(metricName, metric);
        }
        log.debug("Stage '{}': selected metrics {}", instanceName, selected.keySet());
        return selected;
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> configSection(Map<String, Object> metricConfig, String section) {
        Object value = metricConfig.get(section);
        if (value == null) {
            return Map.of();
        }
        if (!(value instanceof Map<?, ?>)) {
            throw new ConfigurationException(String.format("Stage '%s': metricConfig.%s must be a map, got %s",
                    instanceName, section, value));
        }
        return (Map<String, Object>) value;
    }
}
