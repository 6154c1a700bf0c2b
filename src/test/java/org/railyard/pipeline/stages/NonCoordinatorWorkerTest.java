package org.railyard.pipeline.stages;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.railyard.junit.extensions.logging.LogWatchExtension;
import org.railyard.pipeline.api.comm.ICommunicator;
import org.railyard.pipeline.api.data.Table;
import org.railyard.pipeline.data.DataStore;
import org.railyard.pipeline.stages.evaluation.PointToPointEvaluator;
import org.railyard.pipeline.stages.evaluation.metrics.PointMetrics;
import org.railyard.pipeline.stages.tools.RowSelector;

/**
 * Runs stages as rank 1 of 2 against a mocked communicator to check what a worker other
 * than the coordinator contributes to collective calls.
 */
@Tag("unit")
@ExtendWith({MockitoExtension.class, LogWatchExtension.class})
class NonCoordinatorWorkerTest {

    @TempDir
    Path tempDir;

    @Mock
    private ICommunicator comm;

    private StageContext context;

    @BeforeEach
    void setUp() {
        when(comm.rank()).thenReturn(1);
        when(comm.size()).thenReturn(2);
        context = StageContext.local(tempDir).forWorker(new DataStore(), comm);
    }

    @Test
    void wholeOutputsAreWrittenByTheCoordinatorOnly() throws Exception {
        RowSelector selector = new RowSelector("select", Map.of(), context);
        selector.setData(RowSelector.INPUT, Table.of("a", 1, 2, 3));

        selector.execute();

        verify(comm, times(2)).barrier();
        assertThat(tempDir.resolve("output.rtab")).doesNotExist();
    }

    @Test
    @SuppressWarnings("unchecked")
    void partialsOfEveryLocalChunkAreSentToRankZero() throws Exception {
        when(comm.gather(any(), eq(0))).thenReturn(null);
        PointToPointEvaluator evaluator = new PointToPointEvaluator("eval",
                Map.of("metrics", List.of("mean_bias"), "chunkSize", 2L, "outputMode", "return"), context);
        evaluator.setData(PointToPointEvaluator.INPUT, Table.of("zmode", 0.1, 0.2, 0.3, 0.4, 0.5, 0.6, 0.7));
        evaluator.setData(PointToPointEvaluator.TRUTH, Table.of("redshift", 0.1, 0.2, 0.3, 0.4, 0.5, 0.6, 0.7));

        evaluator.execute();

        ArgumentCaptor<Object> sent = ArgumentCaptor.forClass(Object.class);
        verify(comm).gather(sent.capture(), eq(0));
        Map<String, List<Object>> partials = (Map<String, List<Object>>) sent.getValue();
        // rank 1 of 2 owns rows [2, 4) and [6, 7)
        assertThat(partials.get("mean_bias")).extracting(p -> ((PointMetrics.Moments) p).count()).containsExactly(2L, 1L);
        verify(comm, never()).bcast(any(), eq(0));
        assertThat(evaluator.store().contains("summary")).isFalse();
    }
}
