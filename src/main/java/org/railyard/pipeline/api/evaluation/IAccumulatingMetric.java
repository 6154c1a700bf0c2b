package org.railyard.pipeline.api.evaluation;

import java.util.List;

/**
 * An aggregate metric that can be computed in two phases: a chunk-local partial statistic
 * per chunk, and one final combination of all partials.
 * <p>
 * Partials must be self-contained values (they may travel between workers), and
 * {@code finalizeResult(partials of every chunk)} must equal {@code evaluate(all data)}
 * up to floating-point rounding.
 *
 * @param <E> evaluation data type
 * @param <S> partial statistic type
 */
public interface IAccumulatingMetric<E, S> extends IMetric<E> {

    /**
     * Computes the partial statistic of one chunk.
     */
    S accumulate(E chunk);

    /**
     * Combines the partials of all chunks of all workers, in any order.
     */
    MetricResult finalizeResult(List<S> partials);
}
