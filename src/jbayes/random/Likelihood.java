package jbayes.random;

/**
 * Likelihood of observed data given a hypothesis, as used by
 * {@link BayesianUpdater#update(Object)}.
 * <p>
 * Implementations may close over external state that changes as a side
 * effect of evaluation (e.g. draws without replacement). The updater calls
 * {@link #likelihood(Object, Object)} exactly once per hypothesis per update.
 *
 * @param <D> type of observed data
 * @param <T> type of hypotheses
 */
public interface Likelihood<D, T>
{
	/**
	 * @return a non-negative likelihood (need not be normalized)
	 */
	public double likelihood(D data, T hypothesis);
}
