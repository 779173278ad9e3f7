package jbayes.random;

/**
 * Combines an event from each of two distributions into the event of the
 * joint outcome, as used by {@link WeightedMap#combine}.
 *
 * @param <T> type of events
 */
public interface EventCombiner<T>
{
	public T combine(T a, T b);
}
