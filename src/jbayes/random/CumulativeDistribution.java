package jbayes.random;

import java.util.*;

/**
 * Cumulative distribution built from a snapshot of a {@link WeightedMap}.
 * Events are sorted by a comparator (natural ordering by default) and paired
 * with the running sum of their weights. Immutable; later changes to the
 * source map are not seen.
 *
 * @param <T> type of events
 */
public class CumulativeDistribution<T>
{
	private final Comparator<? super T> order;
	private final Object[] events;
	private final double[] cumulative;

	/**
	 * @throws ClassCastException if events are not {@link Comparable}
	 * @throws IllegalArgumentException if the source is empty
	 */
	public CumulativeDistribution(WeightedMap<? extends T> source)
	{
		this(source, null);
	}

	/**
	 * @param comparator event ordering; null for natural ordering
	 * @throws IllegalArgumentException if the source is empty
	 */
	public CumulativeDistribution(WeightedMap<? extends T> source, Comparator<? super T> comparator)
	{
		if(source.isEmpty()) throw new IllegalArgumentException("Cannot build a cumulative distribution from an empty map.");

		List<Map.Entry<T, Double>> entries = new ArrayList<Map.Entry<T, Double>>(source.getSize());
		for(Map.Entry<? extends T, Double> entry : source.getWeights().entrySet())
		{
			entries.add(new AbstractMap.SimpleImmutableEntry<T, Double>(entry.getKey(), entry.getValue()));
		}

		order = comparator != null ? comparator : CumulativeDistribution.<T>naturalOrder();

		// Stable: equal events keep map order
		Collections.sort(entries, new Comparator<Map.Entry<T, Double>>()
		{
			public int compare(Map.Entry<T, Double> a, Map.Entry<T, Double> b)
			{
				return order.compare(a.getKey(), b.getKey());
			}
		});

		int n = entries.size();
		events = new Object[n];
		cumulative = new double[n];

		double C = 0;
		for(int i = 0; i < n; i++)
		{
			Map.Entry<T, Double> entry = entries.get(i);
			C += entry.getValue();
			events[i] = entry.getKey();
			cumulative[i] = C;
		}
	}

	// Events must be Comparable to themselves
	private static <T> Comparator<T> naturalOrder()
	{
		return new Comparator<T>()
		{
			@SuppressWarnings("unchecked")
			public int compare(T a, T b)
			{
				return ((Comparable<Object>)a).compareTo(b);
			}
		};
	}

	public int getSize()
	{
		return events.length;
	}

	public double getTotalWeight()
	{
		return cumulative[cumulative.length - 1];
	}

	@SuppressWarnings("unchecked")
	public List<T> getEvents()
	{
		List<T> result = new ArrayList<T>(events.length);
		for(Object event : events)
		{
			result.add((T)event);
		}
		return Collections.unmodifiableList(result);
	}

	public double[] getCumulativeWeights()
	{
		return cumulative.clone();
	}

	/**
	 * Index of the event at the given cumulative probability: the smallest
	 * index whose cumulative weight exceeds the probability, except that a
	 * probability landing exactly on the previous cumulative weight resolves
	 * to that previous index.
	 *
	 * @throws IllegalArgumentException if the probability is outside
	 * [0, total weight]
	 */
	public int floorIndex(double probability)
	{
		if(!(probability >= 0.0 && probability <= getTotalWeight()))
		{
			throw new IllegalArgumentException(String.format(
					"Probability %s outside [0, %s]", probability, getTotalWeight()));
		}

		int idx = upperBound(probability);
		if(idx > 0 && cumulative[idx - 1] == probability)
		{
			return idx - 1;
		}
		return idx;
	}

	// Smallest index with cumulative[index] > value, or length if none
	private int upperBound(double value)
	{
		int lo = 0;
		int hi = cumulative.length;
		while(lo < hi)
		{
			int mid = (lo + hi) >>> 1;
			if(cumulative[mid] > value)
				hi = mid;
			else
				lo = mid + 1;
		}
		return lo;
	}

	@SuppressWarnings("unchecked")
	public T percentile(double probability)
	{
		return (T)events[floorIndex(probability)];
	}

	/**
	 * @return events for each probability, in the order requested
	 */
	public List<T> percentiles(double... probabilities)
	{
		List<T> result = new ArrayList<T>(probabilities.length);
		for(double probability : probabilities)
		{
			result.add(percentile(probability));
		}
		return result;
	}

	/**
	 * Equal-tailed credible interval containing the given fraction of the
	 * total weight.
	 *
	 * @param percentage fraction in [0, 1], e.g. 0.9 for a 90% interval
	 * @return lower and upper bound
	 */
	public List<T> credibleInterval(double percentage)
	{
		if(!(percentage >= 0.0 && percentage <= 1.0))
		{
			throw new IllegalArgumentException("Credible interval must be in [0, 1]: " + percentage);
		}
		double total = getTotalWeight();
		double tail = (1.0 - percentage) / 2.0;
		return percentiles(total * tail, total * (1.0 - tail));
	}

	/**
	 * Weight at or below the given event in sort order; 0 if the event sorts
	 * before every event.
	 */
	@SuppressWarnings("unchecked")
	public double cumulativeWeight(T event)
	{
		double C = 0;
		for(int i = 0; i < events.length; i++)
		{
			if(order.compare((T)events[i], event) > 0) break;
			C = cumulative[i];
		}
		return C;
	}

	@Override
	public String toString()
	{
		StringBuilder sb = new StringBuilder();
		sb.append("[");
		for(int i = 0; i < events.length; i++)
		{
			sb.append(events[i]).append("=").append(cumulative[i]);
			if(i != events.length - 1) sb.append(", ");
		}
		sb.append("]");
		return sb.toString();
	}
}
