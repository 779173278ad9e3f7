package jbayes.random;

import java.util.*;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import cern.jet.random.Uniform;
import cern.jet.random.engine.*;

/**
 * Probability mass function over an arbitrary set of hypotheses.
 * Weights are non-negative but need not sum to one except immediately
 * after {@link #normalize()}.
 * <p>
 * Hypotheses are iterated in insertion order. Not synchronized.
 *
 * @param <T> type of hypotheses
 */
public class WeightedMap<T>
{
	private static final Logger LOG = LoggerFactory.getLogger(WeightedMap.class);

	// Shared by sample(); thread safety is up to the caller
	private static final RandomEngine DEFAULT_RNG = new MersenneTwister(new Date());

	private final Map<T, Double> weights;

	public WeightedMap()
	{
		weights = new LinkedHashMap<T, Double>();
	}

	public WeightedMap(Map<? extends T, ? extends Number> initialWeights)
	{
		this();
		for(Map.Entry<? extends T, ? extends Number> entry : initialWeights.entrySet())
		{
			set(entry.getKey(), entry.getValue().doubleValue());
		}
	}

	public WeightedMap(WeightedMap<? extends T> other)
	{
		weights = new LinkedHashMap<T, Double>(other.weights);
	}

	/**
	 * @return a new map with the same weights; changes to either are not
	 * seen by the other
	 */
	public WeightedMap<T> copy()
	{
		return new WeightedMap<T>(this);
	}

	public void set(T hypothesis, double weight)
	{
		if(hypothesis == null) throw new NullPointerException("Hypothesis must not be null.");
		if(weight < 0) throw new IllegalArgumentException("Weight must be non-negative: " + weight);
		weights.put(hypothesis, weight);
	}

	public double getWeight(T hypothesis)
	{
		Double weight = weights.get(hypothesis);
		return weight == null ? 0.0 : weight;
	}

	public void increment(T hypothesis, double amount)
	{
		set(hypothesis, getWeight(hypothesis) + amount);
	}

	/**
	 * @throws IllegalArgumentException if the factor is negative or NaN
	 */
	public void multiply(T hypothesis, double factor)
	{
		if(!(factor >= 0)) throw new IllegalArgumentException("Factor must be non-negative: " + factor);

		Double weight = weights.get(hypothesis);
		if(weight == null) return;
		weights.put(hypothesis, weight * factor);
	}

	public void remove(T hypothesis)
	{
		weights.remove(hypothesis);
	}

	public boolean contains(T hypothesis)
	{
		return weights.containsKey(hypothesis);
	}

	public int getSize()
	{
		return weights.size();
	}

	public boolean isEmpty()
	{
		return weights.isEmpty();
	}

	public Set<T> getHypotheses()
	{
		return Collections.unmodifiableSet(weights.keySet());
	}

	public Map<T, Double> getWeights()
	{
		return Collections.unmodifiableMap(weights);
	}

	public double getTotal()
	{
		double total = 0.0;
		for(double weight : weights.values())
		{
			total += weight;
		}
		return total;
	}

	/**
	 * @return 1/total, or positive infinity if the total is zero
	 */
	public double getNormalizer()
	{
		double total = getTotal();
		return total > 0.0 ? 1.0 / total : Double.POSITIVE_INFINITY;
	}

	/**
	 * Multiplies every weight by the factor. Infinity is allowed, so that an
	 * all-zero map normalizes to NaN.
	 *
	 * @throws IllegalArgumentException if the factor is negative or NaN
	 */
	public void scale(double factor)
	{
		if(!(factor >= 0)) throw new IllegalArgumentException("Factor must be non-negative: " + factor);

		for(Map.Entry<T, Double> entry : weights.entrySet())
		{
			entry.setValue(entry.getValue() * factor);
		}
	}

	/**
	 * Scales weights so that they sum to one. If every weight is zero, every
	 * weight becomes NaN (0 times infinity).
	 */
	public void normalize()
	{
		double normalizer = getNormalizer();
		if(Double.isInfinite(normalizer))
		{
			LOG.debug("Normalizing {} hypotheses with zero total weight", weights.size());
		}
		scale(normalizer);
	}

	/**
	 * Sum of hypothesis times weight over the current weights, which are
	 * not normalized first.
	 *
	 * @throws ClassCastException if a hypothesis is not a {@link Number}
	 */
	public double expectation()
	{
		double sum = 0.0;
		for(Map.Entry<T, Double> entry : weights.entrySet())
		{
			sum += toNumber(entry.getKey()).doubleValue() * entry.getValue();
		}
		return sum;
	}

	/**
	 * @return the hypothesis with the largest weight (first one on ties),
	 * or null if empty
	 */
	public T getMode()
	{
		T mode = null;
		double maxWeight = Double.NEGATIVE_INFINITY;
		for(Map.Entry<T, Double> entry : weights.entrySet())
		{
			if(mode == null || entry.getValue() > maxWeight)
			{
				mode = entry.getKey();
				maxWeight = entry.getValue();
			}
		}
		return mode;
	}

	public T sample()
	{
		return sample(DEFAULT_RNG);
	}

	/**
	 * Draws a hypothesis with probability proportional to its weight.
	 *
	 * @return the drawn hypothesis, or null if no hypothesis has positive weight
	 */
	public T sample(RandomEngine rng)
	{
		double total = getTotal();
		if(!(total > 0.0)) return null;

		double x = new Uniform(rng).nextDoubleFromTo(0, total);

		double C = 0;
		T last = null;
		for(Map.Entry<T, Double> entry : weights.entrySet())
		{
			double weight = entry.getValue();
			if(weight <= 0.0) continue;

			C += weight;
			last = entry.getKey();
			if(C >= x) return last;
		}

		// Rounding in the running sum can leave C just short of x
		return last;
	}

	/**
	 * Replaces the contents with equal weights for each event.
	 */
	public void uniformDist(Collection<? extends T> events)
	{
		weights.clear();
		for(T event : events)
		{
			set(event, 1.0);
		}
		normalize();
	}

	public void powerLawDist(Collection<? extends T> events)
	{
		powerLawDist(events, 1.0);
	}

	/**
	 * Replaces the contents with weight event^(-alpha) for each event.
	 *
	 * @throws ClassCastException if an event is not a {@link Number}
	 * @throws IllegalArgumentException if an event is not positive
	 */
	public void powerLawDist(Collection<? extends T> events, double alpha)
	{
		weights.clear();
		for(T event : events)
		{
			double value = toNumber(event).doubleValue();
			if(!(value > 0.0))
			{
				throw new IllegalArgumentException("Power law events must be positive: " + event);
			}
			set(event, Math.pow(value, -alpha));
		}
		normalize();
	}

	public CumulativeDistribution<T> toCumulative()
	{
		return new CumulativeDistribution<T>(this);
	}

	public CumulativeDistribution<T> toCumulative(Comparator<? super T> comparator)
	{
		return new CumulativeDistribution<T>(this, comparator);
	}

	/**
	 * Distribution of the combination of two independent random quantities.
	 * Every pair of positive-weight events (x, y) contributes P(x)*P(y) to
	 * the event adder(x, y).
	 */
	public static <T> WeightedMap<T> combine(WeightedMap<? extends T> a, WeightedMap<? extends T> b,
			EventCombiner<T> adder)
	{
		WeightedMap<T> result = new WeightedMap<T>();
		for(Map.Entry<? extends T, Double> entryA : a.weights.entrySet())
		{
			if(entryA.getValue() <= 0.0) continue;

			for(Map.Entry<? extends T, Double> entryB : b.weights.entrySet())
			{
				if(entryB.getValue() <= 0.0) continue;

				T event = adder.combine(entryA.getKey(), entryB.getKey());
				result.increment(event, entryA.getValue() * entryB.getValue());
			}
		}
		return result;
	}

	public static WeightedMap<Integer> sumOfIntegers(WeightedMap<Integer> a, WeightedMap<Integer> b)
	{
		return combine(a, b, new EventCombiner<Integer>()
		{
			public Integer combine(Integer x, Integer y)
			{
				return x + y;
			}
		});
	}

	public static WeightedMap<Double> sumOfDoubles(WeightedMap<Double> a, WeightedMap<Double> b)
	{
		return combine(a, b, new EventCombiner<Double>()
		{
			public Double combine(Double x, Double y)
			{
				return x + y;
			}
		});
	}

	private static Number toNumber(Object hypothesis)
	{
		if(!(hypothesis instanceof Number))
		{
			throw new ClassCastException("Can't compute with non-numeric hypothesis " + hypothesis
					+ (hypothesis == null ? "" : " (" + hypothesis.getClass().getName() + ")"));
		}
		return (Number)hypothesis;
	}

	@Override
	public String toString()
	{
		return weights.toString();
	}
}
