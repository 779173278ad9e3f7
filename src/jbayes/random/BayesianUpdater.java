package jbayes.random;

import java.util.*;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Probability mass function with Bayesian update of posterior weights.
 * <p>
 * The likelihood is either injected at construction or supplied by
 * overriding {@link #likelihood(Object, Object)} in a subclass. An updater
 * with neither fails when {@link #update(Object)} is called.
 *
 * @param <T> type of hypotheses
 * @param <D> type of observed data
 */
public class BayesianUpdater<T, D> extends WeightedMap<T>
{
	private static final Logger LOG = LoggerFactory.getLogger(BayesianUpdater.class);

	private final Likelihood<? super D, ? super T> likelihood;

	/**
	 * For subclasses that override {@link #likelihood(Object, Object)}.
	 */
	protected BayesianUpdater()
	{
		this.likelihood = null;
	}

	public BayesianUpdater(Likelihood<? super D, ? super T> likelihood)
	{
		this.likelihood = likelihood;
	}

	public BayesianUpdater(Map<? extends T, ? extends Number> prior, Likelihood<? super D, ? super T> likelihood)
	{
		super(prior);
		this.likelihood = likelihood;
	}

	public BayesianUpdater(WeightedMap<? extends T> prior, Likelihood<? super D, ? super T> likelihood)
	{
		super(prior);
		this.likelihood = likelihood;
	}

	/**
	 * @return a new updater with the same weights whose likelihood delegates
	 * to this one; weights are independent, any state behind the likelihood
	 * is shared
	 */
	@Override
	public BayesianUpdater<T, D> copy()
	{
		return new BayesianUpdater<T, D>(this, new Likelihood<D, T>()
		{
			public double likelihood(D data, T hypothesis)
			{
				return BayesianUpdater.this.likelihood(data, hypothesis);
			}
		});
	}

	/**
	 * Likelihood of the data given a hypothesis. Delegates to the injected
	 * {@link Likelihood}, if any.
	 *
	 * @throws UnsupportedOperationException if no likelihood was supplied
	 */
	public double likelihood(D data, T hypothesis)
	{
		if(likelihood == null)
		{
			throw new UnsupportedOperationException("No likelihood supplied for " + getClass().getName());
		}
		return likelihood.likelihood(data, hypothesis);
	}

	/**
	 * Updates the posterior distribution given new data. The likelihood is
	 * evaluated exactly once per hypothesis, in map order, before any weight
	 * is changed; the weights are then multiplied and normalized.
	 *
	 * @throws UnsupportedOperationException if no likelihood was supplied
	 * @throws IllegalStateException if a likelihood is negative or NaN;
	 * weights are left unchanged
	 */
	public void update(D data)
	{
		List<T> hypotheses = new ArrayList<T>(getHypotheses());
		double[] factors = new double[hypotheses.size()];

		int i = 0;
		for(T hypothesis : hypotheses)
		{
			double factor = likelihood(data, hypothesis);
			if(!(factor >= 0.0))
			{
				throw new IllegalStateException(String.format(
						"Likelihood of %s given %s must be non-negative, was %s", data, hypothesis, factor));
			}
			factors[i++] = factor;
		}

		for(i = 0; i < factors.length; i++)
		{
			multiply(hypotheses.get(i), factors[i]);
		}

		if(LOG.isDebugEnabled())
		{
			LOG.debug("Updated {} hypotheses with {}; unnormalized total {}", hypotheses.size(), data, getTotal());
		}
		normalize();
	}

	/**
	 * Updates with each datum in turn; each posterior is the prior of the
	 * next update.
	 */
	public void updateSet(Iterable<? extends D> dataset)
	{
		for(D data : dataset)
		{
			update(data);
		}
	}
}
