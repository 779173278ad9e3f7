package jbayes.examples.cookie;

import jbayes.random.BayesianUpdater;

/**
 * Which bowl did the cookie come from? Hypotheses are bowls, equally likely
 * a priori; data are flavors.
 */
public class CookieProblem extends BayesianUpdater<String, String>
{
	private final Bowls bowls;

	public CookieProblem(Bowls bowls)
	{
		super(bowls);
		this.bowls = bowls;
		uniformDist(bowls.getBowls());
	}

	public Bowls getBowls()
	{
		return bowls;
	}
}
