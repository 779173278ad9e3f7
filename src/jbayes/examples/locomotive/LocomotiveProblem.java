package jbayes.examples.locomotive;

import java.util.*;

import jbayes.random.BayesianUpdater;

/**
 * A railroad numbers its locomotives 1..N. Given observed serial numbers,
 * estimate N.
 */
public class LocomotiveProblem extends BayesianUpdater<Integer, Integer>
{
	/**
	 * Uniform prior over 1..upperBound.
	 */
	public LocomotiveProblem(int upperBound)
	{
		uniformDist(fleetSizes(upperBound));
	}

	/**
	 * Power law prior over 1..upperBound.
	 */
	public LocomotiveProblem(int upperBound, double alpha)
	{
		powerLawDist(fleetSizes(upperBound), alpha);
	}

	private static List<Integer> fleetSizes(int upperBound)
	{
		if(upperBound < 1) throw new IllegalArgumentException("Upper bound must be positive: " + upperBound);

		List<Integer> sizes = new ArrayList<Integer>(upperBound);
		for(int n = 1; n <= upperBound; n++) sizes.add(n);
		return sizes;
	}

	@Override
	public double likelihood(Integer observed, Integer fleetSize)
	{
		if(observed > fleetSize) return 0;
		return 1.0 / fleetSize;
	}
}
