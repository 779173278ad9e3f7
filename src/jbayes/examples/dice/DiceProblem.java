package jbayes.examples.dice;

import java.util.*;

import jbayes.random.BayesianUpdater;
import jbayes.random.WeightedMap;

/**
 * Which die was rolled? Hypotheses are numbers of sides; data are rolls.
 */
public class DiceProblem extends BayesianUpdater<Integer, Integer>
{
	public static final List<Integer> STANDARD_DICE = Collections.unmodifiableList(Arrays.asList(4, 6, 8, 12, 20));

	public DiceProblem()
	{
		this(STANDARD_DICE);
	}

	public DiceProblem(Collection<Integer> sides)
	{
		uniformDist(sides);
	}

	@Override
	public double likelihood(Integer roll, Integer sides)
	{
		if(roll < 1 || roll > sides) return 0;
		return 1.0 / sides;
	}

	/**
	 * Outcomes of a single fair die.
	 */
	public static WeightedMap<Integer> die(int sides)
	{
		List<Integer> faces = new ArrayList<Integer>(sides);
		for(int face = 1; face <= sides; face++) faces.add(face);

		WeightedMap<Integer> die = new WeightedMap<Integer>();
		die.uniformDist(faces);
		return die;
	}

	/**
	 * Distribution of the total of several fair dice.
	 */
	public static WeightedMap<Integer> totalOf(int... sides)
	{
		if(sides.length == 0) throw new IllegalArgumentException("Need at least one die.");

		WeightedMap<Integer> total = die(sides[0]);
		for(int i = 1; i < sides.length; i++)
		{
			total = WeightedMap.sumOfIntegers(total, die(sides[i]));
		}
		return total;
	}
}
