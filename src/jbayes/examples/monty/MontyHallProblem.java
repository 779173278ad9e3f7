package jbayes.examples.monty;

import java.util.*;

import jbayes.random.BayesianUpdater;

/**
 * Hypotheses are the door hiding the car; data is the door Monty opens.
 * Monty never opens the contestant's door or the car's door, and picks at
 * random when he has a choice.
 */
public class MontyHallProblem extends BayesianUpdater<String, String>
{
	private final String picked;

	/**
	 * @param picked door chosen by the contestant
	 * @param doors all doors, including the picked one
	 */
	public MontyHallProblem(String picked, String... doors)
	{
		if(!Arrays.asList(doors).contains(picked))
			throw new IllegalArgumentException("Picked door " + picked + " is not one of " + Arrays.toString(doors));

		this.picked = picked;
		uniformDist(Arrays.asList(doors));
	}

	public String getPicked()
	{
		return picked;
	}

	@Override
	public double likelihood(String opened, String car)
	{
		if(car.equals(opened)) return 0;
		else if(car.equals(picked)) return 1.0 / (getSize() - 1);
		else return 1;
	}
}
