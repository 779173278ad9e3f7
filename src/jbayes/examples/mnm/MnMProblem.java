package jbayes.examples.mnm;

import java.util.*;

import jbayes.random.BayesianUpdater;

/**
 * Two bags of M&Ms, one from 1994 and one from 1996, with different color
 * mixes. One candy is drawn from each bag. Hypothesis A: bag1 is from 1994
 * and bag2 from 1996. Hypothesis B: the other way around.
 */
public class MnMProblem extends BayesianUpdater<String, Draw>
{
	public static final String BAG_1 = "bag1";
	public static final String BAG_2 = "bag2";

	// Color percentages
	static final Map<String, Integer> MIX_94 = mix(
			"brown", 30, "yellow", 20, "red", 20, "green", 10, "orange", 10, "tan", 10);
	static final Map<String, Integer> MIX_96 = mix(
			"blue", 24, "green", 20, "orange", 16, "yellow", 14, "red", 13, "brown", 13);

	private final Map<String, Map<String, Map<String, Integer>>> hypotheses =
			new HashMap<String, Map<String, Map<String, Integer>>>();

	public MnMProblem()
	{
		Map<String, Map<String, Integer>> a = new HashMap<String, Map<String, Integer>>();
		a.put(BAG_1, MIX_94);
		a.put(BAG_2, MIX_96);

		Map<String, Map<String, Integer>> b = new HashMap<String, Map<String, Integer>>();
		b.put(BAG_1, MIX_96);
		b.put(BAG_2, MIX_94);

		hypotheses.put("A", a);
		hypotheses.put("B", b);

		uniformDist(Arrays.asList("A", "B"));
	}

	private static Map<String, Integer> mix(Object... colorsAndPercents)
	{
		Map<String, Integer> mix = new HashMap<String, Integer>();
		for(int i = 0; i < colorsAndPercents.length; i += 2)
		{
			mix.put((String)colorsAndPercents[i], (Integer)colorsAndPercents[i + 1]);
		}
		return Collections.unmodifiableMap(mix);
	}

	@Override
	public double likelihood(Draw draw, String hypothesis)
	{
		Map<String, Integer> mix = hypotheses.get(hypothesis).get(draw.getBag());
		if(mix == null) throw new IllegalArgumentException("Unknown bag: " + draw.getBag());

		Integer percent = mix.get(draw.getColor());
		return percent == null ? 0 : percent;
	}
}
