package jbayes.examples.cookie;

import java.util.*;

import jbayes.random.Likelihood;

/**
 * Bowls of cookies by flavor. The likelihood of a flavor given a bowl is the
 * fraction of that bowl's cookies with the flavor. When drawing without
 * replacement, each evaluation also eats the cookie from the bowl it was
 * evaluated for, so every bowl hypothesis sees its own depleted contents on
 * the next draw.
 */
public class Bowls implements Likelihood<String, String>
{
	private final Map<String, Map<String, Integer>> contents = new LinkedHashMap<String, Map<String, Integer>>();
	private final boolean replacement;

	public Bowls(boolean replacement)
	{
		this.replacement = replacement;
	}

	/**
	 * Bowl 1 holds 30 vanilla and 10 chocolate cookies, bowl 2 holds 20 of each.
	 */
	public static Bowls standard(boolean replacement)
	{
		Bowls bowls = new Bowls(replacement);
		bowls.fill("Bowl 1", "vanilla", 30);
		bowls.fill("Bowl 1", "chocolate", 10);
		bowls.fill("Bowl 2", "vanilla", 20);
		bowls.fill("Bowl 2", "chocolate", 20);
		return bowls;
	}

	public boolean isReplacement()
	{
		return replacement;
	}

	public void fill(String bowl, String flavor, int count)
	{
		if(count < 0) throw new IllegalArgumentException("Count must be non-negative: " + count);

		Map<String, Integer> flavors = contents.get(bowl);
		if(flavors == null)
		{
			flavors = new LinkedHashMap<String, Integer>();
			contents.put(bowl, flavors);
		}
		flavors.put(flavor, count);
	}

	public Set<String> getBowls()
	{
		return Collections.unmodifiableSet(contents.keySet());
	}

	public int getCount(String bowl, String flavor)
	{
		Map<String, Integer> flavors = contents.get(bowl);
		if(flavors == null) return 0;
		Integer count = flavors.get(flavor);
		return count == null ? 0 : count;
	}

	public int getTotal(String bowl)
	{
		Map<String, Integer> flavors = contents.get(bowl);
		if(flavors == null) return 0;

		int total = 0;
		for(int count : flavors.values()) total += count;
		return total;
	}

	public double likelihood(String flavor, String bowl)
	{
		if(!contents.containsKey(bowl)) throw new IllegalArgumentException("Unknown bowl: " + bowl);

		int total = getTotal(bowl);
		if(total == 0) return 0;

		int count = getCount(bowl, flavor);
		double fraction = (double)count / total;

		if(!replacement && count > 0)
		{
			contents.get(bowl).put(flavor, count - 1);
		}
		return fraction;
	}
}
