package jbayes.examples;

import java.io.*;
import java.util.*;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import jbayes.examples.cookie.*;
import jbayes.examples.dice.DiceProblem;
import jbayes.examples.locomotive.LocomotiveProblem;
import jbayes.examples.mnm.*;
import jbayes.examples.monty.MontyHallProblem;
import jbayes.random.*;

import cern.jet.random.engine.*;

/**
 * Runs one of the example problems as described by a JSON configuration
 * file and logs the posterior.
 */
public class Main
{
	private static final Logger LOG = LoggerFactory.getLogger(Main.class);

	public static void main(String[] args)
	{
		if(args.length != 1)
		{
			System.err.println("Usage: Main <config.json>");
			System.exit(2);
		}

		try
		{
			ExampleConfig config = ExampleConfig.load(new File(args[0]));

			if(config.randomSeed == null)
				config.randomSeed = (int)(new Date()).getTime();
			RandomEngine rng = new MersenneTwister(config.randomSeed);

			// Write parameters as read
			PrintStream paramsStream = new PrintStream("parameters_out.json");
			config.write(paramsStream);
			paramsStream.println();
			paramsStream.close();

			new Main(config, rng).run();
		}
		catch(ExampleException e)
		{
			LOG.error("Example failed", e);
			System.exit(1);
		}
		catch(IOException e)
		{
			LOG.error("Could not write parameters", e);
			System.exit(1);
		}
	}

	private final ExampleConfig config;
	private final RandomEngine rng;

	public Main(ExampleConfig config, RandomEngine rng)
	{
		this.config = config;
		this.rng = rng;
	}

	/**
	 * @return the posterior after all observations
	 */
	public WeightedMap<?> run() throws ExampleException
	{
		LOG.info("Running {} problem with {} observations", config.problem, config.data.size());

		WeightedMap<?> posterior;
		try
		{
			posterior = solve();
			report(posterior);
		}
		catch(IllegalArgumentException e)
		{
			throw new ExampleException("Bad input for " + config.problem + " problem: " + e.getMessage(), e);
		}
		return posterior;
	}

	private WeightedMap<?> solve() throws ExampleException
	{
		String problem = config.problem == null ? "" : config.problem.toLowerCase();
		if(problem.equals("cookie"))
		{
			CookieProblem pmf = new CookieProblem(Bowls.standard(config.replacement));
			pmf.updateSet(config.data);
			return pmf;
		}
		else if(problem.equals("monty"))
		{
			MontyHallProblem pmf = new MontyHallProblem(config.pickedDoor,
					config.doors.toArray(new String[config.doors.size()]));
			pmf.updateSet(config.data);
			return pmf;
		}
		else if(problem.equals("dice"))
		{
			DiceProblem pmf = new DiceProblem(config.dice);
			pmf.updateSet(parseIntegers(config.data));
			return pmf;
		}
		else if(problem.equals("mnm"))
		{
			MnMProblem pmf = new MnMProblem();
			for(String text : config.data)
			{
				pmf.update(Draw.parse(text));
			}
			return pmf;
		}
		else if(problem.equals("locomotive"))
		{
			LocomotiveProblem pmf = config.alpha == null
					? new LocomotiveProblem(config.upperBound)
					: new LocomotiveProblem(config.upperBound, config.alpha);
			pmf.updateSet(parseIntegers(config.data));
			return pmf;
		}
		throw new ExampleException("Unknown problem: " + config.problem);
	}

	private static List<Integer> parseIntegers(List<String> data)
	{
		List<Integer> values = new ArrayList<Integer>(data.size());
		for(String text : data)
		{
			try
			{
				values.add(Integer.parseInt(text.trim()));
			}
			catch(NumberFormatException e)
			{
				throw new IllegalArgumentException("Not an integer: " + text, e);
			}
		}
		return values;
	}

	private <T> void report(WeightedMap<T> posterior)
	{
		if(!(posterior.getTotal() > 0.0))
		{
			LOG.warn("Observations are impossible under every hypothesis: {}", posterior);
			return;
		}

		if(posterior.getSize() <= 20)
		{
			for(T hypothesis : posterior.getHypotheses())
			{
				LOG.info("P({}) = {}", hypothesis, String.format("%.4f", posterior.getWeight(hypothesis)));
			}
		}

		LOG.info("Mode: {}", posterior.getMode());
		if(posterior.getMode() instanceof Number)
		{
			LOG.info("Mean: {}", String.format("%.4f", posterior.expectation()));
		}

		CumulativeDistribution<T> cdf = posterior.toCumulative();
		LOG.info("{}% credible interval: {}", Math.round(config.credibleInterval * 100),
				cdf.credibleInterval(config.credibleInterval));

		if(config.samples < 0) throw new IllegalArgumentException("Number of samples must be non-negative: " + config.samples);

		List<T> draws = new ArrayList<T>(config.samples);
		for(int i = 0; i < config.samples; i++)
		{
			draws.add(posterior.sample(rng));
		}
		LOG.info("Samples: {}", draws);
	}
}
