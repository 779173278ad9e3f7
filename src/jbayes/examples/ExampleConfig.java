package jbayes.examples;

import java.io.*;
import java.util.*;

import com.google.gson.*;

/**
 * Settings for {@link Main}, read from JSON.
 */
public class ExampleConfig
{
	// One of cookie, monty, dice, mnm, locomotive
	String problem = "cookie";

	// Observations, in order. Parsed according to the problem:
	// flavors, door names, rolls, "bag:color" draws or serial numbers.
	List<String> data = new ArrayList<String>();

	Integer randomSeed = null;

	// Cookie problem: draw with or without replacement
	boolean replacement = true;

	// Monty Hall problem
	String pickedDoor = "A";
	List<String> doors = new ArrayList<String>(Arrays.asList("A", "B", "C"));

	// Dice problem
	List<Integer> dice = new ArrayList<Integer>(Arrays.asList(4, 6, 8, 12, 20));

	// Locomotive problem: largest fleet size considered
	int upperBound = 1000;

	// Locomotive problem: power law exponent for the prior, or null for uniform
	Double alpha = null;

	// Width of the reported credible interval
	double credibleInterval = 0.9;

	// Number of draws from the posterior to report
	int samples = 5;

	public static ExampleConfig load(Reader reader) throws ExampleException
	{
		try
		{
			ExampleConfig config = new Gson().fromJson(reader, ExampleConfig.class);
			if(config == null) throw new ExampleException("Empty configuration");
			return config;
		}
		catch(JsonParseException e)
		{
			throw new ExampleException("Could not parse configuration", e);
		}
	}

	public static ExampleConfig load(File file) throws ExampleException
	{
		try
		{
			Reader reader = new FileReader(file);
			try
			{
				return load(reader);
			}
			finally
			{
				reader.close();
			}
		}
		catch(IOException e)
		{
			throw new ExampleException("Could not read configuration " + file, e);
		}
	}

	public void write(Appendable out)
	{
		new GsonBuilder().setPrettyPrinting().create().toJson(this, out);
	}

	public String getProblem()
	{
		return problem;
	}

	public List<String> getData()
	{
		return data;
	}

	public Integer getRandomSeed()
	{
		return randomSeed;
	}
}
