package jbayes.examples.test;

import java.util.*;

import jbayes.examples.cookie.*;
import jbayes.examples.dice.DiceProblem;
import jbayes.examples.locomotive.LocomotiveProblem;
import jbayes.examples.mnm.*;
import jbayes.examples.monty.MontyHallProblem;
import jbayes.random.*;

import org.junit.*;

import static org.junit.Assert.*;

public class TestExampleProblems
{
	@Test
	public void cookieWithReplacement()
	{
		CookieProblem pmf = new CookieProblem(Bowls.standard(true));
		assertEquals(0.5, pmf.getWeight("Bowl 1"), 1e-12);

		pmf.update("vanilla");
		assertEquals(0.6, pmf.getWeight("Bowl 1"), 1e-9);
		assertEquals(30, pmf.getBowls().getCount("Bowl 1", "vanilla"));
	}

	@Test
	public void cookieWithoutReplacement()
	{
		CookieProblem pmf = new CookieProblem(Bowls.standard(false));

		pmf.update("vanilla");
		assertEquals(0.6, pmf.getWeight("Bowl 1"), 1e-9);

		pmf.update("vanilla");
		assertEquals(0.696, pmf.getWeight("Bowl 1"), 1e-9);
		assertEquals(0.304, pmf.getWeight("Bowl 2"), 1e-9);

		// One cookie eaten per bowl hypothesis per draw
		Bowls bowls = pmf.getBowls();
		assertEquals(28, bowls.getCount("Bowl 1", "vanilla"));
		assertEquals(18, bowls.getCount("Bowl 2", "vanilla"));
		assertEquals(10, bowls.getCount("Bowl 1", "chocolate"));
	}

	@Test
	public void cookieUnknownFlavor()
	{
		CookieProblem pmf = new CookieProblem(Bowls.standard(false));
		pmf.update("strawberry");

		assertTrue(Double.isNaN(pmf.getWeight("Bowl 1")));
		assertEquals(40, pmf.getBowls().getTotal("Bowl 1"));
	}

	@Test
	public void montyHall()
	{
		MontyHallProblem pmf = new MontyHallProblem("A", "A", "B", "C");
		pmf.update("B");

		assertEquals(1.0 / 3, pmf.getWeight("A"), 1e-9);
		assertEquals(0.0, pmf.getWeight("B"), 0.0);
		assertEquals(2.0 / 3, pmf.getWeight("C"), 1e-9);
		assertEquals("C", pmf.getMode());
	}

	@Test(expected = IllegalArgumentException.class)
	public void montyHallUnknownPick()
	{
		new MontyHallProblem("D", "A", "B", "C");
	}

	@Test
	public void dice()
	{
		DiceProblem pmf = new DiceProblem();
		pmf.update(6);

		assertEquals(0.0, pmf.getWeight(4), 0.0);
		assertTrue(pmf.getWeight(6) > pmf.getWeight(8));

		pmf.updateSet(Arrays.asList(8, 7, 7, 5, 4));

		assertEquals(0.0, pmf.getWeight(6), 0.0);
		assertEquals(8, (int)pmf.getMode());
		assertEquals(0.9158, pmf.getWeight(8), 1e-4);
		assertEquals(0.0804, pmf.getWeight(12), 1e-4);
		assertEquals(0.0038, pmf.getWeight(20), 1e-4);
	}

	@Test
	public void totalOfDice()
	{
		WeightedMap<Integer> total = DiceProblem.totalOf(6, 6);
		assertEquals(1.0 / 6, total.getWeight(7), 1e-12);
		assertEquals(1.0 / 36, total.getWeight(2), 1e-12);

		WeightedMap<Integer> three = DiceProblem.totalOf(6, 6, 6);
		assertEquals(16, three.getSize());
		assertEquals(10.5, three.expectation(), 1e-9);
		assertEquals(1.0 / 216, three.getWeight(18), 1e-12);
	}

	@Test
	public void mnm()
	{
		MnMProblem pmf = new MnMProblem();
		pmf.update(new Draw(MnMProblem.BAG_1, "yellow"));
		pmf.update(Draw.parse("bag2:green"));

		assertEquals(20.0 / 27, pmf.getWeight("A"), 1e-9);
		assertEquals(7.0 / 27, pmf.getWeight("B"), 1e-9);
	}

	@Test(expected = IllegalArgumentException.class)
	public void mnmBadDraw()
	{
		Draw.parse("yellow");
	}

	@Test
	public void locomotiveUniformPrior()
	{
		LocomotiveProblem pmf = new LocomotiveProblem(1000);
		pmf.update(60);

		assertEquals(333.42, pmf.expectation(), 0.01);
		assertEquals(60, (int)pmf.getMode());
		assertEquals(0.0, pmf.getWeight(59), 0.0);
	}

	@Test
	public void locomotivePowerLawPrior()
	{
		LocomotiveProblem uniform = new LocomotiveProblem(1000);
		uniform.updateSet(Arrays.asList(30, 60, 90));

		LocomotiveProblem powerLaw = new LocomotiveProblem(1000, 1.0);
		powerLaw.updateSet(Arrays.asList(30, 60, 90));

		assertEquals(164.31, uniform.expectation(), 0.01);
		assertEquals(133.28, powerLaw.expectation(), 0.01);

		List<Integer> interval = powerLaw.toCumulative().credibleInterval(0.9);
		assertTrue(interval.toString(), interval.get(0) >= 90 && interval.get(0) <= 92);
		assertTrue(interval.toString(), interval.get(1) >= 241 && interval.get(1) <= 243);
	}
}
