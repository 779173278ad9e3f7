package jbayes.examples.mnm;

/**
 * A candy of some color drawn from one of the bags.
 */
public class Draw
{
	private final String bag;
	private final String color;

	public Draw(String bag, String color)
	{
		this.bag = bag;
		this.color = color;
	}

	/**
	 * Parses "bag:color".
	 */
	public static Draw parse(String text)
	{
		int colon = text.indexOf(':');
		if(colon <= 0 || colon == text.length() - 1)
			throw new IllegalArgumentException("Expected bag:color, got " + text);
		return new Draw(text.substring(0, colon).trim(), text.substring(colon + 1).trim());
	}

	public String getBag()
	{
		return bag;
	}

	public String getColor()
	{
		return color;
	}

	@Override
	public int hashCode()
	{
		return bag.hashCode() * 31 + color.hashCode();
	}

	@Override
	public boolean equals(Object obj)
	{
		if(this == obj) return true;
		if(obj == null || getClass() != obj.getClass()) return false;

		Draw draw = (Draw)obj;
		return bag.equals(draw.bag) && color.equals(draw.color);
	}

	@Override
	public String toString()
	{
		return String.format("(%s, %s)", bag, color);
	}
}
