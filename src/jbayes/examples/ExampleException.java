package jbayes.examples;

/**
 * Failure to run an example: unreadable or malformed configuration, an
 * unknown problem name, or observations and settings the problem rejects.
 */
@SuppressWarnings("serial")
public class ExampleException extends Exception
{
	public ExampleException()
	{
		super();
	}

	public ExampleException(String message, Throwable cause)
	{
		super(message, cause);
	}

	public ExampleException(String message)
	{
		super(message);
	}

	public ExampleException(Throwable cause)
	{
		super(cause);
	}
}
