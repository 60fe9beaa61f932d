package org.humanscript.ast;

/**
 * {@code use <header>;} - a header carried verbatim into the generated includes.
 */
public final class UseDeclaration
{
	private final String headerName;
	private final int line;

	public UseDeclaration(String headerName, int line)
	{
		this.headerName = headerName;
		this.line = line;
	}

	public String getHeaderName()
	{
		return headerName;
	}

	public int getLine()
	{
		return line;
	}

	@Override
	public String toString()
	{
		return "use <" + headerName + ">;";
	}
}
