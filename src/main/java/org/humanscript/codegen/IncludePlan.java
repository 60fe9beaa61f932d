package org.humanscript.codegen;

import java.util.List;

/**
 * The include section of a generated file: the headers the program asked for with {@code use},
 * followed by the ones the generator adds itself.
 */
public final class IncludePlan
{
	public static final class AutoInclude
	{
		private final String header;
		private final String reason;

		AutoInclude(String header, String reason)
		{
			this.header = header;
			this.reason = reason;
		}

		public String getHeader()
		{
			return header;
		}

		public String getReason()
		{
			return reason;
		}
	}

	private final List<String> useHeaders;
	private final List<AutoInclude> autoIncludes;
	private final boolean ioStreamIncluded;

	IncludePlan(List<String> useHeaders, List<AutoInclude> autoIncludes, boolean ioStreamIncluded)
	{
		this.useHeaders = List.copyOf(useHeaders);
		this.autoIncludes = List.copyOf(autoIncludes);
		this.ioStreamIncluded = ioStreamIncluded;
	}

	public List<String> getUseHeaders()
	{
		return useHeaders;
	}

	public List<AutoInclude> getAutoIncludes()
	{
		return autoIncludes;
	}

	/**
	 * True when {@code <iostream>} ends up included, by {@code use} or automatically.
	 */
	public boolean isIoStreamIncluded()
	{
		return ioStreamIncluded;
	}

	public boolean includes(String header)
	{
		return useHeaders.contains(header) || autoIncludes.stream().anyMatch(a -> a.getHeader().equals(header));
	}
}
