package org.humanscript.dto;

public class SymbolDTO
{
	public String name;
	public String type;
	public String cppType;
	public boolean initialized = false;
}
