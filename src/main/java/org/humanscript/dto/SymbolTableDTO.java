package org.humanscript.dto;

import java.util.ArrayList;
import java.util.List;

public class SymbolTableDTO
{
	public String source;
	public List<SymbolDTO> symbols = new ArrayList<>();
}
