package org.humanscript.util;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import org.humanscript.codegen.TypeConverter;
import org.humanscript.dto.SymbolDTO;
import org.humanscript.dto.SymbolTableDTO;
import org.humanscript.semantic.symbol.Symbol;
import org.humanscript.semantic.symbol.SymbolTable;
import org.humanscript.semantic.symbol.VariableSymbol;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Converts an analysed symbol table to its JSON report form.
 */
public class SymbolDTOConverter
{
	private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

	public static SymbolTableDTO toReport(String sourceName, SymbolTable table)
	{
		SymbolTableDTO dto = new SymbolTableDTO();
		dto.source = sourceName;
		table.forEachSymbol((name, symbol) -> dto.symbols.add(toDTO(symbol)));
		return dto;
	}

	public static SymbolDTO toDTO(Symbol symbol)
	{
		SymbolDTO dto = new SymbolDTO();
		dto.name = symbol.getName();
		dto.type = symbol.getType().getName();
		dto.cppType = TypeConverter.toCppType(symbol.getType());
		if (symbol instanceof VariableSymbol variable)
		{
			dto.initialized = variable.isInitialized();
		}
		return dto;
	}

	public static String toJson(SymbolTableDTO report)
	{
		return GSON.toJson(report);
	}

	public static SymbolTableDTO fromJson(String json)
	{
		return GSON.fromJson(json, SymbolTableDTO.class);
	}

	public static void writeReport(SymbolTableDTO report, Path outPath) throws IOException
	{
		FileUtils.writeText(outPath, toJson(report));
		Debug.logInfo("Wrote symbol table to: " + outPath);
	}
}
