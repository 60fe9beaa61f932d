package org.humanscript.util;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

public class FileUtils
{
	public static String readSource(Path filePath) throws IOException
	{
		return Files.readString(filePath, StandardCharsets.UTF_8);
	}

	public static void writeText(Path filePath, String content) throws IOException
	{
		Path parent = filePath.toAbsolutePath().getParent();
		if (parent != null)
		{
			Files.createDirectories(parent);
		}
		Files.writeString(filePath, content, StandardCharsets.UTF_8, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
	}

	public static String getFileExtension(Path path)
	{
		String fileName = path.getFileName().toString();
		int lastDotIndex = fileName.lastIndexOf('.');
		if (lastDotIndex > 0)
		{
			return fileName.substring(lastDotIndex);
		}
		return null;
	}

	/**
	 * Strips the last extension, keeping any directory part: {@code dir/hello.hs -> dir/hello}.
	 */
	public static String getBaseName(Path path)
	{
		String full = path.toString();
		String extension = getFileExtension(path);
		if (extension == null)
		{
			return full;
		}
		return full.substring(0, full.length() - extension.length());
	}
}
