package edu.upf.taln.udpas.tools;

import com.beust.jcommander.IParameterValidator;
import com.beust.jcommander.IStringConverter;
import com.beust.jcommander.ParameterException;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

public class CMLCheckers
{
	public static class PathConverter implements IStringConverter<Path>
	{
		@Override
		public Path convert(String value)
		{
			return Paths.get(value);
		}
	}

	public static class IntegerConverter implements IStringConverter<Integer>
	{
		@Override
		public Integer convert(String value) { return Integer.parseInt(value); }
	}

	public static class ValidPathToFile implements IParameterValidator
	{
		@Override
		public void validate(String name, String value) throws ParameterException
		{
			Path path = Paths.get(value).toAbsolutePath();
			if ((Files.exists(path) && Files.isDirectory(path)) || path.getParent() == null || !Files.exists(path.getParent()))
			{
				throw new ParameterException("Cannot write to file " + name + " = " + value);
			}
		}
	}

	public static class PathToExistingFile implements IParameterValidator
	{
		@Override
		public void validate(String name, String value) throws ParameterException
		{
			Path path = Paths.get(value);
			if (!Files.exists(path) || !Files.isRegularFile(path))
			{
				throw new ParameterException("Cannot open file " + name + " = " + value);
			}
		}
	}

	public static class PathToExistingFolder implements IParameterValidator
	{
		@Override
		public void validate(String name, String value) throws ParameterException
		{
			Path path = Paths.get(value);
			if (!Files.exists(path) || !Files.isDirectory(path))
			{
				throw new ParameterException("Cannot open folder " + name + " = " + value);
			}
		}
	}

	public static class IntegerGreaterThanZero implements IParameterValidator
	{

		@Override
		public void validate(String name, String value) throws ParameterException
		{
			int n = Integer.parseInt(value);
			if (n < 1)
				throw new ParameterException("Value must be greater than 0: " + value);
		}
	}

	/**
	 * Sentences refer to the release they come from by its handle
	 */
	public static class ReleaseHandle implements IParameterValidator
	{
		@Override
		public void validate(String name, String value) throws ParameterException
		{
			if (!value.startsWith("http://hdl.handle.net/"))
				throw new ParameterException(name + " must provide the http://hdl.handle.net/ identifier of the underlying UD release: " + value);
		}
	}

	public static class TreebankFolder implements IParameterValidator
	{
		@Override
		public void validate(String name, String value) throws ParameterException
		{
			if (!value.matches("^UD_[A-Z].*"))
				throw new ParameterException(name + " must provide the name of the UD treebank repository: " + value);
		}
	}

	public static class TreebankFileName implements IParameterValidator
	{
		@Override
		public void validate(String name, String value) throws ParameterException
		{
			if (!value.matches("^[-a-z_]+\\.conllu$"))
				throw new ParameterException(name + " must provide the name of the source CoNLL-U file without path: " + value);
		}
	}
}
