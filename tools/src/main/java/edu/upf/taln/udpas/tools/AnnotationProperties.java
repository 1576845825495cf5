package edu.upf.taln.udpas.tools;

import edu.upf.taln.udpas.core.Options;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.InputStream;
import java.util.Properties;

/**
 * Default annotation settings read from the udpas.properties resource. Command line arguments take precedence.
 */
public class AnnotationProperties
{
	public static final String RESOURCE = "udpas.properties";

	private String release = null;
	private String empty = "_";
	private boolean abortOnError = false;
	private boolean parallel = false;
	private int batchSize = 1000;

	private final static Logger log = LogManager.getLogger();

	public AnnotationProperties()
	{
		Properties prop = new Properties();
		try (InputStream input = AnnotationProperties.class.getClassLoader().getResourceAsStream(RESOURCE))
		{
			if (input == null)
			{
				log.warn("Unable to find " + RESOURCE + ", using defaults");
				return;
			}
			prop.load(input);
		}
		catch (Exception ex)
		{
			log.error("Failed to load properties: " + ex);
			return;
		}

		load(prop);
	}

	public AnnotationProperties(Properties prop)
	{
		load(prop);
	}

	private void load(Properties prop)
	{
		release = emptyToNull(prop.getProperty("udpas.release"));
		empty = prop.getProperty("udpas.empty", empty);
		abortOnError = Boolean.parseBoolean(prop.getProperty("udpas.abort_on_error", Boolean.toString(abortOnError)));
		parallel = Boolean.parseBoolean(prop.getProperty("udpas.parallel", Boolean.toString(parallel)));
		batchSize = Integer.parseInt(prop.getProperty("udpas.batch_size", Integer.toString(batchSize)));
		if (empty.isEmpty())
			throw new RuntimeException("udpas.empty cannot be an empty string");
		if (batchSize < 1)
			throw new RuntimeException("udpas.batch_size must be greater than 0: " + batchSize);
	}

	public String getRelease() { return release; }
	public String getEmpty() { return empty; }
	public boolean isAbortOnError() { return abortOnError; }
	public boolean isParallel() { return parallel; }
	public int getBatchSize() { return batchSize; }

	/**
	 * Annotation options initialized with these properties
	 */
	public Options toOptions()
	{
		Options o = new Options();
		o.release = release;
		o.empty = empty;
		o.abort_on_error = abortOnError;
		o.parallel = parallel;
		return o;
	}

	private static String emptyToNull(String value)
	{
		return value == null || value.trim().isEmpty() ? null : value.trim();
	}
}
