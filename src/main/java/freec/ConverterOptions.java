package freec;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Properties;

/**
 * Options of the conversion of a module.
 *
 * @param emitHelperComments whether a comment is emitted before each block of helper functions
 * @param useSections        whether recursive functions with constant arguments are converted with a section
 * @param moduleName         name of modules that do not declare one
 */
public record ConverterOptions(boolean emitHelperComments, boolean useSections, String moduleName) {
	public static final String RESOURCE = "freec.properties";

	private static final ConverterOptions BUILT_IN = new ConverterOptions(true, true, "Main");

	/**
	 * Options from {@value #RESOURCE} on the class path, or the built-in defaults if there is no such resource.
	 */
	public static ConverterOptions defaults() {
		try (InputStream in = ConverterOptions.class.getClassLoader().getResourceAsStream(RESOURCE)) {
			if (in == null) {
				return BUILT_IN;
			}
			return load(in);
		} catch (IOException e) {
			throw new UncheckedIOException("could not read " + RESOURCE, e);
		}
	}

	public static ConverterOptions load(InputStream in) throws IOException {
		Properties props = new Properties();
		props.load(in);
		return new ConverterOptions(
				Boolean.parseBoolean(props.getProperty("freec.emitHelperComments",
						String.valueOf(BUILT_IN.emitHelperComments))),
				Boolean.parseBoolean(props.getProperty("freec.useSections", String.valueOf(BUILT_IN.useSections))),
				props.getProperty("freec.moduleName", BUILT_IN.moduleName).trim());
	}

	public ConverterOptions withEmitHelperComments(boolean value) {
		return new ConverterOptions(value, useSections, moduleName);
	}

	public ConverterOptions withUseSections(boolean value) {
		return new ConverterOptions(emitHelperComments, value, moduleName);
	}

	public ConverterOptions withModuleName(String value) {
		return new ConverterOptions(emitHelperComments, useSections, value);
	}
}
