package freec.transform;

import freec.ConverterOptions;
import freec.env.Environment;
import freec.report.ConversionException;
import freec.report.ConversionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Supplier;

/**
 * State of a conversion: the environment and the options. Passed to every converter and transformer.
 */
public final class Converter {
	private static final Logger LOG = LoggerFactory.getLogger(Converter.class);

	private final Environment env;
	private final ConverterOptions options;

	public Converter(Environment env, ConverterOptions options) {
		this.env = env;
		this.options = options;
	}

	public Converter() {
		this(new Environment(), ConverterOptions.defaults());
	}

	public Environment env() {
		return env;
	}

	public ConverterOptions options() {
		return options;
	}

	/**
	 * Runs the action in a nested scope. Entries, type signatures and decreasing arguments added by the action are
	 * discarded afterwards; fresh identifiers stay used.
	 */
	public <T> T localEnv(Supplier<T> action) {
		Environment.Snapshot snapshot = env.snapshot();
		env.enterScope();
		try {
			return action.get();
		} finally {
			env.restore(snapshot);
		}
	}

	/**
	 * Runs the action as one unit. If it fails, the environment is reset to the state before the action.
	 */
	public <T> ConversionResult<T> atomically(Supplier<T> action) {
		Environment.Snapshot snapshot = env.snapshot();
		try {
			return ConversionResult.success(action.get());
		} catch (ConversionException e) {
			env.restore(snapshot);
			LOG.debug("Rolled back after: {}", e.diagnostic());
			return ConversionResult.failure(e.diagnostic());
		}
	}
}
