package freec.report;

import java.util.function.Function;

/**
 * Outcome of converting a declaration group: either a value or the fatal message that aborted it.
 */
public sealed interface ConversionResult<T> permits ConversionResult.Success, ConversionResult.Failure {
	record Success<T>(T value) implements ConversionResult<T> {
	}

	record Failure<T>(Message message) implements ConversionResult<T> {
	}

	static <T> ConversionResult<T> success(T value) {
		return new Success<>(value);
	}

	static <T> ConversionResult<T> failure(Message message) {
		return new Failure<>(message);
	}

	default boolean isSuccess() {
		return this instanceof Success<T>;
	}

	default <R> ConversionResult<R> map(Function<? super T, ? extends R> f) {
		if (this instanceof Success<T> success) {
			return new Success<>(f.apply(success.value()));
		}
		return new Failure<>(((Failure<T>) this).message());
	}

	/**
	 * Returns the value or rethrows the failure as {@link ConversionException}.
	 */
	default T orElseThrow() {
		if (this instanceof Success<T> success) {
			return success.value();
		}
		throw new ConversionException(((Failure<T>) this).message());
	}
}
