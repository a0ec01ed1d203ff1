package freec.report;

import freec.ast.SourceSpan;

/**
 * Fatal diagnostic that aborts the conversion of the current declaration group.
 */
public class ConversionException extends RuntimeException {
	private final Message diagnostic;

	public ConversionException(Message diagnostic) {
		super(diagnostic.toString());
		this.diagnostic = diagnostic;
	}

	public static ConversionException error(SourceSpan span, String text) {
		return new ConversionException(Message.error(span, text));
	}

	public static ConversionException internal(SourceSpan span, String text) {
		return new ConversionException(Message.internal(span, text));
	}

	public Message diagnostic() {
		return diagnostic;
	}
}
