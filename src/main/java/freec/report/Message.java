package freec.report;

import freec.ast.SourceSpan;

public record Message(SourceSpan span, Severity severity, String text) {
	public static Message error(SourceSpan span, String text) {
		return new Message(span, Severity.ERROR, text);
	}

	public static Message internal(SourceSpan span, String text) {
		return new Message(span, Severity.INTERNAL, text);
	}

	@Override
	public String toString() {
		String kind = switch (severity) {
			case ERROR -> "error";
			case WARNING -> "warning";
			case INTERNAL -> "internal error";
		};
		return span + ": " + kind + ": " + text;
	}
}
