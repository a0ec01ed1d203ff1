package freec.ast;

/**
 * Source span for diagnostics.
 *
 * Lines and columns are 1-based; the end position is inclusive.
 */
public record SourceSpan(String fileName, int startLine, int startColumn, int endLine, int endColumn) {
	public static final SourceSpan NONE = new SourceSpan(null, -1, -1, -1, -1);

	public static SourceSpan of(String fileName, int line, int column) {
		return new SourceSpan(fileName, line, column, line, column);
	}

	public boolean isKnown() {
		return startLine >= 0;
	}

	@Override
	public String toString() {
		if (!isKnown()) {
			return fileName == null ? "<no location>" : fileName;
		}
		String file = fileName == null ? "<unknown>" : fileName;
		if (startLine == endLine) {
			return file + ":" + startLine + ":" + startColumn + "-" + endColumn;
		}
		return file + ":" + startLine + ":" + startColumn + "-" + endLine + ":" + endColumn;
	}
}
