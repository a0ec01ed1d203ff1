package freec.report;

public enum Severity {
	/** A problem with the user's program. */
	ERROR,
	WARNING,
	/** A violated invariant of the compiler itself. */
	INTERNAL
}
