package freec.env;

/**
 * Types and values live in separate namespaces.
 */
public enum Scope {
	TYPE, VALUE
}
