package freec.env;

/**
 * Index and name of the decreasing argument of a recursive function.
 */
public record DecArg(int index, String argName) {
}
