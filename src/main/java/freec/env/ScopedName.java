package freec.env;

public record ScopedName(Scope scope, String name) {
}
