package freec.ast.coq;

public record CoqComment(String text) implements CoqSentence {
}
