package io.issuebridge.doc;

public record DocMark(String type) {
    public static final String STRONG = "strong";
    public static final String EM = "em";
    public static final String CODE = "code";

    public static DocMark strong() {
        return new DocMark(STRONG);
    }

    public static DocMark em() {
        return new DocMark(EM);
    }

    public static DocMark code() {
        return new DocMark(CODE);
    }
}
