package info.isaksson.erland.javatoseq.emitter;

/** Control-flow statements rendered as PlantUML {@code group} blocks. */
public enum BlockKind {
    IF("if"),
    FOR("for"),
    FOREACH("foreach"),
    WHILE("while"),
    DO_WHILE("do/while");

    private final String label;

    BlockKind(String label) {
        this.label = label;
    }

    /** Text after {@code group}. */
    public String label() {
        return label;
    }
}
