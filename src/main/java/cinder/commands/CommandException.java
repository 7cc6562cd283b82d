package cinder.commands;

/**
 * A failure that is reported to the client as an error reply. The connection stays open.
 */
public class CommandException extends RuntimeException {
    private final String kind;

    public CommandException(String message) {
        this("ERR", message);
    }

    public CommandException(String kind, String message) {
        super(message);
        this.kind = kind;
    }

    /** First word of the error line, e.g. {@code ERR} or {@code WRONGTYPE}. */
    public String getKind() {
        return kind;
    }
}
