package cinder.commands;

/**
 * An argument or stored value that does not parse as the number a command needs.
 */
public class FormatException extends CommandException {
    public static final String NOT_AN_INTEGER = "value is not an integer or out of range";
    public static final String NOT_A_FLOAT = "value is not a valid float";

    public FormatException(String message) {
        super(message);
    }
}
