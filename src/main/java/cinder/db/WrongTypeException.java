package cinder.db;

import cinder.commands.CommandException;

public class WrongTypeException extends CommandException {
    public WrongTypeException() {
        super("WRONGTYPE", "Operation against a key holding the wrong kind of value");
    }
}
