package cinder.commands;

import cinder.db.Database;
import cinder.protocol.Command;
import cinder.protocol.Reply;

import java.nio.charset.StandardCharsets;

/**
 * Validates a request against the registry and runs its handler.
 * Unknown verbs and bad arity are answered without touching the database.
 * Anything thrown that is not a {@link CommandException} is left to the caller.
 */
public final class CommandDispatcher {
    private static final int MAX_ECHOED_ARGS_LENGTH = 128;

    private CommandDispatcher() { }

    public static Reply execute(Database db, Command command) {
        return execute(db, command, CommandRegistry.get(command.getName()));
    }

    /**
     * Runs an already resolved container; {@code container} may be null for an unknown verb.
     */
    public static Reply execute(Database db, Command command, CommandContainer container) {
        if (container == null) return unknownCommand(command);
        if (!container.getMetadata().acceptsArity(command.arity())) {
            return toReply(Args.wrongArity(command.getName()));
        }
        try {
            Reply reply = container.getHandler().execute(db, command);
            if (container.getMetadata().hasFlag(CommandMetadata.WRITE)) db.markDirty();
            return reply;
        } catch (CommandException e) {
            return toReply(e);
        }
    }

    private static Reply toReply(CommandException e) {
        return Reply.error(e.getKind(), e.getMessage());
    }

    private static Reply unknownCommand(Command command) {
        StringBuilder args = new StringBuilder();
        for (byte[] arg : command.args()) {
            if (args.length() >= MAX_ECHOED_ARGS_LENGTH) break;
            String s = new String(arg, StandardCharsets.UTF_8).replace('\r', ' ').replace('\n', ' ');
            args.append('\'').append(s, 0, Math.min(s.length(), MAX_ECHOED_ARGS_LENGTH - args.length())).append("' ");
        }
        String name = command.getName().replace('\r', ' ').replace('\n', ' ');
        return Reply.error("ERR", "unknown command '" + name + "', with args beginning with: " + args);
    }
}
