package cinder.protocol;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * A decoded request: the upper-cased verb followed by its raw byte arguments.
 */
public final class Command {
    private final String name;
    private final List<byte[]> args;

    private Command(String name, List<byte[]> args) {
        this.name = name;
        this.args = args;
    }

    /**
     * Builds a command from its wire parts, the first of which is the verb.
     */
    public static Command of(List<byte[]> parts) {
        if (parts.isEmpty()) throw new IllegalArgumentException("command needs a verb");
        String verb = new String(parts.get(0), StandardCharsets.UTF_8).toUpperCase(Locale.ROOT);
        return new Command(verb, Collections.unmodifiableList(new ArrayList<>(parts.subList(1, parts.size()))));
    }

    public static Command of(String... parts) {
        List<byte[]> raw = new ArrayList<>(parts.length);
        for (String p : parts) {
            raw.add(p.getBytes(StandardCharsets.UTF_8));
        }
        return of(raw);
    }

    public String getName() {
        return name;
    }

    public List<byte[]> args() {
        return args;
    }

    public byte[] arg(int i) {
        return args.get(i);
    }

    public String argString(int i) {
        return new String(args.get(i), StandardCharsets.UTF_8);
    }

    public int argCount() {
        return args.size();
    }

    /** Argument count including the verb. */
    public int arity() {
        return args.size() + 1;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(name);
        for (byte[] a : args) {
            sb.append(' ').append(new String(a, StandardCharsets.UTF_8));
        }
        return sb.toString();
    }
}
