package cinder.commands;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

public class CommandMetadata {
    public static final int UNBOUNDED = -1;

    public static final String WRITE = "write";
    public static final String READONLY = "readonly";
    public static final String FAST = "fast";
    public static final String CLOSE = "close";

    private final int minArity;
    private final int maxArity;
    private final Set<String> flags;

    public CommandMetadata(int minArity, int maxArity, Set<String> flags) {
        if (minArity < 1 || (maxArity != UNBOUNDED && maxArity < minArity)) {
            throw new IllegalArgumentException("bad arity bounds " + minArity + ".." + maxArity);
        }
        this.minArity = minArity;
        this.maxArity = maxArity;
        this.flags = flags != null ? Collections.unmodifiableSet(flags) : Collections.emptySet();
    }

    public static CommandMetadata exactly(int arity, String... flags) {
        return new CommandMetadata(arity, arity, new HashSet<>(Arrays.asList(flags)));
    }

    public static CommandMetadata atLeast(int arity, String... flags) {
        return new CommandMetadata(arity, UNBOUNDED, new HashSet<>(Arrays.asList(flags)));
    }

    public static CommandMetadata between(int min, int max, String... flags) {
        return new CommandMetadata(min, max, new HashSet<>(Arrays.asList(flags)));
    }

    public int getMinArity() {
        return minArity;
    }

    public int getMaxArity() {
        return maxArity;
    }

    public Set<String> getFlags() {
        return flags;
    }

    public boolean hasFlag(String flag) {
        return flags.contains(flag);
    }

    /** Arity counts the verb itself. */
    public boolean acceptsArity(int arity) {
        return arity >= minArity && (maxArity == UNBOUNDED || arity <= maxArity);
    }
}
