package cinder.commands;

public class CommandContainer {
    private final String name;
    private final CommandHandler handler;
    private final CommandMetadata metadata;

    public CommandContainer(String name, CommandHandler handler, CommandMetadata metadata) {
        this.name = name;
        this.handler = handler;
        this.metadata = metadata;
    }

    public String getName() {
        return name;
    }

    public CommandHandler getHandler() {
        return handler;
    }

    public CommandMetadata getMetadata() {
        return metadata;
    }
}
