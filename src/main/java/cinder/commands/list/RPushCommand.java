package cinder.commands.list;

import cinder.structs.CinderList;

public class RPushCommand extends PushCommand {
    @Override
    int push(CinderList list, byte[] value) {
        return list.pushRight(value);
    }
}
