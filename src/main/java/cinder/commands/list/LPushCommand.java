package cinder.commands.list;

import cinder.structs.CinderList;

public class LPushCommand extends PushCommand {
    @Override
    int push(CinderList list, byte[] value) {
        return list.pushLeft(value);
    }
}
