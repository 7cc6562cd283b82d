package cinder.commands.list;

import cinder.structs.CinderList;

public class LPopCommand extends PopCommand {
    @Override
    byte[] pop(CinderList list) {
        return list.popLeft();
    }
}
