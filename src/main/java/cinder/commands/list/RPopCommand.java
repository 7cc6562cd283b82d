package cinder.commands.list;

import cinder.structs.CinderList;

public class RPopCommand extends PopCommand {
    @Override
    byte[] pop(CinderList list) {
        return list.popRight();
    }
}
