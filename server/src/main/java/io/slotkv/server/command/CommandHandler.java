package io.slotkv.server.command;

import io.slotkv.core.resp.Command;
import io.slotkv.core.resp.Reply;

@FunctionalInterface
public interface CommandHandler {
    Reply execute(Session session, Command command);
}
