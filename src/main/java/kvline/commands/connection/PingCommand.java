package kvline.commands.connection;

import kvline.commands.Args;
import kvline.commands.Command;
import kvline.db.KvStore;
import kvline.protocol.Reply;
import java.util.List;

public class PingCommand implements Command {
    @Override
    public Reply execute(KvStore store, List<String> args) {
        if (!args.isEmpty()) {
            return Reply.bulkString(Args.joinFrom(args, 0));
        }
        return Reply.status("PONG");
    }
}
