package kvline.commands.connection;

import kvline.commands.Args;
import kvline.commands.Command;
import kvline.db.KvStore;
import kvline.protocol.Reply;
import java.util.List;

public class EchoCommand implements Command {
    @Override
    public Reply execute(KvStore store, List<String> args) {
        return Reply.bulkString(Args.joinFrom(args, 0));
    }
}
