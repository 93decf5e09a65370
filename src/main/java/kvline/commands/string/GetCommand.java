package kvline.commands.string;

import kvline.commands.Command;
import kvline.db.KvStore;
import kvline.protocol.Reply;
import java.util.List;

public class GetCommand implements Command {
    @Override
    public Reply execute(KvStore store, List<String> args) {
        return Reply.bulkString(store.get(args.get(0)));
    }
}
