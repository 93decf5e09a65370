package kvline.commands.set;

import kvline.commands.Command;
import kvline.db.KvStore;
import kvline.protocol.Reply;
import java.util.List;

public class SMembersCommand implements Command {
    @Override
    public Reply execute(KvStore store, List<String> args) {
        return Reply.array(store.smembers(args.get(0)));
    }
}
