package kvline.commands.set;

import kvline.commands.Command;
import kvline.db.KvStore;
import kvline.protocol.Reply;
import java.util.List;

public class SIsMemberCommand implements Command {
    @Override
    public Reply execute(KvStore store, List<String> args) {
        return Reply.integer(store.sismember(args.get(0), args.get(1)) ? 1 : 0);
    }
}
