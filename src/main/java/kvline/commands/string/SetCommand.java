package kvline.commands.string;

import kvline.commands.Args;
import kvline.commands.Command;
import kvline.db.KvStore;
import kvline.protocol.Reply;
import java.util.List;

public class SetCommand implements Command {
    @Override
    public Reply execute(KvStore store, List<String> args) {
        // Everything after the key is the value: "SET greeting hello world" stores "hello world".
        store.set(args.get(0), Args.joinFrom(args, 1));
        return Reply.ok();
    }
}
