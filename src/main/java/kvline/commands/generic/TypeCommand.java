package kvline.commands.generic;

import kvline.commands.Command;
import kvline.db.DataType;
import kvline.db.KvStore;
import kvline.protocol.Reply;
import java.util.List;
import java.util.Locale;

public class TypeCommand implements Command {
    @Override
    public Reply execute(KvStore store, List<String> args) {
        DataType type = store.type(args.get(0));
        return Reply.status(type == null ? "none" : type.name().toLowerCase(Locale.ROOT));
    }
}
