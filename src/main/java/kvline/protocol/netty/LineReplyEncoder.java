package kvline.protocol.netty;

import kvline.protocol.Reply;
import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToByteEncoder;
import java.nio.charset.StandardCharsets;

/**
 * Encodes a {@link Reply} as one UTF-8 line terminated by {@code \n}.
 */
public class LineReplyEncoder extends MessageToByteEncoder<Reply> {

    @Override
    protected void encode(ChannelHandlerContext ctx, Reply msg, ByteBuf out) throws Exception {
        out.writeCharSequence(msg.toLine(), StandardCharsets.UTF_8);
        out.writeByte('\n');
    }
}
