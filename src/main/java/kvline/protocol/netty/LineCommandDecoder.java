package kvline.protocol.netty;

import kvline.protocol.CommandLine;
import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ByteToMessageDecoder;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Netty decoder for the line protocol.
 * Emits one {@link CommandLine} per {@code \n}-terminated line; a trailing {@code \r} is dropped.
 * Lines longer than {@code maxLineLength} bytes are skipped and reported as a protocol error.
 */
public class LineCommandDecoder extends ByteToMessageDecoder {

    private final int maxLineLength;

    // Set while skipping the rest of an overlong line that has no terminator yet
    private boolean discarding = false;

    public LineCommandDecoder(int maxLineLength) {
        this.maxLineLength = maxLineLength;
    }

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) throws Exception {
        while (in.isReadable()) {
            int eol = in.indexOf(in.readerIndex(), in.writerIndex(), (byte) '\n');

            if (discarding) {
                if (eol == -1) {
                    in.skipBytes(in.readableBytes());
                    return;
                }
                in.readerIndex(eol + 1);
                discarding = false;
                out.add(CommandLine.error(CommandLine.ERR_TOO_LONG));
                continue;
            }

            if (eol == -1) {
                // Wait for more data, unless the pending line is already too long (one byte of slack for \r)
                if (in.readableBytes() > maxLineLength + 1) {
                    in.skipBytes(in.readableBytes());
                    discarding = true;
                }
                return;
            }

            int length = eol - in.readerIndex();
            if (length > 0 && in.getByte(eol - 1) == '\r') length--;

            if (length > maxLineLength) {
                in.readerIndex(eol + 1);
                out.add(CommandLine.error(CommandLine.ERR_TOO_LONG));
                continue;
            }

            String line = in.toString(in.readerIndex(), length, StandardCharsets.UTF_8);
            in.readerIndex(eol + 1);
            out.add(CommandLine.parse(line));
        }
    }
}
