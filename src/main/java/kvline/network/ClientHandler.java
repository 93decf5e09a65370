package kvline.network;

import kvline.commands.CommandDispatcher;
import kvline.protocol.CommandLine;
import kvline.protocol.Reply;
import kvline.utils.Log;

import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;

import java.util.Locale;

/**
 * Per-connection handler: runs each decoded line through the dispatcher and writes back
 * exactly one reply. Errors on this channel close this channel only.
 */
public class ClientHandler extends ChannelInboundHandlerAdapter {
    private final CommandDispatcher dispatcher;
    private final ServerStats stats;

    public ClientHandler(CommandDispatcher dispatcher, ServerStats stats) {
        this.dispatcher = dispatcher;
        this.stats = stats;
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception {
        stats.connectionOpened();
        Log.debug("Client connected: " + ctx.channel().remoteAddress());
        super.channelActive(ctx);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        stats.connectionClosed();
        Log.debug("Client disconnected: " + ctx.channel().remoteAddress());
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        Log.debug("Closing " + ctx.channel().remoteAddress() + " after I/O error: " + cause.getMessage());
        ctx.close();
    }

    @Override
    public void channelRead(ChannelHandlerContext ctx, Object msg) throws Exception {
        if (!(msg instanceof CommandLine)) {
            super.channelRead(ctx, msg);
            return;
        }
        CommandLine line = (CommandLine) msg;

        if (line.isProtocolError()) {
            ctx.writeAndFlush(Reply.error(line.getProtocolError()));
            return;
        }

        stats.commandProcessed();
        Reply reply = dispatcher.handleCommand(line.getCommand(), line.getArgs());
        ChannelFuture f = ctx.writeAndFlush(reply);

        if (line.getCommand().toUpperCase(Locale.ROOT).equals("QUIT") && !reply.isError()) {
            f.addListener(ChannelFutureListener.CLOSE);
        }
    }
}
