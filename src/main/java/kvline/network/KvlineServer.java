package kvline.network;

import kvline.Config;
import kvline.commands.CommandDispatcher;
import kvline.protocol.netty.LineCommandDecoder;
import kvline.protocol.netty.LineReplyEncoder;
import kvline.utils.Log;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;

import java.net.InetSocketAddress;

/**
 * TCP listener. One boss thread accepts; each connection is pinned to a worker event loop
 * and gets its own decoder, encoder and {@link ClientHandler}. All handlers share the
 * dispatcher, and through it the store.
 */
public class KvlineServer implements AutoCloseable {
    private final Config config;
    private final CommandDispatcher dispatcher;
    private final ServerStats stats;

    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private Channel serverChannel;

    public KvlineServer(Config config, CommandDispatcher dispatcher, ServerStats stats) {
        this.config = config;
        this.dispatcher = dispatcher;
        this.stats = stats;
    }

    /**
     * Binds the listener. Throws {@link IllegalStateException} if the address cannot be bound.
     */
    public void start() throws InterruptedException {
        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup(config.workerThreads);
        try {
            ServerBootstrap b = new ServerBootstrap();
            b.group(bossGroup, workerGroup)
             .channel(NioServerSocketChannel.class)
             .childHandler(new ChannelInitializer<SocketChannel>() {
                 @Override
                 public void initChannel(SocketChannel ch) throws Exception {
                     ch.pipeline().addLast(new LineCommandDecoder(config.maxLineLength));
                     ch.pipeline().addLast(new LineReplyEncoder());
                     ch.pipeline().addLast(new ClientHandler(dispatcher, stats));
                 }
             });

            serverChannel = b.bind(config.bind, config.port).sync().channel();
            Log.info("Ready on " + config.bind + ":" + getPort());
        } catch (InterruptedException e) {
            close();
            throw e;
        } catch (Exception e) {
            close();
            throw new IllegalStateException("Cannot bind " + config.bind + ":" + config.port + ": " + e.getMessage(), e);
        }
    }

    /** The bound port; differs from the configured one when that was 0. */
    public int getPort() {
        return ((InetSocketAddress) serverChannel.localAddress()).getPort();
    }

    public ServerStats getStats() {
        return stats;
    }

    public void awaitTermination() throws InterruptedException {
        serverChannel.closeFuture().sync();
    }

    @Override
    public void close() {
        if (serverChannel != null) serverChannel.close().syncUninterruptibly();
        if (bossGroup != null) bossGroup.shutdownGracefully();
        if (workerGroup != null) workerGroup.shutdownGracefully();
    }
}
