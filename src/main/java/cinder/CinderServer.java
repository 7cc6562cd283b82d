package cinder;

import cinder.db.Database;
import cinder.network.ClientHandler;
import cinder.network.ClientRegistry;
import cinder.protocol.RespParser;
import cinder.protocol.netty.NettyRespDecoder;
import cinder.protocol.netty.NettyRespEncoder;
import cinder.utils.Log;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.WriteBufferWaterMark;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;

import java.net.InetSocketAddress;

/**
 * The TCP front end: one boss thread accepting, a pool of worker event loops running the
 * per-client pipelines. Port 0 binds an ephemeral port, see {@link #getPort()}.
 */
public class CinderServer {
    private final Config config;
    private final Database db;
    private final ClientRegistry clients;
    private final NettyRespEncoder encoder = new NettyRespEncoder();
    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private Channel serverChannel;

    public CinderServer(Config config, Database db) {
        this.config = config;
        this.db = db;
        this.clients = new ClientRegistry(config.getMaxClients());
    }

    public synchronized void start() throws InterruptedException {
        if (serverChannel != null) throw new IllegalStateException("Server already started");
        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup(config.getIoThreads());
        try {
            ServerBootstrap b = new ServerBootstrap();
            b.group(bossGroup, workerGroup)
             .channel(NioServerSocketChannel.class)
             .option(ChannelOption.SO_BACKLOG, 511)
             .childOption(ChannelOption.TCP_NODELAY, true)
             .childOption(ChannelOption.WRITE_BUFFER_WATER_MARK,
                     new WriteBufferWaterMark(config.getWriteBufferLowWaterMark(), config.getWriteBufferHighWaterMark()))
             .childHandler(new ChannelInitializer<SocketChannel>() {
                 @Override
                 public void initChannel(SocketChannel ch) {
                     RespParser parser = new RespParser(config.getMaxBulkLength(), config.getMaxInlineLength(),
                             config.getMaxMultiBulkLength());
                     ch.pipeline().addLast(new NettyRespDecoder(parser));
                     ch.pipeline().addLast(encoder);
                     ch.pipeline().addLast(new ClientHandler(db, clients, config.getSlowlogThresholdMicros()));
                 }
             });

            serverChannel = b.bind(config.getHost(), config.getPort()).sync().channel();
            Log.info("Ready on " + serverChannel.localAddress());
        } catch (Exception e) {
            shutdownGroups();
            throw e;
        }
    }

    public synchronized int getPort() {
        if (serverChannel == null) throw new IllegalStateException("Server not started");
        return ((InetSocketAddress) serverChannel.localAddress()).getPort();
    }

    public ClientRegistry getClients() {
        return clients;
    }

    public Database getDatabase() {
        return db;
    }

    /**
     * Blocks until the listening socket is closed.
     */
    public void awaitClose() throws InterruptedException {
        Channel ch;
        synchronized (this) {
            ch = serverChannel;
        }
        if (ch != null) ch.closeFuture().sync();
    }

    public synchronized void stop() {
        if (serverChannel == null) return;
        Log.info("Stopping server on " + serverChannel.localAddress());
        serverChannel.close().syncUninterruptibly();
        serverChannel = null;
        shutdownGroups();
    }

    private void shutdownGroups() {
        if (bossGroup != null) bossGroup.shutdownGracefully().syncUninterruptibly();
        if (workerGroup != null) workerGroup.shutdownGracefully().syncUninterruptibly();
        bossGroup = null;
        workerGroup = null;
    }
}
