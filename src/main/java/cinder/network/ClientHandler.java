package cinder.network;

import cinder.db.Database;
import cinder.protocol.Command;
import cinder.protocol.ProtocolException;
import cinder.protocol.Reply;
import cinder.utils.Log;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.util.ReferenceCountUtil;

import java.io.IOException;

/**
 * Last handler of a client pipeline. Feeds decoded commands into the {@link Connection},
 * writes replies as they are produced and flushes at the end of each read batch.
 * While the channel is over its high water mark, execution and reading both pause.
 */
public class ClientHandler extends ChannelInboundHandlerAdapter {
    static final Reply MAX_CLIENTS_REACHED = Reply.error("ERR", "max number of clients reached");

    private final Database db;
    private final ClientRegistry registry;
    private final long slowlogThresholdMicros;
    private Connection connection;
    private boolean registered;

    public ClientHandler(Database db, ClientRegistry registry, long slowlogThresholdMicros) {
        this.db = db;
        this.registry = registry;
        this.slowlogThresholdMicros = slowlogThresholdMicros;
    }

    Connection getConnection() {
        return connection;
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception {
        connection = new Connection(registry.nextId(), db, slowlogThresholdMicros);
        if (!registry.tryRegister()) {
            Log.warn("Rejecting " + ctx.channel().remoteAddress() + ": max number of clients reached");
            connection.beginClose();
            ctx.channel().config().setAutoRead(false);
            ctx.writeAndFlush(MAX_CLIENTS_REACHED).addListener(ChannelFutureListener.CLOSE);
            return;
        }
        registered = true;
        connection.activate();
        Log.debug("Client " + connection.getId() + " connected from " + ctx.channel().remoteAddress());
        super.channelActive(ctx);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        if (connection != null) {
            connection.closed();
            Log.debug("Client " + connection.getId() + " disconnected");
        }
        if (registered) {
            registered = false;
            registry.unregister();
        }
        super.channelInactive(ctx);
    }

    @Override
    public void channelRead(ChannelHandlerContext ctx, Object msg) {
        if (!(msg instanceof Command)) {
            ReferenceCountUtil.release(msg);
            return;
        }
        if (connection.isClosing()) return;
        connection.enqueue((Command) msg);
        drain(ctx);
    }

    @Override
    public void channelReadComplete(ChannelHandlerContext ctx) {
        ctx.flush();
    }

    @Override
    public void channelWritabilityChanged(ChannelHandlerContext ctx) throws Exception {
        if (connection != null && !connection.isClosing()) {
            if (ctx.channel().isWritable()) {
                drain(ctx);
                ctx.flush();
            } else {
                ctx.channel().config().setAutoRead(false);
            }
        }
        super.channelWritabilityChanged(ctx);
    }

    private void drain(ChannelHandlerContext ctx) {
        connection.drain(new ChannelSink(ctx));
        if (connection.isClosing()) return;
        // stop reading while replies cannot be written out
        boolean backlogged = connection.hasPending() || !ctx.channel().isWritable();
        ctx.channel().config().setAutoRead(!backlogged);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        boolean first = connection == null || connection.beginClose();
        if (!first) return;
        if (cause instanceof ProtocolException) {
            Log.debug("Protocol error from " + ctx.channel().remoteAddress() + ": " + cause.getMessage());
            ctx.writeAndFlush(Reply.error("ERR", "Protocol error: " + cause.getMessage()))
                    .addListener(ChannelFutureListener.CLOSE);
        } else if (cause instanceof IOException) {
            Log.debug("Connection error: " + cause.getMessage());
            ctx.close();
        } else {
            Log.error("Internal error on connection " + (connection == null ? "?" : connection.getId()), cause);
            ctx.close();
        }
    }

    private static final class ChannelSink implements ReplySink {
        private final ChannelHandlerContext ctx;

        ChannelSink(ChannelHandlerContext ctx) {
            this.ctx = ctx;
        }

        @Override
        public boolean isWritable() {
            return ctx.channel().isWritable();
        }

        @Override
        public void write(Reply reply) {
            ctx.write(reply).addListener(ChannelFutureListener.FIRE_EXCEPTION_ON_FAILURE);
        }

        @Override
        public void flush() {
            ctx.flush();
        }

        @Override
        public void closeAfterFlush() {
            ctx.writeAndFlush(Unpooled.EMPTY_BUFFER).addListener(ChannelFutureListener.CLOSE);
        }
    }
}
