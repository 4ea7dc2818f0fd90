package site.kvmini.server.handler;

import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.DecoderException;
import io.netty.handler.timeout.IdleStateEvent;
import lombok.extern.slf4j.Slf4j;
import site.kvmini.protocol.Errors;
import site.kvmini.protocol.ProtocolException;
import site.kvmini.protocol.Resp;
import site.kvmini.protocol.RespArray;
import site.kvmini.pubsub.PubSubBroker;
import site.kvmini.server.command.executor.CommandDispatcher;
import site.kvmini.server.session.ClientSession;

import java.io.IOException;

/**
 * 命令处理器，运行在命令执行线程上，负责把请求交给分发器并通过会话写回回复。
 *
 * <p>所有回复和订阅推送都经过 {@link ClientSession} 的出站队列，保证同一连接上的顺序。
 * 协议错误先回复错误再关闭连接，之前已经解析出的请求照常执行。
 *
 * @author hnfy258
 * @since 1.0
 */
@Slf4j
@ChannelHandler.Sharable
public class RespCommandHandler extends SimpleChannelInboundHandler<Resp> {

    private static final Errors UNSUPPORTED_REQUEST_ERROR = new Errors("ERR Protocol error: expected array request");

    private final CommandDispatcher dispatcher;

    private final PubSubBroker broker;

    /** 每个订阅者允许排队的推送消息数 */
    private final int pushCapacity;

    public RespCommandHandler(CommandDispatcher dispatcher, PubSubBroker broker, int pushCapacity) {
        if (dispatcher == null || broker == null) {
            throw new IllegalArgumentException("分发器和发布订阅组件不能为null");
        }
        this.dispatcher = dispatcher;
        this.broker = broker;
        this.pushCapacity = pushCapacity;
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception {
        final ClientSession session = new ClientSession(ctx.channel(), ctx.executor(), pushCapacity);
        ctx.channel().attr(ClientSession.SESSION_KEY).set(session);
        log.debug("客户端连接 {} 建立，会话 {}", ctx.channel().remoteAddress(), session.getId());
        super.channelActive(ctx);
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, Resp msg) {
        final ClientSession session = ctx.channel().attr(ClientSession.SESSION_KEY).get();
        if (session == null || session.isDraining()) {
            return;
        }
        if (!(msg instanceof RespArray)) {
            session.reply(UNSUPPORTED_REQUEST_ERROR);
            return;
        }
        final Resp response = dispatcher.dispatch((RespArray) msg, session);
        if (response != null) {
            session.reply(response);
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        final ClientSession session = ctx.channel().attr(ClientSession.SESSION_KEY).get();
        final ProtocolException protocolError = findProtocolError(cause);
        if (protocolError != null && session != null) {
            log.debug("客户端 {} 协议错误: {}", ctx.channel().remoteAddress(), protocolError.getMessage());
            session.reply(new Errors(protocolError.toErrorReply()));
            session.closeAfterReplies();
            return;
        }
        if (cause instanceof IOException) {
            log.debug("连接 {} 异常关闭: {}", ctx.channel().remoteAddress(), cause.getMessage());
        } else {
            log.error("连接异常: {}", cause.getMessage(), cause);
        }
        ctx.close();
    }

    private static ProtocolException findProtocolError(Throwable cause) {
        if (cause instanceof ProtocolException) {
            return (ProtocolException) cause;
        }
        if (cause instanceof DecoderException && cause.getCause() instanceof ProtocolException) {
            return (ProtocolException) cause.getCause();
        }
        return null;
    }

    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
        if (evt instanceof IdleStateEvent) {
            final ClientSession session = ctx.channel().attr(ClientSession.SESSION_KEY).get();
            if (session == null || !session.isSubscribed()) {
                log.debug("连接 {} 空闲超时，关闭", ctx.channel().remoteAddress());
                ctx.close();
            }
            return;
        }
        super.userEventTriggered(ctx, evt);
    }

    @Override
    public void channelWritabilityChanged(ChannelHandlerContext ctx) throws Exception {
        if (ctx.channel().isWritable()) {
            final ClientSession session = ctx.channel().attr(ClientSession.SESSION_KEY).get();
            if (session != null) {
                session.scheduleDrain();
            }
        }
        super.channelWritabilityChanged(ctx);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        final ClientSession session = ctx.channel().attr(ClientSession.SESSION_KEY).get();
        if (session != null) {
            broker.removeAll(session, session.getChannels(), session.getPatterns());
            session.clearSubscriptions();
            log.debug("客户端连接 {} 关闭，会话 {}", ctx.channel().remoteAddress(), session.getId());
        }
        super.channelInactive(ctx);
    }
}
