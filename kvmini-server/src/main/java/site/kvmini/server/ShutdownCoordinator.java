package site.kvmini.server;

import io.netty.channel.Channel;
import io.netty.channel.group.ChannelGroup;
import lombok.extern.slf4j.Slf4j;
import site.kvmini.server.session.ClientSession;

import java.io.IOException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 按固定顺序停止服务器，只执行一次。
 *
 * <ol>
 *   <li>关闭监听端口，不再接受新连接</li>
 *   <li>每个连接停止读取，当前命令完成、回复写出后关闭</li>
 *   <li>等待连接关闭，超时后强制关闭剩余连接</li>
 *   <li>停止过期扫描</li>
 *   <li>停止定时快照，刷写 AOF，保存最终快照，关闭 AOF</li>
 *   <li>关闭事件循环和命令执行线程</li>
 * </ol>
 *
 * @author hnfy258
 * @since 1.0
 */
@Slf4j
public class ShutdownCoordinator {

    private final KvMiniServer server;

    private final AtomicBoolean started = new AtomicBoolean(false);

    public ShutdownCoordinator(KvMiniServer server) {
        this.server = server;
    }

    public void shutdown() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        final long timeoutMillis = TimeUnit.SECONDS.toMillis(server.getConfig().getShutdownTimeoutSeconds());
        log.info("开始关闭服务器");

        final Channel serverChannel = server.getServerChannel();
        if (serverChannel != null) {
            serverChannel.close().syncUninterruptibly();
        }

        drainConnections(server.getClientChannels(), timeoutMillis);

        server.getSweeper().close();

        try {
            server.getPersistence().shutdown(timeoutMillis);
        } catch (IOException e) {
            log.error("关闭持久化时出错，数据可能没有完整落盘", e);
        }

        server.shutdownGroups();
        log.info("服务器已关闭");
    }

    private void drainConnections(ChannelGroup channels, long timeoutMillis) {
        for (Channel channel : channels) {
            final ClientSession session = channel.attr(ClientSession.SESSION_KEY).get();
            if (session == null) {
                channel.close();
            } else {
                session.beginDrain();
            }
        }
        final boolean closed = channels.newCloseFuture().awaitUninterruptibly(timeoutMillis);
        if (!closed) {
            log.warn("{} 个连接在 {} ms 内未关闭，强制关闭", channels.size(), timeoutMillis);
            channels.close().awaitUninterruptibly();
        }
    }
}
