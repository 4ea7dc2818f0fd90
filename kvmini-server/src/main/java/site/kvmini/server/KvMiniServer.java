package site.kvmini.server;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.ServerChannel;
import io.netty.channel.epoll.Epoll;
import io.netty.channel.epoll.EpollEventLoopGroup;
import io.netty.channel.epoll.EpollServerSocketChannel;
import io.netty.channel.group.ChannelGroup;
import io.netty.channel.group.DefaultChannelGroup;
import io.netty.channel.kqueue.KQueue;
import io.netty.channel.kqueue.KQueueEventLoopGroup;
import io.netty.channel.kqueue.KQueueServerSocketChannel;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.timeout.IdleStateHandler;
import io.netty.util.concurrent.DefaultEventExecutorGroup;
import io.netty.util.concurrent.DefaultThreadFactory;
import io.netty.util.concurrent.EventExecutorGroup;
import io.netty.util.concurrent.GlobalEventExecutor;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import site.kvmini.database.ExpirySweeper;
import site.kvmini.database.Keyspace;
import site.kvmini.persistence.PersistenceManager;
import site.kvmini.protocol.handler.RespDecoder;
import site.kvmini.protocol.handler.RespEncoder;
import site.kvmini.pubsub.PubSubBroker;
import site.kvmini.server.command.executor.CommandDispatcher;
import site.kvmini.server.config.ServerConfig;
import site.kvmini.server.context.ServerContext;
import site.kvmini.server.handler.RespCommandHandler;

import java.net.InetSocketAddress;
import java.util.concurrent.TimeUnit;

/**
 * 基于 Netty 的服务器实现。
 *
 * <p>线程模型：
 * <ul>
 *   <li>boss/worker 事件循环负责网络读写和 RESP 编解码，优先使用 Epoll 或 KQueue</li>
 *   <li>命令在独立的命令执行线程组上运行，键空间锁保证同一时刻只有一条命令在修改数据</li>
 *   <li>回复经会话的出站队列回到连接所在的事件循环写出</li>
 * </ul>
 *
 * <p>启动时先加载 RDB 和 AOF，全部成功后才绑定端口。
 *
 * @author hnfy258
 * @since 1.0
 */
@Slf4j
@Getter
public class KvMiniServer implements KvServer {

    private final ServerConfig config;

    private final Keyspace keyspace;

    private final PubSubBroker broker;

    private final PersistenceManager persistence;

    private final ServerContext context;

    private final CommandDispatcher dispatcher;

    private final ExpirySweeper sweeper;

    private final ChannelGroup clientChannels = new DefaultChannelGroup("kv-clients", GlobalEventExecutor.INSTANCE);

    private Class<? extends ServerChannel> serverChannelClass;

    private EventLoopGroup bossGroup;

    private EventLoopGroup workerGroup;

    private EventExecutorGroup commandExecutor;

    private Channel serverChannel;

    private ShutdownCoordinator shutdownCoordinator;

    public KvMiniServer(ServerConfig config) {
        this(config, new Keyspace());
    }

    public KvMiniServer(ServerConfig config, Keyspace keyspace) {
        config.validate();
        this.config = config;
        this.keyspace = keyspace;
        this.broker = new PubSubBroker();
        this.persistence = new PersistenceManager(keyspace, config.toPersistenceOptions());
        this.context = new ServerContext(keyspace, broker, persistence);
        this.dispatcher = new CommandDispatcher(context);
        this.sweeper = new ExpirySweeper(keyspace, config.getHz());
    }

    @Override
    public void start() throws Exception {
        persistence.load(dispatcher);

        initializeEventLoopGroups();
        commandExecutor = new DefaultEventExecutorGroup(config.getCommandExecutorThreadCount(),
                new DefaultThreadFactory("kv-cmd"));

        final RespEncoder encoder = new RespEncoder();
        final RespCommandHandler commandHandler = new RespCommandHandler(dispatcher, broker,
                config.getPubsubOutputLimit());
        final ServerBootstrap serverBootstrap = new ServerBootstrap();
        serverBootstrap.group(bossGroup, workerGroup)
                .channel(serverChannelClass)
                .option(ChannelOption.SO_BACKLOG, config.getBacklogSize())
                .childOption(ChannelOption.SO_KEEPALIVE, true)
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        clientChannels.add(ch);
                        final ChannelPipeline pipeline = ch.pipeline();
                        if (config.getTimeoutSeconds() > 0) {
                            pipeline.addLast(new IdleStateHandler(0, 0, config.getTimeoutSeconds(), TimeUnit.SECONDS));
                        }
                        pipeline.addLast(RespDecoder.forRequests(config.getMaxBulkLen()));
                        pipeline.addLast(encoder);
                        pipeline.addLast(commandExecutor, commandHandler);
                    }
                });
        try {
            serverChannel = serverBootstrap.bind(config.getHost(), config.getPort()).sync().channel();
        } catch (Exception e) {
            log.error("端口绑定失败 {}:{}", config.getHost(), config.getPort(), e);
            shutdownGroups();
            persistence.shutdown(0);
            throw e;
        }

        sweeper.start();
        persistence.startSnapshotTimer();
        shutdownCoordinator = new ShutdownCoordinator(this);
        log.info("kv-mini 服务器启动于 {}:{}，键数量 {}", config.getHost(), getPort(), keyspace.size());
    }

    /**
     * @return 实际监听的端口，配置为 0 时由系统分配
     */
    public int getPort() {
        if (serverChannel != null && serverChannel.localAddress() instanceof InetSocketAddress) {
            return ((InetSocketAddress) serverChannel.localAddress()).getPort();
        }
        return config.getPort();
    }

    @Override
    public void stop() {
        if (shutdownCoordinator == null) {
            log.warn("服务器尚未启动");
            return;
        }
        shutdownCoordinator.shutdown();
    }

    void shutdownGroups() {
        if (bossGroup != null) {
            bossGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS).syncUninterruptibly();
        }
        if (workerGroup != null) {
            workerGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS).syncUninterruptibly();
        }
        if (commandExecutor != null) {
            commandExecutor.shutdownGracefully(0, 2, TimeUnit.SECONDS).syncUninterruptibly();
        }
    }

    private void initializeEventLoopGroups() {
        final String osName = System.getProperty("os.name").toLowerCase();
        final int workers = config.getWorkerThreadCount();

        if (Epoll.isAvailable()) {
            log.info("使用Epoll EventLoopGroup (操作系统: {})", osName);
            this.bossGroup = new EpollEventLoopGroup(1, new DefaultThreadFactory("epoll-boss"));
            this.workerGroup = new EpollEventLoopGroup(workers, new DefaultThreadFactory("epoll-worker"));
            this.serverChannelClass = EpollServerSocketChannel.class;
        } else if (KQueue.isAvailable()) {
            log.info("使用KQueue EventLoopGroup (操作系统: {})", osName);
            this.bossGroup = new KQueueEventLoopGroup(1, new DefaultThreadFactory("kqueue-boss"));
            this.workerGroup = new KQueueEventLoopGroup(workers, new DefaultThreadFactory("kqueue-worker"));
            this.serverChannelClass = KQueueServerSocketChannel.class;
        } else {
            log.info("使用NIO EventLoopGroup (操作系统: {})", osName);
            this.bossGroup = new NioEventLoopGroup(1, new DefaultThreadFactory("nio-boss"));
            this.workerGroup = new NioEventLoopGroup(workers, new DefaultThreadFactory("nio-worker"));
            this.serverChannelClass = NioServerSocketChannel.class;
        }
    }
}
