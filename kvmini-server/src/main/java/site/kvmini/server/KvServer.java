package site.kvmini.server;

/**
 * 服务器生命周期接口。
 *
 * @author hnfy258
 * @since 1.0
 */
public interface KvServer {

    /**
     * 加载持久化数据并开始监听。
     *
     * @throws Exception 数据无法加载或端口无法绑定
     */
    void start() throws Exception;

    /**
     * 优雅停止：排空连接，刷写 AOF，保存最终快照，释放线程。
     */
    void stop();
}
