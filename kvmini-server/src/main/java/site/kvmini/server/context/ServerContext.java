package site.kvmini.server.context;

import lombok.Getter;
import site.kvmini.database.Keyspace;
import site.kvmini.persistence.PersistenceManager;
import site.kvmini.pubsub.PubSubBroker;

/**
 * 命令执行需要的服务端共享组件。
 *
 * @author hnfy258
 * @since 1.0
 */
@Getter
public class ServerContext {

    private final Keyspace keyspace;

    private final PubSubBroker broker;

    private final PersistenceManager persistence;

    public ServerContext(Keyspace keyspace, PubSubBroker broker, PersistenceManager persistence) {
        if (keyspace == null || broker == null || persistence == null) {
            throw new IllegalArgumentException("键空间、发布订阅和持久化组件都不能为null");
        }
        this.keyspace = keyspace;
        this.broker = broker;
        this.persistence = persistence;
    }
}
