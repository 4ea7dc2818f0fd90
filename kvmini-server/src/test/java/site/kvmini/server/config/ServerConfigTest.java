package site.kvmini.server.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import site.kvmini.aof.writer.AofSyncPolicy;
import site.kvmini.persistence.PersistenceOptions;

import java.io.File;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("服务器配置测试")
class ServerConfigTest {

    @Test
    @DisplayName("缺省配置")
    void testDefaults() {
        final ServerConfig config = ServerConfig.fromProperties(new Properties());
        assertEquals("127.0.0.1", config.getHost());
        assertEquals(6379, config.getPort());
        assertTrue(config.isAofEnabled());
        assertEquals(AofSyncPolicy.EVERYSEC, config.getSyncPolicy());
        assertEquals(64L * 1024 * 1024, config.getAofRewriteMinSize());
        assertTrue(config.isAofUseRdbPreamble());
        assertEquals(10, config.getHz());
        config.validate();
    }

    @Test
    @DisplayName("读取 redis.conf 风格的键")
    void testFromProperties() {
        final Properties props = new Properties();
        props.setProperty("port", "7000");
        props.setProperty("dir", "/tmp/kv");
        props.setProperty("appendonly", "no");
        props.setProperty("appendfsync", "always");
        props.setProperty("auto-aof-rewrite-min-size", "16mb");
        props.setProperty("proto-max-bulk-len", "1gb");
        props.setProperty("rdb-enabled", "yes");
        props.setProperty("dbfilename", "snap.rdb");
        props.setProperty("timeout", "30");
        props.setProperty("client-output-buffer-limit-pubsub", "10");
        props.setProperty("aof-use-rdb-preamble", "no");

        final ServerConfig config = ServerConfig.fromProperties(props);
        assertEquals(7000, config.getPort());
        assertFalse(config.isAofEnabled());
        assertEquals(AofSyncPolicy.ALWAYS, config.getSyncPolicy());
        assertEquals(16L * 1024 * 1024, config.getAofRewriteMinSize());
        assertEquals(1024L * 1024 * 1024, config.getMaxBulkLen());
        assertEquals(30, config.getTimeoutSeconds());
        assertEquals(10, config.getPubsubOutputLimit());

        final PersistenceOptions options = config.toPersistenceOptions();
        assertFalse(options.isAofEnabled());
        assertFalse(options.isAofUseRdbPreamble());
        assertEquals(new File("/tmp/kv", "snap.rdb"), options.rdbFile());
    }

    @Test
    @DisplayName("fsync 策略别名")
    void testSyncAliases() {
        final Properties props = new Properties();
        props.setProperty("appendfsync", "never");
        assertEquals(AofSyncPolicy.NO, ServerConfig.fromProperties(props).getSyncPolicy());
        props.setProperty("appendfsync", "interval");
        assertEquals(AofSyncPolicy.EVERYSEC, ServerConfig.fromProperties(props).getSyncPolicy());
    }

    @Test
    @DisplayName("大小单位")
    void testParseSize() {
        assertEquals(100, ServerConfig.parseSize("100"));
        assertEquals(2048, ServerConfig.parseSize("2kb"));
        assertEquals(3L * 1024 * 1024, ServerConfig.parseSize("3MB"));
        assertThrows(IllegalArgumentException.class, () -> ServerConfig.parseSize("abc"));
    }

    @Test
    @DisplayName("非法取值")
    void testInvalid() {
        final Properties props = new Properties();
        props.setProperty("appendonly", "maybe");
        assertThrows(IllegalArgumentException.class, () -> ServerConfig.fromProperties(props));

        assertThrows(IllegalArgumentException.class, () -> ServerConfig.builder().port(70000).build().validate());
        assertThrows(IllegalArgumentException.class, () -> ServerConfig.builder().hz(0).build().validate());
        assertThrows(IllegalArgumentException.class,
                () -> ServerConfig.builder().aofEnabled(true).aofFileName(" ").build().validate());
    }
}
