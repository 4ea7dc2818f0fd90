package site.kvmini;

import lombok.extern.slf4j.Slf4j;
import site.kvmini.server.KvMiniServer;
import site.kvmini.server.KvServer;
import site.kvmini.server.config.ServerConfig;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * 启动入口。参数为配置文件路径，省略时读取类路径下的 kvmini.properties。
 */
@Slf4j
public class KvServerLauncher {

    private static final String DEFAULT_CONFIG = "kvmini.properties";

    public static void main(String[] args) throws Exception {
        final ServerConfig config = ServerConfig.fromProperties(loadProperties(args));
        final KvServer server = new KvMiniServer(config);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("收到关闭信号，正在关闭服务器...");
            server.stop();
        }, "kv-shutdown"));

        try {
            server.start();
        } catch (Exception e) {
            log.error("服务器启动失败", e);
            System.exit(1);
        }
    }

    private static Properties loadProperties(String[] args) throws IOException {
        final Properties props = new Properties();
        if (args.length > 0) {
            try (InputStream in = new FileInputStream(args[0])) {
                props.load(in);
            }
            log.info("使用配置文件 {}", args[0]);
            return props;
        }
        try (InputStream in = KvServerLauncher.class.getClassLoader().getResourceAsStream(DEFAULT_CONFIG)) {
            if (in != null) {
                props.load(in);
            }
        }
        return props;
    }
}
