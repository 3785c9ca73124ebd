import config.ServerConfig;
import lombok.extern.slf4j.Slf4j;
import server.RedisServer;

import java.io.IOException;

/**
 * 서버 애플리케이션의 진입점
 */
@Slf4j
public class Main {

    public static void main(String[] args) {
        // 서버 설정 생성
        ServerConfig config = new ServerConfig();

        // 명령행 인수로 설정 오버라이드
        config.parseCommandLineArgs(args);

        try (RedisServer server = new RedisServer(config)) {
            server.start();
        } catch (IOException e) {
            log.error("Failed to start server on {}:{}", config.getHost(), config.getPort(), e);
            System.exit(1);
        }
    }
}
