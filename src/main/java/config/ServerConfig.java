package config;

import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;

/**
 * 서버 설정을 관리하는 클래스.
 * maxBufferSize, idleTimeoutMillis 의 기본값 0 은 제한 없음을 뜻합니다.
 */
@Slf4j
@Getter
@Setter
public class ServerConfig {
    private String host = "127.0.0.1";
    private int port = 6379;
    private int maxBufferSize = 0;       // 연결당 누적 버퍼 최대 크기 (bytes)
    private int idleTimeoutMillis = 0;   // 읽기 대기 최대 시간

    /**
     * 명령행 인수를 파싱하여 설정을 업데이트합니다.
     */
    public void parseCommandLineArgs(String[] args) {
        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--host":
                    if (i + 1 < args.length) {
                        this.host = args[++i];
                        log.info("Host set from command line: {}", this.host);
                    }
                    break;
                case "--port":
                    if (i + 1 < args.length) {
                        this.port = parseNonNegative(args[++i], "--port", this.port);
                    }
                    break;
                case "--max-buffer-size":
                    if (i + 1 < args.length) {
                        this.maxBufferSize = parseNonNegative(args[++i], "--max-buffer-size", this.maxBufferSize);
                    }
                    break;
                case "--idle-timeout":
                    if (i + 1 < args.length) {
                        this.idleTimeoutMillis = parseNonNegative(args[++i], "--idle-timeout", this.idleTimeoutMillis);
                    }
                    break;
                default:
                    log.warn("Ignoring unknown argument: {}", args[i]);
                    break;
            }
        }
    }

    private static int parseNonNegative(String value, String option, int fallback) {
        try {
            int parsed = Integer.parseInt(value);
            if (parsed < 0) {
                log.error("Invalid value for {}: {}", option, value);
                return fallback;
            }
            log.info("{} set from command line: {}", option, parsed);
            return parsed;
        } catch (NumberFormatException e) {
            log.error("Invalid value for {}: {}", option, value);
            return fallback;
        }
    }

    public boolean hasBufferLimit() {
        return maxBufferSize > 0;
    }
}
