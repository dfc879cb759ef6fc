package io.github.yok.nntpchan.config;

import lombok.Data;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration class that binds the {@code nntp} section of {@code application.yml}: the NNTP
 * server the front-end posts to and reads from, and the optional login pair.
 *
 * <pre>
 * nntp:
 *   server:
 *     host: 127.0.0.1
 *     port: 1129
 *   login:
 *     user: frontend
 *     password: secret
 * </pre>
 *
 * @author Yasuharu.Okawauchi
 */
@ConfigurationProperties(prefix = "nntp")
@Data
public class NntpConfig {

    /**
     * Port of the nntpchan daemon when none is configured.
     */
    public static final int DEFAULT_PORT = 1129;

    private Server server = new Server();

    private Login login = new Login();

    /**
     * Returns whether a complete login pair is configured.
     *
     * @return {@code true} when both user and password are non-blank
     */
    public boolean hasCredentials() {
        return login != null && StringUtils.isNotBlank(login.getUser())
                && StringUtils.isNotBlank(login.getPassword());
    }

    /**
     * Renders the server endpoint as {@code host:port}. IPv6 literals are wrapped in brackets.
     *
     * @return endpoint string
     * @throws IllegalStateException if the host is not configured
     */
    public String toEndpoint() {
        if (server == null || StringUtils.isBlank(server.getHost())) {
            throw new IllegalStateException(
                    "nntp.server.host is not configured. Please set 'nntp.server.host'.");
        }
        String host = server.getHost();
        if (host.indexOf(':') >= 0 && !host.startsWith("[")) {
            host = "[" + host + "]";
        }
        return host + ":" + server.getPort();
    }

    /**
     * NNTP server endpoint.
     */
    @Data
    public static class Server {
        // Host name or IP address of the NNTP server
        private String host = "127.0.0.1";
        // TCP port of the NNTP server
        private int port = DEFAULT_PORT;

        public void setHost(String host) {
            this.host = StringUtils.trim(host);
        }
    }

    /**
     * NNTP login credentials. Both values unset means anonymous access.
     */
    @Data
    public static class Login {
        private String user;
        private String password;

        public void setUser(String user) {
            this.user = StringUtils.trim(user);
        }
    }
}
