package com.tcrimer.app.properties;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Getter
@Setter
@ConfigurationProperties(prefix = "db")
public class DbProperties {
    private Primary primary = new Primary();
    private Fallback fallback = new Fallback();
    private SqlLog sqlLog = new SqlLog();

    @Getter
    @Setter
    public static class Primary {
        private String url = "jdbc:postgresql://localhost:5432/tcrimer";
        private String user = "tcrimer";
        private String pass = "tcrimer";
        private String schema = "tcrimer";
    }

    @Getter
    @Setter
    public static class Fallback {
        private String path = "outputs/tcrimer.db";
    }

    @Getter
    @Setter
    public static class SqlLog {
        private boolean enabled = false;
    }
}
