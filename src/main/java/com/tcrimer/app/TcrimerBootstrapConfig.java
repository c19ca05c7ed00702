package com.tcrimer.app;

import com.tcrimer.app.properties.CacheProperties;
import com.tcrimer.app.properties.DbProperties;
import com.tcrimer.app.properties.PoolProperties;
import com.tcrimer.backtest.BacktestService;
import com.tcrimer.config.Config;
import com.tcrimer.data.CsvHistoryCollector;
import com.tcrimer.db.Backend;
import com.tcrimer.db.PostgresBackend;
import com.tcrimer.db.SqliteBackend;
import com.tcrimer.indicator.IndicatorService;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.context.properties.bind.Bindable;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Lazy;
import org.springframework.core.env.Environment;

import java.nio.file.Path;
import java.time.Clock;
import java.util.Map;

@Configuration
@EnableConfigurationProperties({DbProperties.class, PoolProperties.class, CacheProperties.class})
public class TcrimerBootstrapConfig {
    @Bean
    public Config tcrimerConfig(Environment environment) {
        Map<String, Object> rawProperties = Binder.get(environment)
                .bind("", Bindable.mapOf(String.class, Object.class))
                .orElseGet(Map::of);
        Path workingDir = Path.of(".").toAbsolutePath().normalize();
        return Config.fromConfigurationProperties(workingDir, rawProperties);
    }

    @Bean(destroyMethod = "close")
    @Lazy
    public DataLayer dataLayer(Config config, DbProperties dbProperties, PoolProperties poolProperties,
                               CacheProperties cacheProperties) {
        boolean sqlLog = dbProperties.getSqlLog() != null && dbProperties.getSqlLog().isEnabled();
        DbProperties.Primary primary = dbProperties.getPrimary() == null ? new DbProperties.Primary() : dbProperties.getPrimary();
        Backend primaryBackend = new PostgresBackend(
                DataLayer.firstNonBlank(System.getenv("TCRIMER_DB_URL"), primary.getUrl(), "jdbc:postgresql://localhost:5432/tcrimer"),
                DataLayer.firstNonBlank(System.getenv("TCRIMER_DB_USER"), primary.getUser(), "tcrimer"),
                DataLayer.firstNonBlank(System.getenv("TCRIMER_DB_PASS"), primary.getPass(), "tcrimer"),
                DataLayer.firstNonBlank(primary.getSchema(), "tcrimer"),
                sqlLog);
        String fallbackPath = dbProperties.getFallback() == null ? null : dbProperties.getFallback().getPath();
        Backend fallbackBackend = new SqliteBackend(
                config.workingDir().resolve(DataLayer.firstNonBlank(fallbackPath, "outputs/tcrimer.db")).normalize(),
                sqlLog);
        return DataLayer.open(config, poolProperties.toSettings(), cacheProperties.toSettings(),
                primaryBackend, fallbackBackend, new CsvHistoryCollector(config), Clock.systemUTC(), true);
    }

    @Bean(destroyMethod = "")
    @Lazy
    public BacktestService backtestService(DataLayer dataLayer) {
        return dataLayer.backtests();
    }

    @Bean
    @Lazy
    public IndicatorService indicatorService(DataLayer dataLayer) {
        return dataLayer.indicators();
    }
}
