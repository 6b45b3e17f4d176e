package com.haulmarket.arb.config;

import com.haulmarket.arb.infra.Sleeper;
import com.haulmarket.arb.infra.sqlite.MarketCacheDao;
import com.haulmarket.arb.infra.sqlite.OpportunityDao;
import com.haulmarket.arb.infra.sqlite.SqliteConnection;
import com.haulmarket.arb.infra.sqlite.SqliteSchema;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.File;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;

@Slf4j
@Configuration
public class ArbitrageConfig {

    @Bean
    public OkHttpClient marketHttpClient(ArbitrageProperties properties) {
        Duration timeout = properties.getApi().getRequestTimeout();
        return new OkHttpClient.Builder()
                .connectTimeout(timeout)
                .readTimeout(timeout)
                .callTimeout(timeout)
                .retryOnConnectionFailure(true)
                .build();
    }

    @Bean
    public Sleeper sleeper() {
        return Sleeper.SYSTEM;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(destroyMethod = "close")
    public SqliteConnection sqliteConnection(ArbitrageProperties properties) throws SQLException {
        SqliteConnection conn = new SqliteConnection(new File(properties.getCache().getDbPath()));
        SqliteSchema.initialize(conn);
        log.info("Market cache and result store at {}", conn.getDbFile().getAbsolutePath());
        return conn;
    }

    @Bean
    public MarketCacheDao marketCacheDao(SqliteConnection sqliteConnection) {
        return new MarketCacheDao(sqliteConnection);
    }

    @Bean
    public OpportunityDao opportunityDao(SqliteConnection sqliteConnection) {
        return new OpportunityDao(sqliteConnection);
    }
}
