package com.my.offers.config;

import io.quarkus.arc.properties.IfBuildProperty;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import org.sqlite.SQLiteDataSource;

import javax.sql.DataSource;
import java.nio.file.Path;

@ApplicationScoped
public class StateStoreConfig {

    @Produces
    @Singleton
    @IfBuildProperty(name = "app.state.backend", stringValue = "sqlite", enableIfMissing = true)
    public DataSource stateDataSource(AppConfig appConfig) {
        SQLiteDataSource dataSource = new SQLiteDataSource();
        dataSource.setUrl("jdbc:sqlite:" + Path.of(appConfig.state().sqlitePath()).toAbsolutePath());
        return dataSource;
    }
}
