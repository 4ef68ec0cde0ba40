package org.lupenghan.eazystorage.connection;

import lombok.extern.slf4j.Slf4j;
import org.lupenghan.eazystorage.driver.interfaces.Driver;
import org.lupenghan.eazystorage.driver.interfaces.DriverFactory;
import org.lupenghan.eazystorage.exceptions.NotFoundException;
import org.lupenghan.eazystorage.table.interfaces.SchemaSnapshotManager;
import org.lupenghan.eazystorage.table.models.Schema;

import java.io.IOException;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 按名称管理连接配置和已建立的连接。驱动按 URL 的 scheme 注册。
 */
@Slf4j
public class ConnectionManager {
    private final Map<String, Settings> definitions = new LinkedHashMap<>();
    private final Map<String, DriverFactory> drivers = new HashMap<>();
    private final Map<String, Connection> connections = new HashMap<>();
    private final SchemaSnapshotManager snapshots;

    public ConnectionManager(SchemaSnapshotManager snapshots) {
        this.snapshots = snapshots;
    }

    public ConnectionManager register(String scheme, DriverFactory factory) {
        drivers.put(scheme, factory);
        return this;
    }

    public ConnectionManager define(String name, Settings settings) {
        definitions.put(name, settings);
        connections.remove(name);
        return this;
    }

    public ConnectionManager define(String name, String url) {
        return define(name, Settings.fromUrl(url));
    }

    public Settings getSettings(String name) {
        Settings settings = definitions.get(name);
        if (settings == null) {
            throw new NotFoundException("Connection " + name + " is not defined");
        }
        return settings;
    }

    public SchemaSnapshotManager getSnapshots() {
        return snapshots;
    }

    /**
     * 返回缓存的连接，第一次调用时建立
     */
    public Connection get(String name) throws IOException {
        Connection connection = connections.get(name);
        if (connection == null) {
            connection = make(name);
            connections.put(name, connection);
        }
        return connection;
    }

    /**
     * 总是建立新连接，不放入缓存
     */
    public Connection make(String name) throws IOException {
        Settings settings = getSettings(name);
        DriverFactory factory = drivers.get(settings.getDriver());
        if (factory == null) {
            throw new NotFoundException("No driver registered for scheme " + settings.getDriver());
        }

        Driver driver = factory.create(settings);
        driver.connect();

        Schema schema = snapshots.exists() ? snapshots.load() : new Schema(settings.getSchema());
        log.info("连接 {} 已建立 (driver={}, schema={})", name, settings.getDriver(), settings.getSchema());
        return new Connection(schema, driver);
    }
}
