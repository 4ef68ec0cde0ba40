package org.lupenghan.eazystorage.driver.interfaces;

import org.lupenghan.eazystorage.connection.Settings;

import java.io.IOException;

@FunctionalInterface
public interface DriverFactory {

    Driver create(Settings settings) throws IOException;
}
