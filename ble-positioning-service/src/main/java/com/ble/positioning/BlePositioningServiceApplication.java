package com.ble.positioning;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * BLE positioning service: turns gateway RSSI readings into smoothed beacon positions and zone
 * alerts.
 */
@SpringBootApplication
@EnableScheduling
@ConfigurationPropertiesScan
public class BlePositioningServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(BlePositioningServiceApplication.class, args);
    }
}
