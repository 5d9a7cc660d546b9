/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.wellcast.web;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class WellCastApplication {
    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(WellCastApplication.class);
        app.setRegisterShutdownHook(true); // ContextClosedEvent on JVM shutdown drives the teardown
        app.run(args);
    }
}
