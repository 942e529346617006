package com.ivamare.ogcapi;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.SpringBootConfiguration;
import org.springframework.boot.autoconfigure.EnableAutoConfiguration;

/**
 * Standalone server. Every component is contributed by {@link OgcApiAutoConfiguration},
 * so there is no component scan.
 */
@SpringBootConfiguration
@EnableAutoConfiguration
public class OgcApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(OgcApiApplication.class, args);
    }
}
