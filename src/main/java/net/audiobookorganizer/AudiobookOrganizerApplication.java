package net.audiobookorganizer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point for the audiobook organizer persistence service.
 *
 * <p>The stores build their own connections, so the default datasource auto-configuration is
 * disabled.
 */
@SpringBootApplication(exclude = {
    org.springframework.boot.jdbc.autoconfigure.DataSourceAutoConfiguration.class,
    org.springframework.boot.jdbc.autoconfigure.DataSourceInitializationAutoConfiguration.class
})
public class AudiobookOrganizerApplication {

    public static void main(String[] args) {
        SpringApplication.run(AudiobookOrganizerApplication.class, args);
    }
}
