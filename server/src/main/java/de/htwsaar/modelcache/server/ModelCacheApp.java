package de.htwsaar.modelcache.server;

import de.htwsaar.modelcache.common.auth.SecurityConfig;
import de.htwsaar.modelcache.common.logging.LoggingConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Import;

@SpringBootApplication
@Import({LoggingConfig.class, SecurityConfig.class})
public class ModelCacheApp {
    public static void main(String[] args) {
        SpringApplication.run(ModelCacheApp.class, args);
    }
}
