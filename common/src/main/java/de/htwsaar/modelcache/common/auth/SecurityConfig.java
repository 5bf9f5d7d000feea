package de.htwsaar.modelcache.common.auth;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Stellt den {@link AdminAuthFilter} für die Admin-Routen des Caches bereit.
 *
 * <p>Token und Pfadpräfix kommen aus {@value #TOKEN_PROPERTY} und {@value #PREFIX_PROPERTY}.
 * Läuft der Dienst mit dem Standard-Token, wird beim Start gewarnt.</p>
 */
@Configuration
public class SecurityConfig {

    private static final Logger log = LoggerFactory.getLogger(SecurityConfig.class);

    static final String TOKEN_PROPERTY = "modelcache.admin.token";
    static final String PREFIX_PROPERTY = "modelcache.admin.path-prefix";
    static final String DEFAULT_TOKEN = "secret-token";

    private final String adminToken;
    private final String adminPrefix;

    public SecurityConfig(
            @Value("${" + TOKEN_PROPERTY + ":" + DEFAULT_TOKEN + "}") String adminToken,
            @Value("${" + PREFIX_PROPERTY + ":" + AdminAuthFilter.DEFAULT_ADMIN_PREFIX + "}") String adminPrefix) {
        this.adminToken = adminToken;
        this.adminPrefix = adminPrefix;
    }

    @Bean
    public AdminAuthFilter adminAuthFilter() {
        if (DEFAULT_TOKEN.equals(adminToken)) {
            log.warn("Admin routes under {} use the default token; set {}", adminPrefix, TOKEN_PROPERTY);
        }
        return new AdminAuthFilter(adminToken, adminPrefix);
    }
}
