package de.htwsaar.modelcache.common.auth;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Schützt die Admin-Routen des Caches (der Pfad {@value #DEFAULT_ADMIN_PREFIX} und alles darunter)
 * mit einem gemeinsamen Token im Header {@value #AUTH_HEADER}. Modell-IDs, die zufällig ein
 * Segment {@code admin} enthalten, bleiben öffentlich.
 *
 * <p>Fehlt der Header, antwortet der Filter mit 401, bei falschem Token mit 403.</p>
 */
public class AdminAuthFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(AdminAuthFilter.class);

    public static final String AUTH_HEADER = "X-Admin-Token";
    public static final String DEFAULT_ADMIN_PREFIX = "/api/cache/admin";

    private final byte[] expectedToken;
    private final String adminPrefix;

    public AdminAuthFilter(String expectedToken) {
        this(expectedToken, DEFAULT_ADMIN_PREFIX);
    }

    /**
     * @param expectedToken erwartetes Token (nicht leer)
     * @param adminPrefix   Pfadpräfix der Admin-Routen ohne abschließenden Slash
     */
    public AdminAuthFilter(String expectedToken, String adminPrefix) {
        Objects.requireNonNull(expectedToken, "expectedToken must not be null");
        Objects.requireNonNull(adminPrefix, "adminPrefix must not be null");
        if (expectedToken.isBlank()) {
            throw new IllegalArgumentException("admin token must not be blank");
        }
        if (!adminPrefix.startsWith("/") || adminPrefix.endsWith("/")) {
            throw new IllegalArgumentException("admin prefix must start and not end with '/': " + adminPrefix);
        }
        this.expectedToken = expectedToken.getBytes(StandardCharsets.UTF_8);
        this.adminPrefix = adminPrefix;
    }

    public String adminPrefix() {
        return adminPrefix;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        if (isAdminRoute(pathWithinApplication(request), adminPrefix)) {
            String providedToken = request.getHeader(AUTH_HEADER);

            if (providedToken == null || providedToken.isBlank()) {
                response.sendError(HttpServletResponse.SC_UNAUTHORIZED, "Missing Admin Token");
                return;
            }

            if (!MessageDigest.isEqual(expectedToken, providedToken.getBytes(StandardCharsets.UTF_8))) {
                log.warn("Rejected admin request to {} with invalid token", request.getRequestURI());
                response.sendError(HttpServletResponse.SC_FORBIDDEN, "Invalid Admin Token");
                return;
            }
        }

        filterChain.doFilter(request, response);
    }

    static boolean isAdminRoute(String path, String adminPrefix) {
        if (path == null || !path.startsWith(adminPrefix)) return false;
        return path.length() == adminPrefix.length() || path.charAt(adminPrefix.length()) == '/';
    }

    private static String pathWithinApplication(HttpServletRequest request) {
        String uri = request.getRequestURI();
        String contextPath = request.getContextPath();
        if (uri != null && contextPath != null && !contextPath.isEmpty() && uri.startsWith(contextPath)) {
            return uri.substring(contextPath.length());
        }
        return uri;
    }
}
