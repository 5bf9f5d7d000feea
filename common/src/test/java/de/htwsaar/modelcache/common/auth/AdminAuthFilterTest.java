package de.htwsaar.modelcache.common.auth;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import jakarta.servlet.ServletException;
import java.io.IOException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

class AdminAuthFilterTest {

    private final AdminAuthFilter filter = new AdminAuthFilter("s3cret");

    private static MockHttpServletRequest request(String uri) {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", uri);
        request.setRequestURI(uri);
        return request;
    }

    @Test
    void publicRoutesPassWithoutToken() throws ServletException, IOException {
        MockHttpServletResponse response = new MockHttpServletResponse();
        AtomicBoolean passed = new AtomicBoolean();

        filter.doFilter(request("/api/cache/models/bert"), response, (req, resp) -> passed.set(true));

        assertTrue(passed.get());
        assertEquals(200, response.getStatus());
    }

    @Test
    void adminRouteWithoutTokenIsUnauthorized() throws ServletException, IOException {
        MockHttpServletResponse response = new MockHttpServletResponse();
        AtomicBoolean passed = new AtomicBoolean();

        filter.doFilter(request("/api/cache/admin/stats"), response, (req, resp) -> passed.set(true));

        assertFalse(passed.get());
        assertEquals(401, response.getStatus());
    }

    @Test
    void adminRouteWithWrongTokenIsForbidden() throws ServletException, IOException {
        MockHttpServletRequest request = request("/api/cache/admin/config");
        request.addHeader(AdminAuthFilter.AUTH_HEADER, "guess");
        MockHttpServletResponse response = new MockHttpServletResponse();

        filter.doFilter(request, response, (req, resp) -> {});

        assertEquals(403, response.getStatus());
    }

    @Test
    void adminRouteWithValidTokenPasses() throws ServletException, IOException {
        MockHttpServletRequest request = request("/api/cache/admin/all");
        request.addHeader(AdminAuthFilter.AUTH_HEADER, "s3cret");
        AtomicBoolean passed = new AtomicBoolean();

        filter.doFilter(request, new MockHttpServletResponse(), (req, resp) -> passed.set(true));

        assertTrue(passed.get());
    }

    @Test
    void modelIdsContainingAnAdminSegmentStayPublic() throws ServletException, IOException {
        for (String uri : new String[] {"/api/cache/models/org/admin/x", "/api/cache/models/admin", "/api/cache/administration"}) {
            MockHttpServletRequest request = request(uri);
            request.setMethod("PUT");
            MockHttpServletResponse response = new MockHttpServletResponse();
            AtomicBoolean passed = new AtomicBoolean();

            filter.doFilter(request, response, (req, resp) -> passed.set(true));

            assertTrue(passed.get(), uri);
            assertEquals(200, response.getStatus(), uri);
        }
    }

    @Test
    void adminPrefixItselfAndContextPathAreRecognised() throws ServletException, IOException {
        MockHttpServletResponse bare = new MockHttpServletResponse();
        filter.doFilter(request("/api/cache/admin"), bare, (req, resp) -> {});
        assertEquals(401, bare.getStatus());

        MockHttpServletRequest withContext = request("/cdn/api/cache/admin/stats");
        withContext.setContextPath("/cdn");
        MockHttpServletResponse response = new MockHttpServletResponse();
        filter.doFilter(withContext, response, (req, resp) -> {});
        assertEquals(401, response.getStatus());
    }

    @Test
    void customPrefixIsHonoured() throws ServletException, IOException {
        AdminAuthFilter custom = new AdminAuthFilter("s3cret", "/ops");
        AtomicBoolean passed = new AtomicBoolean();

        custom.doFilter(request("/api/cache/admin/stats"), new MockHttpServletResponse(), (req, resp) -> passed.set(true));
        MockHttpServletResponse response = new MockHttpServletResponse();
        custom.doFilter(request("/ops/stats"), response, (req, resp) -> {});

        assertTrue(passed.get());
        assertEquals(401, response.getStatus());
        assertThrows(IllegalArgumentException.class, () -> new AdminAuthFilter("s3cret", "/ops/"));
    }

    @Test
    void blankTokenIsRejectedAtConstruction() {
        assertThrows(IllegalArgumentException.class, () -> new AdminAuthFilter("  "));
    }
}
