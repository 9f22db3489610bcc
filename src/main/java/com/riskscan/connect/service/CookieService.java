package com.riskscan.connect.service;

import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

@Service
public class CookieService {

    public static final String SESSION_COOKIE = "rs_session";

    @Value("${jwt.expiration:604800000}")
    private long sessionExpirationMillis;

    @Value("${app.cookie.domain:}")
    private String cookieDomain;

    @Value("${app.cookie.secure:true}")
    private boolean secureCookie;

    /**
     * Sets the session cookie naming the connected identity
     */
    public void addSessionCookie(HttpServletResponse response, String sessionToken) {
        response.addCookie(createCookie(SESSION_COOKIE, sessionToken, (int) (sessionExpirationMillis / 1000)));
    }

    public void clearSessionCookie(HttpServletResponse response) {
        response.addCookie(createCookie(SESSION_COOKIE, "", 0));
    }

    private Cookie createCookie(String name, String value, int maxAge) {
        Cookie cookie = new Cookie(name, value);
        cookie.setHttpOnly(true);
        cookie.setSecure(secureCookie);
        cookie.setPath("/");
        cookie.setMaxAge(maxAge);

        // Empty domain means host-only (localhost)
        if (cookieDomain != null && !cookieDomain.isEmpty()) {
            cookie.setDomain(cookieDomain);
        }

        // Lax so the cookie survives the top-level redirect back from the provider
        cookie.setAttribute("SameSite", "Lax");
        return cookie;
    }
}
