package com.riskscan.connect.controller;

import com.riskscan.connect.config.OAuthClientSettings;
import com.riskscan.connect.dto.ConnectStatusResponse;
import com.riskscan.connect.dto.ConnectionResponse;
import com.riskscan.connect.security.CurrentIdentity;
import com.riskscan.connect.service.AuthorizationFlowService;
import com.riskscan.connect.service.CookieService;
import com.riskscan.connect.service.PkceSessionStore;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.net.URI;

@RestController
@RequestMapping("/api/connect")
public class ConnectController {

    private final AuthorizationFlowService authorizationFlowService;
    private final CookieService cookieService;
    private final OAuthClientSettings settings;
    private final PkceSessionStore sessionStore;

    public ConnectController(AuthorizationFlowService authorizationFlowService,
                             CookieService cookieService,
                             OAuthClientSettings settings,
                             PkceSessionStore sessionStore) {
        this.authorizationFlowService = authorizationFlowService;
        this.cookieService = cookieService;
        this.settings = settings;
        this.sessionStore = sessionStore;
    }

    /**
     * Redirects the browser to the provider's consent page.
     */
    @GetMapping("/login")
    public ResponseEntity<Void> login() {
        String authorizeUrl = authorizationFlowService.beginLogin();
        return ResponseEntity.status(HttpStatus.FOUND).location(URI.create(authorizeUrl)).build();
    }

    /**
     * Provider redirect target. Stores the identity and sets the session cookie.
     */
    @GetMapping("/callback")
    public ResponseEntity<ConnectionResponse> callback(
            @RequestParam(value = "code", required = false) String code,
            @RequestParam(value = "state", required = false) String state,
            @RequestParam(value = "error", required = false) String error,
            @RequestParam(value = "error_description", required = false) String errorDescription,
            HttpServletResponse response) {
        AuthorizationFlowService.ConnectResult result =
                authorizationFlowService.handleCallback(code, state, error, errorDescription);
        cookieService.addSessionCookie(response, result.getSessionToken());
        return ResponseEntity.ok(ConnectionResponse.connected(result.getIdentity()));
    }

    @GetMapping("/status")
    public ResponseEntity<ConnectStatusResponse> status() {
        return ResponseEntity.ok(new ConnectStatusResponse(
                settings.isConfigured(),
                settings.getRedirectUri(),
                settings.getScopes(),
                sessionStore.size(),
                CurrentIdentity.id()));
    }

    @PostMapping("/logout")
    public ResponseEntity<MessageResponse> logout(HttpServletResponse response) {
        cookieService.clearSessionCookie(response);
        return ResponseEntity.ok(new MessageResponse("Disconnected"));
    }

    public static class MessageResponse {
        private final String message;

        public MessageResponse(String message) {
            this.message = message;
        }

        public String getMessage() {
            return message;
        }
    }
}
