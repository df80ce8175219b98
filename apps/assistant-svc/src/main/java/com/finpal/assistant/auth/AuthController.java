package com.finpal.assistant.auth;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.finpal.assistant.controller.LenientRequestBodyReader;
import com.finpal.assistant.controller.dto.LoginResponseDto;
import com.finpal.assistant.controller.dto.RegisterResponseDto;
import com.finpal.assistant.security.CookieBearerTokenFilter;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseCookie;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class AuthController {

    private final AuthService authService;
    private final LenientRequestBodyReader bodyReader;

    public AuthController(AuthService authService, LenientRequestBodyReader bodyReader) {
        this.authService = authService;
        this.bodyReader = bodyReader;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record LoginRequest(String phone, String password) {}

    @PostMapping(path = "/login", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<LoginResponseDto> login(@RequestBody(required = false) String body, HttpServletRequest httpRequest) {
        LoginRequest request = bodyReader.read(body, LoginRequest.class, () -> new LoginRequest(null, null));
        AuthService.LoginResult result = authService.login(request.phone(), request.password());

        ResponseCookie cookie = ResponseCookie.from(CookieBearerTokenFilter.TOKEN_COOKIE, result.accessToken())
                .httpOnly(true)
                .secure(httpRequest.isSecure())
                .sameSite("Lax")
                .path("/")
                .maxAge(result.expiresIn())
                .build();

        return ResponseEntity.ok()
                .header(HttpHeaders.SET_COOKIE, cookie.toString())
                .body(new LoginResponseDto(
                        true,
                        new LoginResponseDto.UserSummaryDto(result.phone(), result.name()),
                        result.finance(),
                        result.accessToken(),
                        "Bearer",
                        result.expiresIn()
                ));
    }

    @PostMapping(path = "/register", produces = MediaType.APPLICATION_JSON_VALUE)
    public RegisterResponseDto register(@RequestBody(required = false) String body) {
        authService.register(bodyReader.readObject(body));
        return new RegisterResponseDto(true, "Registered successfully");
    }
}
