package com.authgate.backend.modules.auth.presentation;

import com.authgate.backend.modules.auth.application.AuthService;
import com.authgate.backend.modules.auth.application.AuthService.IssuedSession;
import com.authgate.backend.modules.auth.application.AuthService.RegisteredUser;
import com.authgate.backend.modules.auth.presentation.dto.CurrentUserResponse;
import com.authgate.backend.modules.auth.presentation.dto.LoginResponse;
import com.authgate.backend.modules.auth.presentation.dto.MessageResponse;
import com.authgate.backend.modules.auth.presentation.dto.RegisterResponse;

import com.fasterxml.jackson.databind.JsonNode;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CookieValue;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/auth")
public class AuthController {

    private final AuthService authService;
    private final boolean secureCookie;

    public AuthController(AuthService authService, @Value("${app.auth.cookie-secure:false}") boolean secureCookie) {
        this.authService = authService;
        this.secureCookie = secureCookie;
    }

    @Operation(
            summary = "회원 가입",
            description = """
                    username 은 앞뒤 공백을 제거한 뒤 저장된다. \
                    password 는 6자 이상이어야 하며, 이미 존재하는 username 이면 400 `USERNAME_TAKEN`.
                    """
    )
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "가입 성공"),
            @ApiResponse(responseCode = "400", description = "검증 실패 또는 중복 username")
    })
    @PostMapping("/register")
    public ResponseEntity<RegisterResponse> register(@RequestBody(required = false) JsonNode payload) {
        RegisteredUser user = authService.register(payload);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(new RegisterResponse("Registration successful", user.id(), user.username()));
    }

    @Operation(
            summary = "로그인",
            description = "성공 시 `session` 쿠키(HttpOnly, Path=/)로 세션 토큰을 발급한다."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "로그인 성공"),
            @ApiResponse(responseCode = "400", description = "검증 실패"),
            @ApiResponse(responseCode = "401", description = "username 또는 password 불일치 – `INVALID_CREDENTIALS`")
    })
    @PostMapping("/login")
    public ResponseEntity<LoginResponse> login(@RequestBody(required = false) JsonNode payload) {
        IssuedSession session = authService.login(payload);
        return ResponseEntity.ok()
                .header(HttpHeaders.SET_COOKIE, SessionCookies.issue(session.token(), secureCookie).toString())
                .body(new LoginResponse("Login successful", session.username()));
    }

    @Operation(summary = "로그아웃", description = "세션이 없거나 이미 만료된 경우에도 200 을 반환한다.")
    @PostMapping("/logout")
    public ResponseEntity<MessageResponse> logout(
            @CookieValue(name = SessionCookies.NAME, required = false) String token
    ) {
        authService.logout(token);
        return ResponseEntity.ok()
                .header(HttpHeaders.SET_COOKIE, SessionCookies.clear(secureCookie).toString())
                .body(new MessageResponse("Logout successful"));
    }

    @GetMapping("/me")
    public ResponseEntity<CurrentUserResponse> currentUser(
            @CookieValue(name = SessionCookies.NAME, required = false) String token
    ) {
        return ResponseEntity.ok(authService.currentUser(token));
    }
}
