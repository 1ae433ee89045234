package org.dongguk.discrecovery.core.constant;

public class AuthConstant {
    public static final String USER_ID_CLAIM_NAME = "uid";
    public static final String BEARER_PREFIX = "Bearer ";
    public static final String AUTHORIZATION_HEADER = "Authorization";
    public static final String ANONYMOUS_USER = "anonymousUser";
    public static final String[] AUTH_WHITELIST = {
            // QR 코드 공개 조회 (로그인 선택)
            "/api/v1/qr-codes/*/lookup",
            "/actuator/health"
    };
    private AuthConstant() {
    }
}
