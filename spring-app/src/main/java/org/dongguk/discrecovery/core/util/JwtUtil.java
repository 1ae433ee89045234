package org.dongguk.discrecovery.core.util;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.io.Decoders;
import io.jsonwebtoken.security.Keys;
import org.dongguk.discrecovery.core.constant.AuthConstant;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.time.Clock;
import java.util.Date;

/**
 * 토큰 발급은 외부 인증 서버가 담당하며, 이 서비스는 서명 검증과 사용자 ID 추출만 수행한다.
 * generateAccessToken 은 로컬 개발/테스트용.
 */
@Component
public class JwtUtil implements InitializingBean {
    private final Clock clock;

    @Value("${jwt.secret}")
    private String secretKey;

    @Value("${jwt.access-token-expire-period:3600000}")
    private Long accessExpirePeriod;

    private SecretKey key;

    public JwtUtil(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void afterPropertiesSet() {
        this.key = Keys.hmacShaKeyFor(Decoders.BASE64.decode(secretKey));
    }

    public String generateAccessToken(Long userId) {
        long now = clock.millis();
        return Jwts.builder()
                .claim(AuthConstant.USER_ID_CLAIM_NAME, userId)
                .issuedAt(new Date(now))
                .expiration(new Date(now + accessExpirePeriod))
                .signWith(key)
                .compact();
    }

    /**
     * 서명/만료를 검증하고 클레임을 반환한다. 실패 시 JwtException.
     */
    public Claims validateToken(String token) {
        return Jwts.parser()
                .verifyWith(key)
                .clock(() -> new Date(clock.millis()))
                .build()
                .parseSignedClaims(token)
                .getPayload();
    }

    public Long getUserId(Claims claims) {
        return claims.get(AuthConstant.USER_ID_CLAIM_NAME, Long.class);
    }
}
