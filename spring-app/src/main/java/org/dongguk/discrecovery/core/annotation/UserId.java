package org.dongguk.discrecovery.core.annotation;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * 인증된 사용자의 ID를 컨트롤러 파라미터로 주입한다.
 * required = false 이면 비로그인 요청에서 null 이 주입된다.
 */
@Target(ElementType.PARAMETER)
@Retention(RetentionPolicy.RUNTIME)
public @interface UserId {
    boolean required() default true;
}
