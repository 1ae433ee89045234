package org.dongguk.discrecovery.domain.type;

/**
 * 다른 사용자에게 보여줄 이름 선택
 */
public enum DisplayPreference {
    USERNAME,
    FULL_NAME
}
