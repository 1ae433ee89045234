package org.dongguk.discrecovery.repository;

import org.dongguk.discrecovery.domain.user.User;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

public interface UserRepository extends JpaRepository<User, Long> {
    // Expo 가 DeviceNotRegistered 를 돌려준 토큰 정리
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update User u set u.pushToken = null where u.id = :userId and u.pushToken = :pushToken")
    int clearPushToken(@Param("userId") Long userId, @Param("pushToken") String pushToken);
}
