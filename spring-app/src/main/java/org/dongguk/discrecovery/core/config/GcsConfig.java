package org.dongguk.discrecovery.core.config;

import com.google.cloud.storage.Storage;
import com.google.cloud.storage.StorageOptions;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
public class GcsConfig {

    @Value("${cloud.storage.project-id:}")
    private String projectId;

    @Bean
    public Storage storage() {
        StorageOptions.Builder builder = StorageOptions.newBuilder();
        if (projectId != null && !projectId.isBlank()) {
            builder.setProjectId(projectId);
        } else {
            log.info("cloud.storage.project-id 미설정: 기본 자격 증명의 프로젝트를 사용합니다.");
        }
        return builder.build().getService();
    }
}
