package org.dongguk.discrecovery.core.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;

@Configuration
public class ExpoPushConfig {

    @Value("${expo.push.url:https://exp.host/--/api/v2/push}")
    private String expoPushUrl;

    @Bean
    public RestClient expoPushRestClient() {
        return RestClient.builder()
                .baseUrl(expoPushUrl)
                .defaultHeader("Content-Type", MediaType.APPLICATION_JSON_VALUE)
                .defaultHeader("Accept", MediaType.APPLICATION_JSON_VALUE)
                .build();
    }
}
