package org.dongguk.discrecovery.core.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

@Configuration
@EnableAsync
public class AsyncConfig {

    @Value("${notification.executor.core-pool-size:2}")
    private int corePoolSize;

    @Value("${notification.executor.max-pool-size:4}")
    private int maxPoolSize;

    @Value("${notification.executor.queue-capacity:500}")
    private int queueCapacity;

    /**
     * 알림 발송(인앱 알림 저장 + 푸시) 전용 비동기 실행자.
     * 회수 상태 전이 트랜잭션이 커밋된 뒤에만 작업이 들어온다.
     */
    @Bean(name = "notificationExecutor")
    public ThreadPoolTaskExecutor notificationExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("notification-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);

        // 큐가 가득 차면 알림을 버린다 (요청 스레드를 막지 않음)
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.DiscardOldestPolicy());

        executor.initialize();
        return executor;
    }
}
