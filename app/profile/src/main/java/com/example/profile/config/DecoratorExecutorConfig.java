package com.example.profile.config;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class DecoratorExecutorConfig {

  // 付与情報の並列取得専用。キューが溢れた呼び出しは RejectedExecutionException で劣化扱いにする
  @Bean(destroyMethod = "shutdownNow")
  ExecutorService profileDecoratorExecutor(ProfileDecoratorProperties properties) {
    return new ThreadPoolExecutor(
        properties.poolSize(),
        properties.poolSize(),
        60L,
        TimeUnit.SECONDS,
        new ArrayBlockingQueue<>(properties.queueCapacity()),
        new ThreadFactoryBuilder().setNameFormat("profile-decorator-%d").setDaemon(true).build(),
        new ThreadPoolExecutor.AbortPolicy());
  }
}
