package net.javahippie.workoutlog;

import lombok.extern.slf4j.Slf4j;
import org.apache.hc.client5.http.classic.HttpClient;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.HttpClientBuilder;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.client5.http.io.HttpClientConnectionManager;
import org.apache.hc.core5.util.Timeout;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

/**
 * Main Spring Boot application class for WorkoutLog.
 * WorkoutLog is an offline workout journal backed by a single SQLite file.
 */
@SpringBootApplication
@Slf4j
public class WorkoutLogApplication {

    public static void main(String[] args) {
        SpringApplication.run(WorkoutLogApplication.class, args);
        log.info("WorkoutLog store ready");
    }

    /**
     * REST template for fetching exercise catalogs.
     */
    @Bean
    public RestTemplate restTemplate(@Value("${workoutlog.catalog.timeout-seconds:30}") int timeoutSeconds) {
        Timeout timeout = Timeout.ofSeconds(timeoutSeconds);

        HttpClientConnectionManager connectionManager = PoolingHttpClientConnectionManagerBuilder.create()
            .setDefaultConnectionConfig(ConnectionConfig.custom()
                .setConnectTimeout(timeout)
                .setSocketTimeout(timeout)
                .build())
            .build();

        HttpClient httpClient = HttpClientBuilder.create()
            .setConnectionManager(connectionManager)
            .setDefaultRequestConfig(RequestConfig.custom()
                .setResponseTimeout(timeout)
                .build())
            .build();

        return new RestTemplate(new HttpComponentsClientHttpRequestFactory(httpClient));
    }
}
