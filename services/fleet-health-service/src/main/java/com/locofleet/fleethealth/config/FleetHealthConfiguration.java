package com.locofleet.fleethealth.config;

import com.locofleet.common.resilience.CallGateway;
import com.locofleet.common.resilience.Sleeper;
import io.fabric8.kubernetes.client.Config;
import io.fabric8.kubernetes.client.ConfigBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Infrastructure beans: orchestrator client, call gateway, HTTP clients and thread pools.
 * Every outbound call made through these beans carries a timeout.
 */
@Slf4j
@Configuration
public class FleetHealthConfiguration {

    private static final int GATEWAY_MAX_THREADS = 64;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Sleeper sleeper() {
        return Sleeper.THREAD_SLEEP;
    }

    @Bean(destroyMethod = "close")
    public KubernetesClient kubernetesClient(FleetMonitorProperties properties) {
        int timeoutMs = (int) properties.getDiscovery().getRequestTimeout().toMillis();
        Config config = new ConfigBuilder(Config.autoConfigure(null))
            .withNamespace(properties.getDiscovery().getNamespace())
            .withRequestTimeout(timeoutMs)
            .withConnectionTimeout(timeoutMs)
            .build();
        log.info("Kubernetes client targeting {} (namespace {})", config.getMasterUrl(), config.getNamespace());
        return new KubernetesClientBuilder().withConfig(config).build();
    }

    /**
     * Process-wide breaker registry. Protected calls run on a bounded pool so the time
     * limiter can abandon hung calls.
     */
    @Bean(destroyMethod = "shutdown")
    public CallGateway callGateway(MeterRegistry meterRegistry, Clock clock, ApplicationEventPublisher eventPublisher) {
        ThreadPoolExecutor executor = new ThreadPoolExecutor(0, GATEWAY_MAX_THREADS, 60L, TimeUnit.SECONDS,
            new SynchronousQueue<>(), new CustomizableThreadFactory("fleet-gateway-"));
        CallGateway gateway = new CallGateway(executor, meterRegistry, clock);
        gateway.addTransitionListener((name, from, to) ->
            eventPublisher.publishEvent(new BreakerStateChangedEvent(gateway, name, from, to)));
        return gateway;
    }

    @Bean(name = "fleetProbeExecutor", destroyMethod = "shutdown")
    public ExecutorService fleetProbeExecutor(FleetMonitorProperties properties) {
        return Executors.newFixedThreadPool(properties.getHealth().getMaxConcurrentProbes(),
            new CustomizableThreadFactory("fleet-probe-"));
    }

    /**
     * Runs cycle bodies and manual recovery requests.
     */
    @Bean(name = "fleetTaskExecutor")
    public ThreadPoolTaskExecutor fleetTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(4);
        executor.setMaxPoolSize(4);
        executor.setQueueCapacity(64);
        executor.setThreadNamePrefix("fleet-task-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }

    /**
     * One thread per cadence so a slow cadence never delays another.
     */
    @Bean(name = "fleetScheduler")
    public ThreadPoolTaskScheduler fleetScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(3);
        scheduler.setThreadNamePrefix("fleet-scheduler-");
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(30);
        return scheduler;
    }

    @Bean(name = "agentRestTemplate")
    public RestTemplate agentRestTemplate(RestTemplateBuilder builder, FleetMonitorProperties properties) {
        return builder
            .setConnectTimeout(properties.getHealth().getRequestTimeout())
            .setReadTimeout(properties.getHealth().getRequestTimeout())
            .build();
    }

    @Bean(name = "connectivityRestTemplate")
    public RestTemplate connectivityRestTemplate(RestTemplateBuilder builder, FleetMonitorProperties properties) {
        return builder
            .setConnectTimeout(properties.getConnectivity().getTimeout())
            .setReadTimeout(properties.getConnectivity().getTimeout())
            .build();
    }
}
