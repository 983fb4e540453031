package com.github.salilvnair.toolhub.engine.dispatch;

import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * One bounded worker pool per service. A backend whose handlers hang only exhausts its own
 * threads; tools of other services keep running on theirs.
 */
@Slf4j
public class ServiceWorkerPools implements AutoCloseable {

    private final int threadsPerService;
    private final Map<String, ExecutorService> pools = new ConcurrentHashMap<>();
    private volatile boolean closed;

    public ServiceWorkerPools(int threadsPerService) {
        this.threadsPerService = Math.max(threadsPerService, 1);
    }

    public ExecutorService forService(String serviceId) {
        if (closed) {
            throw new IllegalStateException("Worker pools are shut down");
        }
        return pools.computeIfAbsent(serviceId, id -> {
            log.debug("Creating worker pool service={} threads={}", id, threadsPerService);
            return Executors.newFixedThreadPool(threadsPerService,
                    new CustomizableThreadFactory("toolhub-" + id + "-"));
        });
    }

    @Override
    public void close() {
        closed = true;
        pools.values().forEach(ExecutorService::shutdownNow);
        pools.clear();
    }
}
