package com.marketplace.realtime.connection.examples;

import com.marketplace.realtime.connection.ChangeEvent;
import com.marketplace.realtime.connection.ChangeFilter;
import com.marketplace.realtime.connection.ChangeType;
import com.marketplace.realtime.connection.ConnectionManagerConfig;
import com.marketplace.realtime.connection.DefaultConnectionManager;
import com.marketplace.realtime.connection.SubscribeOptions;
import com.marketplace.realtime.connection.Subscription;
import com.marketplace.realtime.connection.memory.InMemoryEventSource;
import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

public class Example {

    public static void main(String[] args) throws InterruptedException {
        ScheduledExecutorService sourceExecutor = Executors.newSingleThreadScheduledExecutor();
        InMemoryEventSource source = new InMemoryEventSource(sourceExecutor);
        ConnectionManagerConfig config = ConnectionManagerConfig.builder()
                .batchDelay(Duration.ofMillis(50))
                .idleGracePeriod(Duration.ofMillis(200))
                .build();

        try (DefaultConnectionManager manager = new DefaultConnectionManager(source, config)) {
            System.out.println("--- Connection Manager Showcase ---");

            System.out.println();
            System.out.println("1. Two subscriptions to one topic share a connection:");
            Subscription inserts = manager.subscribe("listings",
                    ChangeFilter.builder().event(ChangeType.INSERT).table("listings").build(),
                    event -> System.out.println("  inserts got " + event.size() + " event(s) of kind "
                            + event.getEventKind()),
                    SubscribeOptions.builder()
                            .statusListener((topic, status) -> System.out.println("  '" + topic + "' is " + status))
                            .build());
            manager.subscribe("listings", ChangeFilter.builder().filter("category=eq.bikes").build(),
                    event -> System.out.println("  bikes got " + event.size() + " event(s)"),
                    SubscribeOptions.builder().batching(false).build());
            TimeUnit.MILLISECONDS.sleep(50);
            System.out.println("  " + manager.getStats());

            System.out.println();
            System.out.println("2. Publishing three inserts, batched within 50ms:");
            for (int i = 1; i <= 3; i++) {
                source.publish(ChangeEvent.builder("listings", ChangeType.INSERT, "listings")
                        .value("id", i)
                        .value("category", i == 2 ? "bikes" : "books")
                        .build());
            }
            TimeUnit.MILLISECONDS.sleep(100);

            System.out.println();
            System.out.println("3. Unsubscribing one handler, then closing every connection:");
            inserts.unsubscribe();
            manager.cleanup();
            TimeUnit.MILLISECONDS.sleep(50);
            System.out.println("  " + manager.getStats());
        } finally {
            sourceExecutor.shutdownNow();
        }
    }
}
