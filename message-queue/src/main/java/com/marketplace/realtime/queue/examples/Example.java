package com.marketplace.realtime.queue.examples;

import com.marketplace.realtime.queue.EnqueueOptions;
import com.marketplace.realtime.queue.MessagePriority;
import com.marketplace.realtime.queue.MessageQueueConfig;
import com.marketplace.realtime.queue.OverallQueueStats;
import com.marketplace.realtime.queue.PriorityMessageQueue;
import com.marketplace.realtime.queue.ProcessorOptions;
import com.marketplace.realtime.queue.QueueStats;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

public class Example {

    public static void main(String[] args) throws InterruptedException {
        MessageQueueConfig config = MessageQueueConfig.builder()
                .processingDelay(Duration.ofMillis(10))
                .retryDelay(Duration.ofMillis(50))
                .build();

        try (PriorityMessageQueue queue = new PriorityMessageQueue(config)) {
            System.out.println("--- Priority Message Queue Showcase ---");

            System.out.println();
            System.out.println("1. Enqueueing before a processor exists...");
            queue.enqueue("notifications", "weekly digest", EnqueueOptions.withPriority(MessagePriority.LOW));
            queue.enqueue("notifications", "new message");
            queue.enqueue("notifications", "payment failed", EnqueueOptions.withPriority(MessagePriority.HIGH));

            System.out.println();
            System.out.println("2. Registering a processor, highest priority drains first:");
            queue.setProcessor("notifications", String.class,
                    (payload, metadata) -> System.out.println("  notified: " + payload));
            TimeUnit.MILLISECONDS.sleep(200);

            System.out.println();
            System.out.println("3. A flaky processor is retried with backoff:");
            int[] attempts = {0};
            queue.setProcessor("webhooks", String.class, (payload, metadata) -> {
                attempts[0]++;
                if (attempts[0] < 3) {
                    System.out.println("  attempt " + attempts[0] + " failed");
                    throw new IllegalStateException("endpoint unavailable");
                }
                System.out.println("  attempt " + attempts[0] + " delivered " + payload);
            });
            queue.enqueue("webhooks", "order-created");
            TimeUnit.MILLISECONDS.sleep(400);

            System.out.println();
            System.out.println("4. Batching analytics events:");
            queue.setBatchProcessor("analytics", String.class,
                    (payloads, metadata) -> System.out.println("  batch of " + payloads.size() + ": " + payloads),
                    ProcessorOptions.batched(4, Duration.ofMillis(100)));
            for (int i = 1; i <= 10; i++) {
                queue.enqueue("analytics", "view-" + i);
            }
            TimeUnit.MILLISECONDS.sleep(400);

            System.out.println();
            System.out.println("--- [Statistics] ---");
            OverallQueueStats overall = queue.getOverallStats();
            for (QueueStats stats : overall.getQueues().values()) {
                System.out.printf("%s: processed=%d failed=%d retried=%d mean=%.3fms p95=%.3fms%n",
                        stats.getName(), stats.getProcessedMessages(), stats.getFailedMessages(),
                        stats.getRetriedMessages(), stats.getMeanProcessingTimeMillis(),
                        stats.getP95ProcessingTimeMillis());
            }
            System.out.println(overall);
        }

        System.out.println();
        System.out.println("--- Showcase Complete ---");
    }
}
