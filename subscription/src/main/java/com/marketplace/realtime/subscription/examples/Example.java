package com.marketplace.realtime.subscription.examples;

import com.marketplace.realtime.connection.ChangeEvent;
import com.marketplace.realtime.connection.ChangeFilter;
import com.marketplace.realtime.connection.ChangeType;
import com.marketplace.realtime.connection.memory.InMemoryEventSource;
import com.marketplace.realtime.queue.MessagePriority;
import com.marketplace.realtime.subscription.OptimizedSubscription;
import com.marketplace.realtime.subscription.OptimizerConfig;
import com.marketplace.realtime.subscription.PriorityRules;
import com.marketplace.realtime.subscription.RealtimeContext;
import com.marketplace.realtime.subscription.SubscriptionOptimizer;
import com.marketplace.realtime.subscription.SubscriptionOptions;
import com.marketplace.realtime.subscription.TopicSpec;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

public class Example {

    public static void main(String[] args) throws InterruptedException {
        ScheduledExecutorService sourceExecutor = Executors.newSingleThreadScheduledExecutor();
        InMemoryEventSource source = new InMemoryEventSource(sourceExecutor);
        TopicSpec orders = TopicSpec.of("orders", ChangeFilter.table("orders"));
        PriorityRules rules = PriorityRules.builder()
                .eventKind("DELETE", MessagePriority.HIGH)
                .field("status", "disputed", MessagePriority.HIGH)
                .defaultPriority(MessagePriority.LOW)
                .build();

        try (RealtimeContext context = RealtimeContext.builder(source)
                .optimizerConfig(OptimizerConfig.builder().maxSubscriptionsPerConsumer(2).build())
                .build()) {
            SubscriptionOptimizer optimizer = context.getSubscriptionOptimizer();
            System.out.println("--- Subscription Optimizer Showcase ---");

            System.out.println();
            System.out.println("1. The same consumer subscribing twice is deduplicated:");
            OptimizedSubscription first = optimizer.subscribe("alice", orders,
                    event -> System.out.println("  alice (tab 1) got " + event));
            OptimizedSubscription second = optimizer.subscribe("alice", orders,
                    event -> System.out.println("  alice (tab 2) got " + event));
            System.out.println("  same id: " + first.getSubscriptionId().equals(second.getSubscriptionId())
                    + ", deduplicated: " + second.isDeduplicated());

            System.out.println();
            System.out.println("2. Another consumer joins the group, with priorities:");
            OptimizedSubscription bob = optimizer.subscribe("bob", orders,
                    event -> System.out.println("  bob got " + event.getEventKind()),
                    SubscriptionOptions.withPriority(rules));
            System.out.println("  grouped: " + bob.isGrouped());
            TimeUnit.MILLISECONDS.sleep(100);

            System.out.println();
            System.out.println("3. Publishing an insert and a delete:");
            source.publish(ChangeEvent.builder("orders", ChangeType.INSERT, "orders").value("status", "paid").build());
            source.publish(ChangeEvent.builder("orders", ChangeType.DELETE, "orders").oldValue("id", 7).build());
            TimeUnit.MILLISECONDS.sleep(400);
            System.out.println("  " + optimizer.getStats());

            System.out.println();
            System.out.println("4. Unsubscribing everyone:");
            first.unsubscribe();
            second.unsubscribe();
            bob.unsubscribe();
            System.out.println("  " + optimizer.getStats());
            System.out.println("  " + context.getConnectionManager().getStats());
        } finally {
            sourceExecutor.shutdownNow();
        }
    }
}
