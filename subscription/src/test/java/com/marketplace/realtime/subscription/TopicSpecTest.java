package com.marketplace.realtime.subscription;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.marketplace.realtime.connection.ChangeFilter;
import org.junit.jupiter.api.Test;

class TopicSpecTest {

    @Test
    void equalSpecsShareFingerprint() {
        TopicSpec a = TopicSpec.of("orders", ChangeFilter.builder().table("orders").filter("status=eq.paid").build());
        TopicSpec b = TopicSpec.of("orders", ChangeFilter.builder().table("orders").filter("status=eq.paid").build());

        assertThat(a).isEqualTo(b).hasSameHashCodeAs(b);
        assertThat(a.fingerprint()).isEqualTo(b.fingerprint()).matches("[0-9a-z]+");
    }

    @Test
    void filterIsPartOfTheIdentity() {
        TopicSpec orders = TopicSpec.of("orders", ChangeFilter.table("orders"));
        TopicSpec everything = TopicSpec.channel("orders");

        assertThat(orders).isNotEqualTo(everything);
        assertThat(orders.fingerprint()).isNotEqualTo(everything.fingerprint());
    }

    @Test
    void subscriptionIdEmbedsConsumerAndFingerprint() {
        TopicSpec spec = TopicSpec.channel("orders");

        assertThat(new SubscriptionKey("alice", spec).baseId()).isEqualTo("sub_alice_" + spec.fingerprint());
    }

    @Test
    void rejectsBlankChannel() {
        assertThatThrownBy(() -> TopicSpec.channel(" "))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> TopicSpec.of("orders", null))
                .isInstanceOf(NullPointerException.class);
    }
}
