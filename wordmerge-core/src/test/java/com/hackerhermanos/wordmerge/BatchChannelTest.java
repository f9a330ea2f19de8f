package com.hackerhermanos.wordmerge;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.Set;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

@DisplayName("BatchChannel Tests")
class BatchChannelTest {

	private static LineBatch batch(String... lines) {
		return new LineBatch(Path.of("input.txt"), Set.of(lines), 0);
	}

	@Test
	@DisplayName("Should deliver batches in order and end after close")
	void shouldDeliverInOrder() throws InterruptedException {
		BatchChannel channel = new BatchChannel(4);
		LineBatch first = batch("a");
		LineBatch second = batch("b");

		channel.send(first);
		channel.send(second);
		assertThat(channel.close(1, TimeUnit.SECONDS)).isTrue();

		assertThat(channel.receive()).isSameAs(first);
		assertThat(channel.receive()).isSameAs(second);
		assertThat(channel.receive()).isNull();
	}

	@Test
	@DisplayName("Should report a timeout when closing a full channel")
	void shouldTimeOutClosingFullChannel() throws InterruptedException {
		BatchChannel channel = new BatchChannel(1);
		channel.send(batch("a"));

		assertThat(channel.size()).isEqualTo(1);
		assertThat(channel.close(10, TimeUnit.MILLISECONDS)).isFalse();
	}

	@Test
	@DisplayName("Should reject sends after close")
	void shouldRejectSendAfterClose() throws InterruptedException {
		BatchChannel channel = new BatchChannel(2);
		channel.close(1, TimeUnit.SECONDS);

		assertThatThrownBy(() -> channel.send(batch("a"))).isInstanceOf(IllegalStateException.class);
	}

	@Test
	@DisplayName("Should block a producer until the consumer makes room")
	void shouldApplyBackpressure() throws Exception {
		BatchChannel channel = new BatchChannel(1);
		channel.send(batch("a"));
		Thread producer = new Thread(() -> {
			try {
				channel.send(batch("b"));
			}
			catch (InterruptedException e) {
				Thread.currentThread().interrupt();
			}
		});
		producer.start();

		producer.join(200);
		assertThat(producer.isAlive()).isTrue();

		assertThat(channel.receive().lines()).containsExactly("a");
		producer.join(5000);
		assertThat(producer.isAlive()).isFalse();
		assertThat(channel.receive().lines()).containsExactly("b");
	}

	@Test
	@DisplayName("Should reject a non-positive capacity")
	void shouldRejectZeroCapacity() {
		assertThatThrownBy(() -> new BatchChannel(0)).isInstanceOf(IllegalArgumentException.class);
	}

}
