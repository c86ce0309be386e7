/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.bkmr.lsp.spec;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import io.bkmr.lsp.MockLspClientTransport;
import io.bkmr.lsp.spec.LspSchema.JsonRpcNotification;
import io.bkmr.lsp.spec.LspSchema.JsonRpcRequest;
import io.bkmr.lsp.spec.LspSchema.JsonRpcResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static io.bkmr.lsp.MockLspClientTransport.errorResponse;
import static io.bkmr.lsp.MockLspClientTransport.notification;
import static io.bkmr.lsp.MockLspClientTransport.response;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Test suite for {@link LspRequestCorrelator} that verifies id allocation, response
 * matching amid interleaved traffic, timeouts and the handling of a dying server.
 */
class LspRequestCorrelatorTests {

	private static final Duration TIMEOUT = Duration.ofSeconds(2);

	private final List<JsonRpcNotification> notifications = new CopyOnWriteArrayList<>();

	private MockLspClientTransport transport;

	private LspRequestCorrelator correlator;

	@BeforeEach
	void setUp() {
		transport = MockLspClientTransport.answering(Map.of("ok", true));
		transport.start();
		correlator = new LspRequestCorrelator(transport, notifications::add);
	}

	@Test
	void returnsTheMatchingResponse() {
		JsonRpcResponse response = correlator.sendRequest("workspace/executeCommand", Map.of("command", "x.test"),
				TIMEOUT);

		JsonRpcRequest sent = transport.getLastSentMessageAsRequest();
		assertThat(sent.method()).isEqualTo("workspace/executeCommand");
		assertThat(response.id()).isEqualTo(sent.id());
		assertThat(response.result()).isEqualTo(Map.of("ok", true));
		assertThat(correlator.getPendingCount()).isZero();
	}

	@Test
	void idsAreStrictlyIncreasingAndStartAtOne() {
		List<Long> ids = new ArrayList<>();
		for (int i = 0; i < 10; i++) {
			correlator.sendRequest("test.method", null, TIMEOUT);
			ids.add((Long) transport.getLastSentMessageAsRequest().id());
		}

		assertThat(ids.get(0)).isEqualTo(1L);
		assertThat(ids).isSorted().doesNotHaveDuplicates().hasSize(10);
	}

	@Test
	void routesInterleavedNotificationsAndMatchesById() {
		transport = new MockLspClientTransport((message, t) -> {
			if (message instanceof JsonRpcRequest request && request.method().equals("first")) {
				t.simulateIncomingMessage(notification("window/logMessage", Map.of("type", 3, "message", "a")));
				t.simulateIncomingMessage(response(999L, "not mine"));
				t.simulateIncomingMessage(notification("window/logMessage", Map.of("type", 3, "message", "b")));
				t.simulateIncomingMessage(response(request.id(), "first result"));
				t.simulateIncomingMessage(notification("window/logMessage", Map.of("type", 3, "message", "c")));
			}
			else if (message instanceof JsonRpcRequest request) {
				t.simulateIncomingMessage(response(request.id(), "second result"));
			}
		});
		transport.start();
		correlator = new LspRequestCorrelator(transport, notifications::add);

		JsonRpcResponse first = correlator.sendRequest("first", null, TIMEOUT);
		assertThat(first.result()).isEqualTo("first result");
		assertThat(messages()).containsExactly("a", "b");

		JsonRpcResponse second = correlator.sendRequest("second", null, TIMEOUT);
		assertThat(second.result()).isEqualTo("second result");
		assertThat(messages()).containsExactly("a", "b", "c");
	}

	@Test
	void timesOutNoEarlierThanTheTimeoutAndDropsTheLateResponse() {
		transport = new MockLspClientTransport();
		transport.start();
		correlator = new LspRequestCorrelator(transport, notifications::add);
		Duration timeout = Duration.ofMillis(300);

		long start = System.nanoTime();
		assertThatThrownBy(() -> correlator.sendRequest("slow", null, timeout))
			.isInstanceOfSatisfying(LspTimeoutException.class, e -> {
				assertThat(e.getMethod()).isEqualTo("slow");
				assertThat(e.getRequestId()).isEqualTo(1L);
				assertThat(e.getTimeout()).isEqualTo(timeout);
			});
		Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
		assertThat(elapsed).isGreaterThanOrEqualTo(timeout).isLessThan(timeout.plusSeconds(1));
		assertThat(correlator.getPendingCount()).isZero();

		// the abandoned request's answer arrives late, right before the next one's
		transport.simulateIncomingMessage(response(1L, "late"));
		transport.simulateIncomingMessage(response(2L, "fresh"));

		JsonRpcResponse next = correlator.sendRequest("fast", null, TIMEOUT);
		assertThat(next.result()).isEqualTo("fresh");
	}

	@Test
	void onlyTheMostRecentAbandonedRequestsAreRemembered() {
		transport = new MockLspClientTransport();
		transport.start();
		correlator = new LspRequestCorrelator(transport, notifications::add);
		int abandoned = LspRequestCorrelator.MAX_ABANDONED_REQUESTS + 50;

		for (int i = 0; i < abandoned; i++) {
			assertThatThrownBy(() -> correlator.sendRequest("slow", null, Duration.ofMillis(1)))
				.isInstanceOf(LspTimeoutException.class);
		}
		assertThat(correlator.getAbandonedCount()).isEqualTo(LspRequestCorrelator.MAX_ABANDONED_REQUESTS);

		// the newest abandoned id is still recognized, the oldest is already forgotten
		transport.simulateIncomingMessage(response((long) abandoned, "late"));
		transport.simulateIncomingMessage(response(1L, "very late"));
		transport.simulateIncomingMessage(response((long) abandoned + 1, "fresh"));

		assertThat(correlator.sendRequest("fast", null, TIMEOUT).result()).isEqualTo("fresh");
		assertThat(correlator.getAbandonedCount()).isEqualTo(LspRequestCorrelator.MAX_ABANDONED_REQUESTS - 1);
	}

	@Test
	void endOfStreamWhileWaitingMeansTheServerDied() {
		transport = new MockLspClientTransport((message, t) -> t.simulateServerExit(101));
		transport.start();
		correlator = new LspRequestCorrelator(transport, notifications::add);

		assertThatThrownBy(() -> correlator.sendRequest("workspace/executeCommand", null, TIMEOUT))
			.isInstanceOfSatisfying(LspServerDiedException.class, e -> {
				assertThat(e.getMethod()).isEqualTo("workspace/executeCommand");
				assertThat(e.getExitCode()).hasValue(101);
			});
	}

	@Test
	void malformedFrameSurfacesAndTheSessionCanContinue() {
		transport = new MockLspClientTransport((message, t) -> {
			if (message instanceof JsonRpcRequest request && request.method().equals("broken")) {
				t.simulateMalformedFrame("Malformed JSON payload: {oops");
				t.simulateIncomingMessage(response(request.id(), "too late"));
			}
			else if (message instanceof JsonRpcRequest request) {
				t.simulateIncomingMessage(response(request.id(), "fine"));
			}
		});
		transport.start();
		correlator = new LspRequestCorrelator(transport, notifications::add);

		assertThatThrownBy(() -> correlator.sendRequest("broken", null, TIMEOUT))
			.isInstanceOf(LspProtocolException.class)
			.hasMessageContaining("oops");

		assertThat(correlator.sendRequest("next", null, TIMEOUT).result()).isEqualTo("fine");
	}

	@Test
	void repeatedResponseForAnAnsweredRequestIsDropped() {
		transport = new MockLspClientTransport((message, t) -> {
			if (message instanceof JsonRpcRequest request) {
				t.simulateIncomingMessage(response(request.id(), "once"));
				t.simulateIncomingMessage(response(request.id(), "twice"));
			}
		});
		transport.start();
		correlator = new LspRequestCorrelator(transport, notifications::add);

		assertThat(correlator.sendRequest("a", null, TIMEOUT).result()).isEqualTo("once");
		assertThat(correlator.sendRequest("b", null, TIMEOUT).result()).isEqualTo("once");
	}

	@Test
	void errorResponsesAreReturnedToTheCaller() {
		transport = new MockLspClientTransport((message, t) -> {
			if (message instanceof JsonRpcRequest request) {
				t.simulateIncomingMessage(errorResponse(request.id(), LspSchema.ErrorCodes.INVALID_PARAMS, "bad"));
			}
		});
		transport.start();
		correlator = new LspRequestCorrelator(transport, notifications::add);

		JsonRpcResponse response = correlator.sendRequest("x", null, TIMEOUT);

		assertThat(response.result()).isNull();
		assertThat(response.error().code()).isEqualTo(LspSchema.ErrorCodes.INVALID_PARAMS);
	}

	@Test
	void serverRequestsAreAnsweredWithMethodNotFoundByDefault() {
		transport = new MockLspClientTransport((message, t) -> {
			if (message instanceof JsonRpcRequest request && request.method().equals("x")) {
				t.simulateIncomingMessage(
						new JsonRpcRequest(LspSchema.JSONRPC_VERSION, "workspace/configuration", "srv-1", null));
				t.simulateIncomingMessage(response(request.id(), "done"));
			}
		});
		transport.start();
		correlator = new LspRequestCorrelator(transport, notifications::add);

		assertThat(correlator.sendRequest("x", null, TIMEOUT).result()).isEqualTo("done");

		JsonRpcResponse reply = transport.getSentMessages()
			.stream()
			.filter(JsonRpcResponse.class::isInstance)
			.map(JsonRpcResponse.class::cast)
			.findFirst()
			.orElseThrow();
		assertThat(reply.id()).isEqualTo("srv-1");
		assertThat(reply.error().code()).isEqualTo(LspSchema.ErrorCodes.METHOD_NOT_FOUND);
		assertThat(notifications).isEmpty();
	}

	@Test
	void serverRequestsAreAnsweredByTheConfiguredHandler() {
		transport = new MockLspClientTransport((message, t) -> {
			if (message instanceof JsonRpcRequest request && request.method().equals("x")) {
				t.simulateIncomingMessage(
						new JsonRpcRequest(LspSchema.JSONRPC_VERSION, "workspace/configuration", 77L, null));
				t.simulateIncomingMessage(response(request.id(), "done"));
			}
		});
		transport.start();
		correlator = new LspRequestCorrelator(transport, RequestIdGenerator.ofIncremental(), notifications::add,
				request -> List.of(Map.of("snippets", true)));

		correlator.sendRequest("x", null, TIMEOUT);

		JsonRpcResponse reply = (JsonRpcResponse) transport.getSentMessages().get(1);
		assertThat(reply.id()).isEqualTo(77L);
		assertThat(reply.error()).isNull();
		assertThat(reply.result()).isEqualTo(List.of(Map.of("snippets", true)));
	}

	@Test
	void failingNotificationSinkDoesNotDisturbCorrelation() {
		transport = new MockLspClientTransport((message, t) -> {
			if (message instanceof JsonRpcRequest request) {
				t.simulateIncomingMessage(notification("window/logMessage", Map.of("type", 1, "message", "x")));
				t.simulateIncomingMessage(response(request.id(), "still fine"));
			}
		});
		transport.start();
		correlator = new LspRequestCorrelator(transport, notification -> {
			throw new IllegalStateException("sink failure");
		});

		assertThat(correlator.sendRequest("x", null, TIMEOUT).result()).isEqualTo("still fine");
	}

	@Test
	void notificationsCarryNoId() {
		correlator.sendNotification("initialized", Map.of());

		JsonRpcNotification sent = transport.getLastSentMessageAsNotification();
		assertThat(sent.method()).isEqualTo("initialized");
		assertThat(sent.params()).isEqualTo(Map.of());
	}

	@Test
	void sendingToADeadServerIsATransportError() {
		transport.simulateServerExit(1);

		assertThatThrownBy(() -> correlator.sendNotification("exit", null)).isInstanceOf(LspTransportException.class);
		assertThatThrownBy(() -> correlator.sendRequest("shutdown", null, TIMEOUT))
			.isInstanceOf(LspTransportException.class);
		assertThat(correlator.getPendingCount()).isZero();
	}

	private List<String> messages() {
		return notifications.stream().map(n -> ((Map<?, ?>) n.params()).get("message").toString()).toList();
	}

}
