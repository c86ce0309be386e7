/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.bkmr.lsp.client.transport;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import com.fasterxml.jackson.databind.JsonNode;
import io.bkmr.lsp.StubLspServer;
import io.bkmr.lsp.spec.InboundFrame;
import io.bkmr.lsp.spec.LspSchema;
import io.bkmr.lsp.spec.LspSchema.JsonRpcNotification;
import io.bkmr.lsp.spec.LspSchema.JsonRpcRequest;
import io.bkmr.lsp.spec.LspSchema.JsonRpcResponse;
import io.bkmr.lsp.spec.LspStartupException;
import io.bkmr.lsp.spec.LspTransportException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Process-level tests for {@link StdioClientTransport} against {@link StubLspServer}.
 */
@Timeout(60)
class StdioClientTransportTests {

	private static final Duration TIMEOUT = Duration.ofSeconds(10);

	private StdioClientTransport transport;

	@AfterEach
	void tearDown() {
		if (transport != null) {
			transport.terminate(Duration.ofSeconds(2));
		}
	}

	@Test
	void exchangesFramedMessagesWithTheServer() {
		transport = StdioClientTransport.builder(StubLspServer.parameters("echo").build()).build();
		transport.start();
		assertThat(transport.isAlive()).isTrue();
		assertThat(transport.exitCode()).isEmpty();

		transport.send(new JsonRpcRequest(LspSchema.JSONRPC_VERSION, LspSchema.METHOD_INITIALIZE, 1L, Map.of()));

		InboundFrame first = transport.receive(TIMEOUT);
		InboundFrame second = transport.receive(TIMEOUT);
		assertThat(first).isInstanceOfSatisfying(InboundFrame.Message.class,
				frame -> assertThat(frame.message()).isInstanceOf(JsonRpcNotification.class));
		assertThat(second).isInstanceOfSatisfying(InboundFrame.Message.class, frame -> {
			JsonRpcResponse response = (JsonRpcResponse) frame.message();
			assertThat(response.numericId()).isEqualTo(1L);
			assertThat(((JsonNode) response.result()).has("capabilities")).isTrue();
		});
	}

	@Test
	void untimedReceiveWaitsForTheNextFrame() {
		transport = StdioClientTransport.builder(StubLspServer.parameters("echo").build()).build();
		transport.start();

		transport.send(new JsonRpcRequest(LspSchema.JSONRPC_VERSION, LspSchema.METHOD_SHUTDOWN, 1L, null));
		InboundFrame frame;
		do {
			frame = transport.receive();
		}
		while (frame instanceof InboundFrame.Message message && !(message.message() instanceof JsonRpcResponse));
		assertThat(frame).isInstanceOfSatisfying(InboundFrame.Message.class,
				message -> assertThat(((JsonRpcResponse) message.message()).numericId()).isEqualTo(1L));

		transport.send(new JsonRpcNotification(LspSchema.JSONRPC_VERSION, LspSchema.METHOD_EXIT, null));
		do {
			frame = transport.receive();
		}
		while (frame instanceof InboundFrame.Message);
		assertThat(frame).isInstanceOf(InboundFrame.EndOfStream.class);
		assertThat(transport.receive()).isInstanceOf(InboundFrame.EndOfStream.class);
	}

	@Test
	void receiveReturnsNullWhenNothingArrivesInTime() {
		transport = StdioClientTransport.builder(StubLspServer.parameters("silent").build()).build();
		transport.start();

		assertThat(transport.receive(Duration.ofMillis(200))).isNull();
	}

	@Test
	void serverExitingDuringGracePeriodFailsStartWithItsExitCode() {
		transport = StdioClientTransport.builder(StubLspServer.parameters("exit", "3").build())
			.startupGracePeriod(Duration.ofSeconds(20))
			.build();

		assertThatThrownBy(() -> transport.start()).isInstanceOfSatisfying(LspStartupException.class,
				e -> assertThat(e.getExitCode()).hasValue(3));
		assertThat(transport.isAlive()).isFalse();
	}

	@Test
	void missingExecutableFailsStart() {
		transport = new StdioClientTransport(ServerParameters.builder("/nonexistent/lsp-server-binary").build());
		assertThat(transport.getServerParameters().getCommand()).isEqualTo("/nonexistent/lsp-server-binary");

		assertThatThrownBy(() -> transport.start()).isInstanceOfSatisfying(LspStartupException.class,
				e -> assertThat(e.getExitCode()).isEmpty());
	}

	@Test
	void environmentOverlayReachesTheServer() {
		transport = StdioClientTransport
			.builder(StubLspServer.parameters("echo").addEnvVar("BKMR_DB_URL", "/tmp/stub.db").build())
			.build();
		transport.start();

		transport.send(new JsonRpcRequest(LspSchema.JSONRPC_VERSION, LspSchema.METHOD_WORKSPACE_EXECUTE_COMMAND, 1L,
				new LspSchema.ExecuteCommandParams("x.env", List.of(Map.of("name", "BKMR_DB_URL")))));

		JsonRpcResponse response = nextResponse();
		assertThat(((JsonNode) response.result()).path("value").asText()).isEqualTo("/tmp/stub.db");
	}

	@Test
	void endOfStreamIsStickyAndCarriesTheExitCode() {
		transport = StdioClientTransport.builder(StubLspServer.parameters("echo").build()).build();
		transport.start();

		transport.send(new JsonRpcRequest(LspSchema.JSONRPC_VERSION, LspSchema.METHOD_WORKSPACE_EXECUTE_COMMAND, 1L,
				new LspSchema.ExecuteCommandParams("x.crash", List.of())));

		InboundFrame frame;
		do {
			frame = transport.receive(TIMEOUT);
		}
		while (frame instanceof InboundFrame.Message);
		assertThat(frame).isInstanceOf(InboundFrame.EndOfStream.class);
		assertThat(transport.receive(Duration.ofMillis(10))).isInstanceOf(InboundFrame.EndOfStream.class);
		assertThat(transport.exitCode()).hasValue(7);
	}

	@Test
	void sendingAfterServerDeathIsABrokenPipe() {
		transport = StdioClientTransport.builder(StubLspServer.parameters("echo").build()).build();
		transport.start();
		transport.send(new JsonRpcNotification(LspSchema.JSONRPC_VERSION, LspSchema.METHOD_EXIT, null));
		while (!(transport.receive(TIMEOUT) instanceof InboundFrame.EndOfStream)) {
			// drain until the server is gone
		}

		assertThatThrownBy(() -> transport.send(
				new JsonRpcNotification(LspSchema.JSONRPC_VERSION, LspSchema.METHOD_EXIT, null)))
			.isInstanceOf(LspTransportException.class)
			.hasMessageContaining("Broken pipe");
	}

	@Test
	void terminateStopsTheServerAndIsIdempotent() {
		transport = StdioClientTransport.builder(StubLspServer.parameters("silent").build()).build();
		transport.start();

		transport.terminate(Duration.ofSeconds(2));
		transport.terminate(Duration.ofSeconds(2));

		assertThat(transport.isAlive()).isFalse();
		assertThat(transport.exitCode()).isPresent();
	}

	@Test
	void stderrLinesAreClassifiedAndDelivered() {
		List<DiagnosticLine> lines = new CopyOnWriteArrayList<>();
		transport = StdioClientTransport.builder(StubLspServer.parameters("echo").build())
			.diagnosticsConsumer(lines::add)
			.build();
		transport.start();

		transport.send(new JsonRpcRequest(LspSchema.JSONRPC_VERSION, LspSchema.METHOD_SHUTDOWN, 1L, null));
		nextResponse();
		transport.terminate(Duration.ofSeconds(2));

		assertThat(lines).anySatisfy(line -> {
			assertThat(line.severity()).isEqualTo(DiagnosticLine.Severity.INFO);
			assertThat(line.text()).contains("started in echo mode");
		});
		assertThat(lines).anySatisfy(line -> {
			assertThat(line.text()).contains("Executing shutdown");
			assertThat(line.highlighted()).isTrue();
		});
	}

	@Test
	void diagnosticsStreamReplaysServerOutputAndCompletesOnExit() {
		transport = StdioClientTransport.builder(StubLspServer.parameters("echo").build()).build();
		StepVerifier.create(transport.diagnostics()).expectComplete().verify(TIMEOUT);
		transport.start();

		transport.send(new JsonRpcRequest(LspSchema.JSONRPC_VERSION, LspSchema.METHOD_SHUTDOWN, 1L, null));
		nextResponse();
		transport.send(new JsonRpcNotification(LspSchema.JSONRPC_VERSION, LspSchema.METHOD_EXIT, null));

		StepVerifier.create(transport.diagnostics())
			.recordWith(ArrayList::new)
			.thenConsumeWhile(line -> true)
			.consumeRecordedWith(lines -> {
				assertThat(lines).anySatisfy(line -> {
					assertThat(line.text()).contains("started in echo mode");
					assertThat(line.highlighted()).isFalse();
				});
				assertThat(lines).anySatisfy(line -> {
					assertThat(line.text()).contains("Executing shutdown");
					assertThat(line.highlighted()).isTrue();
				});
			})
			.expectComplete()
			.verify(TIMEOUT);
	}

	private JsonRpcResponse nextResponse() {
		while (true) {
			InboundFrame frame = transport.receive(TIMEOUT);
			assertThat(frame).isInstanceOf(InboundFrame.Message.class);
			if (((InboundFrame.Message) frame).message() instanceof JsonRpcResponse response) {
				return response;
			}
		}
	}

}
