/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.bkmr.lsp.spec;

import io.bkmr.lsp.spec.LspSchema.JsonRpcMessage;

/**
 * One item taken from a transport's inbound stream: a decoded message, a frame that
 * could not be decoded, or the end of the stream.
 */
public sealed interface InboundFrame permits InboundFrame.Message, InboundFrame.Malformed, InboundFrame.EndOfStream {

	InboundFrame END_OF_STREAM = new EndOfStream();

	static InboundFrame of(JsonRpcMessage message) {
		return new Message(message);
	}

	static InboundFrame malformed(LspProtocolException error) {
		return new Malformed(error);
	}

	record Message(JsonRpcMessage message) implements InboundFrame {
	}

	/**
	 * A frame whose header or payload was rejected. The bytes were consumed, so reading
	 * can continue with the next frame.
	 *
	 * @param error why the frame was rejected
	 */
	record Malformed(LspProtocolException error) implements InboundFrame {
	}

	record EndOfStream() implements InboundFrame {
	}

}
