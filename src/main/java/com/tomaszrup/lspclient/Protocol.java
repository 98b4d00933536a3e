package com.tomaszrup.lspclient;

/**
 * Method names of the protocol messages the client sends.
 */
public final class Protocol {

	private Protocol() {
	}

	public static final String REQUEST_INITIALIZE = "initialize";
	public static final String REQUEST_COMPLETION = "textDocument/completion";
	public static final String REQUEST_HOVER = "textDocument/hover";

	public static final String NOTIFICATION_INITIALIZED = "initialized";
	public static final String NOTIFICATION_DID_OPEN = "textDocument/didOpen";
	public static final String NOTIFICATION_DID_CHANGE = "textDocument/didChange";

	/** Version sent with {@code didOpen}; later changes carry the caller's version. */
	public static final int INITIAL_DOCUMENT_VERSION = 1;
}
