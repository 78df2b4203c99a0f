/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.walterops.tools;

import io.walterops.spec.McpError;
import io.walterops.spec.McpProtocolException;
import io.walterops.spec.WalterDecodeException;
import io.walterops.spec.WalterSchema;
import io.walterops.util.Utils;

/**
 * Rendering helpers shared by the Walter tools.
 */
public final class ToolResults {

	static final String UNEXPECTED_RESPONSE = "Walter returned an unexpected response. Please try again.";

	private ToolResults() {
	}

	/**
	 * Converts an error into a message fit for the agent. Errors reported by the server or
	 * the transport are passed through; malformed payloads and unexpected failures are
	 * internal details and are replaced by a generic message.
	 */
	public static String toUserMessage(Throwable error) {
		if (error instanceof WalterDecodeException || error instanceof McpProtocolException) {
			return UNEXPECTED_RESPONSE;
		}
		if (error instanceof McpError && error.getMessage() != null) {
			return error.getMessage();
		}
		return UNEXPECTED_RESPONSE;
	}

	/**
	 * {@code - <id>: <title> (<last activity>)}, with a green dot for an active chat.
	 */
	static String formatChat(WalterSchema.Chat chat) {
		StringBuilder line = new StringBuilder("- ").append(chat.getId()).append(": ").append(chatTitle(chat));
		if (!Utils.isBlank(chat.getLastActivityAt())) {
			line.append(" (").append(chat.getLastActivityAt()).append(')');
		}
		if ("active".equals(chat.getStatus())) {
			line.append(" 🟢");
		}
		return line.toString();
	}

	/**
	 * {@code <status dot> <label> (<os>) — <type>}
	 */
	static String formatTurf(WalterSchema.Turf turf) {
		StringBuilder line = new StringBuilder();
		line.append("online".equals(turf.getStatus()) ? "🟢" : "⚫").append(' ').append(turfLabel(turf));
		if (!Utils.isBlank(turf.getOs())) {
			line.append(" (").append(turf.getOs()).append(')');
		}
		return line.append(" — ").append(turf.getKind()).toString();
	}

	private static String chatTitle(WalterSchema.Chat chat) {
		if (!Utils.isBlank(chat.getName())) {
			return chat.getName();
		}
		if (!Utils.isBlank(chat.getFirstMessage())) {
			return chat.getFirstMessage();
		}
		return "(untitled)";
	}

	private static String turfLabel(WalterSchema.Turf turf) {
		if (!Utils.isBlank(turf.getName())) {
			return turf.getName();
		}
		if (!Utils.isBlank(turf.getHostname())) {
			return turf.getHostname();
		}
		return turf.getId();
	}

}
