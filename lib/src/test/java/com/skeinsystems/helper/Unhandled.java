package com.skeinsystems.helper;

import com.skeinsystems.message.Message;

/**
 * Message type no test component registers a handler for.
 */
public record Unhandled() implements Message {
}
