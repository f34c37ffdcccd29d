package ch.so.arp.rag.engine.web;

/**
 * JSON body of every error response.
 */
public record ErrorResponse(String error, String message) {
}
