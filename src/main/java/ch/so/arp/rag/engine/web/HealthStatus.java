package ch.so.arp.rag.engine.web;

public record HealthStatus(String status, String backend, int indexes) {
}
