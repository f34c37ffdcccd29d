package ch.so.arp.rag.engine.web;

import java.util.List;

import jakarta.validation.constraints.NotNull;

public record DeleteRequest(@NotNull List<String> docIds) {
}
