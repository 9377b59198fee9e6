package io.kneo.playqueue.model;

public record PositionId(int position, int id) {
}
