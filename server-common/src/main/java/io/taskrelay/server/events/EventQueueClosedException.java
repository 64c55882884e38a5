package io.taskrelay.server.events;

/**
 * Thrown by {@link EventQueue#dequeueEvent(int)} once the queue is closed and drained.
 */
public class EventQueueClosedException extends Exception {
}
