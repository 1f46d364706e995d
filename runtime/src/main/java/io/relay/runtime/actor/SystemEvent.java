package io.relay.runtime.actor;

/** A lifecycle message, handled by the actor itself rather than dispatched as a call. */
public interface SystemEvent {}
