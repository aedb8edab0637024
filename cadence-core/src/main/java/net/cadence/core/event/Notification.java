package net.cadence.core.event;

public record Notification(String address, String subject, String body) {}
