package com.strumbot.model;

/**
 * Twitch category (game) metadata.
 */
public record Game(String id, String name) {
}
