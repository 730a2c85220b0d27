package com.starkiller.core.consequence;

/**
 * An item in the officer's news feed.
 *
 * @param day            day the item was published
 * @param headline       headline
 * @param content        body text
 * @param requiresAction whether the item calls for the officer's attention
 * @param source         decision that led to the item
 */
public record NewsEntry(int day, String headline, String content, boolean requiresAction, String source) {}
