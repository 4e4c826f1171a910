package com.condortrader.execution;

/**
 * Derives the broker order tag from a client order id. Kite accepts alphanumeric tags of
 * at most 20 characters, so separators become 'x' and long ids keep their tail, which
 * holds the order sequence.
 */
public final class OrderTags {

    static final int MAX_LENGTH = 20;

    private OrderTags() {}

    public static String of(String clientOrderId) {
        String tag = clientOrderId.replaceAll("[^A-Za-z0-9]", "x");
        return tag.length() <= MAX_LENGTH ? tag : tag.substring(tag.length() - MAX_LENGTH);
    }
}
