package com.condortrader.domain.model;

import com.condortrader.domain.enums.OrderIntent;

/**
 * Outstanding order tracked by a Position: which leg it works, in which direction and for
 * how many units.
 */
public record OrderRef(String orderId, String legId, OrderIntent intent, int quantity) {}
