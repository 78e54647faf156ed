package com.plcopen.generator.codegen.translate;

import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

import lombok.Value;

/**
 * Run-wide record of {@code orderWithinParamSet} values handed out per POU.
 * Never reset between compilation units. POU names are compared case-insensitively,
 * the same way POU declarations are matched to their bodies.
 */
public class ParameterOrderTracker {

    @Value
    private static class Claim {
        String pouKey;
        long order;
    }

    private final Set<Claim> claims = new HashSet<>();

    /**
     * Claims the first free order at or above {@code startOrder} for the POU.
     *
     * @throws ArithmeticException if the search runs past {@link Long#MAX_VALUE}
     */
    public long claim(String pouName, long startOrder) {
        String pouKey = pouName.toUpperCase(Locale.ROOT);
        long order = startOrder;
        while (claims.contains(new Claim(pouKey, order))) {
            order = Math.addExact(order, 1L);
        }
        claims.add(new Claim(pouKey, order));
        return order;
    }
}
