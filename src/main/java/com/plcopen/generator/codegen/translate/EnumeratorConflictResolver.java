package com.plcopen.generator.codegen.translate;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.plcopen.generator.codegen.xml.smc.Enumerator;

/**
 * Makes enumeration values pairwise distinct.
 *
 * Members are visited in declaration order. A value that is already taken, including one
 * assigned by an earlier increment, is bumped by one until a free value is found. Order
 * and names are preserved; the result is fully determined by the input order.
 */
public class EnumeratorConflictResolver {

    private static final Logger log = LoggerFactory.getLogger(EnumeratorConflictResolver.class);

    public List<Enumerator> resolve(List<EnumeratorCandidate> candidates) {
        return resolveValues(candidates).stream()
                .map(c -> Enumerator.of(c.getName(), c.getInitialValue()))
                .collect(Collectors.toList());
    }

    /**
     * @throws ArithmeticException if the search runs past {@link Long#MAX_VALUE}
     * @throws NumberFormatException if a conflicting value is not decimal integer text, which
     *         {@link ExpressionValues#enumValue} never produces
     */
    public List<EnumeratorCandidate> resolveValues(List<EnumeratorCandidate> candidates) {
        Set<String> seen = new HashSet<>();
        List<EnumeratorCandidate> resolved = new ArrayList<>(candidates.size());

        for (EnumeratorCandidate candidate : candidates) {
            String value = candidate.getInitialValue();
            if (seen.add(value)) {
                resolved.add(candidate);
                continue;
            }

            long next = Long.parseLong(value.trim());
            String nextValue;
            do {
                next = Math.addExact(next, 1L);
                nextValue = Long.toString(next);
            } while (seen.contains(nextValue));

            seen.add(nextValue);
            log.debug("Enumerator {} value {} already taken, using {}", candidate.getName(), value, nextValue);
            resolved.add(EnumeratorCandidate.of(candidate.getName(), nextValue));
        }
        return resolved;
    }
}
