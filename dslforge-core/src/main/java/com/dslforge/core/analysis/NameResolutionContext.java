package com.dslforge.core.analysis;

import com.dslforge.core.naming.IdentifierRules;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Name bookkeeping owned by a single analysis or repair invocation.
 *
 * <p>Tracks every name already in use so that generated names never collide,
 * and records each rename as {@code new name -> original name} so diagnostics
 * can map generated code back to the source. Nothing here is shared between
 * sessions: two transpile sessions running at once each get their own context
 * and always produce the same names for the same input.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * NameResolutionContext context = NameResolutionContext.of(List.of("d"));
 * context.allocate("d");           // "d_2"
 * context.allocate("d");           // "d_3"
 * context.sanitize("95th_pct");    // "_95th_pct"
 * context.renames();               // {d_2=d, d_3=d, _95th_pct=95th_pct}
 * }</pre>
 */
public final class NameResolutionContext {

    private final Set<String> taken;
    private final Map<String, String> renames = new LinkedHashMap<>();

    private NameResolutionContext(Collection<String> takenNames) {
        this.taken = new LinkedHashSet<>(takenNames);
    }

    /**
     * Creates a context with the given names already in use.
     *
     * @param takenNames names that must not be handed out
     * @return new context
     */
    public static NameResolutionContext of(Collection<String> takenNames) {
        return new NameResolutionContext(takenNames);
    }

    /**
     * Whether a name is in use.
     *
     * @param name candidate
     * @return true if taken
     */
    public boolean isTaken(String name) {
        return taken.contains(name);
    }

    /**
     * Marks a name as in use.
     *
     * @param name name to reserve
     */
    public void reserve(String name) {
        taken.add(name);
    }

    /**
     * Hands out the first free name of the form {@code base_2}, {@code base_3}, ...
     *
     * @param base original name
     * @return fresh name, now reserved
     */
    public String allocate(String base) {
        int suffix = 2;
        String candidate = base + "_" + suffix;
        while (taken.contains(candidate)) {
            suffix++;
            candidate = base + "_" + suffix;
        }
        taken.add(candidate);
        renames.put(candidate, base);
        return candidate;
    }

    /**
     * Returns a legal identifier for a name, allocating a suffixed variant when
     * the sanitized form is already used by another variable.
     *
     * @param original name as written in source
     * @return legal, unused identifier, or the original when it is already legal
     */
    public String sanitize(String original) {
        String sanitized = IdentifierRules.sanitize(original);
        if (sanitized.equals(original)) {
            return original;
        }
        if (taken.contains(sanitized)) {
            sanitized = allocate(sanitized);
        } else {
            taken.add(sanitized);
        }
        renames.put(sanitized, original);
        return sanitized;
    }

    /**
     * Returns every rename made through this context.
     *
     * @return map of new name to original name, in the order renames were made
     */
    public Map<String, String> renames() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(renames));
    }
}
