package org.codex.runtime.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * An immutable, order-independent set of modifiers identifying one variant of a symbol.
 * <p>
 * The canonical textual form joins the modifiers with {@code .} and suffixes optional
 * modifiers with {@code ?}, e.g. {@code r.double.stroked?}. Two sets are equal when they
 * contain the same modifiers, regardless of the order they were written in.
 * <p>
 * Iteration follows the order the modifiers were written in. Callers must only rely on
 * that order for display.
 */
public final class ModifierSet implements Iterable<Modifier> {

    /** The empty modifier set. */
    public static final ModifierSet EMPTY = new ModifierSet(List.of());

    private final List<Modifier> modifiers;

    private ModifierSet(List<Modifier> modifiers) {
        this.modifiers = modifiers;
    }

    /**
     * Parses a dotted modifier string such as {@code r.double} or {@code a?.b}.
     * An empty string yields {@link #EMPTY}.
     *
     * @param dotted The dotted modifier string.
     * @return The parsed set.
     * @throws IllegalArgumentException if a segment is empty, invalid, or named twice.
     */
    public static ModifierSet fromRawDotted(String dotted) {
        if (dotted == null || dotted.isEmpty()) {
            return EMPTY;
        }
        ModifierSet result = EMPTY;
        for (String segment : dotted.split("\\.", -1)) {
            result = result.insertRaw(segment);
        }
        return result;
    }

    /**
     * Builds a set from already parsed modifiers.
     * @param modifiers The modifiers, in display order.
     * @return The set.
     * @throws IllegalArgumentException if a modifier name occurs twice.
     */
    public static ModifierSet of(List<Modifier> modifiers) {
        ModifierSet result = EMPTY;
        for (Modifier modifier : modifiers) {
            result = result.insert(modifier);
        }
        return result;
    }

    /**
     * Returns a new set with one more raw modifier segment appended.
     * @param raw A single segment, e.g. {@code double} or {@code stroked?}.
     * @return A new set containing the additional modifier.
     * @throws IllegalArgumentException if the segment is invalid or already present by name.
     */
    public ModifierSet insertRaw(String raw) {
        return insert(Modifier.parse(raw));
    }

    private ModifierSet insert(Modifier modifier) {
        if (contains(modifier.name())) {
            throw new IllegalArgumentException("Duplicate modifier '" + modifier.name() + "' in '" + this + "'");
        }
        List<Modifier> next = new ArrayList<>(modifiers.size() + 1);
        next.addAll(modifiers);
        next.add(modifier);
        return new ModifierSet(Collections.unmodifiableList(next));
    }

    public boolean isEmpty() {
        return modifiers.isEmpty();
    }

    public int size() {
        return modifiers.size();
    }

    /**
     * Checks whether a modifier with the given name is part of this set,
     * regardless of whether it is optional.
     */
    public boolean contains(String name) {
        for (Modifier modifier : modifiers) {
            if (modifier.name().equals(name)) return true;
        }
        return false;
    }

    /**
     * Whether every modifier name in this set also appears in {@code other}.
     * Optional markers are ignored on both sides.
     */
    public boolean isSubset(ModifierSet other) {
        for (Modifier modifier : modifiers) {
            if (!other.contains(modifier.name())) return false;
        }
        return true;
    }

    /**
     * Whether every non-optional modifier in this set appears in {@code other}.
     */
    public boolean requiredIsSubset(ModifierSet other) {
        for (Modifier modifier : modifiers) {
            if (!modifier.optional() && !other.contains(modifier.name())) return false;
        }
        return true;
    }

    /**
     * Selects the candidate that best matches this set, treated as a request.
     * <p>
     * A candidate is eligible if all of its required modifiers are requested and all requested
     * modifiers are present on it. Eligible candidates are ranked by the number of modifiers they
     * share with the request (more is better), then by their own modifier count (fewer is better).
     * Ties go to the candidate that comes first.
     *
     * @param candidates  The candidates, in priority order.
     * @param modifiersOf Extracts the modifier set of a candidate.
     * @param <T>         The candidate type.
     * @return The best candidate, or empty if none is eligible.
     */
    public <T> Optional<T> bestMatchIn(Iterable<? extends T> candidates, Function<? super T, ModifierSet> modifiersOf) {
        T best = null;
        int bestCommon = -1;
        int bestTotal = Integer.MAX_VALUE;
        for (T candidate : candidates) {
            ModifierSet set = modifiersOf.apply(candidate);
            if (!admits(set)) {
                continue;
            }
            int common = countCommon(set);
            int total = set.size();
            if (common > bestCommon || (common == bestCommon && total < bestTotal)) {
                best = candidate;
                bestCommon = common;
                bestTotal = total;
            }
        }
        return Optional.ofNullable(best);
    }

    /**
     * Whether a candidate set is eligible for this set as a request: every required modifier of the
     * candidate is requested, and every requested modifier is present on the candidate.
     */
    public boolean admits(ModifierSet candidate) {
        return candidate.requiredIsSubset(this) && this.isSubset(candidate);
    }

    /**
     * Counts the modifiers of {@code other} whose names also appear in this set.
     */
    public int countCommon(ModifierSet other) {
        int common = 0;
        for (Modifier modifier : other.modifiers) {
            if (contains(modifier.name())) common++;
        }
        return common;
    }

    /**
     * Returns the bare modifier names, in display order.
     */
    public List<String> names() {
        return modifiers.stream().map(Modifier::name).collect(Collectors.toUnmodifiableList());
    }

    public List<Modifier> modifiers() {
        return modifiers;
    }

    @Override
    public Iterator<Modifier> iterator() {
        return modifiers.iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ModifierSet other)) return false;
        return modifiers.size() == other.modifiers.size() && asSet().equals(other.asSet());
    }

    @Override
    public int hashCode() {
        return asSet().hashCode();
    }

    private Set<Modifier> asSet() {
        return new HashSet<>(modifiers);
    }

    /**
     * Returns the dotted encoding, e.g. {@code r.double.stroked?}.
     */
    @Override
    public String toString() {
        return modifiers.stream().map(Modifier::toString).collect(Collectors.joining("."));
    }
}
