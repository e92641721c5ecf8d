package org.codex.runtime.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/**
 * An immutable module of definitions, sorted by name.
 * <p>
 * Names are unique within a module. Lookups use binary search over the sorted names, and
 * iteration always yields the entries in name order.
 */
public final class Module implements Def, Iterable<Module.Entry> {

    /**
     * A named binding inside a module.
     * @param name    The binding's name.
     * @param binding The binding.
     */
    public record Entry(String name, Binding binding) {}

    private final String[] names;
    private final List<Entry> entries;

    private Module(List<Entry> sorted) {
        this.entries = List.copyOf(sorted);
        this.names = new String[sorted.size()];
        for (int i = 0; i < sorted.size(); i++) {
            names[i] = sorted.get(i).name();
        }
    }

    /**
     * Creates a module from entries in any order.
     * @param entries The entries to bind.
     * @return The sorted module.
     * @throws IllegalArgumentException if a name is bound twice.
     */
    public static Module of(Collection<Entry> entries) {
        List<Entry> sorted = new ArrayList<>(entries);
        sorted.sort(Comparator.comparing(Entry::name));
        for (int i = 1; i < sorted.size(); i++) {
            if (sorted.get(i - 1).name().equals(sorted.get(i).name())) {
                throw new IllegalArgumentException("Duplicate binding '" + sorted.get(i).name() + "'");
            }
        }
        return new Module(sorted);
    }

    /**
     * Tries to get a bound definition in the module.
     * @param name The exact name.
     * @return The binding, or empty if the name is not bound.
     */
    public Optional<Binding> get(String name) {
        int index = Arrays.binarySearch(names, name);
        return index >= 0 ? Optional.of(entries.get(index).binding()) : Optional.empty();
    }

    /**
     * Returns the entries in name order.
     */
    public List<Entry> entries() {
        return entries;
    }

    @Override
    public Iterator<Entry> iterator() {
        return entries.iterator();
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /**
     * Checks that this module and every nested module have strictly increasing names.
     */
    public boolean isSortedRecursively() {
        for (int i = 1; i < names.length; i++) {
            if (names[i - 1].compareTo(names[i]) >= 0) return false;
        }
        for (Entry entry : entries) {
            if (entry.binding().def() instanceof Module nested && !nested.isSortedRecursively()) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        return o instanceof Module other && entries.equals(other.entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return "Module" + Arrays.toString(names);
    }
}
