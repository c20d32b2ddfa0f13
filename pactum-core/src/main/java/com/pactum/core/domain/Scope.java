package com.pactum.core.domain;

import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * A (data types, actions) pair. Scopes compare by set containment.
 * <p>
 * Null and blank entries are kept rather than rejected, so the services receiving a scope can
 * answer with a typed error; see {@link #hasBlankEntries()}.
 */
public record Scope(Set<String> dataTypes, Set<String> actions) {

    private static final Comparator<String> ENTRY_ORDER = Comparator.nullsFirst(Comparator.naturalOrder());

    public Scope {
        dataTypes = sortedCopy(dataTypes);
        actions = sortedCopy(actions);
    }

    public static Scope of(Collection<String> dataTypes, Collection<String> actions) {
        return new Scope(sortedCopy(dataTypes), sortedCopy(actions));
    }

    /**
     * True when every data type and every action of this scope is also granted by {@code granted}.
     */
    public boolean isSubsetOf(Scope granted) {
        return granted.dataTypes.containsAll(dataTypes) && granted.actions.containsAll(actions);
    }

    public boolean hasBlankEntries() {
        return hasBlankEntry(dataTypes) || hasBlankEntry(actions);
    }

    static Set<String> sortedCopy(Collection<String> values) {
        if (values == null || values.isEmpty()) {
            return Collections.emptySortedSet();
        }
        SortedSet<String> copy = new TreeSet<>(ENTRY_ORDER);
        copy.addAll(values);
        return Collections.unmodifiableSortedSet(copy);
    }

    static boolean hasBlankEntry(Collection<String> values) {
        return values.stream().anyMatch(v -> v == null || v.isBlank());
    }
}
