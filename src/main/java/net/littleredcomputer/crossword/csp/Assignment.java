package net.littleredcomputer.crossword.csp;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedMap;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * A partial map from variables to words, grown and shrunk by search along a
 * single path of the search tree.
 */
public class Assignment {
    private final Map<Variable, String> words = new HashMap<>();

    public Assignment() {}

    public Assignment(Map<Variable, String> initial) {
        words.putAll(initial);
    }

    public void assign(Variable v, String word) { words.put(v, word); }
    public void unassign(Variable v) { words.remove(v); }
    public boolean isAssigned(Variable v) { return words.containsKey(v); }
    public String get(Variable v) { return words.get(v); }
    public int size() { return words.size(); }
    public Set<Variable> variables() { return words.keySet(); }

    /** @return an immutable copy, in variable order */
    public ImmutableMap<Variable, String> asMap() { return ImmutableSortedMap.copyOf(words); }

    @Override
    public String toString() { return asMap().toString(); }
}
