package minic;

import java.util.*;

import lrlab.util.Utils;

/**
 * Scoped symbol table for variables and functions.
 *
 * Scopes form a stack with parent links, lookup walks from the innermost to the global scope. Every
 * entry ever inserted is also kept in a history, so the whole table can be printed after the
 * analysis left all scopes.
 */
public class SymbolTable {

    public static class Entry {

        public final String name;

        /**
         * Type of a variable, the return type of a function
         */
        public final Type type;

        public final boolean isFunction;

        /**
         * Parameter types of a function, empty for variables
         */
        public final List<Type> parameterTypes;

        public final int scopeLevel;

        public final int line;

        /**
         * Storage offset, functions don't take any storage
         */
        public final int offset;

        private boolean initialized;

        Entry(String name, Type type, boolean isFunction, List<Type> parameterTypes, int scopeLevel, int line,
              int offset, boolean initialized) {
            this.name = name;
            this.type = type;
            this.isFunction = isFunction;
            this.parameterTypes = Collections.unmodifiableList(new ArrayList<>(parameterTypes));
            this.scopeLevel = scopeLevel;
            this.line = line;
            this.offset = offset;
            this.initialized = initialized;
        }

        public boolean isInitialized() {
            return initialized;
        }

        public void markInitialized() {
            initialized = true;
        }

        public Type returnType() {
            return type;
        }

        public String formatType() {
            if (isFunction) {
                return "(" + Utils.join(parameterTypes, ", ") + ") -> " + type;
            }
            return type.toString();
        }

        @Override
        public String toString() {
            if (isFunction) {
                return String.format("Function(%s, %s, line=%d)", name, formatType(), line);
            }
            return String.format("Symbol(%s, %s, scope=%d, line=%d)", name, type, scopeLevel, line);
        }
    }

    /**
     * Relates names to entries in a scope
     */
    public static class Scope {

        private final Map<String, Entry> entries = new LinkedHashMap<>();

        /**
         * Null for the global scope
         */
        final Scope parent;

        final int level;

        Scope(Scope parent) {
            this.parent = parent;
            this.level = parent == null ? 0 : parent.level + 1;
        }

        Entry lookup(String name) {
            if (entries.containsKey(name)) return entries.get(name);
            else if (parent != null) return parent.lookup(name);
            else return null;
        }
    }

    private Scope current = new Scope(null);

    private int offsetCounter = 0;

    private final List<Entry> history = new ArrayList<>();

    public void enterScope() {
        current = new Scope(current);
    }

    /**
     * Leaves the current scope, the global scope is never left
     */
    public void exitScope() {
        if (current.parent != null) {
            current = current.parent;
        }
    }

    public int getScopeLevel() {
        return current.level;
    }

    public Entry lookup(String name) {
        return current.lookup(name);
    }

    public Entry lookupCurrentScope(String name) {
        return current.entries.get(name);
    }

    /**
     * Inserts a variable into the current scope
     *
     * @throws CompilerError if the current scope already contains the name
     */
    public Entry insertVariable(String name, Type type, Location location, boolean initialized) {
        checkNotDeclared(name, location, "Variable");
        Entry entry = new Entry(name, type, false, Collections.emptyList(), current.level, location.line,
                offsetCounter, initialized);
        offsetCounter += type.size();
        return add(entry);
    }

    /**
     * Inserts a function into the current scope
     *
     * @throws CompilerError if the current scope already contains the name
     */
    public Entry insertFunction(String name, List<Type> parameterTypes, Type returnType, Location location) {
        checkNotDeclared(name, location, "Function");
        return add(new Entry(name, returnType, true, parameterTypes, current.level, location.line, offsetCounter, true));
    }

    private void checkNotDeclared(String name, Location location, String kind) {
        if (current.entries.containsKey(name)) {
            throw CompilerError.semantic(location, String.format("%s '%s' already declared in this scope", kind, name));
        }
    }

    private Entry add(Entry entry) {
        current.entries.put(entry.name, entry);
        history.add(entry);
        return entry;
    }

    /**
     * All entries in insertion order
     */
    public List<Entry> getHistory() {
        return Collections.unmodifiableList(history);
    }

    /**
     * Bytes of storage used by all variables
     */
    public int getTotalSize() {
        return offsetCounter;
    }

    /**
     * Table of all entries ever inserted
     */
    public String format() {
        List<List<String>> rows = new ArrayList<>();
        rows.add(Utils.makeArrayList("Name", "Type", "Scope", "Line", "Initialized", "Offset"));
        for (Entry entry : history) {
            rows.add(Utils.makeArrayList(entry.name, entry.formatType(), String.valueOf(entry.scopeLevel),
                    String.valueOf(entry.line), entry.isFunction ? "-" : String.valueOf(entry.isInitialized()),
                    entry.isFunction ? "-" : String.valueOf(entry.offset)));
        }
        return Utils.formatTable(rows);
    }

    @Override
    public String toString() {
        return format();
    }
}
