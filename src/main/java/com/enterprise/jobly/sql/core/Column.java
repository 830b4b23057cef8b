package com.enterprise.jobly.sql.core;

/**
 * A storage column together with the name clients use for it.
 * Statements address a single table, so references are unqualified.
 */
public class Column<T> {

    private final String name;
    private final String externalName;
    private final Class<T> type;

    public Column(String name, String externalName, Class<T> type) {
        this.name = name;
        this.externalName = externalName;
        this.type = type;
    }

    /** Column reference as used in predicates: column_name */
    public String ref() {
        return name;
    }

    /** Select-list entry exposing the column under its external name. */
    public String projection() {
        return isTranslated() ? name + " AS \"" + externalName + "\"" : name;
    }

    /** True when clients know this column under a different name. */
    public boolean isTranslated() {
        return !name.equals(externalName);
    }

    public String name() { return name; }
    public String externalName() { return externalName; }
    public Class<T> type() { return type; }

    @Override
    public String toString() {
        return ref();
    }
}
