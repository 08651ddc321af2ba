package com.example.leads.store;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.util.StringUtils;

/**
 * Conjunction of equality predicates for {@link RecordStoreClient#deleteWhere}. Columns use the
 * store's column names ({@code phone}, {@code organization_id}, ...).
 */
public final class DeleteCriteria {

    public static final String ID = "id";
    public static final String PHONE = "phone";
    public static final String CONTACT_PHONE = "contact_phone";
    public static final String ORGANIZATION_ID = "organization_id";
    public static final String SESSION_ID = "session_id";

    private final Map<String, String> equalities;

    private DeleteCriteria(Map<String, String> equalities) {
        this.equalities = equalities;
    }

    public static DeleteCriteria where(String column, String value) {
        return new DeleteCriteria(new LinkedHashMap<>()).and(column, value);
    }

    public DeleteCriteria and(String column, String value) {
        if (!StringUtils.hasText(column) || !StringUtils.hasText(value)) {
            throw new IllegalArgumentException("Delete predicate requires a column and a value: " + column);
        }
        Map<String, String> next = new LinkedHashMap<>(equalities);
        next.put(column, value);
        return new DeleteCriteria(next);
    }

    public Map<String, String> equalities() {
        return Collections.unmodifiableMap(equalities);
    }

    public String get(String column) {
        return equalities.get(column);
    }

    public boolean has(String column) {
        return equalities.containsKey(column);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof DeleteCriteria other && equalities.equals(other.equalities);
    }

    @Override
    public int hashCode() {
        return equalities.hashCode();
    }

    @Override
    public String toString() {
        return equalities.toString();
    }
}
