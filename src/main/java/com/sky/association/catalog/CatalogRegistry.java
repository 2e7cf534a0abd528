package com.sky.association.catalog;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Immutable mapping of external catalog names to integer ids.
 * Ids are assigned from 1 in the order the catalogs are configured.
 * Names are case-insensitive and stored in lower case.
 */
public final class CatalogRegistry {

    private final Map<String, Integer> idsByName;
    private final Map<Integer, String> namesById;

    private CatalogRegistry(List<String> names) {
        Map<String, Integer> ids = new LinkedHashMap<>();
        Map<Integer, String> byId = new LinkedHashMap<>();
        int next = 1;
        for (String raw : names) {
            String name = normalize(raw);
            if (name.isEmpty()) {
                throw new IllegalArgumentException("Catalog name must not be blank");
            }
            if (ids.containsKey(name)) {
                throw new IllegalArgumentException("Duplicate catalog name: " + name);
            }
            ids.put(name, next);
            byId.put(next, name);
            next++;
        }
        this.idsByName = Collections.unmodifiableMap(ids);
        this.namesById = Collections.unmodifiableMap(byId);
    }

    public static CatalogRegistry of(List<String> names) {
        return new CatalogRegistry(names);
    }

    public static CatalogRegistry of(String... names) {
        return new CatalogRegistry(List.of(names));
    }

    public int idOf(String name) {
        Integer id = idsByName.get(normalize(name));
        if (id == null) {
            throw new UnknownCatalogException(name);
        }
        return id;
    }

    public String nameOf(int id) {
        String name = namesById.get(id);
        if (name == null) {
            throw new UnknownCatalogException("#" + id);
        }
        return name;
    }

    public boolean contains(String name) {
        return idsByName.containsKey(normalize(name));
    }

    /**
     * Names in registration order.
     */
    public List<String> names() {
        return List.copyOf(idsByName.keySet());
    }

    public int size() {
        return idsByName.size();
    }

    /**
     * Checks every name and reports all unknown ones at once.
     *
     * @return the normalized names, in the given order
     * @throws UnknownCatalogException if any name is not registered
     */
    public List<String> validate(Collection<String> names) {
        List<String> unknown = new ArrayList<>();
        List<String> normalized = new ArrayList<>();
        for (String name : names) {
            String n = normalize(name);
            if (!idsByName.containsKey(n)) {
                unknown.add(name);
            } else if (!normalized.contains(n)) {
                normalized.add(n);
            }
        }
        if (!unknown.isEmpty()) {
            throw new UnknownCatalogException(unknown);
        }
        return normalized;
    }

    private static String normalize(String name) {
        return name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
    }
}
