package org.smtflat.encoder.pointer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Session-owned provenance table translating the integer object identifiers
 * found in pointer tuples back to named objects. Identifier 0 is always the
 * null object.
 */
public final class PointerTable {

    private static final Logger LOG = LoggerFactory.getLogger(PointerTable.class);

    public static final String NULL_OBJECT = "NULL";
    public static final String INVALID_OBJECT = "INVALID";

    private final List<PointerObject> objects = new ArrayList<>();
    private final Map<String, PointerObject> byName = new HashMap<>();

    public PointerTable() {
        register(NULL_OBJECT);
    }

    /**
     * Registers an object, or returns the existing entry for that name.
     * @param name The object name.
     * @return The table entry.
     */
    public PointerObject register(String name) {
        PointerObject existing = byName.get(name);
        if (existing != null) return existing;
        PointerObject created = new PointerObject(objects.size(), name);
        objects.add(created);
        byName.put(name, created);
        LOG.debug("Registered pointer object {}", created);
        return created;
    }

    /**
     * @return The null object, identifier 0.
     */
    public PointerObject nullObject() {
        return objects.get(0);
    }

    /**
     * @return The invalid-pointer object, registered on first use.
     */
    public PointerObject invalidObject() {
        return register(INVALID_OBJECT);
    }

    /**
     * @param name An object name.
     * @return The entry if registered.
     */
    public Optional<PointerObject> lookup(String name) {
        return Optional.ofNullable(byName.get(name));
    }

    /**
     * Resolves an object identifier read from a model.
     * @param id The identifier.
     * @return The registered entry, or an unregistered marker carrying the identifier.
     */
    public PointerObject resolve(long id) {
        if (id >= 0 && id < objects.size()) return objects.get((int) id);
        return new PointerObject(id, null);
    }

    public List<PointerObject> objects() {
        return Collections.unmodifiableList(objects);
    }
}
