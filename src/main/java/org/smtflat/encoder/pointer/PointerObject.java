package org.smtflat.encoder.pointer;

/**
 * An entry of the pointer provenance table.
 * @param id The object identifier stored in the {@code object_id} field.
 * @param name The object name, or {@code null} if the identifier was never registered.
 */
public record PointerObject(long id, String name) {

    /**
     * @return {@code true} if the identifier is known to the pointer table.
     */
    public boolean isRegistered() {
        return name != null;
    }

    @Override
    public String toString() {
        return isRegistered() ? name + "#" + id : "unregistered#" + id;
    }
}
