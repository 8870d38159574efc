package org.smtflat.encoder.pointer;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class PointerTableTest {

    @Test
    @DisplayName("Object 0 is NULL and new objects get increasing ids")
    void registration() {
        PointerTable table = new PointerTable();

        assertThat(table.nullObject()).isEqualTo(new PointerObject(0, PointerTable.NULL_OBJECT));
        assertThat(table.register("heap").id()).isEqualTo(1);
        assertThat(table.register("stack").id()).isEqualTo(2);
        assertThat(table.register("heap").id()).isEqualTo(1);
        assertThat(table.objects()).hasSize(3);
    }

    @Test
    void invalidObjectIsRegisteredOnFirstUse() {
        PointerTable table = new PointerTable();
        assertThat(table.lookup(PointerTable.INVALID_OBJECT)).isEmpty();

        PointerObject invalid = table.invalidObject();

        assertThat(invalid.id()).isEqualTo(1);
        assertThat(table.invalidObject()).isSameAs(invalid);
        assertThat(table.lookup(PointerTable.INVALID_OBJECT)).contains(invalid);
    }

    @Test
    void unknownIdsResolveToUnregisteredMarker() {
        PointerTable table = new PointerTable();
        PointerObject unknown = table.resolve(42);

        assertThat(unknown.id()).isEqualTo(42);
        assertThat(unknown.isRegistered()).isFalse();
        assertThat(table.resolve(0).isRegistered()).isTrue();
    }
}
