package org.pragmatica.tinyc;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class TinyCConfigTest {

    @Test
    void defaults_matchStandardPrelude() {
        var config = TinyCConfig.DEFAULT;

        assertEquals("    ", config.indentUnit());
        assertEquals(List.of("stdio.h", "stdlib.h", "string.h"), config.includes());
        assertEquals("this", config.receiverName());
        assertEquals(1_000_000, config.maxSourceLength());
    }

    @Test
    void builder_withoutChanges_equalsDefault() {
        assertEquals(TinyCConfig.DEFAULT, TinyC.builder().build());
    }

    @Test
    void includes_copiedOnConstruction() {
        var headers = new ArrayList<>(List.of("stdio.h"));
        var config = new TinyCConfig("  ", headers, "self", 100);

        headers.add("math.h");

        assertThat(config.includes()).containsExactly("stdio.h");
    }

    @Test
    void receiverName_mustBeIdentifier() {
        assertThrows(IllegalArgumentException.class, () -> TinyC.builder().receiverName("my self").build());
        assertThrows(IllegalArgumentException.class, () -> TinyC.builder().receiverName("1st").build());
    }

    @Test
    void maxSourceLength_mustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> TinyC.builder().maxSourceLength(0).build());
    }

    @Test
    void indentUnit_mustNotBeNull() {
        assertThrows(NullPointerException.class, () -> TinyC.builder().indentUnit(null).build());
    }
}
