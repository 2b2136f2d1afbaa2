package org.example.coursearchiver.site;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class SiteIdsTest {

    @Test
    void idIsPathWithoutTrailingSlashOrQuery() {
        assertEquals("/cursos/java", SiteIds.fromUrl("https://example.com/cursos/java/"));
        assertEquals("/cursos/java", SiteIds.fromUrl("https://example.com/cursos/java?utm_source=mail"));
        assertEquals("/clases/1234-intro", SiteIds.fromUrl(" https://example.com/clases/1234-intro/// "));
    }

    @Test
    void bareIdentifiersAreKept() {
        assertEquals("curso-java", SiteIds.fromUrl("curso-java"));
    }

    @Test
    void blankUrlIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> SiteIds.fromUrl("  "));
    }
}
