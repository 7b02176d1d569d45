package work.strata.core.shared;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import org.junit.jupiter.api.Test;

class PathUtilsTest {
    @Test
    void normalizesToRelativeForm() {
        assertEquals("", PathUtils.normalize("/"));
        assertEquals("", PathUtils.normalize(null));
        assertEquals("a/c", PathUtils.normalize("//a/./b/../c/"));
        assertEquals("etc", PathUtils.normalize("/../../etc"));
    }

    @Test
    void joinsAndResolves() {
        assertEquals("srv/app", PathUtils.join("/srv", "/app"));
        assertEquals("app", PathUtils.join("", "app"));
        assertEquals("srv/app/out.txt", PathUtils.resolve("srv/app", "out.txt"));
        assertEquals("tmp/out.txt", PathUtils.resolve("srv/app", "/tmp/out.txt"));
    }

    @Test
    void relativizesBeneathPrefix() {
        assertEquals("b/c", PathUtils.relativize("/a", "a/b/c"));
        assertEquals("", PathUtils.relativize("a", "/a/"));
        assertEquals("a/b", PathUtils.relativize("", "a/b"));
        assertNull(PathUtils.relativize("a", "ab/c"));
    }
}
