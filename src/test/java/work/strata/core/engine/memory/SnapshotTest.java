package work.strata.core.engine.memory;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

class SnapshotTest {
    private final Snapshot tree = Snapshot.ofText(Map.of(
        "/etc/hosts", "localhost",
        "etc/ssl/cert.pem", "cert",
        "etcetera", "x"
    ));

    @Test
    void normalizesPaths() {
        assertEquals(Set.of("etc/hosts", "etc/ssl/cert.pem", "etcetera"), tree.paths());
        assertTrue(tree.read("./etc//hosts").isPresent());
    }

    @Test
    void directoriesExistThroughTheirFiles() {
        assertTrue(tree.exists("/"));
        assertTrue(tree.exists("etc"));
        assertTrue(tree.exists("etc/ssl"));
        assertFalse(tree.exists("et"));
        assertFalse(tree.exists("etc/missing"));
    }

    @Test
    void subtreeRerootsAtThePrefix() {
        var etc = tree.subtree("etc");
        assertEquals(Set.of("hosts", "ssl/cert.pem"), etc.paths());
    }

    @Test
    void graftReplacesEverythingBeneathThePrefix() {
        var replacement = Snapshot.ofText(Map.of("new.conf", "n"));

        var grafted = tree.graft("etc", replacement);

        assertEquals(Set.of("etc/new.conf", "etcetera"), grafted.paths());
        assertEquals(3, tree.size());
    }

    @Test
    void withLeavesTheOriginalUntouched() {
        var updated = tree.with("tmp/file", new byte[] {1});
        assertEquals(4, updated.size());
        assertEquals(3, tree.size());
    }
}
