package dev.fumaz.tether.handle;

import dev.fumaz.tether.affinity.AffinityPolicy;
import dev.fumaz.tether.affinity.PermissiveAffinityToken;
import dev.fumaz.tether.affinity.SequenceChecker;
import dev.fumaz.tether.exception.TetherException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class HandleOptionsTest {

    @Test
    void absentPropertyFollowsAssertionStatus() {
        assertEquals(AffinityPolicy.ABORT, HandleOptions.fromProperty(null, true).getPolicy());
        assertFalse(HandleOptions.fromProperty(null, false).isChecking());
        assertFalse(HandleOptions.fromProperty("  ", false).isChecking());
    }

    @Test
    void propertySelectsThePolicy() {
        assertEquals(AffinityPolicy.ABORT, HandleOptions.fromProperty("abort", false).getPolicy());
        assertEquals(AffinityPolicy.THROW, HandleOptions.fromProperty("THROW", false).getPolicy());
        assertEquals(AffinityPolicy.RESOLVE_EMPTY, HandleOptions.fromProperty(" empty ", false).getPolicy());
        assertFalse(HandleOptions.fromProperty("off", true).isChecking());
    }

    @Test
    void unknownPropertyValueIsRejected() {
        TetherException exception = assertThrows(TetherException.class,
                () -> HandleOptions.fromProperty("sometimes", true));

        assertTrue(exception.getMessage().contains(HandleOptions.AFFINITY_PROPERTY));
    }

    @Test
    void optionsCreateMatchingTokens() {
        assertTrue(HandleOptions.unchecked().newToken() instanceof PermissiveAffinityToken);

        HandleOptions checking = HandleOptions.builder()
                .affinity(AffinityPolicy.THROW)
                .sequence(() -> "serial")
                .build();

        assertTrue(checking.newToken() instanceof SequenceChecker);
        assertNotSame(checking.newToken(), checking.newToken(), "each generation gets its own token");
        assertEquals(AffinityPolicy.THROW, ((SequenceChecker) checking.newToken()).getPolicy());
    }
}
