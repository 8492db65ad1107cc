package dev.fumaz.tether.affinity;

import dev.fumaz.tether.exception.AffinityViolationException;
import dev.fumaz.tether.exception.ContractViolationError;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class SequenceCheckerTest {

    private ExecutorService other;

    @BeforeEach
    void startOtherSequence() {
        other = Executors.newSingleThreadExecutor();
    }

    @AfterEach
    void stopOtherSequence() throws InterruptedException {
        other.shutdownNow();
        assertTrue(other.awaitTermination(5, TimeUnit.SECONDS), "executor should stop");
    }

    @Test
    void firstCheckBindsTheCallingSequence() {
        AffinityToken token = AffinityToken.checking(AffinityPolicy.ABORT);

        assertFalse(token.isBound(), "a fresh token should be unbound");
        assertTrue(token.check(), "the first check should succeed");
        assertTrue(token.isBound(), "the first check should bind the token");
        assertTrue(token.check(), "later checks on the same sequence should succeed");
    }

    @Test
    void defaultSequenceIsTheThreadId() throws Exception {
        SequenceIdentity identity = SequenceIdentity.currentThread();
        long here = Thread.currentThread().getId();

        assertEquals(here, identity.current());
        assertNotEquals(here, other.submit(identity::current).get(5, TimeUnit.SECONDS));
    }

    @Test
    void abortPolicyRaisesContractViolationOnAnotherSequence() {
        AffinityToken token = AffinityToken.checking(AffinityPolicy.ABORT);
        token.check();

        ExecutionException exception = assertThrows(ExecutionException.class,
                () -> other.submit(token::check).get(5, TimeUnit.SECONDS));

        assertTrue(exception.getCause() instanceof ContractViolationError,
                "mismatch under ABORT should be a contract violation");
        assertTrue(exception.getCause().getMessage().contains("bound to sequence"),
                "the diagnostic should name the bound sequence");
    }

    @Test
    void throwPolicyRaisesTypedException() {
        AffinityToken token = AffinityToken.checking(AffinityPolicy.THROW);
        token.check();

        ExecutionException exception = assertThrows(ExecutionException.class,
                () -> other.submit(token::check).get(5, TimeUnit.SECONDS));

        assertTrue(exception.getCause() instanceof AffinityViolationException,
                "mismatch under THROW should raise AffinityViolationException");
    }

    @Test
    void resolveEmptyPolicyFailsTheCheckQuietly() throws Exception {
        AffinityToken token = AffinityToken.checking(AffinityPolicy.RESOLVE_EMPTY);
        token.check();

        assertFalse(other.submit(token::check).get(5, TimeUnit.SECONDS),
                "mismatch under RESOLVE_EMPTY should fail the check");
        assertTrue(token.check(), "the bound sequence should still pass");
    }

    @Test
    void detachLetsAnotherSequenceTakeOver() throws Exception {
        AffinityToken token = AffinityToken.checking(AffinityPolicy.THROW);
        token.check();
        token.detach();

        assertFalse(token.isBound(), "detach should unbind the token");
        assertTrue(other.submit(token::check).get(5, TimeUnit.SECONDS),
                "the first check after detach should succeed on a new sequence");
        assertThrows(AffinityViolationException.class, token::check,
                "the original sequence should no longer be accepted");
    }

    @Test
    void customIdentitySpansThreads() throws Exception {
        AtomicReference<String> sequence = new AtomicReference<>("serial-1");
        AffinityToken token = AffinityToken.checking(AffinityPolicy.RESOLVE_EMPTY, sequence::get);

        assertTrue(token.check(), "binding should succeed");
        assertTrue(other.submit(token::check).get(5, TimeUnit.SECONDS),
                "a different thread on the same logical sequence should pass");

        sequence.set("serial-2");
        assertFalse(token.check(), "a different logical sequence should be rejected");
    }

    @Test
    void permissiveTokenAcceptsEverySequence() throws Exception {
        AffinityToken token = AffinityToken.permissive();

        assertTrue(token.check());
        assertTrue(other.submit(token::check).get(5, TimeUnit.SECONDS));

        token.detach();
        assertFalse(token.isBound(), "a permissive token is never bound");
    }
}
