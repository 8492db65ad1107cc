package dev.fumaz.tether.benchmark;

import dev.fumaz.tether.affinity.AffinityPolicy;
import dev.fumaz.tether.handle.ErasedHandle;
import dev.fumaz.tether.handle.HandleOptions;
import dev.fumaz.tether.handle.WeakHandle;
import dev.fumaz.tether.handle.WeakSubject;
import dev.fumaz.tether.ownership.Owned;
import dev.fumaz.tether.ownership.Ownership;
import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.TearDown;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.infra.Blackhole;

import java.util.concurrent.TimeUnit;

@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.NANOSECONDS)
@Warmup(iterations = 5, time = 1, timeUnit = TimeUnit.SECONDS)
@Measurement(iterations = 5, time = 1, timeUnit = TimeUnit.SECONDS)
@Fork(1)
public class WeakHandleBenchmark {

    @State(Scope.Thread)
    public static class HandleState {

        Owned<Node> checked;
        Owned<Node> unchecked;
        WeakHandle<Node> checkedHandle;
        WeakHandle<Node> uncheckedHandle;
        ErasedHandle erasedHandle;

        @Setup(Level.Trial)
        public void setUp() {
            checked = Node.create(HandleOptions.checking(AffinityPolicy.ABORT));
            unchecked = Node.create(HandleOptions.unchecked());
            checkedHandle = checked.get().weakHandle();
            uncheckedHandle = unchecked.get().weakHandle();
            erasedHandle = uncheckedHandle.erase();
        }

        @TearDown(Level.Trial)
        public void tearDown() {
            checked.close();
            unchecked.close();
        }
    }

    @Benchmark
    public Object resolveChecked(HandleState state) {
        return state.checkedHandle.resolve();
    }

    @Benchmark
    public Object resolveUnchecked(HandleState state) {
        return state.uncheckedHandle.resolve();
    }

    @Benchmark
    public Object resolveErased(HandleState state) {
        return state.erasedHandle.resolve();
    }

    @Benchmark
    public void issueAndReset(HandleState state, Blackhole blackhole) {
        WeakHandle<Node> handle = state.unchecked.get().weakHandle();
        blackhole.consume(handle.rawIdentity());
        handle.reset();
    }

    public static final class Node extends WeakSubject<Node> {

        private Node(HandleOptions options) {
            super(Node.class, options);
        }

        static Owned<Node> create(HandleOptions options) {
            return Ownership.create(() -> new Node(options));
        }
    }
}
