package dev.fumaz.graft.benchmark;

import dev.fumaz.graft.bind.Lifetime;
import dev.fumaz.graft.container.Container;
import dev.fumaz.graft.module.GraftModule;
import dev.fumaz.graft.scope.ScopeHandle;
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
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.infra.Blackhole;

import java.util.concurrent.TimeUnit;

@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.NANOSECONDS)
@Warmup(iterations = 5, time = 1, timeUnit = TimeUnit.SECONDS)
@Measurement(iterations = 5, time = 1, timeUnit = TimeUnit.SECONDS)
@Fork(1)
public class ContainerBenchmark {

    @State(Scope.Benchmark)
    public static class ContainerState {

        Container container;

        @Setup(Level.Trial)
        public void setUp() {
            container = Container.create(new BenchmarkModule());
        }
    }

    @Benchmark
    public Object resolveSingleton(ContainerState state) {
        return state.container.resolve(SingletonService.class);
    }

    @Benchmark
    public Object resolveCompositeGraph(ContainerState state) {
        return state.container.resolve(CompositeService.class);
    }

    @Benchmark
    public void resolveScopedGraph(ContainerState state, Blackhole blackhole) {
        try (ScopeHandle ignored = state.container.beginScope()) {
            blackhole.consume(state.container.resolve(RequestService.class));
            blackhole.consume(state.container.resolve(RequestService.class));
        }
    }

    @Benchmark
    public Object tryResolveUnregistered(ContainerState state) {
        return state.container.tryResolve(UnboundType.class);
    }

    private static class BenchmarkModule extends GraftModule {
        @Override
        public void configure() {
            bind(SingletonService.class).asSingleton().toSelf();
            bind(HeavyComputation.class).toSelf();
            bind(ExpensiveDependency.class).toSelf();
            bind(TransientService.class).toSelf();
            bind(CompositeService.class).toSelf();
            bind(RequestService.class).in(Lifetime.SCOPED).toSelf();
        }
    }

    public static class SingletonService {
        private final HeavyComputation heavyComputation;

        public SingletonService(HeavyComputation heavyComputation) {
            this.heavyComputation = heavyComputation;
        }

        public int compute() {
            return heavyComputation.compute();
        }
    }

    public static class TransientService {
        private final ExpensiveDependency dependency;

        public TransientService(ExpensiveDependency dependency) {
            this.dependency = dependency;
        }

        public int compute() {
            return dependency.value();
        }
    }

    public static class RequestService {
        private final SingletonService singletonService;

        public RequestService(SingletonService singletonService) {
            this.singletonService = singletonService;
        }

        public int compute() {
            return singletonService.compute();
        }
    }

    public static class CompositeService {
        private final SingletonService singletonService;
        private final TransientService transientService;
        private final ExpensiveDependency expensiveDependency;

        public CompositeService(SingletonService singletonService,
                                TransientService transientService,
                                ExpensiveDependency expensiveDependency) {
            this.singletonService = singletonService;
            this.transientService = transientService;
            this.expensiveDependency = expensiveDependency;
        }

        public int aggregate() {
            return singletonService.compute() + transientService.compute() + expensiveDependency.value();
        }
    }

    public static class ExpensiveDependency {
        private final HeavyComputation heavyComputation;

        public ExpensiveDependency(HeavyComputation heavyComputation) {
            this.heavyComputation = heavyComputation;
        }

        public int value() {
            return heavyComputation.compute();
        }
    }

    public static class HeavyComputation {
        public int compute() {
            int result = 0;
            for (int i = 0; i < 16; i++) {
                result = (result * 31) ^ i;
            }
            return result;
        }
    }

    public static class UnboundType {
    }
}
