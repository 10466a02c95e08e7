package com.rusticlang.compiler.compiler;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Logger;

/**
 * 并行编译多个互相独立的单元
 *
 * <p>每个单元在工作线程中独立完成整条流水线，线程之间只共享只读的映射表。
 * 结果按输入顺序返回；单元的编译错误记录在结果中，不影响其他单元。</p>
 */
public class ParallelCompiler implements AutoCloseable {

    private static final Logger LOG = Logger.getLogger(ParallelCompiler.class.getName());

    private final RusticCompiler compiler;
    private final ExecutorService executor;

    public ParallelCompiler(RusticCompiler compiler, int threads) {
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be positive: " + threads);
        }
        this.compiler = compiler;
        this.executor = Executors.newFixedThreadPool(threads, new WorkerThreadFactory());
    }

    /**
     * 编译全部单元，阻塞直到完成
     */
    public List<CompilationResult> compileAll(List<CompilationUnit> units) throws InterruptedException {
        List<Future<CompilationResult>> futures = new ArrayList<Future<CompilationResult>>();
        for (final CompilationUnit unit : units) {
            futures.add(executor.submit(new Callable<CompilationResult>() {
                @Override
                public CompilationResult call() {
                    return compiler.tryCompile(unit);
                }
            }));
        }

        List<CompilationResult> results = new ArrayList<CompilationResult>();
        for (Future<CompilationResult> future : futures) {
            try {
                results.add(future.get());
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof RuntimeException) throw (RuntimeException) cause;
                if (cause instanceof Error) throw (Error) cause;
                throw new IllegalStateException("Compilation worker failed", cause);
            }
        }
        LOG.fine("Compiled " + units.size() + " unit(s)");
        return results;
    }

    @Override
    public void close() {
        executor.shutdown();
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "rustic-compiler-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
