package io.esub.client;

import java.lang.reflect.Method;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

final class SessionThreads {
    private SessionThreads() {
    }

    /**
     * One thread per session: virtual threads where the runtime has them, daemon platform threads
     * otherwise.
     */
    static ExecutorService newExecutor(String namePrefix) {
        Objects.requireNonNull(namePrefix, "namePrefix");
        try {
            Method method = Executors.class.getMethod("newVirtualThreadPerTaskExecutor");
            return (ExecutorService) method.invoke(null);
        } catch (ReflectiveOperationException ignored) {
            return Executors.newCachedThreadPool(new NamedThreadFactory(namePrefix));
        }
    }

    /**
     * Scheduler for liveness probes. Cancelled probes leave the queue immediately.
     */
    static ScheduledExecutorService newScheduler(String namePrefix) {
        Objects.requireNonNull(namePrefix, "namePrefix");
        ScheduledThreadPoolExecutor scheduler = new ScheduledThreadPoolExecutor(1, new NamedThreadFactory(namePrefix));
        scheduler.setRemoveOnCancelPolicy(true);
        return scheduler;
    }

    private static final class NamedThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger counter = new AtomicInteger();

        private NamedThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable);
            thread.setName(prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
