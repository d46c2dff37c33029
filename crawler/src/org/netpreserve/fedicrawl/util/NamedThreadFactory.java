package org.netpreserve.fedicrawl.util;

import org.jetbrains.annotations.NotNull;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

public class NamedThreadFactory implements ThreadFactory {
    private final String name;
    private final AtomicInteger counter = new AtomicInteger();

    public NamedThreadFactory(String name) {
        this.name = name;
    }

    @Override
    public Thread newThread(@NotNull Runnable r) {
        int n = counter.getAndIncrement();
        Thread thread = new Thread(r, n == 0 ? name : name + "-" + n);
        thread.setDaemon(true);
        return thread;
    }
}
