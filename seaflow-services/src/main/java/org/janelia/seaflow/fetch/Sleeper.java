package org.janelia.seaflow.fetch;

@FunctionalInterface
public interface Sleeper {
    Sleeper THREAD_SLEEPER = Thread::sleep;

    void sleep(long millis) throws InterruptedException;
}
